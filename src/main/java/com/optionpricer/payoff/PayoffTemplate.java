package com.optionpricer.payoff;

import com.optionpricer.exception.InvalidArgumentException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.DoubleFunction;
import java.util.stream.Collectors;

/**
 * Pre-registered payoffs selectable by name, the closed alternative to compiling a
 * user expression. Names are matched case-insensitively.
 */
public enum PayoffTemplate {
    CALL("call", strike -> s -> Math.max(s - strike, 0.0)),
    PUT("put", strike -> s -> Math.max(strike - s, 0.0)),
    DIGITAL_CALL("digital-call", strike -> s -> s > strike ? 1.0 : 0.0),
    DIGITAL_PUT("digital-put", strike -> s -> s < strike ? 1.0 : 0.0),
    STRADDLE("straddle", strike -> s -> Math.abs(s - strike));

    private final String templateName;
    private final DoubleFunction<PayoffFunction> factory;

    PayoffTemplate(String templateName, DoubleFunction<PayoffFunction> factory) {
        this.templateName = templateName;
        this.factory = factory;
    }

    public String getTemplateName() {
        return templateName;
    }

    /** Binds the template to a strike. */
    public PayoffFunction withStrike(double strike) {
        return factory.apply(strike);
    }

    public static Optional<PayoffTemplate> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(template -> template.templateName.equals(normalized))
                .findFirst();
    }

    public static PayoffTemplate byName(String name) {
        return find(name)
                .orElseThrow(() -> InvalidArgumentException.forParameter(
                        "payoff",
                        name,
                        "Unknown payoff template '" + name + "', expected one of " + availableNames()));
    }

    public static String availableNames() {
        return Arrays.stream(values()).map(PayoffTemplate::getTemplateName).collect(Collectors.joining(", "));
    }
}
