package com.optionpricer.cli;

import com.optionpricer.domain.enums.ExerciseStyle;
import com.optionpricer.domain.enums.OptionKind;
import com.optionpricer.domain.model.LatticeParameters;
import com.optionpricer.domain.model.LatticeResult;
import com.optionpricer.domain.model.MonteCarloResult;
import com.optionpricer.exception.BaseException;
import com.optionpricer.exception.InvalidArgumentException;
import com.optionpricer.service.PricingService;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Command-line front end. Prices one contract when started with {@code --method}, and stays
 * idle otherwise so the application can be embedded without side effects.
 *
 * <pre>
 * --method=lattice     --spot --strike --maturity --rate --up --down --steps --kind --american
 * --method=monte-carlo --spot --strike --maturity --rate --volatility --steps --paths --seed --payoff
 * </pre>
 *
 * Omitted options fall back to the defaults below ({@code seed} is omitted by default, which
 * makes the run non-reproducible). {@code --payoff} takes a template name or an expression
 * over S and K.
 */
@Component
public class PricingCommandLineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PricingCommandLineRunner.class);

    static final String METHOD_LATTICE = "lattice";
    static final String METHOD_MONTE_CARLO = "monte-carlo";

    private static final double DEFAULT_SPOT = 100.0;
    private static final double DEFAULT_STRIKE = 100.0;
    private static final double DEFAULT_MATURITY = 1.0;
    private static final double DEFAULT_RATE = 0.05;
    private static final double DEFAULT_UP = 1.1;
    private static final double DEFAULT_DOWN = 0.9;
    private static final int DEFAULT_LATTICE_STEPS = 3;
    private static final double DEFAULT_VOLATILITY = 0.2;
    private static final int DEFAULT_SIMULATION_STEPS = 252;
    private static final int DEFAULT_PATHS = 10_000;
    private static final String DEFAULT_PAYOFF = "max(S - K, 0)";

    private final PricingService pricingService;

    public PricingCommandLineRunner(PricingService pricingService) {
        this.pricingService = pricingService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("method")) {
            return;
        }
        try {
            log.info(execute(args));
        } catch (BaseException e) {
            log.warn("Pricing rejected [{}]: {}", e.getCode(), e.getMessage());
        }
    }

    /**
     * Runs the requested method and returns the one-line summary that {@link #run} logs.
     *
     * @throws InvalidArgumentException for an unknown method or a malformed option value
     */
    public String execute(ApplicationArguments args) {
        String method = stringOption(args, "method", METHOD_LATTICE).toLowerCase(Locale.ROOT);
        return switch (method) {
            case METHOD_LATTICE -> priceLattice(args);
            case METHOD_MONTE_CARLO -> priceMonteCarlo(args);
            default -> throw InvalidArgumentException.forParameter(
                    "method", method, "Unknown method '" + method + "', expected lattice or monte-carlo");
        };
    }

    private String priceLattice(ApplicationArguments args) {
        LatticeParameters parameters = LatticeParameters.builder()
                .spot(doubleOption(args, "spot", DEFAULT_SPOT))
                .strike(doubleOption(args, "strike", DEFAULT_STRIKE))
                .maturity(doubleOption(args, "maturity", DEFAULT_MATURITY))
                .rate(doubleOption(args, "rate", DEFAULT_RATE))
                .up(doubleOption(args, "up", DEFAULT_UP))
                .down(doubleOption(args, "down", DEFAULT_DOWN))
                .steps(intOption(args, "steps", DEFAULT_LATTICE_STEPS))
                .kind(kindOption(args))
                .exerciseStyle(booleanOption(args, "american") ? ExerciseStyle.AMERICAN : ExerciseStyle.EUROPEAN)
                .build();

        LatticeResult result = pricingService.priceLattice(parameters);
        return String.format(
                Locale.US,
                "Option price: %.4f, Delta: %.4f (%s %s, %d steps)",
                result.getPrice(),
                result.getDelta(),
                parameters.getExerciseStyle(),
                parameters.getKind(),
                parameters.getSteps());
    }

    private String priceMonteCarlo(ApplicationArguments args) {
        double spot = doubleOption(args, "spot", DEFAULT_SPOT);
        double strike = doubleOption(args, "strike", DEFAULT_STRIKE);
        double maturity = doubleOption(args, "maturity", DEFAULT_MATURITY);
        double rate = doubleOption(args, "rate", DEFAULT_RATE);
        double volatility = doubleOption(args, "volatility", DEFAULT_VOLATILITY);
        String payoff = stringOption(args, "payoff", DEFAULT_PAYOFF);
        String seedText = stringOption(args, "seed", null);
        Long seed = seedText == null || seedText.isBlank() ? null : parseLong("seed", seedText);

        MonteCarloResult result = pricingService.priceMonteCarlo(
                spot,
                strike,
                maturity,
                rate,
                volatility,
                intOption(args, "steps", DEFAULT_SIMULATION_STEPS),
                intOption(args, "paths", DEFAULT_PATHS),
                payoff,
                seed);
        return String.format(
                Locale.US,
                "Monte Carlo price: %.4f (std error: %.4f) payoff=%s seed=%s",
                result.getPrice(),
                result.getStandardError(),
                payoff,
                seed == null ? "entropy" : seed);
    }

    private static OptionKind kindOption(ApplicationArguments args) {
        String kind = stringOption(args, "kind", "call");
        try {
            return OptionKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw InvalidArgumentException.forParameter("kind", kind, "Option kind must be CALL or PUT");
        }
    }

    /** A bare {@code --american} counts as true. */
    private static boolean booleanOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String raw = stringOption(args, name, "true");
        return raw.isBlank() || Boolean.parseBoolean(raw.trim());
    }

    private static String stringOption(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        return values.get(values.size() - 1);
    }

    private static double doubleOption(ApplicationArguments args, String name, double defaultValue) {
        String raw = stringOption(args, name, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw InvalidArgumentException.forParameter(name, raw, "Option --" + name + " must be a number");
        }
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue) {
        String raw = stringOption(args, name, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw InvalidArgumentException.forParameter(name, raw, "Option --" + name + " must be an integer");
        }
    }

    private static long parseLong(String name, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw InvalidArgumentException.forParameter(name, raw, "Option --" + name + " must be an integer");
        }
    }
}
