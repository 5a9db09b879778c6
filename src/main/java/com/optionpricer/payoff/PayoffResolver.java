package com.optionpricer.payoff;

import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns the payoff text a front end received into a {@link PayoffFunction}: a registered
 * {@link PayoffTemplate} name wins, anything else is compiled as an expression.
 */
@Component
public class PayoffResolver {

    private final PayoffExpressionCompiler compiler;

    public PayoffResolver(PayoffExpressionCompiler compiler) {
        this.compiler = compiler;
    }

    public PayoffFunction resolve(String payoff, double strike) {
        Optional<PayoffTemplate> template = PayoffTemplate.find(payoff);
        if (template.isPresent()) {
            return template.get().withStrike(strike);
        }
        return compiler.compile(payoff, strike);
    }
}
