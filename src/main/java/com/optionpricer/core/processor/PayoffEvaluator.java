package com.optionpricer.core.processor;

import com.optionpricer.domain.enums.OptionKind;
import com.optionpricer.exception.InvalidArgumentException;
import org.springframework.stereotype.Component;

/**
 * Exercise value of a vanilla call or put. Stateless and thread-safe.
 */
@Component
public class PayoffEvaluator {

    /**
     * @param price  underlying price at exercise
     * @param strike option strike
     * @param kind   CALL or PUT
     * @return {@code max(price - strike, 0)} for calls, {@code max(strike - price, 0)} for puts
     * @throws InvalidArgumentException if {@code kind} is null
     */
    public double payoff(double price, double strike, OptionKind kind) {
        if (kind == null) {
            throw InvalidArgumentException.forParameter("kind", null, "Option kind must be CALL or PUT");
        }
        return switch (kind) {
            case CALL -> Math.max(price - strike, 0.0);
            case PUT -> Math.max(strike - price, 0.0);
        };
    }
}
