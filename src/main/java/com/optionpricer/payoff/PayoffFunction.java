package com.optionpricer.payoff;

/**
 * Caller-supplied payoff for the Monte Carlo pricer: maps a simulated terminal price to a
 * payoff. Payoffs are non-negative by convention, which the engine does not enforce.
 *
 * <p>Implementations must be stateless (or at least safe to call repeatedly from one thread)
 * since a single run invokes them once per path.
 */
@FunctionalInterface
public interface PayoffFunction {

    double apply(double terminalPrice);
}
