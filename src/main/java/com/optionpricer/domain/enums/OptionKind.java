package com.optionpricer.domain.enums;

/**
 * Vanilla option kind priced by the binomial lattice. Closed set: the Monte Carlo pricer takes
 * an arbitrary {@link com.optionpricer.payoff.PayoffFunction} instead.
 */
public enum OptionKind {
    CALL,
    PUT
}
