package com.optionpricer.domain.model;

import lombok.Value;

/**
 * Sample mean of the discounted payoffs and the standard error of that mean.
 *
 * <p>{@code standardError} is NaN for a single path: one sample carries no dispersion
 * estimate, and zero would wrongly read as an exact price.
 */
@Value
public class MonteCarloResult {

    double price;
    double standardError;

    public boolean hasStandardError() {
        return !Double.isNaN(standardError);
    }
}
