package com.optionpricer.domain.model;

import lombok.Value;

/**
 * Market and contract inputs shared by every lattice pricing call.
 *
 * <p>Rate is continuously compounded and may be negative; it only has to be finite.
 */
@Value
public class MarketParameters {

    double spot;
    double strike;
    double maturity;
    double rate;

    public MarketParameters(double spot, double strike, double maturity, double rate) {
        this.spot = ParameterChecks.requirePositive("spot", spot, "Spot price must be positive");
        this.strike = ParameterChecks.requirePositive("strike", strike, "Strike price must be positive");
        this.maturity = ParameterChecks.requirePositive("maturity", maturity, "Maturity must be positive");
        this.rate = ParameterChecks.requireFinite("rate", rate, "Risk-free rate must be a finite number");
    }
}
