package com.optionpricer.domain.model;

import com.optionpricer.payoff.PayoffFunction;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs of a GBM Monte Carlo run. The payoff is applied to the simulated terminal price;
 * its semantics are the caller's business and are not checked beyond being present.
 *
 * <p>A null seed means the run draws its generator seed from system entropy and is not
 * reproducible.
 */
@Value
public class SimulationParameters {

    double spot;
    double maturity;
    double rate;
    double volatility;
    int steps;
    int paths;
    Long seed;
    PayoffFunction payoff;

    @Builder
    public SimulationParameters(
            double spot,
            double maturity,
            double rate,
            double volatility,
            int steps,
            int paths,
            Long seed,
            PayoffFunction payoff) {
        this.spot = ParameterChecks.requirePositive("spot", spot, "Spot price must be positive");
        this.maturity = ParameterChecks.requirePositive("maturity", maturity, "Maturity must be positive");
        this.rate = ParameterChecks.requireFinite("rate", rate, "Risk-free rate must be a finite number");
        this.volatility =
                ParameterChecks.requireNonNegative("volatility", volatility, "Volatility cannot be negative");
        this.steps = ParameterChecks.requirePositive("steps", steps, "Steps must be positive");
        this.paths = ParameterChecks.requirePositive("paths", paths, "Number of paths must be positive");
        this.seed = seed;
        this.payoff = ParameterChecks.requireNonNull("payoff", payoff, "Payoff function is required");
    }

    /** Total number of GBM increments the run will draw. */
    public long totalDraws() {
        return (long) steps * paths;
    }
}
