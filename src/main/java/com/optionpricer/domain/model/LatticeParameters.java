package com.optionpricer.domain.model;

import com.optionpricer.domain.enums.ExerciseStyle;
import com.optionpricer.domain.enums.OptionKind;
import com.optionpricer.exception.InvalidArgumentException;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs of a Cox-Ross-Rubinstein lattice. Construction runs every check eagerly in a fixed
 * order (market fields, steps, factors, no-arbitrage bound) and fails on the first violation.
 *
 * <p>No-arbitrage: the down-move gross return must be strictly below the riskless gross return
 * per step, {@code down < exp(rate * maturity / steps)}.
 */
@Value
public class LatticeParameters {

    MarketParameters market;
    double up;
    double down;
    int steps;
    OptionKind kind;
    ExerciseStyle exerciseStyle;

    @Builder
    public LatticeParameters(
            double spot,
            double strike,
            double maturity,
            double rate,
            double up,
            double down,
            int steps,
            OptionKind kind,
            ExerciseStyle exerciseStyle) {
        this.market = new MarketParameters(spot, strike, maturity, rate);
        this.steps = ParameterChecks.requirePositive("steps", steps, "Steps must be positive");
        if (steps == Integer.MAX_VALUE) {
            // the pricer keeps steps + 1 node values
            throw InvalidArgumentException.forParameter(
                    "steps", steps, "Steps must be less than " + Integer.MAX_VALUE);
        }
        if (!(up > 0) || !(down > 0)) {
            throw InvalidArgumentException.forParameter(
                    up > 0 ? "down" : "up", up > 0 ? down : up, "Up and down factors must be positive");
        }
        if (up <= down) {
            throw InvalidArgumentException.forParameter("up", up, "Up factor must exceed down factor");
        }
        if (down >= Math.exp(rate * (maturity / steps))) {
            throw InvalidArgumentException.forParameter(
                    "down", down, "Down factor must be less than the discount factor to avoid arbitrage");
        }
        this.up = up;
        this.down = down;
        this.kind = ParameterChecks.requireNonNull("kind", kind, "Option kind must be CALL or PUT");
        this.exerciseStyle = ParameterChecks.requireNonNull(
                "exerciseStyle", exerciseStyle, "Exercise style must be EUROPEAN or AMERICAN");
    }

    public double getSpot() {
        return market.getSpot();
    }

    public double getStrike() {
        return market.getStrike();
    }

    public double getMaturity() {
        return market.getMaturity();
    }

    public double getRate() {
        return market.getRate();
    }

    public boolean isAmerican() {
        return exerciseStyle == ExerciseStyle.AMERICAN;
    }

    /** Length of one lattice step in years. */
    public double timeStep() {
        return market.getMaturity() / steps;
    }
}
