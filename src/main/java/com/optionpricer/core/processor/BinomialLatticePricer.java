package com.optionpricer.core.processor;

import com.optionpricer.domain.enums.ExerciseStyle;
import com.optionpricer.domain.enums.OptionKind;
import com.optionpricer.domain.model.LatticeParameters;
import com.optionpricer.domain.model.LatticeResult;
import com.optionpricer.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cox-Ross-Rubinstein binomial lattice pricer for European and American calls and puts.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>dt = T / n, discount = e^(-r dt)
 *   <li>p = (e^(r dt) - d) / (u - d), the risk-neutral up probability
 *   <li>Terminal node j (j up-moves): S * u^j * d^(n-j); node 0 is the all-down path
 *   <li>Node value: discount * (p * V_up + (1 - p) * V_down), floored at the immediate
 *       exercise value for American exercise
 *   <li>Delta: (V_u - V_d) / (S * (u - d)) from the two nodes after the first branching
 * </ul>
 *
 * <p>Backward induction overwrites a single buffer of n + 1 values in place; after step k only
 * indices 0..k are live, and node i reads indices i and i + 1 before they are overwritten.
 * Terminal nodes carry the payoff only; the early-exercise comparison starts one step before
 * maturity. Cost is O(n^2) time and O(n) memory.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class BinomialLatticePricer {

    private final PayoffEvaluator payoffEvaluator;

    public BinomialLatticePricer(PayoffEvaluator payoffEvaluator) {
        this.payoffEvaluator = payoffEvaluator;
    }

    /**
     * Validates the inputs and prices the option.
     *
     * @param american true for American exercise, false for European
     * @return price and delta
     * @throws InvalidArgumentException naming the first violated constraint
     */
    public LatticeResult price(
            double spot,
            double strike,
            double maturity,
            double rate,
            double up,
            double down,
            int steps,
            OptionKind kind,
            boolean american) {
        LatticeParameters parameters = LatticeParameters.builder()
                .spot(spot)
                .strike(strike)
                .maturity(maturity)
                .rate(rate)
                .up(up)
                .down(down)
                .steps(steps)
                .kind(kind)
                .exerciseStyle(american ? ExerciseStyle.AMERICAN : ExerciseStyle.EUROPEAN)
                .build();
        return price(parameters);
    }

    /**
     * Prices an already-validated parameter set.
     *
     * @throws InvalidArgumentException if the derived risk-neutral probability is outside [0, 1]
     */
    public LatticeResult price(LatticeParameters parameters) {
        double spot = parameters.getSpot();
        double strike = parameters.getStrike();
        double up = parameters.getUp();
        double down = parameters.getDown();
        int steps = parameters.getSteps();
        OptionKind kind = parameters.getKind();
        boolean american = parameters.isAmerican();

        double dt = parameters.timeStep();
        double discount = Math.exp(-parameters.getRate() * dt);
        double p = (Math.exp(parameters.getRate() * dt) - down) / (up - down);
        if (!(p >= 0.0 && p <= 1.0)) {
            throw InvalidArgumentException.forParameter(
                    "riskNeutralProbability", p, "Risk-neutral probability out of bounds; check parameters");
        }
        log.debug(
                "Lattice n={} dt={} p={} discount={} style={}",
                steps,
                dt,
                p,
                discount,
                parameters.getExerciseStyle());

        double[] values = new double[steps + 1];
        for (int j = 0; j <= steps; j++) {
            values[j] = payoffEvaluator.payoff(nodePrice(spot, up, down, j, steps), strike, kind);
        }

        double delta = steps == 1 ? firstBranchDelta(values, spot, up, down) : Double.NaN;
        for (int step = steps - 1; step >= 0; step--) {
            for (int i = 0; i <= step; i++) {
                double continuation = discount * (p * values[i + 1] + (1.0 - p) * values[i]);
                if (american) {
                    double exercise = payoffEvaluator.payoff(nodePrice(spot, up, down, i, step), strike, kind);
                    values[i] = Math.max(continuation, exercise);
                } else {
                    values[i] = continuation;
                }
            }
            if (step == 1) {
                delta = firstBranchDelta(values, spot, up, down);
            }
        }

        return new LatticeResult(values[0], delta);
    }

    /** Underlying price after {@code ups} up-moves out of {@code step} moves. */
    private static double nodePrice(double spot, double up, double down, int ups, int step) {
        return spot * Math.pow(up, ups) * Math.pow(down, step - ups);
    }

    private static double firstBranchDelta(double[] values, double spot, double up, double down) {
        return (values[1] - values[0]) / (spot * (up - down));
    }
}
