package com.optionpricer.core.processor;

import com.optionpricer.domain.enums.OptionKind;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Closed-form Black-Scholes price of a European call or put without dividends. Used as the
 * analytic reference the lattice and Monte Carlo estimates are compared against.
 *
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * N(-d1)
 * </ul>
 *
 * <p>With zero volatility the price collapses to the discounted payoff of the forward
 * S * e^(rT).
 */
@Component
public class BlackScholesFormula {

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    public double price(double S, double K, double T, double r, double sigma, OptionKind kind) {
        double discountedStrike = K * Math.exp(-r * T);
        if (sigma == 0.0) {
            double forwardValue = S - discountedStrike;
            return kind == OptionKind.CALL ? Math.max(forwardValue, 0.0) : Math.max(-forwardValue, 0.0);
        }

        double sqrtT = Math.sqrt(T);
        double d1 = (Math.log(S / K) + (r + sigma * sigma / 2.0) * T) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;

        if (kind == OptionKind.CALL) {
            return S * NORM.cumulativeProbability(d1) - discountedStrike * NORM.cumulativeProbability(d2);
        }
        return discountedStrike * NORM.cumulativeProbability(-d2) - S * NORM.cumulativeProbability(-d1);
    }
}
