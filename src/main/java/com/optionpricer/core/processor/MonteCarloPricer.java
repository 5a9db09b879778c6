package com.optionpricer.core.processor;

import com.optionpricer.core.random.RandomStream;
import com.optionpricer.domain.model.MonteCarloResult;
import com.optionpricer.domain.model.SimulationParameters;
import com.optionpricer.exception.InvalidArgumentException;
import com.optionpricer.payoff.PayoffFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Monte Carlo pricer under geometric Brownian motion with a caller-supplied payoff.
 *
 * <p>Each path starts at S and takes m log-normal steps:
 * <ul>
 *   <li>dt = T / m
 *   <li>drift = (r - sigma^2 / 2) * dt, diffusion = sigma * sqrt(dt)
 *   <li>S_next = S * e^(drift + diffusion * z), z ~ N(0, 1)
 * </ul>
 * The payoff of the terminal price is discounted by e^(-rT). Mean and variance are
 * accumulated in one streaming pass (Welford), so memory does not grow with the path count.
 *
 * <p>Standard error is the Bessel-corrected sample deviation over sqrt(N), and NaN when N = 1.
 * A payoff that yields NaN or an infinity for some terminal price aborts the run.
 *
 * <p>Every call creates its own {@link RandomStream}; the pricer itself holds no mutable state
 * and is safe to call concurrently. No variance reduction and no early exercise.
 */
@Slf4j
@Component
public class MonteCarloPricer {

    /**
     * Validates the inputs and runs the simulation.
     *
     * @param payoff terminal-price payoff; every value it returns must be finite
     * @param seed   generator seed, or null for a non-reproducible run
     * @throws InvalidArgumentException naming the first violated constraint, or the terminal
     *     price at which the payoff stopped being a real number
     */
    public MonteCarloResult price(
            double spot,
            double maturity,
            double rate,
            double volatility,
            int steps,
            int paths,
            PayoffFunction payoff,
            Long seed) {
        SimulationParameters parameters = SimulationParameters.builder()
                .spot(spot)
                .maturity(maturity)
                .rate(rate)
                .volatility(volatility)
                .steps(steps)
                .paths(paths)
                .payoff(payoff)
                .seed(seed)
                .build();
        return price(parameters);
    }

    public MonteCarloResult price(SimulationParameters parameters) {
        int steps = parameters.getSteps();
        int paths = parameters.getPaths();
        double sigma = parameters.getVolatility();
        double rate = parameters.getRate();
        PayoffFunction payoff = parameters.getPayoff();

        double dt = parameters.getMaturity() / steps;
        double drift = (rate - 0.5 * sigma * sigma) * dt;
        double diffusion = sigma * Math.sqrt(dt);
        double discount = Math.exp(-rate * parameters.getMaturity());
        RandomStream random = RandomStream.of(parameters.getSeed());
        log.debug(
                "Monte Carlo paths={} steps={} drift={} diffusion={} seeded={}",
                paths,
                steps,
                drift,
                diffusion,
                parameters.getSeed() != null);

        double mean = 0.0;
        double sumSquaredDeviations = 0.0;
        for (int path = 1; path <= paths; path++) {
            double price = parameters.getSpot();
            for (int step = 0; step < steps; step++) {
                price *= Math.exp(drift + diffusion * random.nextStandardNormal());
            }
            double value = payoff.apply(price);
            double sample = discount * value;
            if (!Double.isFinite(sample)) {
                throw InvalidArgumentException.forPayoffValue(price, value);
            }

            double deviation = sample - mean;
            mean += deviation / path;
            sumSquaredDeviations += deviation * (sample - mean);
        }

        double standardError =
                paths > 1 ? Math.sqrt(sumSquaredDeviations / (paths - 1)) / Math.sqrt(paths) : Double.NaN;
        return new MonteCarloResult(mean, standardError);
    }
}
