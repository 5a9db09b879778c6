package com.optionpricer.service;

import com.optionpricer.config.PricingConfig;
import com.optionpricer.core.processor.BinomialLatticePricer;
import com.optionpricer.core.processor.BlackScholesFormula;
import com.optionpricer.core.processor.MonteCarloPricer;
import com.optionpricer.domain.enums.OptionKind;
import com.optionpricer.domain.model.LatticeParameters;
import com.optionpricer.domain.model.LatticeResult;
import com.optionpricer.domain.model.MonteCarloResult;
import com.optionpricer.domain.model.SimulationParameters;
import com.optionpricer.exception.PricingBudgetExceededException;
import com.optionpricer.payoff.PayoffFunction;
import com.optionpricer.payoff.PayoffResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for front ends (CLI, HTTP handlers, batch jobs).
 *
 * <p>Neither pricer can be interrupted once started, so this facade rejects requests above
 * the configured work ceilings ({@link PricingConfig}) before delegating. It also resolves
 * end-user payoff text into a {@link PayoffFunction} through the sandboxed
 * {@link PayoffResolver}; raw user code is never executed.
 *
 * <p>Validation failures from the engine propagate unchanged to the caller.
 */
@Slf4j
@Service
public class PricingService {

    private final BinomialLatticePricer latticePricer;
    private final MonteCarloPricer monteCarloPricer;
    private final BlackScholesFormula blackScholesFormula;
    private final PayoffResolver payoffResolver;
    private final PricingConfig pricingConfig;

    public PricingService(
            BinomialLatticePricer latticePricer,
            MonteCarloPricer monteCarloPricer,
            BlackScholesFormula blackScholesFormula,
            PayoffResolver payoffResolver,
            PricingConfig pricingConfig) {
        this.latticePricer = latticePricer;
        this.monteCarloPricer = monteCarloPricer;
        this.blackScholesFormula = blackScholesFormula;
        this.payoffResolver = payoffResolver;
        this.pricingConfig = pricingConfig;
    }

    public LatticeResult priceLattice(LatticeParameters parameters) {
        int maxSteps = pricingConfig.getMaxLatticeSteps();
        if (parameters.getSteps() > maxSteps) {
            throw new PricingBudgetExceededException(
                    "Lattice steps " + parameters.getSteps() + " exceed the limit of " + maxSteps,
                    parameters.getSteps(),
                    maxSteps);
        }

        long start = System.nanoTime();
        LatticeResult result = latticePricer.price(parameters);
        log.info(
                "Lattice priced: {} {} S={} K={} n={} -> price={} delta={} ({}ms)",
                parameters.getExerciseStyle(),
                parameters.getKind(),
                parameters.getSpot(),
                parameters.getStrike(),
                parameters.getSteps(),
                result.getPrice(),
                result.getDelta(),
                elapsedMillis(start));
        return result;
    }

    public MonteCarloResult priceMonteCarlo(SimulationParameters parameters) {
        long maxWork = pricingConfig.getMaxSimulationWork();
        long work = parameters.totalDraws();
        if (work > maxWork) {
            throw new PricingBudgetExceededException(
                    "Simulation work " + parameters.getSteps() + " steps x " + parameters.getPaths()
                            + " paths exceeds the limit of " + maxWork,
                    work,
                    maxWork);
        }

        long start = System.nanoTime();
        MonteCarloResult result = monteCarloPricer.price(parameters);
        log.info(
                "Monte Carlo priced: S={} sigma={} steps={} paths={} payoff={} -> price={} stderr={} ({}ms)",
                parameters.getSpot(),
                parameters.getVolatility(),
                parameters.getSteps(),
                parameters.getPaths(),
                parameters.getPayoff(),
                result.getPrice(),
                result.getStandardError(),
                elapsedMillis(start));
        return result;
    }

    /**
     * Prices a payoff given as text, either a template name ({@code call}, {@code straddle}, ...)
     * or an expression over {@code S} and {@code K}.
     */
    public MonteCarloResult priceMonteCarlo(
            double spot,
            double strike,
            double maturity,
            double rate,
            double volatility,
            int steps,
            int paths,
            String payoff,
            Long seed) {
        PayoffFunction payoffFunction = payoffResolver.resolve(payoff, strike);
        return priceMonteCarlo(SimulationParameters.builder()
                .spot(spot)
                .maturity(maturity)
                .rate(rate)
                .volatility(volatility)
                .steps(steps)
                .paths(paths)
                .seed(seed)
                .payoff(payoffFunction)
                .build());
    }

    /** Analytic European price for the same market inputs, for side-by-side comparison. */
    public double blackScholesReference(
            double spot, double strike, double maturity, double rate, double volatility, OptionKind kind) {
        return blackScholesFormula.price(spot, strike, maturity, rate, volatility, kind);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
