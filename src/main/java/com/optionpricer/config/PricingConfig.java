package com.optionpricer.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Work ceilings applied before a request reaches the engine, plus the payoff expression
 * size limit.
 *
 * <p>Properties prefix: {@code optionpricer.pricing.*}
 */
@Configuration
@ConfigurationProperties(prefix = "optionpricer.pricing")
@Validated
@Getter
@Setter
public class PricingConfig {

    /** Largest lattice step count accepted. Lattice cost grows with the square of this. */
    @Positive
    private int maxLatticeSteps = 10_000;

    /** Largest steps x paths product accepted for one Monte Carlo run. */
    @Positive
    private long maxSimulationWork = 50_000_000L;

    /** Longest payoff expression, in characters, the compiler will parse. */
    @Positive
    private int maxExpressionLength = 256;
}
