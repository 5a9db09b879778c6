package com.optionpricer.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.optionpricer.config.PricingConfig;
import com.optionpricer.core.processor.BinomialLatticePricer;
import com.optionpricer.core.processor.BlackScholesFormula;
import com.optionpricer.core.processor.MonteCarloPricer;
import com.optionpricer.core.processor.PayoffEvaluator;
import com.optionpricer.domain.enums.ExerciseStyle;
import com.optionpricer.domain.enums.OptionKind;
import com.optionpricer.domain.model.LatticeParameters;
import com.optionpricer.domain.model.LatticeResult;
import com.optionpricer.domain.model.MonteCarloResult;
import com.optionpricer.domain.model.SimulationParameters;
import com.optionpricer.exception.ErrorCode;
import com.optionpricer.exception.InvalidArgumentException;
import com.optionpricer.exception.PricingBudgetExceededException;
import com.optionpricer.payoff.PayoffExpressionCompiler;
import com.optionpricer.payoff.PayoffResolver;
import com.optionpricer.service.PricingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for PricingService: work ceilings are enforced before the engine runs, payoff
 * text is resolved through the sandboxed resolver, and engine results pass through unchanged.
 */
@ExtendWith(MockitoExtension.class)
class PricingServiceTest {

    @Mock
    private BinomialLatticePricer latticePricer;

    @Mock
    private MonteCarloPricer monteCarloPricer;

    private PricingConfig pricingConfig;
    private PricingService pricingService;

    @BeforeEach
    void setUp() {
        pricingConfig = new PricingConfig();
        PayoffResolver payoffResolver = new PayoffResolver(new PayoffExpressionCompiler(pricingConfig));
        pricingService = new PricingService(
                latticePricer, monteCarloPricer, new BlackScholesFormula(), payoffResolver, pricingConfig);
    }

    private static LatticeParameters latticeWithSteps(int steps) {
        double up = Math.exp(0.2 * Math.sqrt(1.0 / steps));
        return LatticeParameters.builder()
                .spot(100)
                .strike(100)
                .maturity(1)
                .rate(0.05)
                .up(up)
                .down(1 / up)
                .steps(steps)
                .kind(OptionKind.PUT)
                .exerciseStyle(ExerciseStyle.AMERICAN)
                .build();
    }

    private static SimulationParameters simulation(int steps, int paths) {
        return SimulationParameters.builder()
                .spot(100)
                .maturity(1)
                .rate(0.05)
                .volatility(0.2)
                .steps(steps)
                .paths(paths)
                .seed(42L)
                .payoff(s -> Math.max(s - 100, 0))
                .build();
    }

    @Nested
    @DisplayName("Lattice budget")
    class LatticeBudget {

        @Test
        @DisplayName("Request within the step ceiling is delegated")
        void withinBudget() {
            LatticeParameters parameters = latticeWithSteps(200);
            LatticeResult expected = new LatticeResult(6.09, -0.41);
            when(latticePricer.price(parameters)).thenReturn(expected);

            LatticeResult result = pricingService.priceLattice(parameters);

            assertThat(result).isSameAs(expected);
        }

        @Test
        @DisplayName("Request above the step ceiling is rejected without pricing")
        void aboveBudget() {
            pricingConfig.setMaxLatticeSteps(100);
            LatticeParameters parameters = latticeWithSteps(101);

            assertThatThrownBy(() -> pricingService.priceLattice(parameters))
                    .isInstanceOf(PricingBudgetExceededException.class)
                    .hasMessageContaining("exceed the limit of 100")
                    .satisfies(e -> {
                        PricingBudgetExceededException ex = (PricingBudgetExceededException) e;
                        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.PRICING_BUDGET_EXCEEDED);
                        assertThat(ex.getDetails()).containsEntry("requested", 101L);
                        assertThat(ex.getCode()).isEqualTo("PRICING_BUDGET_EXCEEDED");
                        assertThat(ex.getDetail("limit")).isEqualTo(100L);
                    });
            verify(latticePricer, never()).price(any(LatticeParameters.class));
        }

        @Test
        @DisplayName("Engine validation errors propagate unchanged")
        void engineErrorPropagates() {
            LatticeParameters parameters = latticeWithSteps(10);
            InvalidArgumentException failure = new InvalidArgumentException("Risk-neutral probability out of bounds");
            when(latticePricer.price(parameters)).thenThrow(failure);

            assertThatThrownBy(() -> pricingService.priceLattice(parameters)).isSameAs(failure);
        }

        @Test
        @DisplayName("Real pricer behind the facade returns the American put value")
        void realPricer() {
            PricingService realService = new PricingService(
                    new BinomialLatticePricer(new PayoffEvaluator()),
                    new MonteCarloPricer(),
                    new BlackScholesFormula(),
                    new PayoffResolver(new PayoffExpressionCompiler(pricingConfig)),
                    pricingConfig);

            LatticeResult result = realService.priceLattice(latticeWithSteps(500));

            // American put exceeds the European Black-Scholes value
            double european = realService.blackScholesReference(100, 100, 1, 0.05, 0.2, OptionKind.PUT);
            assertThat(result.getPrice()).isGreaterThan(european);
        }
    }

    @Nested
    @DisplayName("Monte Carlo budget")
    class MonteCarloBudget {

        @Test
        @DisplayName("Work at exactly the ceiling is delegated")
        void atBudget() {
            pricingConfig.setMaxSimulationWork(1_000);
            SimulationParameters parameters = simulation(10, 100);
            MonteCarloResult expected = new MonteCarloResult(10.4, 0.15);
            when(monteCarloPricer.price(parameters)).thenReturn(expected);

            assertThat(pricingService.priceMonteCarlo(parameters)).isSameAs(expected);
        }

        @Test
        @DisplayName("Steps x paths above the ceiling is rejected without simulating")
        void aboveBudget() {
            pricingConfig.setMaxSimulationWork(1_000);

            assertThatThrownBy(() -> pricingService.priceMonteCarlo(simulation(10, 101)))
                    .isInstanceOf(PricingBudgetExceededException.class)
                    .hasMessageContaining("10 steps x 101 paths");
            verify(monteCarloPricer, never()).price(any(SimulationParameters.class));
        }

        @Test
        @DisplayName("Products beyond int range are compared without overflow")
        void overflowSafe() {
            assertThatThrownBy(() -> pricingService.priceMonteCarlo(simulation(70_000, 70_000)))
                    .isInstanceOf(PricingBudgetExceededException.class);
        }
    }

    @Nested
    @DisplayName("Payoff text")
    class PayoffText {

        @Test
        @DisplayName("Expression is compiled with the strike bound and passed to the pricer")
        void expressionCompiled() {
            ArgumentCaptor<SimulationParameters> captor = ArgumentCaptor.forClass(SimulationParameters.class);
            when(monteCarloPricer.price(captor.capture())).thenReturn(new MonteCarloResult(1.0, 0.1));

            pricingService.priceMonteCarlo(100, 95, 1, 0.05, 0.2, 252, 1_000, "max(K - S, 0)", 7L);

            SimulationParameters captured = captor.getValue();
            assertThat(captured.getPayoff().apply(90.0)).isEqualTo(5.0);
            assertThat(captured.getSeed()).isEqualTo(7L);
            assertThat(captured.getSteps()).isEqualTo(252);
        }

        @Test
        @DisplayName("Template name is resolved without compiling")
        void templateResolved() {
            ArgumentCaptor<SimulationParameters> captor = ArgumentCaptor.forClass(SimulationParameters.class);
            when(monteCarloPricer.price(captor.capture())).thenReturn(new MonteCarloResult(1.0, 0.1));

            pricingService.priceMonteCarlo(100, 95, 1, 0.05, 0.2, 1, 10, "straddle", null);

            assertThat(captor.getValue().getPayoff().apply(90.0)).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Invalid payoff text fails before simulating")
        void invalidPayoff() {
            assertThatThrownBy(() -> pricingService.priceMonteCarlo(
                            100, 95, 1, 0.05, 0.2, 1, 10, "exec('rm -rf /')", null))
                    .isInstanceOf(InvalidArgumentException.class);
            verify(monteCarloPricer, never()).price(any(SimulationParameters.class));
        }
    }
}
