package com.optionpricer.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionpricer.domain.enums.ExerciseStyle;
import com.optionpricer.domain.enums.OptionKind;
import com.optionpricer.domain.model.LatticeParameters;
import com.optionpricer.domain.model.MarketParameters;
import com.optionpricer.domain.model.SimulationParameters;
import com.optionpricer.exception.ErrorCode;
import com.optionpricer.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Construction-time checks of the parameter value objects: order of checks, the quantity named
 * in the message, and NaN handling.
 */
class ParameterValidationTest {

    private static LatticeParameters.LatticeParametersBuilder validLattice() {
        return LatticeParameters.builder()
                .spot(100)
                .strike(100)
                .maturity(1)
                .rate(0.05)
                .up(1.1)
                .down(0.9)
                .steps(3)
                .kind(OptionKind.CALL)
                .exerciseStyle(ExerciseStyle.EUROPEAN);
    }

    @Nested
    @DisplayName("LatticeParameters")
    class Lattice {

        @Test
        @DisplayName("Valid inputs expose the derived time step")
        void valid() {
            LatticeParameters parameters = validLattice().steps(4).build();

            assertThat(parameters.timeStep()).isEqualTo(0.25);
            assertThat(parameters.isAmerican()).isFalse();
            assertThat(parameters.getMarket()).isEqualTo(new MarketParameters(100, 100, 1, 0.05));
        }

        @Test
        @DisplayName("First violated check wins")
        void firstViolationReported() {
            assertThatThrownBy(() -> validLattice().spot(-1).strike(-1).steps(0).build())
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("Spot price must be positive");
        }

        @Test
        @DisplayName("Non-positive factors name the offending factor")
        void nonPositiveFactor() {
            assertThatThrownBy(() -> validLattice().up(2.0).down(0.0).build())
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("Up and down factors must be positive")
                    .satisfies(e -> assertThat(((InvalidArgumentException) e).getDetails())
                            .containsEntry("parameter", "down"));
        }

        @Test
        @DisplayName("NaN spot fails the positivity check")
        void nanSpot() {
            assertThatThrownBy(() -> validLattice().spot(Double.NaN).build())
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("Spot price must be positive");
        }

        @Test
        @DisplayName("Infinite rate is rejected")
        void infiniteRate() {
            assertThatThrownBy(() -> validLattice().rate(Double.POSITIVE_INFINITY).build())
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessageContaining("rate");
        }

        @Test
        @DisplayName("Negative rates are allowed when the down factor stays below the riskless growth")
        void negativeRate() {
            LatticeParameters parameters = validLattice().rate(-0.02).build();

            assertThat(parameters.getRate()).isEqualTo(-0.02);
        }

        @Test
        @DisplayName("Step count with no room for the terminal layer is rejected")
        void maximumStepCount() {
            assertThatThrownBy(() -> validLattice().steps(Integer.MAX_VALUE).build())
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("Steps must be less than 2147483647")
                    .satisfies(e -> assertThat(((InvalidArgumentException) e).getDetail("parameter"))
                            .isEqualTo("steps"));
        }

        @Test
        @DisplayName("Missing option kind keeps the null value in the details")
        void missingKind() {
            assertThatThrownBy(() -> validLattice().kind(null).build())
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("Option kind must be CALL or PUT")
                    .satisfies(e -> {
                        InvalidArgumentException ex = (InvalidArgumentException) e;
                        assertThat(ex.getCode()).isEqualTo("INVALID_ARGUMENT");
                        assertThat(ex.getDetails()).containsEntry("parameter", "kind").containsKey("value");
                        assertThat(ex.getDetail("value")).isNull();
                        assertThatThrownBy(() -> ex.getDetails().put("value", "CALL"))
                                .isInstanceOf(UnsupportedOperationException.class);
                    });
        }

        @Test
        @DisplayName("Missing exercise style is rejected")
        void missingExerciseStyle() {
            assertThatThrownBy(() -> validLattice().exerciseStyle(null).build())
                    .isInstanceOf(InvalidArgumentException.class)
                    .satisfies(e -> assertThat(((InvalidArgumentException) e).getErrorCode())
                            .isEqualTo(ErrorCode.INVALID_ARGUMENT));
        }
    }

    @Nested
    @DisplayName("SimulationParameters")
    class Simulation {

        @Test
        @DisplayName("Total draws is computed without int overflow")
        void totalDraws() {
            SimulationParameters parameters = SimulationParameters.builder()
                    .spot(100)
                    .maturity(1)
                    .rate(0.05)
                    .volatility(0.2)
                    .steps(100_000)
                    .paths(100_000)
                    .payoff(s -> s)
                    .build();

            assertThat(parameters.totalDraws()).isEqualTo(10_000_000_000L);
            assertThat(parameters.getSeed()).isNull();
        }

        @Test
        @DisplayName("Zero volatility is allowed")
        void zeroVolatility() {
            SimulationParameters parameters = SimulationParameters.builder()
                    .spot(100)
                    .maturity(1)
                    .volatility(0.0)
                    .steps(1)
                    .paths(1)
                    .seed(9L)
                    .payoff(s -> s)
                    .build();

            assertThat(parameters.getVolatility()).isZero();
            assertThat(parameters.getSeed()).isEqualTo(9L);
        }
    }
}
