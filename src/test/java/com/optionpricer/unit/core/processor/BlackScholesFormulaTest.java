package com.optionpricer.unit.core.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.optionpricer.core.processor.BlackScholesFormula;
import com.optionpricer.domain.enums.OptionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Reference values cross-checked against standard Black-Scholes calculators.
 */
class BlackScholesFormulaTest {

    private final BlackScholesFormula formula = new BlackScholesFormula();

    @Test
    @DisplayName("ATM one-year call and put at 20% vol, 5% rate")
    void atmReferenceValues() {
        assertEquals(10.450583572185565, formula.price(100, 100, 1.0, 0.05, 0.2, OptionKind.CALL), 1e-6);
        assertEquals(5.573526022256971, formula.price(100, 100, 1.0, 0.05, 0.2, OptionKind.PUT), 1e-6);
    }

    @Test
    @DisplayName("Zero volatility collapses to the discounted forward payoff")
    void zeroVolatility() {
        double discountedStrike = 90 * Math.exp(-0.05);

        assertEquals(100 - discountedStrike, formula.price(100, 90, 1.0, 0.05, 0.0, OptionKind.CALL), 1e-12);
        assertEquals(0.0, formula.price(100, 90, 1.0, 0.05, 0.0, OptionKind.PUT), 1e-12);
    }
}
