package com.optionpricer.payoff;

import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable node of a compiled payoff expression tree. The strike is folded into a constant
 * at compile time, so the only runtime input is the simulated terminal price.
 */
interface ExpressionNode {

    double evaluate(double spot);

    record Constant(double value) implements ExpressionNode {
        @Override
        public double evaluate(double spot) {
            return value;
        }
    }

    record Spot() implements ExpressionNode {
        @Override
        public double evaluate(double spot) {
            return spot;
        }
    }

    record Unary(DoubleUnaryOperator operator, ExpressionNode operand) implements ExpressionNode {
        @Override
        public double evaluate(double spot) {
            return operator.applyAsDouble(operand.evaluate(spot));
        }
    }

    record Binary(DoubleBinaryOperator operator, ExpressionNode left, ExpressionNode right)
            implements ExpressionNode {
        @Override
        public double evaluate(double spot) {
            return operator.applyAsDouble(left.evaluate(spot), right.evaluate(spot));
        }
    }

    /** Left fold of a variadic function (max / min) over its evaluated arguments. */
    record Fold(DoubleBinaryOperator operator, List<ExpressionNode> arguments) implements ExpressionNode {
        @Override
        public double evaluate(double spot) {
            double result = arguments.get(0).evaluate(spot);
            for (int i = 1; i < arguments.size(); i++) {
                result = operator.applyAsDouble(result, arguments.get(i).evaluate(spot));
            }
            return result;
        }
    }
}
