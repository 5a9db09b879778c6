package com.optionpricer.payoff;

import com.optionpricer.config.PricingConfig;
import com.optionpricer.exception.InvalidArgumentException;
import com.optionpricer.payoff.ExpressionToken.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compiles an end-user payoff expression such as {@code max(S - K, 0)} into a
 * {@link PayoffFunction}.
 *
 * <p>This is a closed arithmetic language, not a scripting engine: the parser only builds a
 * tree of {@link ExpressionNode}s, so there is no way to reach classes, reflection or I/O from
 * an expression. The namespace is fixed:
 * <ul>
 *   <li>Variables: {@code S} / {@code spot} (terminal price), {@code K} / {@code strike}
 *   <li>Functions: {@code abs}, {@code exp}, {@code log}, {@code sqrt} (one argument),
 *       {@code max}, {@code min} (two or more arguments)
 *   <li>Operators: {@code + - * / **}, unary sign, and {@code < <= > >=} which yield 1 or 0
 * </ul>
 *
 * <p>Grammar ({@code **} is right-associative and binds tighter than a unary sign on its left):
 * <pre>
 * expression := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)?
 * additive   := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary ('**' unary)?
 * primary    := NUMBER | IDENT | IDENT '(' arguments ')' | '(' expression ')'
 * </pre>
 *
 * <p>Input length and nesting depth are bounded so a hostile expression cannot exhaust the
 * stack. This class is stateless and thread-safe; each call uses its own parser.
 */
@Slf4j
@Component
public class PayoffExpressionCompiler {

    static final int MAX_NESTING_DEPTH = 32;

    private static final Map<String, DoubleUnaryOperator> UNARY_FUNCTIONS = Map.<String, DoubleUnaryOperator>of(
            "abs", Math::abs,
            "exp", Math::exp,
            "log", Math::log,
            "sqrt", Math::sqrt);

    private final PricingConfig pricingConfig;

    public PayoffExpressionCompiler(PricingConfig pricingConfig) {
        this.pricingConfig = pricingConfig;
    }

    /**
     * Compiles the expression with the strike bound to {@code K} / {@code strike}.
     *
     * @throws InvalidArgumentException with {@code INVALID_PAYOFF_EXPRESSION} when the text is
     *     empty, too long, or not a valid expression over the allowed names
     */
    public PayoffFunction compile(String expression, double strike) {
        String clean = expression == null ? "" : expression.strip();
        if (clean.isEmpty()) {
            throw InvalidArgumentException.forExpression("Payoff expression cannot be empty", 0);
        }
        int maxLength = pricingConfig.getMaxExpressionLength();
        if (clean.length() > maxLength) {
            throw InvalidArgumentException.forExpression(
                    "Payoff expression exceeds " + maxLength + " characters", maxLength);
        }

        ExpressionNode root = new Parser(new ExpressionTokenizer(clean).tokenize(), strike).parse();
        log.debug("Compiled payoff expression '{}' with strike {}", clean, strike);
        return new CompiledPayoff(clean, root);
    }

    /** Compiled form. {@link #toString()} returns the source text for logging. */
    private record CompiledPayoff(String source, ExpressionNode root) implements PayoffFunction {
        @Override
        public double apply(double terminalPrice) {
            return root.evaluate(terminalPrice);
        }

        @Override
        public String toString() {
            return source;
        }
    }

    private static final class Parser {

        private final List<ExpressionToken> tokens;
        private final double strike;
        private int index;
        private int depth;

        Parser(List<ExpressionToken> tokens, double strike) {
            this.tokens = tokens;
            this.strike = strike;
        }

        ExpressionNode parse() {
            ExpressionNode root = expression();
            ExpressionToken trailing = current();
            if (!trailing.is(Type.END)) {
                throw error("Unexpected " + trailing.describe(), trailing);
            }
            return root;
        }

        private ExpressionNode expression() {
            ExpressionNode left = additive();
            ExpressionToken op = current();
            return switch (op.type()) {
                case LESS -> comparison(left, (a, b) -> a < b ? 1.0 : 0.0);
                case LESS_EQUAL -> comparison(left, (a, b) -> a <= b ? 1.0 : 0.0);
                case GREATER -> comparison(left, (a, b) -> a > b ? 1.0 : 0.0);
                case GREATER_EQUAL -> comparison(left, (a, b) -> a >= b ? 1.0 : 0.0);
                default -> left;
            };
        }

        private ExpressionNode comparison(ExpressionNode left, DoubleBinaryOperator operator) {
            index++;
            return new ExpressionNode.Binary(operator, left, additive());
        }

        private ExpressionNode additive() {
            ExpressionNode node = term();
            while (true) {
                if (accept(Type.PLUS)) {
                    node = new ExpressionNode.Binary(Double::sum, node, term());
                } else if (accept(Type.MINUS)) {
                    node = new ExpressionNode.Binary((a, b) -> a - b, node, term());
                } else {
                    return node;
                }
            }
        }

        private ExpressionNode term() {
            ExpressionNode node = unary();
            while (true) {
                if (accept(Type.STAR)) {
                    node = new ExpressionNode.Binary((a, b) -> a * b, node, unary());
                } else if (accept(Type.SLASH)) {
                    node = new ExpressionNode.Binary((a, b) -> a / b, node, unary());
                } else {
                    return node;
                }
            }
        }

        private ExpressionNode unary() {
            ExpressionToken token = current();
            if (accept(Type.MINUS)) {
                enter(token);
                ExpressionNode operand = unary();
                depth--;
                return new ExpressionNode.Unary(v -> -v, operand);
            }
            if (accept(Type.PLUS)) {
                enter(token);
                ExpressionNode operand = unary();
                depth--;
                return operand;
            }
            return power();
        }

        private ExpressionNode power() {
            ExpressionNode base = primary();
            ExpressionToken token = current();
            if (accept(Type.POWER)) {
                enter(token);
                ExpressionNode exponent = unary();
                depth--;
                return new ExpressionNode.Binary(Math::pow, base, exponent);
            }
            return base;
        }

        private ExpressionNode primary() {
            ExpressionToken token = current();
            switch (token.type()) {
                case NUMBER -> {
                    index++;
                    return new ExpressionNode.Constant(Double.parseDouble(token.text()));
                }
                case IDENTIFIER -> {
                    index++;
                    if (current().is(Type.LEFT_PAREN)) {
                        return call(token);
                    }
                    return variable(token);
                }
                case LEFT_PAREN -> {
                    index++;
                    enter(token);
                    ExpressionNode inner = expression();
                    expect(Type.RIGHT_PAREN, "')'");
                    depth--;
                    return inner;
                }
                default -> throw error("Expected a number, name or '(' but found " + token.describe(), token);
            }
        }

        private ExpressionNode variable(ExpressionToken name) {
            return switch (name.text()) {
                case "S", "spot" -> new ExpressionNode.Spot();
                case "K", "strike" -> new ExpressionNode.Constant(strike);
                default -> throw error(
                        "Unknown name '" + name.text() + "'; allowed variables are S, spot, K, strike", name);
            };
        }

        private ExpressionNode call(ExpressionToken name) {
            String function = name.text();
            boolean variadic = function.equals("max") || function.equals("min");
            if (!variadic && !UNARY_FUNCTIONS.containsKey(function)) {
                throw error(
                        "Unknown function '" + function + "'; allowed functions are abs, exp, log, sqrt, max, min",
                        name);
            }

            enter(name);
            expect(Type.LEFT_PAREN, "'('");
            List<ExpressionNode> arguments = new ArrayList<>();
            if (!current().is(Type.RIGHT_PAREN)) {
                arguments.add(expression());
                while (accept(Type.COMMA)) {
                    arguments.add(expression());
                }
            }
            expect(Type.RIGHT_PAREN, "')'");
            depth--;

            if (variadic) {
                if (arguments.size() < 2) {
                    throw error(function + "() takes at least 2 arguments, got " + arguments.size(), name);
                }
                DoubleBinaryOperator fold = function.equals("max") ? Math::max : Math::min;
                return new ExpressionNode.Fold(fold, List.copyOf(arguments));
            }
            if (arguments.size() != 1) {
                throw error(function + "() takes exactly 1 argument, got " + arguments.size(), name);
            }
            return new ExpressionNode.Unary(UNARY_FUNCTIONS.get(function), arguments.get(0));
        }

        private void enter(ExpressionToken token) {
            if (++depth > MAX_NESTING_DEPTH) {
                throw error("Payoff expression nested deeper than " + MAX_NESTING_DEPTH + " levels", token);
            }
        }

        private ExpressionToken current() {
            return tokens.get(index);
        }

        private boolean accept(Type type) {
            if (current().is(type)) {
                index++;
                return true;
            }
            return false;
        }

        private void expect(Type type, String description) {
            ExpressionToken token = current();
            if (!accept(type)) {
                throw error("Expected " + description + " but found " + token.describe(), token);
            }
        }

        private static InvalidArgumentException error(String message, ExpressionToken token) {
            return InvalidArgumentException.forExpression(
                    message + " at position " + token.position(), token.position());
        }
    }
}
