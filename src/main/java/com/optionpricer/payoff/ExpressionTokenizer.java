package com.optionpricer.payoff;

import com.optionpricer.exception.InvalidArgumentException;
import com.optionpricer.payoff.ExpressionToken.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a payoff expression into tokens. Only ASCII identifiers, decimal numbers (with an
 * optional exponent) and the arithmetic / comparison operators are recognised; any other
 * character is rejected with its position.
 */
final class ExpressionTokenizer {

    private final String source;
    private int position;

    ExpressionTokenizer(String source) {
        this.source = source;
    }

    List<ExpressionToken> tokenize() {
        List<ExpressionToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                tokens.add(new ExpressionToken(Type.END, "", position));
                return tokens;
            }
            char c = source.charAt(position);
            if (isDigit(c) || (c == '.' && position + 1 < source.length() && isDigit(source.charAt(position + 1)))) {
                tokens.add(readNumber());
            } else if (isIdentifierStart(c)) {
                tokens.add(readIdentifier());
            } else {
                tokens.add(readOperator(c));
            }
        }
    }

    private ExpressionToken readNumber() {
        int start = position;
        while (position < source.length() && isDigit(source.charAt(position))) {
            position++;
        }
        if (position < source.length() && source.charAt(position) == '.') {
            position++;
            while (position < source.length() && isDigit(source.charAt(position))) {
                position++;
            }
        }
        if (position < source.length() && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
            int exponentStart = position;
            position++;
            if (position < source.length() && (source.charAt(position) == '+' || source.charAt(position) == '-')) {
                position++;
            }
            if (position >= source.length() || !isDigit(source.charAt(position))) {
                throw InvalidArgumentException.forExpression(
                        "Malformed exponent in number at position " + exponentStart, exponentStart);
            }
            while (position < source.length() && isDigit(source.charAt(position))) {
                position++;
            }
        }
        return new ExpressionToken(Type.NUMBER, source.substring(start, position), start);
    }

    private ExpressionToken readIdentifier() {
        int start = position;
        while (position < source.length() && isIdentifierPart(source.charAt(position))) {
            position++;
        }
        return new ExpressionToken(Type.IDENTIFIER, source.substring(start, position), start);
    }

    private ExpressionToken readOperator(char c) {
        int start = position;
        Type type;
        switch (c) {
            case '+' -> type = Type.PLUS;
            case '-' -> type = Type.MINUS;
            case '/' -> type = Type.SLASH;
            case '(' -> type = Type.LEFT_PAREN;
            case ')' -> type = Type.RIGHT_PAREN;
            case ',' -> type = Type.COMMA;
            case '*' -> type = peek('*') ? Type.POWER : Type.STAR;
            case '<' -> type = peek('=') ? Type.LESS_EQUAL : Type.LESS;
            case '>' -> type = peek('=') ? Type.GREATER_EQUAL : Type.GREATER;
            default -> throw InvalidArgumentException.forExpression(
                    "Unexpected character '" + c + "' at position " + start, start);
        }
        position += (type == Type.POWER || type == Type.LESS_EQUAL || type == Type.GREATER_EQUAL) ? 2 : 1;
        return new ExpressionToken(type, source.substring(start, position), start);
    }

    private boolean peek(char expected) {
        return position + 1 < source.length() && source.charAt(position + 1) == expected;
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
