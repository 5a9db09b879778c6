package com.optionpricer.payoff;

/**
 * Lexical token of a payoff expression. {@code position} is the zero-based offset of the
 * token's first character, reported back in compile errors.
 */
record ExpressionToken(Type type, String text, int position) {

    enum Type {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        POWER,
        LESS,
        LESS_EQUAL,
        GREATER,
        GREATER_EQUAL,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        END
    }

    boolean is(Type candidate) {
        return type == candidate;
    }

    String describe() {
        return type == Type.END ? "end of expression" : "'" + text + "'";
    }
}
