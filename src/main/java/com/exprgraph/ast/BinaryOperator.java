package com.exprgraph.ast;

/**
 * Infix arithmetic operators.
 *
 * <p>
 * Two precedence tiers exist: additive ({@code + -}) and multiplicative
 * ({@code * /}). All operators are left-associative. Arithmetic is plain
 * IEEE-754 double arithmetic, so {@code 1/0} is {@code +Infinity} and
 * {@code 0/0} is {@code NaN}.
 */
public enum BinaryOperator {
    ADD('+', 1) {
        @Override
        public double apply(double left, double right) {
            return left + right;
        }
    },
    SUB('-', 1) {
        @Override
        public double apply(double left, double right) {
            return left - right;
        }
    },
    MUL('*', 2) {
        @Override
        public double apply(double left, double right) {
            return left * right;
        }
    },
    DIV('/', 2) {
        @Override
        public double apply(double left, double right) {
            return left / right;
        }
    };

    private final char symbol;
    private final int precedence;

    BinaryOperator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char symbol() {
        return symbol;
    }

    /** Higher binds tighter. */
    public int precedence() {
        return precedence;
    }

    public boolean bindsTighterThan(BinaryOperator other) {
        return precedence > other.precedence;
    }

    public abstract double apply(double left, double right);
}
