package com.exprgraph.ast;

/** Prefix sign operators. */
public enum UnaryOperator {
    POS('+') {
        @Override
        public double apply(double operand) {
            return operand;
        }
    },
    NEG('-') {
        @Override
        public double apply(double operand) {
            return -operand;
        }
    };

    private final char symbol;

    UnaryOperator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public abstract double apply(double operand);
}
