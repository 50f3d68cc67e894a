package com.exprgraph.ast;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** An arithmetic operation over two operands. */
public record BinaryOp(BinaryOperator op, Expression left, Expression right) implements Expression {

    public BinaryOp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public double evaluate(List<String> bindings, double[] values) {
        return TreeWalk.evaluate(this, bindings, values);
    }

    @Override
    public void collectVariables(Set<String> into) {
        TreeWalk.collectVariables(this, into);
    }
}
