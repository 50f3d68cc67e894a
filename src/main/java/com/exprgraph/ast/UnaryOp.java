package com.exprgraph.ast;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** A sign applied to a single operand. */
public record UnaryOp(UnaryOperator op, Expression operand) implements Expression {

    public UnaryOp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
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
