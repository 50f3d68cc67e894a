package com.exprgraph.ast;

import java.util.List;
import java.util.Set;

/** A numeric literal. */
public record Val(double value) implements Expression {

    /** The tree a freshly created expression node starts with. */
    public static final Val ZERO = new Val(0.0);

    @Override
    public double evaluate(List<String> bindings, double[] values) {
        return value;
    }

    @Override
    public void collectVariables(Set<String> into) {
        // no variables
    }
}
