package com.exprgraph.ast;

import java.util.List;
import java.util.Set;

/** A reference to a named free variable. */
public record Var(String name) implements Expression {

    @Override
    public double evaluate(List<String> bindings, double[] values) {
        return values[bindings.indexOf(name)];
    }

    @Override
    public void collectVariables(Set<String> into) {
        into.add(name);
    }
}
