package com.exprgraph.node;

/**
 * A source node holding a constant double, typically edited by the user.
 * Feeds bound inputs of expression nodes.
 */
public final class NumberSourceNode implements NumberOutput {
    public static final String KIND = "number";

    private final String name;
    private double value;

    public NumberSourceNode(String name, double initialValue) {
        this.name = name;
        update(initialValue);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Replaces the value. Downstream expressions see it on their next
     * evaluation.
     */
    public void update(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Invalid value: " + value + " for node: " + name);
        }
        this.value = value;
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public int inputs() {
        return 0;
    }

    @Override
    public int outputs() {
        return 1;
    }

    @Override
    public String kind() {
        return KIND;
    }
}
