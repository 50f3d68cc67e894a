package com.exprgraph.node;

import java.util.Objects;

/**
 * A source node holding raw text. Wired into input slot 0 of an expression
 * node it becomes that node's expression source.
 */
public final class StringSourceNode implements TextOutput {
    public static final String KIND = "string";

    private final String name;
    private String text;

    public StringSourceNode(String name, String text) {
        this.name = name;
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String name() {
        return name;
    }

    public void update(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String textValue() {
        return text;
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
