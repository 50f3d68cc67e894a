package com.exprgraph.node;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Persisted form of an expression node. The tree itself is not stored; it is
 * rebuilt from {@code compiledText} on restore.
 *
 * @param text         The raw text buffer, valid or not.
 * @param compiledText The text of the last successfully compiled tree.
 *                     Defaults to {@code text} when null.
 * @param bindings     Ordered, distinct binding names.
 * @param values       Binding values, positionally paired with
 *                     {@code bindings}.
 */
public record NodeState(String text, String compiledText, List<String> bindings, List<Double> values) {

    public NodeState {
        if (text == null)
            throw new IllegalArgumentException("Node text is missing");
        if (compiledText == null)
            compiledText = text;
        if (bindings == null || values == null)
            throw new IllegalArgumentException("Bindings and values are required");
        if (bindings.size() != values.size())
            throw new IllegalArgumentException(
                    "Bindings/values size mismatch: " + bindings.size() + " vs " + values.size());
        Set<String> seen = new HashSet<>();
        for (String b : bindings) {
            if (b == null)
                throw new IllegalArgumentException("Null binding name in " + bindings);
            if (!seen.add(b))
                throw new IllegalArgumentException("Duplicate binding name: " + b);
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null)
                throw new IllegalArgumentException("Missing value for binding: " + bindings.get(i));
        }
        bindings = List.copyOf(bindings);
        values = List.copyOf(values);
    }

    /** State whose buffer is also its compiled text. */
    public NodeState(String text, List<String> bindings, List<Double> values) {
        this(text, text, bindings, values);
    }
}
