package com.exprgraph.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.exprgraph.ast.Expression;
import com.exprgraph.ast.ExpressionFormatter;
import com.exprgraph.ast.Val;
import com.exprgraph.binding.BindingReconciler;
import com.exprgraph.binding.ConnectionMigrator;
import com.exprgraph.binding.Reconciliation;
import com.exprgraph.graph.ConnectionStore;
import com.exprgraph.parse.ExpressionParseException;
import com.exprgraph.parse.ExpressionParser;

import lombok.extern.log4j.Log4j2;

/**
 * A node whose output is an algebraic expression over named inputs.
 *
 * Slots:
 * Input slot 0 is the expression text (typed directly or fed by a string
 * source). Slots 1..bindingCount() are the expression's free variables in
 * first-occurrence order; slot i reads the value of bindingName(i).
 *
 * Edit cycle:
 * applyTextEdit() parses the new text. On success the new bindings are
 * reconciled against a snapshot of the old ones, the resulting plan is applied
 * to the connection store, and only then are tree, bindings and values
 * committed together. On failure only the text buffer changes; the last valid
 * tree keeps driving evaluation and no store command is issued.
 *
 * Threading:
 * Not thread-safe. The host delivers edits for one node serially and each edit
 * runs to completion before the next.
 */
@Log4j2
public final class ExpressionNode implements NumberOutput {
    public static final String KIND = "expression";
    public static final String DEFAULT_TEXT = "0";

    private final String name;

    // Raw buffer; follows every keystroke.
    private String text = DEFAULT_TEXT;

    // Last valid compiled state. Replaced as a unit, never partially.
    private String compiledText = DEFAULT_TEXT;
    private Expression expression = Val.ZERO;
    private List<String> bindings = List.of();
    private double[] values = new double[0];

    public ExpressionNode(String name) {
        this.name = name;
    }

    /**
     * Rebuilds a node from persisted state.
     *
     * The stored compiled text is reparsed and the stored bindings are
     * reconciled against the fresh tree, so wires saved against the stored slot
     * layout are moved or dropped to match it. The raw buffer is restored as is,
     * even when it does not parse. If the compiled text no longer parses the
     * buffer is tried instead; if neither parses the node falls back to the
     * constant zero and every stored slot is dropped.
     */
    public static ExpressionNode restore(String name, NodeState state, ConnectionStore store) {
        ExpressionNode node = new ExpressionNode(name);
        node.bindings = state.bindings();
        node.values = state.values().stream().mapToDouble(Double::doubleValue).toArray();

        String source = state.compiledText();
        Expression parsed = tryParse(name, source);
        if (parsed == null && !source.equals(state.text())) {
            source = state.text();
            parsed = tryParse(name, source);
        }
        if (parsed == null) {
            log.warn("Stored text of node {} no longer parses; resetting to {}", name, DEFAULT_TEXT);
            source = DEFAULT_TEXT;
            parsed = Val.ZERO;
        }
        node.commit(source, parsed, store);
        node.text = state.text();
        return node;
    }

    private static Expression tryParse(String name, String source) {
        try {
            return ExpressionParser.parse(source);
        } catch (ExpressionParseException e) {
            log.debug("Stored text of node {} rejected: {}", name, e.getMessage());
            return null;
        }
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Applies a text edit.
     *
     * @param newText The full new text of the node.
     * @param store   The connection store holding this node's wires.
     * @return Applied, or rejected with the parse error kind.
     */
    public EditResult applyTextEdit(String newText, ConnectionStore store) {
        Objects.requireNonNull(newText, "newText");
        this.text = newText;

        Expression parsed;
        try {
            parsed = ExpressionParser.parse(newText);
        } catch (ExpressionParseException e) {
            log.debug("Rejected edit of node {}: {} ({})", name, e.getMessage(), e.kind());
            return EditResult.rejected(e);
        }
        return commit(newText, parsed, store);
    }

    private EditResult commit(String source, Expression parsed, ConnectionStore store) {
        Reconciliation plan = BindingReconciler.reconcile(parsed, bindings, values);
        int commands = ConnectionMigrator.apply(name, plan, store);

        this.compiledText = source;
        this.expression = parsed;
        this.bindings = plan.bindings();
        this.values = plan.values();

        if (log.isDebugEnabled())
            log.debug("Node {} = {} bindings={} commands={}", name, ExpressionFormatter.format(parsed), bindings,
                    commands);
        return EditResult.applied(plan, commands);
    }

    /** Evaluates the current tree against the current binding values. */
    public double currentOutput() {
        return expression.evaluate(bindings, values);
    }

    @Override
    public double doubleValue() {
        return currentOutput();
    }

    public int bindingCount() {
        return bindings.size();
    }

    /**
     * @param slot Input slot, 1..bindingCount().
     */
    public String bindingName(int slot) {
        return bindings.get(indexOf(slot));
    }

    /**
     * @param slot Input slot, 1..bindingCount().
     */
    public double bindingValue(int slot) {
        return values[indexOf(slot)];
    }

    /**
     * Sets the current value of a bound input, typically from its upstream
     * wire each time the host polls.
     *
     * @param slot Input slot, 1..bindingCount().
     */
    public void setBindingValue(int slot, double value) {
        values[indexOf(slot)] = value;
    }

    /** Slot of a binding name, or -1 when the name is not bound. */
    public int slotOf(String bindingName) {
        int i = bindings.indexOf(bindingName);
        return i < 0 ? -1 : BindingReconciler.slotOf(i);
    }

    /** Ordered binding names. */
    public List<String> bindings() {
        return bindings;
    }

    /** The raw text buffer, which may not be the text of the current tree. */
    public String text() {
        return text;
    }

    /** The text of the last successfully compiled tree. */
    public String compiledText() {
        return compiledText;
    }

    /** The last successfully compiled tree. */
    public Expression expression() {
        return expression;
    }

    /** Captures the persisted form of this node. */
    public NodeState snapshot() {
        List<Double> boxed = new ArrayList<>(values.length);
        for (double v : values)
            boxed.add(v);
        return new NodeState(text, compiledText, bindings, boxed);
    }

    @Override
    public int inputs() {
        return 1 + bindings.size();
    }

    @Override
    public int outputs() {
        return 1;
    }

    @Override
    public String kind() {
        return KIND;
    }

    private int indexOf(int slot) {
        if (slot < 1 || slot > bindings.size())
            throw new IndexOutOfBoundsException("Slot " + slot + " out of range 1.." + bindings.size()
                    + " for node: " + name);
        return slot - 1;
    }
}
