package com.exprgraph.binding;

import java.util.Arrays;
import java.util.List;

import com.exprgraph.ast.Expression;

/**
 * The outcome of reconciling a freshly parsed expression against a node's
 * previous bindings.
 *
 * <p>
 * Holds the new binding state (to be committed by the node) and the complete
 * connection migration plan, both derived from immutable snapshots. Nothing in
 * this object refers to live state, so the plan cannot be skewed by slots being
 * renumbered while it is applied.
 */
public final class Reconciliation {
    /** Marker in {@link #newIndexOf(int)} for a binding whose name disappeared. */
    public static final int REMOVED = -1;

    private final Expression expression;
    private final List<String> bindings;
    private final double[] values;
    private final int[] oldToNew;
    private final List<Integer> droppedSlots;
    private final List<SlotMove> moves;

    Reconciliation(Expression expression, List<String> bindings, double[] values, int[] oldToNew,
            List<Integer> droppedSlots, List<SlotMove> moves) {
        this.expression = expression;
        this.bindings = List.copyOf(bindings);
        this.values = values;
        this.oldToNew = oldToNew;
        this.droppedSlots = List.copyOf(droppedSlots);
        this.moves = List.copyOf(moves);
    }

    public Expression expression() {
        return expression;
    }

    /** New ordered binding names. */
    public List<String> bindings() {
        return bindings;
    }

    /** New binding values, positionally paired with {@link #bindings()}. */
    public double[] values() {
        return values.clone();
    }

    /**
     * Maps an old binding index (0-based) to its new index, or {@link #REMOVED}.
     */
    public int newIndexOf(int oldIndex) {
        return oldToNew[oldIndex];
    }

    public int oldBindingCount() {
        return oldToNew.length;
    }

    /** Old input slots whose binding disappeared, ascending. */
    public List<Integer> droppedSlots() {
        return droppedSlots;
    }

    /** Surviving bindings whose slot index changed, in old slot order. */
    public List<SlotMove> moves() {
        return moves;
    }

    /** True when no connection needs to be touched. */
    public boolean isConnectionNoOp() {
        return droppedSlots.isEmpty() && moves.isEmpty();
    }

    @Override
    public String toString() {
        return "Reconciliation{bindings=" + bindings + ", values=" + Arrays.toString(values)
                + ", dropped=" + droppedSlots + ", moves=" + moves + "}";
    }
}
