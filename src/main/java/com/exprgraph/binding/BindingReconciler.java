package com.exprgraph.binding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.exprgraph.ast.Expression;

/**
 * Recomputes a node's variable bindings after an edit and plans the migration
 * of the wires attached to them.
 *
 * Algorithm:
 * 1. Collect the variable names of the new tree in first-occurrence order
 * (pre-order, left operand first), skipping repeats. A name used twice
 * occupies one slot and both occurrences read the same value.
 * 2. Index the old (bindings, values) snapshot by name.
 * 3. Carry over the value of every surviving name; new names start at 0.0.
 * 4. Map every old binding index to its new index, or REMOVED.
 * 5. Derive the plan from that one mapping: drop the slots of removed names,
 * move the slots of names whose index changed, leave the rest alone.
 *
 * The whole computation runs on snapshots before any connection is touched.
 * Building the complete old-to-new mapping up front is what makes swaps safe:
 * old slot 1 may become slot 2 while old slot 2 becomes slot 1.
 *
 * Reconciliation cannot fail for a successfully parsed tree.
 */
public final class BindingReconciler {
    private BindingReconciler() {
        // Utility class
    }

    /** First-occurrence ordered, de-duplicated variable names of {@code expression}. */
    public static List<String> collectBindings(Expression expression) {
        Set<String> names = new LinkedHashSet<>();
        expression.collectVariables(names);
        return new ArrayList<>(names);
    }

    public static Reconciliation reconcile(Expression expression, List<String> oldBindings, double[] oldValues) {
        if (oldBindings.size() != oldValues.length)
            throw new IllegalArgumentException(
                    "Bindings/values size mismatch: " + oldBindings.size() + " vs " + oldValues.length);

        List<String> newBindings = collectBindings(expression);

        Map<String, Double> oldValueByName = new HashMap<>(oldBindings.size() * 2);
        for (int i = 0; i < oldBindings.size(); i++)
            oldValueByName.put(oldBindings.get(i), oldValues[i]);

        double[] newValues = new double[newBindings.size()];
        Map<String, Integer> newIndexByName = new HashMap<>(newBindings.size() * 2);
        for (int j = 0; j < newBindings.size(); j++) {
            String name = newBindings.get(j);
            newValues[j] = oldValueByName.getOrDefault(name, 0.0);
            newIndexByName.put(name, j);
        }

        int[] oldToNew = new int[oldBindings.size()];
        List<Integer> dropped = new ArrayList<>();
        List<SlotMove> moves = new ArrayList<>();
        for (int i = 0; i < oldBindings.size(); i++) {
            String name = oldBindings.get(i);
            Integer j = newIndexByName.get(name);
            if (j == null) {
                oldToNew[i] = Reconciliation.REMOVED;
                dropped.add(slotOf(i));
            } else {
                oldToNew[i] = j;
                if (j != i)
                    moves.add(new SlotMove(name, slotOf(i), slotOf(j)));
            }
        }
        return new Reconciliation(expression, newBindings, newValues, oldToNew, dropped, moves);
    }

    /** Input slot of a binding index; slot 0 is the text input. */
    public static int slotOf(int bindingIndex) {
        return bindingIndex + 1;
    }
}
