package com.exprgraph.util;

import java.util.Arrays;

import com.exprgraph.graph.EditListener;
import com.exprgraph.node.EditResult;

/**
 * Aggregates multiple {@link EditListener} instances.
 */
public class CompositeEditListener implements EditListener {
    private EditListener[] listeners = new EditListener[0];

    public void addForComposite(EditListener listener) {
        EditListener[] old = listeners;
        EditListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onEditApplied(String node, String text, EditResult result) {
        for (EditListener l : listeners)
            l.onEditApplied(node, text, result);
    }

    @Override
    public void onEditRejected(String node, String text, EditResult result) {
        for (EditListener l : listeners)
            l.onEditRejected(node, text, result);
    }
}
