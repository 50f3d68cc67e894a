package com.exprgraph.graph;

import com.exprgraph.node.EditResult;

/**
 * Observability interface for text edits routed through a {@link NodeGraph}.
 *
 * Callbacks run synchronously on the editing thread after the edit has been
 * fully processed (parsed, reconciled, migrated and committed, or rejected).
 * Hosts use them to refresh pin rendering or show parse errors.
 */
public interface EditListener {

    /**
     * Called after an edit was committed.
     *
     * @param node   Name of the edited node.
     * @param text   The new text.
     * @param result The applied result, carrying the reconciliation.
     */
    void onEditApplied(String node, String text, EditResult result);

    /**
     * Called after an edit failed to parse. Nothing but the text buffer changed.
     *
     * @param node   Name of the edited node.
     * @param text   The rejected text.
     * @param result The rejected result, carrying the parse error.
     */
    void onEditRejected(String node, String text, EditResult result);
}
