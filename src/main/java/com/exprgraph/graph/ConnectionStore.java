package com.exprgraph.graph;

import java.util.List;

/**
 * The externally owned store of wires between node pins.
 *
 * All operations are synchronous and take effect immediately. They are
 * idempotent: connecting an existing wire, disconnecting a missing one, or
 * dropping the inputs of an unconnected slot are no-ops.
 *
 * Expression nodes never hold on to the store between edits. Each command
 * issued during an edit is discrete; there is no batching or rollback.
 */
public interface ConnectionStore {

    /**
     * Returns the remote output pins currently wired into {@code in}, in the
     * order they were connected. The returned list is a snapshot and is not
     * affected by later commands.
     */
    List<OutPinId> remotes(InPinId in);

    /** Wires {@code out} into {@code in}. */
    void connect(OutPinId out, InPinId in);

    /** Removes the wire from {@code out} into {@code in}, if present. */
    void disconnect(OutPinId out, InPinId in);

    /** Removes every wire feeding {@code in}. */
    void dropInputs(InPinId in);
}
