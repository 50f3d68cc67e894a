package com.exprgraph.binding;

import java.util.ArrayList;
import java.util.List;

import com.exprgraph.graph.ConnectionStore;
import com.exprgraph.graph.InPinId;
import com.exprgraph.graph.OutPinId;

import lombok.extern.log4j.Log4j2;

/**
 * Applies a {@link Reconciliation} plan to a {@link ConnectionStore}.
 *
 * <p>
 * Order of commands:
 * <ol>
 * <li>Drop every wire feeding a slot whose binding disappeared.</li>
 * <li>Read the remotes of every moving slot once, before any of them is
 * changed.</li>
 * <li>Disconnect each of those remotes from its old slot.</li>
 * <li>Connect each remote to its new slot.</li>
 * </ol>
 * Every remote is disconnected before it is reconnected and keeps its identity.
 * No slot is re-read after the first command, so a move never picks up a wire
 * that another move has just delivered.
 */
@Log4j2
public final class ConnectionMigrator {
    private ConnectionMigrator() {
        // Utility class
    }

    /**
     * @return the number of store commands issued.
     */
    public static int apply(String node, Reconciliation plan, ConnectionStore store) {
        if (plan.isConnectionNoOp())
            return 0;

        int commands = 0;
        for (int slot : plan.droppedSlots()) {
            InPinId in = new InPinId(node, slot);
            log.debug("Dropping inputs of {}", in);
            store.dropInputs(in);
            commands++;
        }

        List<PendingMove> pending = new ArrayList<>();
        for (SlotMove move : plan.moves())
            for (OutPinId remote : store.remotes(new InPinId(node, move.fromSlot())))
                pending.add(new PendingMove(remote, new InPinId(node, move.fromSlot()), new InPinId(node, move.toSlot())));

        for (PendingMove p : pending) {
            store.disconnect(p.remote(), p.from());
            commands++;
        }
        for (PendingMove p : pending) {
            log.debug("Moving {} from {} to {}", p.remote(), p.from(), p.to());
            store.connect(p.remote(), p.to());
            commands++;
        }
        return commands;
    }

    private record PendingMove(OutPinId remote, InPinId from, InPinId to) {
    }
}
