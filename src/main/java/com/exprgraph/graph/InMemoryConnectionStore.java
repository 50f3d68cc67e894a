package com.exprgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference {@link ConnectionStore} backed by insertion-ordered maps.
 *
 * <p>
 * Keeps a forward index (input → remotes) and a reverse index (output →
 * inputs) so that removing a node can drop both its incoming and outgoing
 * wires. Remote order per input is insertion order.
 */
public final class InMemoryConnectionStore implements ConnectionStore {
    private final Map<InPinId, Set<OutPinId>> inputs = new LinkedHashMap<>();
    private final Map<OutPinId, Set<InPinId>> outputs = new LinkedHashMap<>();

    @Override
    public List<OutPinId> remotes(InPinId in) {
        Set<OutPinId> r = inputs.get(in);
        return r == null ? Collections.emptyList() : List.copyOf(r);
    }

    /** Returns the input pins currently fed by {@code out}. */
    public List<InPinId> targets(OutPinId out) {
        Set<InPinId> t = outputs.get(out);
        return t == null ? Collections.emptyList() : List.copyOf(t);
    }

    @Override
    public void connect(OutPinId out, InPinId in) {
        inputs.computeIfAbsent(in, k -> new LinkedHashSet<>()).add(out);
        outputs.computeIfAbsent(out, k -> new LinkedHashSet<>()).add(in);
    }

    @Override
    public void disconnect(OutPinId out, InPinId in) {
        Set<OutPinId> r = inputs.get(in);
        if (r != null && r.remove(out) && r.isEmpty())
            inputs.remove(in);
        Set<InPinId> t = outputs.get(out);
        if (t != null && t.remove(in) && t.isEmpty())
            outputs.remove(out);
    }

    @Override
    public void dropInputs(InPinId in) {
        for (OutPinId out : remotes(in))
            disconnect(out, in);
    }

    /** Returns every wire as {@code (out, in)} pairs, grouped by input. */
    public List<Map.Entry<OutPinId, InPinId>> connections() {
        List<Map.Entry<OutPinId, InPinId>> all = new ArrayList<>();
        for (var entry : inputs.entrySet())
            for (OutPinId out : entry.getValue())
                all.add(Map.entry(out, entry.getKey()));
        return all;
    }

    /** Total number of wires. */
    public int size() {
        int n = 0;
        for (Set<OutPinId> r : inputs.values())
            n += r.size();
        return n;
    }
}
