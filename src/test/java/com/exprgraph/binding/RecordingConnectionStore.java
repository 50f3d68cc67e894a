package com.exprgraph.binding;

import com.exprgraph.graph.ConnectionStore;
import com.exprgraph.graph.InMemoryConnectionStore;
import com.exprgraph.graph.InPinId;
import com.exprgraph.graph.OutPinId;

import java.util.ArrayList;
import java.util.List;

/** Delegating store that logs every mutating command. */
class RecordingConnectionStore implements ConnectionStore {
    final InMemoryConnectionStore delegate = new InMemoryConnectionStore();
    final List<String> commands = new ArrayList<>();

    @Override
    public List<OutPinId> remotes(InPinId in) {
        return delegate.remotes(in);
    }

    @Override
    public void connect(OutPinId out, InPinId in) {
        commands.add("connect " + out + " " + in);
        delegate.connect(out, in);
    }

    @Override
    public void disconnect(OutPinId out, InPinId in) {
        commands.add("disconnect " + out + " " + in);
        delegate.disconnect(out, in);
    }

    @Override
    public void dropInputs(InPinId in) {
        commands.add("drop " + in);
        delegate.dropInputs(in);
    }
}
