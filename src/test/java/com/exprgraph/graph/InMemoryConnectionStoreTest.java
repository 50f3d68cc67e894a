package com.exprgraph.graph;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class InMemoryConnectionStoreTest {

    private final InMemoryConnectionStore store = new InMemoryConnectionStore();
    private final OutPinId a = new OutPinId("a", 0);
    private final OutPinId b = new OutPinId("b", 0);
    private final InPinId slot = new InPinId("n", 1);

    @Test
    public void testConnectIsIdempotent() {
        store.connect(a, slot);
        store.connect(a, slot);
        assertEquals(List.of(a), store.remotes(slot));
        assertEquals(1, store.size());
    }

    @Test
    public void testRemotesKeepInsertionOrder() {
        store.connect(b, slot);
        store.connect(a, slot);
        assertEquals(List.of(b, a), store.remotes(slot));
        assertEquals(List.of(slot), store.targets(a));
    }

    @Test
    public void testDisconnectMissingWireIsNoOp() {
        store.disconnect(a, slot);
        store.connect(a, slot);
        store.disconnect(b, slot);
        assertEquals(1, store.size());
    }

    @Test
    public void testDropInputsClearsBothIndexes() {
        store.connect(a, slot);
        store.connect(b, slot);
        store.dropInputs(slot);
        store.dropInputs(slot);

        assertTrue(store.remotes(slot).isEmpty());
        assertTrue(store.targets(a).isEmpty());
        assertTrue(store.targets(b).isEmpty());
        assertTrue(store.connections().isEmpty());
    }

    @Test
    public void testRemotesIsASnapshot() {
        store.connect(a, slot);
        List<OutPinId> before = store.remotes(slot);
        store.dropInputs(slot);
        assertEquals(List.of(a), before);
    }
}
