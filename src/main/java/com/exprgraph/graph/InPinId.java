package com.exprgraph.graph;

/**
 * Identity of an input slot: the owning node's name and the slot index.
 */
public record InPinId(String node, int input) {

    @Override
    public String toString() {
        return node + ".in[" + input + "]";
    }
}
