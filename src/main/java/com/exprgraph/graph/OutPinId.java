package com.exprgraph.graph;

/**
 * Identity of an output pin: the owning node's name and the output index.
 */
public record OutPinId(String node, int output) {

    @Override
    public String toString() {
        return node + ".out[" + output + "]";
    }
}
