package com.exprgraph.node;

/** A node whose output pin carries a double. */
public interface NumberOutput extends GraphNode {

    double doubleValue();
}
