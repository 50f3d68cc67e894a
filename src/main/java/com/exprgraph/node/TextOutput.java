package com.exprgraph.node;

/** A node whose output pin carries raw text. */
public interface TextOutput extends GraphNode {

    String textValue();
}
