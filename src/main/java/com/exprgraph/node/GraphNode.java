package com.exprgraph.node;

/**
 * A node that can be placed in a {@link com.exprgraph.graph.NodeGraph}.
 *
 * The set of node kinds is closed: {@link NumberSourceNode},
 * {@link StringSourceNode} and {@link ExpressionNode}. What a node produces is
 * exposed through capability interfaces ({@link NumberOutput},
 * {@link TextOutput}), and operations that only make sense for expressions
 * (text edits, bindings) exist only on {@link ExpressionNode}. Hosts dispatch
 * with {@code instanceof} rather than calling methods that would have to fail
 * at runtime for the wrong kind.
 */
public interface GraphNode {

    /** Unique name of this node within its graph. */
    String name();

    /** Number of input slots currently exposed. */
    int inputs();

    /** Number of output pins. */
    int outputs();

    /** Short type tag used in persisted documents and diagnostics. */
    String kind();
}
