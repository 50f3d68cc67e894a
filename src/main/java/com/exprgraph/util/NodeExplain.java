package com.exprgraph.util;

import java.util.List;

import com.exprgraph.ast.ExpressionFormatter;
import com.exprgraph.graph.InPinId;
import com.exprgraph.graph.NodeGraph;
import com.exprgraph.graph.OutPinId;
import com.exprgraph.node.ExpressionNode;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.NumberOutput;
import com.exprgraph.node.TextOutput;

/**
 * Diagnostic utility for inspecting node state and wiring.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and logging. Allocates strings;
 * reads values without pulling from upstream nodes.
 */
public final class NodeExplain {
    private final NodeGraph graph;

    public NodeExplain(NodeGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeName) {
        GraphNode node = graph.node(nodeName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n');
        if (node instanceof ExpressionNode e) {
            sb.append("  Text: ").append(e.text()).append('\n')
                    .append("  Compiled: ").append(ExpressionFormatter.format(e.expression())).append('\n')
                    .append("  [0] text").append(remotesOf(nodeName, 0)).append('\n');
            for (int slot = 1; slot <= e.bindingCount(); slot++) {
                sb.append("  [").append(slot).append("] ").append(e.bindingName(slot))
                        .append(" = ").append(e.bindingValue(slot))
                        .append(remotesOf(nodeName, slot)).append('\n');
            }
            sb.append("  Output: ").append(e.currentOutput()).append('\n');
        } else if (node instanceof NumberOutput n) {
            sb.append("  Value: ").append(n.doubleValue()).append('\n');
        } else if (node instanceof TextOutput t) {
            sb.append("  Text: ").append(t.textValue()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps every node and the wires feeding it.
     */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(graph.nodes().size()).append(" nodes, ")
                .append(graph.store().size()).append(" wires):\n");
        for (GraphNode node : graph.nodes().values()) {
            sb.append("  ").append(node.name()).append(" (").append(node.kind()).append(')');
            for (int i = 0; i < node.inputs(); i++) {
                List<OutPinId> remotes = graph.store().remotes(new InPinId(node.name(), i));
                for (OutPinId out : remotes)
                    sb.append(" <- ").append(out.node()).append(" @").append(i);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private String remotesOf(String nodeName, int slot) {
        List<OutPinId> remotes = graph.store().remotes(new InPinId(nodeName, slot));
        return remotes.isEmpty() ? "" : " <- " + remotes.get(0);
    }
}
