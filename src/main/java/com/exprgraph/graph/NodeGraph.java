package com.exprgraph.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.exprgraph.node.EditResult;
import com.exprgraph.node.ExpressionNode;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.NumberOutput;
import com.exprgraph.node.NumberSourceNode;
import com.exprgraph.node.StringSourceNode;
import com.exprgraph.node.TextOutput;
import com.exprgraph.util.CompositeEditListener;

/**
 * A container of named nodes and the wires between them.
 *
 * This is the host side of the expression subsystem: it owns the connection
 * store, routes text edits to expression nodes, and pulls upstream values into
 * bound inputs whenever an output is requested.
 *
 * Wiring rules:
 * 1. An input slot holds at most one wire. Connecting into an occupied slot
 * replaces the previous wire.
 * 2. Slot 0 of an expression node accepts text outputs; every other input
 * accepts number outputs.
 * 3. Self-wires and wires that would close a cycle are rejected.
 *
 * Evaluation:
 * evaluate() is pull-based and recomputes on every call. For an expression
 * node it copies the value of each wired upstream node into the matching
 * binding; unwired bindings keep whatever value the host last set. It never
 * edits text or touches wires. Text reaches an expression node only through
 * editText(), through connect() into slot 0, or through updateText() on the
 * string source feeding it.
 *
 * Threading:
 * Single-threaded. Every operation completes before the next one starts.
 */
public final class NodeGraph {
    private static final Logger log = LogManager.getLogger(NodeGraph.class);

    private final String name;
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final InMemoryConnectionStore store;
    private final CompositeEditListener listener = new CompositeEditListener();

    public NodeGraph(String name) {
        this(name, new InMemoryConnectionStore());
    }

    public NodeGraph(String name, InMemoryConnectionStore store) {
        this.name = name;
        this.store = store;
    }

    public String name() {
        return name;
    }

    public InMemoryConnectionStore store() {
        return store;
    }

    public Map<String, GraphNode> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /** Registers an additional edit listener. */
    public void addListener(EditListener l) {
        listener.addForComposite(l);
    }

    // ── Nodes ──

    public <T extends GraphNode> T add(T node) {
        if (nodes.containsKey(node.name()))
            throw new IllegalArgumentException("Duplicate node name: " + node.name());
        nodes.put(node.name(), node);
        return node;
    }

    public NumberSourceNode addNumber(String nodeName, double value) {
        return add(new NumberSourceNode(nodeName, value));
    }

    public StringSourceNode addString(String nodeName, String text) {
        return add(new StringSourceNode(nodeName, text));
    }

    public ExpressionNode addExpression(String nodeName) {
        return add(new ExpressionNode(nodeName));
    }

    /**
     * Adds an expression node and applies {@code text} to it. If the text does
     * not parse the node is still added, holding the constant zero.
     */
    public ExpressionNode addExpression(String nodeName, String text) {
        ExpressionNode node = addExpression(nodeName);
        editText(nodeName, text);
        return node;
    }

    /**
     * Type-safe lookup of a node by name.
     *
     * @return The node, or null if not found.
     */
    @SuppressWarnings("unchecked")
    public <T extends GraphNode> T node(String nodeName) {
        return (T) nodes.get(nodeName);
    }

    private GraphNode require(String nodeName) {
        GraphNode node = nodes.get(nodeName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        return node;
    }

    private ExpressionNode requireExpression(String nodeName) {
        if (require(nodeName) instanceof ExpressionNode e)
            return e;
        throw new IllegalArgumentException("Node " + nodeName + " is not an expression node.");
    }

    /** Removes a node together with every wire into or out of it. */
    public void removeNode(String nodeName) {
        GraphNode node = require(nodeName);
        for (int i = 0; i < node.inputs(); i++)
            store.dropInputs(new InPinId(nodeName, i));
        for (int o = 0; o < node.outputs(); o++) {
            OutPinId out = new OutPinId(nodeName, o);
            for (InPinId in : store.targets(out))
                store.disconnect(out, in);
        }
        nodes.remove(nodeName);
        log.debug("Removed node {}", nodeName);
    }

    // ── Wires ──

    /**
     * Wires {@code out} into {@code in}, replacing any wire already feeding
     * {@code in}.
     *
     * @throws IllegalArgumentException for unknown nodes, pins out of range,
     *                                  self-wires or incompatible pin types.
     * @throws IllegalStateException    if the wire would close a cycle.
     */
    public void connect(OutPinId out, InPinId in) {
        GraphNode from = require(out.node());
        GraphNode to = require(in.node());
        if (out.output() < 0 || out.output() >= from.outputs())
            throw new IllegalArgumentException("No such output: " + out);
        if (in.input() < 0 || in.input() >= to.inputs())
            throw new IllegalArgumentException("No such input: " + in);
        if (out.node().equals(in.node()))
            throw new IllegalArgumentException("Self-edge not allowed: " + out.node());
        checkCompatible(from, to, in);
        if (reaches(in.node(), out.node()))
            throw new IllegalStateException("Cycle detected: " + out + " -> " + in);

        store.dropInputs(in);
        store.connect(out, in);
        log.debug("Connected {} -> {}", out, in);

        if (in.input() == 0 && to instanceof ExpressionNode && from instanceof TextOutput t)
            editText(in.node(), t.textValue());
    }

    public void connect(String fromNode, String toNode, int input) {
        connect(new OutPinId(fromNode, 0), new InPinId(toNode, input));
    }

    /**
     * Wires {@code fromNode} into the slot bound to {@code binding} on an
     * expression node.
     */
    public void connectBinding(String fromNode, String toNode, String binding) {
        int slot = requireExpression(toNode).slotOf(binding);
        if (slot < 0)
            throw new IllegalArgumentException("Node " + toNode + " has no binding: " + binding);
        connect(fromNode, toNode, slot);
    }

    public void disconnect(OutPinId out, InPinId in) {
        store.disconnect(out, in);
    }

    private static void checkCompatible(GraphNode from, GraphNode to, InPinId in) {
        boolean textSlot = to instanceof ExpressionNode && in.input() == 0;
        if (textSlot && !(from instanceof TextOutput))
            throw new IllegalArgumentException("Input " + in + " expects text, but " + from.name()
                    + " is a " + from.kind() + " node");
        if (!textSlot && !(from instanceof NumberOutput))
            throw new IllegalArgumentException("Input " + in + " expects a number, but " + from.name()
                    + " is a " + from.kind() + " node");
    }

    /** True if {@code target} is {@code start} or downstream of it. */
    private boolean reaches(String start, String target) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String curr = queue.poll();
            if (curr.equals(target))
                return true;
            if (!seen.add(curr))
                continue;
            GraphNode node = nodes.get(curr);
            if (node == null)
                continue;
            for (int o = 0; o < node.outputs(); o++)
                for (InPinId in : store.targets(new OutPinId(curr, o)))
                    queue.add(in.node());
        }
        return false;
    }

    /**
     * Removes wires that refer to unknown nodes or to slots a node no longer
     * exposes. Used after loading wires saved against an older layout.
     *
     * @return the number of wires removed.
     */
    public int pruneInvalidWires() {
        int removed = 0;
        for (Map.Entry<OutPinId, InPinId> wire : store.connections()) {
            OutPinId out = wire.getKey();
            InPinId in = wire.getValue();
            GraphNode from = nodes.get(out.node());
            GraphNode to = nodes.get(in.node());
            boolean valid = from != null && to != null
                    && out.output() < from.outputs()
                    && in.input() < to.inputs();
            if (!valid) {
                log.warn("Dropping stale wire {} -> {}", out, in);
                store.disconnect(out, in);
                removed++;
            }
        }
        return removed;
    }

    // ── Edits & evaluation ──

    /**
     * Applies a text edit to an expression node and notifies listeners.
     *
     * @throws IllegalArgumentException if the node is unknown or not an
     *                                  expression node.
     */
    public EditResult editText(String nodeName, String text) {
        ExpressionNode node = requireExpression(nodeName);
        EditResult result = node.applyTextEdit(text, store);
        if (result.isApplied())
            listener.onEditApplied(nodeName, text, result);
        else
            listener.onEditRejected(nodeName, text, result);
        return result;
    }

    /**
     * Sets the text of a string source and applies it to every expression node
     * whose slot 0 it feeds.
     *
     * @return The edit result of each downstream expression node, by name.
     * @throws IllegalArgumentException if the node is unknown or not a string
     *                                  source.
     */
    public Map<String, EditResult> updateText(String nodeName, String text) {
        if (!(require(nodeName) instanceof StringSourceNode source))
            throw new IllegalArgumentException("Node " + nodeName + " is not a string source.");
        source.update(text);

        Map<String, EditResult> results = new LinkedHashMap<>();
        for (InPinId in : store.targets(new OutPinId(nodeName, 0))) {
            if (in.input() == 0 && nodes.get(in.node()) instanceof ExpressionNode)
                results.put(in.node(), editText(in.node(), text));
        }
        return results;
    }

    /**
     * Computes the current output of a node, pulling upstream values first.
     *
     * @throws IllegalArgumentException if the node has no numeric output.
     */
    public double evaluate(String nodeName) {
        GraphNode node = require(nodeName);
        if (node instanceof ExpressionNode e) {
            for (int slot = 1; slot <= e.bindingCount(); slot++) {
                List<OutPinId> remotes = store.remotes(new InPinId(nodeName, slot));
                if (!remotes.isEmpty())
                    e.setBindingValue(slot, evaluate(remotes.get(0).node()));
            }
            return e.currentOutput();
        }
        if (node instanceof NumberOutput n)
            return n.doubleValue();
        throw new IllegalArgumentException("Node " + nodeName + " has no numeric output.");
    }
}
