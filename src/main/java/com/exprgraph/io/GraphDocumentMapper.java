package com.exprgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.exprgraph.graph.InPinId;
import com.exprgraph.graph.NodeGraph;
import com.exprgraph.graph.OutPinId;
import com.exprgraph.node.ExpressionNode;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.NodeState;
import com.exprgraph.node.NumberSourceNode;
import com.exprgraph.node.StringSourceNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Converts a {@link NodeGraph} to and from its JSON document form.
 *
 * <p>
 * Expression trees are not saved. On load every expression node is rebuilt
 * with {@link ExpressionNode#restore}, which reparses the last compiled text and
 * re-validates the stored bindings and their wires against the fresh tree.
 * Wires are therefore loaded into the store before the expression nodes that
 * own them. Wires left pointing at missing nodes or slots are pruned.
 */
@Log4j2
public final class GraphDocumentMapper {
    public static final String FORMAT_VERSION = "1.0";

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public GraphDocument toDocument(NodeGraph graph) {
        GraphDocument doc = new GraphDocument();
        doc.setName(graph.name());
        doc.setVersion(FORMAT_VERSION);

        List<GraphDocument.NodeDef> nodeDefs = new ArrayList<>();
        for (GraphNode node : graph.nodes().values()) {
            GraphDocument.NodeDef def = new GraphDocument.NodeDef();
            def.setName(node.name());
            def.setType(node.kind());
            if (node instanceof ExpressionNode e) {
                NodeState state = e.snapshot();
                def.setText(state.text());
                if (!state.compiledText().equals(state.text()))
                    def.setCompiledText(state.compiledText());
                def.setBindings(state.bindings());
                def.setValues(state.values());
            } else if (node instanceof NumberSourceNode n) {
                def.setValue(n.doubleValue());
            } else if (node instanceof StringSourceNode s) {
                def.setText(s.textValue());
            }
            nodeDefs.add(def);
        }
        doc.setNodes(nodeDefs);

        List<GraphDocument.ConnectionDef> wires = new ArrayList<>();
        for (Map.Entry<OutPinId, InPinId> wire : graph.store().connections()) {
            GraphDocument.ConnectionDef def = new GraphDocument.ConnectionDef();
            def.setFromNode(wire.getKey().node());
            def.setOutput(wire.getKey().output());
            def.setToNode(wire.getValue().node());
            def.setInput(wire.getValue().input());
            wires.add(def);
        }
        doc.setConnections(wires);
        return doc;
    }

    /**
     * Builds a live graph from a document.
     *
     * @throws IllegalArgumentException for unknown node types, missing names,
     *                                  mismatched, null or duplicate
     *                                  bindings/values.
     */
    public NodeGraph toGraph(GraphDocument doc) {
        NodeGraph graph = new NodeGraph(doc.getName() != null ? doc.getName() : "graph");

        if (doc.getConnections() != null) {
            for (GraphDocument.ConnectionDef c : doc.getConnections())
                graph.store().connect(new OutPinId(c.getFromNode(), c.getOutput()),
                        new InPinId(c.getToNode(), c.getInput()));
        }

        if (doc.getNodes() != null) {
            for (GraphDocument.NodeDef def : doc.getNodes()) {
                if (def.getName() == null)
                    throw new IllegalArgumentException("Node without a name");
                String type = def.getType() != null ? def.getType() : "";
                switch (type) {
                    case NumberSourceNode.KIND -> graph.addNumber(def.getName(),
                            def.getValue() != null ? def.getValue() : 0.0);
                    case StringSourceNode.KIND -> graph.addString(def.getName(),
                            def.getText() != null ? def.getText() : "");
                    case ExpressionNode.KIND -> graph.add(ExpressionNode.restore(def.getName(), stateOf(def),
                            graph.store()));
                    default -> throw new IllegalArgumentException(
                            "Unknown node type '" + type + "' for node: " + def.getName());
                }
            }
        }

        int pruned = graph.pruneInvalidWires();
        log.info("Loaded graph {} ({} nodes, {} wires, {} pruned)", graph.name(), graph.nodes().size(),
                graph.store().size(), pruned);
        return graph;
    }

    private static NodeState stateOf(GraphDocument.NodeDef def) {
        return new NodeState(
                def.getText() != null ? def.getText() : ExpressionNode.DEFAULT_TEXT,
                def.getCompiledText(),
                def.getBindings() != null ? def.getBindings() : List.of(),
                def.getValues() != null ? def.getValues() : List.of());
    }

    // ── JSON ──

    public String write(NodeGraph graph) {
        try {
            return mapper.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph " + graph.name(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the JSON is malformed.
     */
    public NodeGraph read(String json) {
        try {
            return toGraph(mapper.readValue(json, GraphDocument.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph document: " + e.getOriginalMessage(), e);
        }
    }

    public void save(NodeGraph graph, Path path) throws IOException {
        Files.writeString(path, write(graph));
        log.info("Graph {} saved to {}", graph.name(), path);
    }

    public NodeGraph load(Path path) throws IOException {
        return read(Files.readString(path));
    }
}
