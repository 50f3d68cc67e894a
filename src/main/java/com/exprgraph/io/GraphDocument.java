package com.exprgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a saved node graph.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDocument {
    private String name, version;
    private List<NodeDef> nodes = new ArrayList<>();
    private List<ConnectionDef> connections = new ArrayList<>();

    /**
     * Definition of a single node. Which fields are used depends on
     * {@code type}: {@code value} for number nodes, {@code text} for string
     * nodes, and {@code text}, {@code compiledText}, {@code bindings},
     * {@code values} for expression nodes. {@code compiledText} is written only
     * when the buffer holds an edit that did not parse.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, text, compiledText;
        private Double value;
        private List<String> bindings;
        private List<Double> values;
    }

    /** A wire from an output pin into an input slot. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionDef {
        private String fromNode, toNode;
        private int output, input;
    }
}
