package com.exprgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO form of an exported graph.
 *
 * <pre>
 * {
 *   "mode": "typed_edge",
 *   "revision": 12,
 *   "nodes": [ { "id": 1, "label": "A", "x": 0.5, "y": 0.25, "value": 1,
 *                "lastFailure": { "kind": "UNRESOLVED_REFERENCE", "message": "..." } } ],
 *   "edges": [ { "id": 1, "source": 1, "target": 2, "type": "increment" } ],
 *   "impulses": [ 2 ]
 * }
 * </pre>
 *
 * Derived edges carry no id or type; they are informational and re-derived on
 * import.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphDocument {
    private String mode;
    private long revision;
    private List<NodeDef> nodes = new ArrayList<>();
    private List<EdgeDef> edges = new ArrayList<>();
    private List<Integer> impulses = new ArrayList<>();

    /** One node with every attribute. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private int id;
        private String label;
        private double x, y;
        private double value;
        private String valueExpression;
        private FailureDef lastFailure;
    }

    /** Failure of a node's most recent evaluation; absent when it succeeded. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FailureDef {
        private String kind;
        private String message;
    }

    /** One edge; {@code id} and {@code type} are null for derived edges. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeDef {
        private Integer id;
        private int source, target;
        private String type;
    }
}
