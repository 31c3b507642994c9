package com.exprgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.exprgraph.api.EdgeKind;
import com.exprgraph.api.EvaluationMode;
import com.exprgraph.api.FailureKind;
import com.exprgraph.engine.GraphSnapshot;
import com.exprgraph.engine.GraphStore;
import com.exprgraph.expr.EvaluationFailure;
import com.exprgraph.node.DerivedEdge;
import com.exprgraph.node.GraphNode;
import com.exprgraph.node.Position;
import com.exprgraph.node.TypedEdge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.extern.log4j.Log4j2;

/**
 * Converts graph snapshots to and from their JSON export form.
 *
 * <p>
 * Doubles are written with Jackson's shortest round-trip representation, so
 * values and positions read back bit-for-bit identical.
 */
@Log4j2
public final class GraphSnapshotCodec {
    private final ObjectMapper mapper;

    public GraphSnapshotCodec() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public GraphDocument toDocument(GraphSnapshot snapshot) {
        GraphDocument doc = new GraphDocument();
        doc.setMode(snapshot.mode().name().toLowerCase(Locale.ROOT));
        doc.setRevision(snapshot.revision());

        List<GraphDocument.NodeDef> nodeDefs = new ArrayList<>(snapshot.nodes().size());
        for (GraphNode n : snapshot.nodes()) {
            GraphDocument.NodeDef nd = new GraphDocument.NodeDef();
            nd.setId(n.id());
            nd.setLabel(n.label());
            nd.setX(n.position().x());
            nd.setY(n.position().y());
            nd.setValue(n.value());
            nd.setValueExpression(n.valueExpression());
            if (n.lastFailure() != null) {
                GraphDocument.FailureDef fd = new GraphDocument.FailureDef();
                fd.setKind(n.lastFailure().kind().name());
                fd.setMessage(n.lastFailure().message());
                nd.setLastFailure(fd);
            }
            nodeDefs.add(nd);
        }
        doc.setNodes(nodeDefs);

        List<GraphDocument.EdgeDef> edgeDefs = new ArrayList<>();
        if (snapshot.mode() == EvaluationMode.EXPRESSION) {
            for (DerivedEdge e : snapshot.derivedEdges()) {
                GraphDocument.EdgeDef ed = new GraphDocument.EdgeDef();
                ed.setSource(e.sourceId());
                ed.setTarget(e.targetId());
                edgeDefs.add(ed);
            }
        } else {
            for (TypedEdge e : snapshot.typedEdges()) {
                GraphDocument.EdgeDef ed = new GraphDocument.EdgeDef();
                ed.setId(e.id());
                ed.setSource(e.sourceId());
                ed.setTarget(e.targetId());
                ed.setType(e.kind().wireName());
                edgeDefs.add(ed);
            }
        }
        doc.setEdges(edgeDefs);
        doc.setImpulses(new ArrayList<>(snapshot.impulses()));
        return doc;
    }

    public String toJson(GraphSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(toDocument(snapshot));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot: " + e.getMessage(), e);
        }
    }

    public GraphDocument fromJson(String json) throws IOException {
        return mapper.readValue(json, GraphDocument.class);
    }

    public void writeFile(Path path, GraphSnapshot snapshot) throws IOException {
        Files.writeString(path, toJson(snapshot));
        log.info("Exported {} nodes to {}", snapshot.nodes().size(), path);
    }

    public GraphDocument readFile(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    /**
     * Rebuilds a live store from a document. The document's mode wins over
     * {@code options}; everything else in {@code options} is kept.
     */
    public GraphStore toStore(GraphDocument doc, StoreOptions options) {
        StoreOptions effective = new StoreOptions();
        effective.setPropagateOnEdit(options.isPropagateOnEdit());
        effective.setDefaultLabel(options.getDefaultLabel());
        effective.setDefaultValue(options.getDefaultValue());
        effective.setMode(doc.getMode() != null ? parseMode(doc.getMode()) : options.getMode());

        List<GraphNode> nodes = new ArrayList<>();
        if (doc.getNodes() != null) {
            for (GraphDocument.NodeDef nd : doc.getNodes()) {
                nodes.add(new GraphNode(nd.getId(), nd.getLabel(), new Position(nd.getX(), nd.getY()),
                        nd.getValue(), nd.getValueExpression(), toFailure(nd)));
            }
        }

        List<TypedEdge> edges = new ArrayList<>();
        if (effective.getMode() == EvaluationMode.TYPED_EDGE && doc.getEdges() != null) {
            for (GraphDocument.EdgeDef ed : doc.getEdges()) {
                if (ed.getId() == null)
                    throw new IllegalArgumentException("Typed edge without id: " + ed);
                edges.add(new TypedEdge(ed.getId(), ed.getSource(), ed.getTarget(), EdgeKind.fromString(ed.getType())));
            }
        }

        List<Integer> impulses = doc.getImpulses() != null ? doc.getImpulses() : List.of();
        return GraphStore.restore(effective, doc.getRevision(), nodes, edges, impulses);
    }

    private static EvaluationFailure toFailure(GraphDocument.NodeDef nd) {
        GraphDocument.FailureDef fd = nd.getLastFailure();
        if (fd == null)
            return null;
        if (fd.getKind() == null)
            throw new IllegalArgumentException("Failure without kind on node " + nd.getId());
        FailureKind kind;
        try {
            kind = FailureKind.valueOf(fd.getKind());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown failure kind on node " + nd.getId() + ": " + fd.getKind(), e);
        }
        return new EvaluationFailure(nd.getId(), nd.getLabel(), kind, fd.getMessage());
    }

    private static EvaluationMode parseMode(String s) {
        try {
            return EvaluationMode.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown evaluation mode: " + s, e);
        }
    }
}
