package com.exprgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.exprgraph.api.EvaluationMode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import lombok.Data;

/**
 * Store configuration.
 *
 * <p>
 * Plain JSON, e.g. {@code {"mode": "typed_edge", "propagateOnEdit": false}}.
 * Missing keys keep their defaults and unknown keys are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StoreOptions {
    /** Classpath resource consulted by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "expr-graph.json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private EvaluationMode mode = EvaluationMode.EXPRESSION;

    /** Re-evaluate every transitive dependent after an expression edit. */
    private boolean propagateOnEdit = true;

    private String defaultLabel = "New node";
    private double defaultValue = 1;

    public static StoreOptions defaults() {
        return new StoreOptions();
    }

    public static StoreOptions forMode(EvaluationMode mode) {
        StoreOptions o = new StoreOptions();
        o.setMode(mode);
        return o;
    }

    /** Reads options from a JSON file. */
    public static StoreOptions load(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), StoreOptions.class);
    }

    /** Reads {@value #DEFAULT_RESOURCE} from the classpath, or defaults if absent. */
    public static StoreOptions load() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Reads options from a classpath resource.
     *
     * @return The parsed options, or defaults if the resource does not exist.
     * @throws UncheckedIOException if the resource exists but cannot be read.
     */
    public static StoreOptions fromResource(String resource) {
        try (InputStream in = StoreOptions.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                return defaults();
            return MAPPER.readValue(in, StoreOptions.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read store options from " + resource, e);
        }
    }
}
