package io.constela.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.constela.core.error.ConstelaError;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Serializes {@link CompiledProgram} and {@link ConstelaError} values to the JSON shapes consumed by
 * renderers, the CLI and the language server. Absent optional fields are omitted, never written as
 * {@code null}; literal {@code null} values inside expressions are kept.
 *
 * <p>
 * Thread-safe: the mapper is configured once and never mutated.
 */
public final class CompiledProgramWriter {

    /** Deepest lowered view, in view levels, the writer is sized for. */
    public static final int MAX_VIEW_DEPTH = 4096;

    /**
     * JSON nesting allowed on output. A view level takes at most two JSON levels (a node and its
     * children array); the rest is headroom for the expressions and steps under the deepest node.
     */
    static final int MAX_NESTING_DEPTH = 4 * MAX_VIEW_DEPTH;

    private static final ObjectMapper MAPPER = new ObjectMapper(JsonFactory.builder()
                    .streamWriteConstraints(StreamWriteConstraints.builder()
                            .maxNestingDepth(MAX_NESTING_DEPTH)
                            .build())
                    .streamReadConstraints(StreamReadConstraints.builder()
                            .maxNestingDepth(MAX_NESTING_DEPTH)
                            .build())
                    .build())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private CompiledProgramWriter() {}

    public static JsonNode toTree(CompiledProgram program) {
        return MAPPER.valueToTree(program);
    }

    public static JsonNode toTree(List<ConstelaError> errors) {
        return MAPPER.valueToTree(errors);
    }

    public static String toJson(CompiledProgram program, boolean pretty) {
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(program)
                    : MAPPER.writeValueAsString(program);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize compiled program", e);
        }
    }
}
