package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Defensive-copy helpers used by the AST and IR records. Null stays null (absent field). */
public final class Immutables {

    private Immutables() {}

    /** Insertion-ordered unmodifiable copy, or {@code null} when {@code source} is null. */
    public static <K, V> Map<K, V> orderedMap(Map<K, V> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Unmodifiable copy, or {@code null} when {@code source} is null. */
    public static <T> List<T> list(List<T> source) {
        return source == null ? null : List.copyOf(source);
    }

    /**
     * Private deep copy of a JSON value, or {@code null} when {@code source} is null. Scalar nodes
     * are immutable and come back as-is; arrays and objects are detached from the caller's tree.
     */
    public static JsonNode json(JsonNode source) {
        return source == null ? null : source.deepCopy();
    }
}
