package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A declared state field.
 *
 * <p>
 * {@code initial} is kept exactly as parsed. It is either a literal matching {@code type} or a
 * deferred {@code cookie} expression ({@code {"expr":"cookie","key":...,"default":...}}) that the
 * runtime resolves; the compiler never evaluates it. The node is a private copy and must be treated
 * as read-only.
 */
public record StateField(StateType type, JsonNode initial) {

    public StateField {
        Objects.requireNonNull(type, "type must not be null");
        initial = Immutables.json(Objects.requireNonNull(initial, "initial must not be null"));
    }

    /** Returns {@code true} if {@code node} is a cookie initial-value expression. */
    public static boolean isCookieExpression(JsonNode node) {
        return node.isObject() && "cookie".equals(node.path("expr").asText(null));
    }

    public boolean hasDeferredInitial() {
        return isCookieExpression(initial);
    }
}
