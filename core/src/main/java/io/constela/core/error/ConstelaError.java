package io.constela.core.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A user-facing compile diagnostic. Immutable; serializes to the JSON shape consumed by the CLI and
 * the language server ({@code code}, {@code severity}, {@code message} and, when present,
 * {@code path}, {@code suggestion} and {@code context}).
 *
 * @param code       closed error code
 * @param message    human-readable description
 * @param path       JSON Pointer to the offending node, or {@code null}
 * @param suggestion "did you mean" hint, or {@code null}
 * @param context    extra structured detail (for example {@code availableNames}), or {@code null}
 * @param severity   {@link Severity#ERROR} unless the diagnostic is advisory
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"code", "severity", "message", "path", "suggestion", "context"})
public record ConstelaError(
        ErrorCode code,
        String message,
        String path,
        String suggestion,
        Map<String, Object> context,
        Severity severity) {

    public ConstelaError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        severity = severity == null ? Severity.ERROR : severity;
    }

    public ConstelaError(
            ErrorCode code, String message, String path, String suggestion, Map<String, Object> context) {
        this(code, message, path, suggestion, context, Severity.ERROR);
    }

    public ConstelaError(ErrorCode code, String message, String path) {
        this(code, message, path, null, null, Severity.ERROR);
    }

    /** A warning: reported alongside a successful compile. */
    public static ConstelaError warning(ErrorCode code, String message, String path) {
        return new ConstelaError(code, message, path, null, null, Severity.WARNING);
    }

    /** Returns a copy carrying the given suggestion and context. */
    public ConstelaError withHint(String newSuggestion, Map<String, Object> newContext) {
        return new ConstelaError(code, message, path, newSuggestion, newContext, severity);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(code).append(": ").append(message);
        if (path != null) {
            sb.append(" at ").append(path);
        }
        if (suggestion != null) {
            sb.append(" (").append(suggestion).append(')');
        }
        return sb.toString();
    }
}
