package io.constela.core.spi;

import io.constela.core.error.ErrorCode;

/**
 * Observability hook for compiler runs. Tooling (a CLI, a language server, a build plugin) can
 * implement it to collect timings and failure statistics without the core depending on any
 * metrics library.
 *
 * <p>
 * All methods receive immutable event records. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by a listener are caught and logged by the compiler; they never
 * change the compile result.
 *
 * <p>
 * Every method has an empty default so implementations override only what they need.
 */
public interface CompileListener {

    /** Called when a compile run begins. */
    default void onCompileStarted(CompileStartedEvent event) {}

    /** Called when the schema validator rejects the document. */
    default void onValidationFailed(ValidationFailedEvent event) {}

    /** Called when semantic analysis reports errors. */
    default void onAnalysisFailed(AnalysisFailedEvent event) {}

    /** Called when a program compiled successfully. */
    default void onCompileCompleted(CompileCompletedEvent event) {}

    // ── Event records ──

    /** @param routePath the route path, or {@code null} when the document has none or is not an object */
    record CompileStartedEvent(String routePath) {}

    record ValidationFailedEvent(ErrorCode code, String path, long durationMs) {}

    /** @param errorCount number of errors, always at least one */
    record AnalysisFailedEvent(int errorCount, ErrorCode firstCode, long durationMs) {}

    record CompileCompletedEvent(String routePath, int actionCount, int inlinedComponents, long durationMs) {}
}
