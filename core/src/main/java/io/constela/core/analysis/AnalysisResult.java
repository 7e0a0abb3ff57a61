package io.constela.core.analysis;

import io.constela.core.error.ConstelaError;
import java.util.List;
import java.util.Objects;

/** Outcome of semantic analysis: the resolved context, or every error found in one traversal. */
public final class AnalysisResult {

    private final AnalysisContext context;
    private final List<ConstelaError> errors;

    private AnalysisResult(AnalysisContext context, List<ConstelaError> errors) {
        this.context = context;
        this.errors = errors;
    }

    public static AnalysisResult success(AnalysisContext context) {
        Objects.requireNonNull(context, "context must not be null for success");
        return new AnalysisResult(context, List.of());
    }

    public static AnalysisResult failure(List<ConstelaError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("failure requires at least one error");
        }
        return new AnalysisResult(null, List.copyOf(errors));
    }

    public boolean isSuccess() {
        return context != null;
    }

    /** Only valid when {@link #isSuccess()}. */
    public AnalysisContext context() {
        return context;
    }

    /** Empty on success. */
    public List<ConstelaError> errors() {
        return errors;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AnalysisResult[OK]" : "AnalysisResult[" + errors.size() + " error(s)]";
    }
}
