package io.constela.core.engine;

import io.constela.core.ir.CompiledProgramWriter;

/**
 * Tunables of the compiler pipeline.
 *
 * @param maxDepth           maximum nesting of views, expressions and steps in the source document
 * @param maxExpandedDepth   maximum depth of the view once every component is inlined; at most
 *                           {@link CompiledProgramWriter#MAX_VIEW_DEPTH} so every accepted program
 *                           can be written out
 * @param suggestionDistance largest edit distance for "Did you mean" hints
 * @param maxExpandedNodes   maximum number of view nodes once every component is inlined
 */
public record CompilerConfig(int maxDepth, int maxExpandedDepth, int suggestionDistance, int maxExpandedNodes) {

    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final int DEFAULT_MAX_EXPANDED_DEPTH = 1024;
    public static final int DEFAULT_SUGGESTION_DISTANCE = 2;
    public static final int DEFAULT_MAX_EXPANDED_NODES = 100_000;

    /** Default configuration. */
    public static final CompilerConfig DEFAULT = new CompilerConfig(
            DEFAULT_MAX_DEPTH, DEFAULT_MAX_EXPANDED_DEPTH, DEFAULT_SUGGESTION_DISTANCE, DEFAULT_MAX_EXPANDED_NODES);

    public CompilerConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxExpandedDepth <= 0 || maxExpandedDepth > CompiledProgramWriter.MAX_VIEW_DEPTH) {
            throw new IllegalArgumentException("maxExpandedDepth must be between 1 and "
                    + CompiledProgramWriter.MAX_VIEW_DEPTH + ", got: " + maxExpandedDepth);
        }
        if (suggestionDistance < 0) {
            throw new IllegalArgumentException("suggestionDistance must not be negative, got: " + suggestionDistance);
        }
        if (maxExpandedNodes <= 0) {
            throw new IllegalArgumentException("maxExpandedNodes must be positive, got: " + maxExpandedNodes);
        }
    }

    /** Configuration with the default node budget. */
    public CompilerConfig(int maxDepth, int maxExpandedDepth, int suggestionDistance) {
        this(maxDepth, maxExpandedDepth, suggestionDistance, DEFAULT_MAX_EXPANDED_NODES);
    }
}
