package io.constela.core.error;

/**
 * Thrown when the lowering pass meets a tree that the validator and analyzer should have rejected.
 * This is a compiler bug, not a user error, and is never reported as a {@link ConstelaError}.
 */
public final class InternalCompilerException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public InternalCompilerException(String message) {
        super(message, null, Phase.TRANSFORM);
    }

    public InternalCompilerException(String message, Throwable cause) {
        super(message, cause, null, Phase.TRANSFORM);
    }
}
