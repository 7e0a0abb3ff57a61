package io.constela.core.error;

/**
 * Abstract base for all Constela compiler faults. These signal problems outside the user-facing
 * {@link ConstelaError} channel: unreadable files, bad configuration, or broken invariants inside
 * the compiler itself. Never thrown directly, use one of the concrete subclasses.
 */
public abstract class CompilerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the fault occurred. */
    public enum Phase {
        READ,
        CONFIG,
        TRANSFORM
    }

    private final String source;
    private final Phase phase;

    protected CompilerException(String message, String source, Phase phase) {
        super(message);
        this.source = source;
        this.phase = phase;
    }

    protected CompilerException(String message, Throwable cause, String source, Phase phase) {
        super(message, cause);
        this.source = source;
        this.phase = phase;
    }

    /** The file path or resource identifier involved, or {@code null} if not applicable. */
    public String source() {
        return source;
    }

    /** Human-readable fault description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the fault occurred. */
    public Phase phase() {
        return phase;
    }
}
