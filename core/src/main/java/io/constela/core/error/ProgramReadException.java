package io.constela.core.error;

/** Thrown when a program file cannot be read or is not well-formed JSON/YAML. */
public final class ProgramReadException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public ProgramReadException(String message, String source) {
        super(message, source, Phase.READ);
    }

    public ProgramReadException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.READ);
    }
}
