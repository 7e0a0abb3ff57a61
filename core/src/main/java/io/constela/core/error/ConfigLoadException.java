package io.constela.core.error;

/** Thrown when compiler configuration (YAML file or environment overlay) is invalid. */
public final class ConfigLoadException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, source, Phase.CONFIG);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.CONFIG);
    }
}
