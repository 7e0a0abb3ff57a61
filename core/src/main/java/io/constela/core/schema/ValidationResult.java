package io.constela.core.schema;

import io.constela.core.error.ConstelaError;
import io.constela.core.model.Program;
import java.util.Objects;

/** Outcome of schema validation: either the typed program or the first structural error. */
public final class ValidationResult {

    private final Program program;
    private final ConstelaError error;

    private ValidationResult(Program program, ConstelaError error) {
        this.program = program;
        this.error = error;
    }

    public static ValidationResult success(Program program) {
        Objects.requireNonNull(program, "program must not be null for success");
        return new ValidationResult(program, null);
    }

    public static ValidationResult failure(ConstelaError error) {
        Objects.requireNonNull(error, "error must not be null for failure");
        return new ValidationResult(null, error);
    }

    public boolean isSuccess() {
        return program != null;
    }

    /** The validated program. Only valid when {@link #isSuccess()}. */
    public Program program() {
        return program;
    }

    /** The first violation found. Only valid when not {@link #isSuccess()}. */
    public ConstelaError error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ValidationResult[OK]" : "ValidationResult[" + error + "]";
    }
}
