package io.constela.core.engine;

import io.constela.core.error.ConstelaError;
import io.constela.core.ir.CompiledProgram;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link ConstelaCompiler#compile}: the lowered program, or the errors of the first pass
 * that failed. A validation failure carries exactly one error; an analysis failure carries every
 * error the analyzer found. A success may carry warnings.
 */
public final class CompileResult {

    private final CompiledProgram program;
    private final List<ConstelaError> errors;
    private final List<ConstelaError> warnings;

    private CompileResult(CompiledProgram program, List<ConstelaError> errors, List<ConstelaError> warnings) {
        this.program = program;
        this.errors = errors;
        this.warnings = warnings;
    }

    public static CompileResult success(CompiledProgram program) {
        return success(program, List.of());
    }

    public static CompileResult success(CompiledProgram program, List<ConstelaError> warnings) {
        Objects.requireNonNull(program, "program must not be null for success");
        return new CompileResult(program, List.of(), List.copyOf(warnings));
    }

    public static CompileResult failure(List<ConstelaError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("failure requires at least one error");
        }
        return new CompileResult(null, List.copyOf(errors), List.of());
    }

    public boolean isSuccess() {
        return program != null;
    }

    /** Only valid when {@link #isSuccess()}. */
    public CompiledProgram program() {
        return program;
    }

    /** Empty on success. */
    public List<ConstelaError> errors() {
        return errors;
    }

    /** Advisory findings of a successful compile; empty on failure. */
    public List<ConstelaError> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CompileResult[OK]" : "CompileResult[" + errors.size() + " error(s)]";
    }
}
