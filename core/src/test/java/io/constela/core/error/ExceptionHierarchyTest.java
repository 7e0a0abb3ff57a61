package io.constela.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the compiler fault hierarchy: one abstract root, concrete subclasses per phase. */
class ExceptionHierarchyTest {

    @Test
    void compilerExceptionIsAbstractAndUnchecked() {
        assertThat(CompilerException.class).isAbstract();
        assertThat(CompilerException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void programReadExceptionCarriesSourceAndReadPhase() {
        var cause = new RuntimeException("unexpected token");
        var ex = new ProgramReadException("bad json", cause, "/tmp/app.json");

        assertThat(ex).isInstanceOf(CompilerException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.detail()).isEqualTo("bad json");
        assertThat(ex.source()).isEqualTo("/tmp/app.json");
        assertThat(ex.phase()).isEqualTo(CompilerException.Phase.READ);
    }

    @Test
    void configLoadExceptionUsesConfigPhase() {
        var ex = new ConfigLoadException("missing", "compiler.yaml");

        assertThat(ex.phase()).isEqualTo(CompilerException.Phase.CONFIG);
        assertThat(ex.source()).isEqualTo("compiler.yaml");
    }

    @Test
    void internalCompilerExceptionHasNoSource() {
        var ex = new InternalCompilerException("unresolved component");

        assertThat(ex.phase()).isEqualTo(CompilerException.Phase.TRANSFORM);
        assertThat(ex.source()).isNull();
        assertThat(ex.getMessage()).isEqualTo("unresolved component");
    }
}
