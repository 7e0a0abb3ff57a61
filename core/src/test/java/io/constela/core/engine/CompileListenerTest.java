package io.constela.core.engine;

import static io.constela.core.testkit.TestPrograms.load;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constela.core.error.ErrorCode;
import io.constela.core.spi.CompileListener;
import io.constela.core.spi.CompileListener.AnalysisFailedEvent;
import io.constela.core.spi.CompileListener.CompileCompletedEvent;
import io.constela.core.spi.CompileListener.CompileStartedEvent;
import io.constela.core.spi.CompileListener.ValidationFailedEvent;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** The listener sees one started event and exactly one outcome event per compile. */
@DisplayName("CompileListener")
class CompileListenerTest {

    private final CapturingListener listener = new CapturingListener();
    private final ConstelaCompiler compiler = new ConstelaCompiler(CompilerConfig.DEFAULT, listener);

    @Test
    void successfulCompile() {
        compiler.compile(load("components.json"));

        assertThat(listener.started).extracting(CompileStartedEvent::routePath).containsExactly("/users/:id");
        assertThat(listener.completed).singleElement().satisfies(event -> {
            assertThat(event.routePath()).isEqualTo("/users/:id");
            assertThat(event.actionCount()).isZero();
            assertThat(event.inlinedComponents()).isEqualTo(3);
            assertThat(event.durationMs()).isGreaterThanOrEqualTo(0);
        });
        assertThat(listener.validationFailed).isEmpty();
        assertThat(listener.analysisFailed).isEmpty();
    }

    @Test
    void validationFailure() {
        ObjectNode program = (ObjectNode) load("counter.json");
        program.remove("view");

        compiler.compile(program);

        assertThat(listener.started).singleElement().extracting(CompileStartedEvent::routePath).isNull();
        assertThat(listener.validationFailed).singleElement().satisfies(event -> {
            assertThat(event.code()).isEqualTo(ErrorCode.SCHEMA_INVALID);
        });
        assertThat(listener.analysisFailed).isEmpty();
        assertThat(listener.completed).isEmpty();
    }

    @Test
    void analysisFailure() {
        compiler.compile(load("three-errors.json"));

        assertThat(listener.analysisFailed).singleElement().satisfies(event -> {
            assertThat(event.errorCount()).isEqualTo(3);
            assertThat(event.firstCode()).isEqualTo(ErrorCode.UNDEFINED_STATE);
        });
        assertThat(listener.completed).isEmpty();
    }

    @Test
    @DisplayName("A throwing listener does not affect the compile result")
    void throwingListenerIsIsolated() {
        CompileListener broken = new CompileListener() {
            @Override
            public void onCompileStarted(CompileStartedEvent event) {
                throw new IllegalStateException("listener bug");
            }

            @Override
            public void onCompileCompleted(CompileCompletedEvent event) {
                throw new IllegalStateException("listener bug");
            }
        };
        ConstelaCompiler guarded = new ConstelaCompiler(CompilerConfig.DEFAULT, broken);

        assertThat(guarded.compile(load("counter.json")).isSuccess()).isTrue();
    }

    @Test
    void defaultMethodsAreNoOps() {
        ConstelaCompiler silent = new ConstelaCompiler(CompilerConfig.DEFAULT, new CompileListener() {});

        assertThat(silent.compile(load("counter.json")).isSuccess()).isTrue();
    }

    private static final class CapturingListener implements CompileListener {
        final List<CompileStartedEvent> started = new CopyOnWriteArrayList<>();
        final List<ValidationFailedEvent> validationFailed = new CopyOnWriteArrayList<>();
        final List<AnalysisFailedEvent> analysisFailed = new CopyOnWriteArrayList<>();
        final List<CompileCompletedEvent> completed = new CopyOnWriteArrayList<>();

        @Override
        public void onCompileStarted(CompileStartedEvent event) {
            started.add(event);
        }

        @Override
        public void onValidationFailed(ValidationFailedEvent event) {
            validationFailed.add(event);
        }

        @Override
        public void onAnalysisFailed(AnalysisFailedEvent event) {
            analysisFailed.add(event);
        }

        @Override
        public void onCompileCompleted(CompileCompletedEvent event) {
            completed.add(event);
        }
    }
}
