package io.constela.core.engine;

import static io.constela.core.testkit.TestPrograms.load;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constela.core.spi.CompileListener;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Log lines emitted by {@link ConstelaCompiler} for each compile outcome. */
@DisplayName("Compile logging")
class CompileLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger compilerLogger;

    @BeforeEach
    void setUp() {
        compilerLogger = (Logger) LoggerFactory.getLogger(ConstelaCompiler.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        compilerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        compilerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<ILoggingEvent> at(Level level) {
        return logAppender.list.stream().filter(e -> e.getLevel() == level).collect(Collectors.toList());
    }

    @Test
    void successLogsOneInfoLine() {
        new ConstelaCompiler().compile(load("components.json"));

        List<ILoggingEvent> info = at(Level.INFO);
        assertThat(info).hasSize(1);
        assertThat(info.get(0).getFormattedMessage())
                .startsWith("Compiled program: route=/users/:id, actions=0, inlined_components=3, duration_ms=");
        assertThat(at(Level.WARN)).isEmpty();
    }

    @Test
    void programWithoutRouteLogsPlaceholder() {
        new ConstelaCompiler().compile(load("counter.json"));

        assertThat(at(Level.INFO)).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .asString()
                .contains("route=<none>", "actions=2", "inlined_components=0");
    }

    @Test
    void validationFailureLogsCodeAndPath() {
        ObjectNode program = (ObjectNode) load("counter.json");
        program.put("version", "0.9");

        new ConstelaCompiler().compile(program);

        assertThat(at(Level.WARN)).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .isEqualTo("Compile failed: validation error UNSUPPORTED_VERSION at '/version'");
        assertThat(at(Level.INFO)).isEmpty();
    }

    @Test
    void analysisFailureLogsCountAndFirstCode() {
        new ConstelaCompiler().compile(load("three-errors.json"));

        assertThat(at(Level.WARN)).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .isEqualTo("Compile failed: 3 analysis error(s), first UNDEFINED_STATE");
    }

    @Test
    void listenerFailureIsLoggedAsWarning() {
        CompileListener broken = new CompileListener() {
            @Override
            public void onCompileCompleted(CompileCompletedEvent event) {
                throw new IllegalStateException("listener bug");
            }
        };

        new ConstelaCompiler(CompilerConfig.DEFAULT, broken).compile(load("counter.json"));

        assertThat(at(Level.WARN)).singleElement().satisfies(event -> {
            assertThat(event.getFormattedMessage()).isEqualTo("CompileListener.onCompileCompleted failed");
            assertThat(event.getThrowableProxy().getMessage()).isEqualTo("listener bug");
        });
    }
}
