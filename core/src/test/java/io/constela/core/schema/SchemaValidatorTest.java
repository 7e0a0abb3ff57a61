package io.constela.core.schema;

import static io.constela.core.testkit.TestPrograms.json;
import static io.constela.core.testkit.TestPrograms.load;
import static io.constela.core.testkit.TestPrograms.withView;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constela.core.error.ErrorCode;
import io.constela.core.model.EventHandler;
import io.constela.core.model.EventPayload;
import io.constela.core.model.Expression;
import io.constela.core.model.StateType;
import io.constela.core.model.TransitionConfig;
import io.constela.core.model.ViewNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SchemaValidator")
class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator(256);

    @Test
    @DisplayName("Well-formed program yields a typed AST")
    void acceptsCounter() {
        ValidationResult result = validator.validate(load("counter.json"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.program().state()).containsOnlyKeys("count");
        assertThat(result.program().state().get("count").type()).isEqualTo(StateType.NUMBER);
        assertThat(result.program().actions()).extracting(a -> a.name()).containsExactly("increment", "reset");
        assertThat(result.program().view()).isInstanceOf(ViewNode.Element.class);
        assertThat(result.program().components()).isNull();
    }

    @Nested
    @DisplayName("top-level gate")
    class TopLevel {

        @ParameterizedTest
        @ValueSource(strings = {"[]", "42", "\"program\"", "null"})
        @DisplayName("Non-object documents are rejected at the root")
        void rejectsNonObject(String document) {
            ValidationResult result = validator.validate(json(document));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error().code()).isEqualTo(ErrorCode.SCHEMA_INVALID);
            assertThat(result.error().path()).isEmpty();
        }

        @Test
        @DisplayName("Version is checked before anything else")
        void unsupportedVersionWins() {
            ValidationResult result = validator.validate(json("{\"version\": \"2.0\"}"));

            assertThat(result.error().code()).isEqualTo(ErrorCode.UNSUPPORTED_VERSION);
            assertThat(result.error().path()).isEqualTo("/version");
        }

        @Test
        @DisplayName("A missing required section is reported before deeper problems")
        void missingSectionWins() {
            ValidationResult result = validator.validate(json("""
                    { "version": "1.0", "state": { "x": { "type": "bogus", "initial": 0 } }, "actions": [] }
                    """));

            assertThat(result.error().code()).isEqualTo(ErrorCode.SCHEMA_INVALID);
            assertThat(result.error().message()).isEqualTo("view is required");
            assertThat(result.error().path()).isEqualTo("/view");
        }

        @Test
        void nonStringVersionIsASchemaError() {
            ObjectNode program = withView("{\"kind\": \"text\", \"value\": {\"expr\": \"lit\", \"value\": 1}}");
            program.put("version", 1.0);

            ValidationResult result = validator.validate(program);

            assertThat(result.error().code()).isEqualTo(ErrorCode.SCHEMA_INVALID);
        }
    }

    @Nested
    @DisplayName("recursive walk")
    class Walk {

        @Test
        @DisplayName("Unknown view kind points at the kind field")
        void unknownViewKind() {
            ValidationResult result = validator.validate(withView("""
                    { "kind": "element", "tag": "div", "children": [ { "kind": "blink" } ] }
                    """));

            assertThat(result.error().code()).isEqualTo(ErrorCode.SCHEMA_INVALID);
            assertThat(result.error().path()).isEqualTo("/view/children/0/kind");
            assertThat(result.error().message()).startsWith("must be one of: element, text");
        }

        @Test
        @DisplayName("Unknown expression kind points at the expr field")
        void unknownExpressionKind() {
            ValidationResult result = validator.validate(withView("""
                    { "kind": "text", "value": { "expr": "magic" } }
                    """));

            assertThat(result.error().path()).isEqualTo("/view/value/expr");
        }

        @Test
        void initialValueMustMatchStateType() {
            ObjectNode program = withView("{\"kind\": \"text\", \"value\": {\"expr\": \"lit\", \"value\": 1}}");
            program.set("state", json("{\"count\": {\"type\": \"number\", \"initial\": \"zero\"}}"));

            ValidationResult result = validator.validate(program);

            assertThat(result.error().path()).isEqualTo("/state/count/initial");
            assertThat(result.error().message()).isEqualTo("must be a number");
        }

        @Test
        @DisplayName("Cookie initial values are accepted when the default matches the type")
        void cookieInitial() {
            ObjectNode program = withView("{\"kind\": \"text\", \"value\": {\"expr\": \"state\", \"name\": \"theme\"}}");
            program.set("state", json("""
                    { "theme": { "type": "string", "initial": { "expr": "cookie", "key": "theme", "default": "dark" } } }
                    """));

            ValidationResult result = validator.validate(program);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.program().state().get("theme").hasDeferredInitial()).isTrue();
        }

        @Test
        void unknownUpdateOperation() {
            ObjectNode program = withView("{\"kind\": \"text\", \"value\": {\"expr\": \"lit\", \"value\": 1}}");
            program.set("actions", json("""
                    [ { "name": "a", "steps": [ { "do": "update", "target": "count", "operation": "double" } ] } ]
                    """));

            ValidationResult result = validator.validate(program);

            assertThat(result.error().path()).isEqualTo("/actions/0/steps/0/operation");
            assertThat(result.error().message()).isEqualTo("must be a valid operation");
        }

        @Test
        void objectLiteralIsAccepted() {
            ValidationResult result = validator.validate(withView("""
                    { "kind": "text", "value": { "expr": "lit", "value": { "a": 1 } } }
                    """));

            assertThat(result.isSuccess()).as("error: %s", result.error()).isTrue();
            Expression.Lit lit = (Expression.Lit) ((ViewNode.Text) result.program().view()).value();
            assertThat(lit.value().get("a").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("Only the first error in document order is reported")
        void firstErrorOnly() {
            ObjectNode program = withView("{\"kind\": \"nope\"}");
            program.set("state", json("{\"count\": {\"type\": \"number\", \"initial\": true}}"));

            ValidationResult result = validator.validate(program);

            assertThat(result.error().path()).isEqualTo("/state/count/initial");
        }
    }

    @Nested
    @DisplayName("event handlers and transitions")
    class HandlersAndTransitions {

        @Test
        void parsesEventHandlerWithFieldPayload() {
            ValidationResult result = validator.validate(withView("""
                    { "kind": "element", "tag": "input",
                      "props": { "onInput": { "event": "input", "action": "increment", "debounce": 300,
                                              "payload": { "value": { "expr": "var", "name": "value" } } } } }
                    """));

            ViewNode.Element input = (ViewNode.Element) result.program().view();
            EventHandler handler = (EventHandler) input.props().get("onInput");
            assertThat(handler.debounce()).isEqualTo(300);
            assertThat(handler.payload()).isInstanceOf(EventPayload.Fields.class);
            assertThat(((EventPayload.Fields) handler.payload()).fields().get("value"))
                    .isEqualTo(new Expression.Var("value", null));
        }

        @Test
        @DisplayName("Omitted transition duration stays absent and defaults to 300ms when read")
        void transitionDurationDefault() {
            ValidationResult result = validator.validate(withView("""
                    { "kind": "if", "condition": { "expr": "lit", "value": true },
                      "then": { "kind": "text", "value": { "expr": "lit", "value": "shown" } },
                      "transition": { "enter": "fade", "enterActive": "fade-on", "exit": "fade", "exitActive": "fade-off" } }
                    """));

            TransitionConfig transition = ((ViewNode.If) result.program().view()).transition();
            assertThat(transition.duration()).isNull();
            assertThat(transition.effectiveDuration()).isEqualTo(TransitionConfig.DEFAULT_DURATION_MS);
        }

        @Test
        void fractionalDurationsAreAccepted() {
            ValidationResult result = validator.validate(withView("""
                    { "kind": "each", "items": { "expr": "lit", "value": [1, 2] }, "as": "item",
                      "body": { "kind": "if", "condition": { "expr": "lit", "value": true },
                                "then": { "kind": "text", "value": { "expr": "var", "name": "item" } },
                                "transition": { "enter": "a", "enterActive": "b", "exit": "c", "exitActive": "d",
                                                "duration": 150.5 } },
                      "transition": { "enter": "a", "enterActive": "b", "exit": "c", "exitActive": "d",
                                      "duration": 300.0 } }
                    """));

            assertThat(result.isSuccess()).as("error: %s", result.error()).isTrue();
            ViewNode.Each each = (ViewNode.Each) result.program().view();
            assertThat(each.transition().effectiveDuration()).isEqualTo(300.0);
            assertThat(((ViewNode.If) each.body()).transition().effectiveDuration()).isEqualTo(150.5);
        }

        @Test
        void negativeDurationIsRejected() {
            ValidationResult result = validator.validate(withView("""
                    { "kind": "if", "condition": { "expr": "lit", "value": true },
                      "then": { "kind": "text", "value": { "expr": "lit", "value": "x" } },
                      "transition": { "enter": "a", "enterActive": "b", "exit": "c", "exitActive": "d", "duration": -5 } }
                    """));

            assertThat(result.error().path()).isEqualTo("/view/transition/duration");
        }
    }

    @Nested
    @DisplayName("nesting bound")
    class Nesting {

        @Test
        @DisplayName("Nesting beyond maxDepth fails with MAX_NESTING_EXCEEDED instead of overflowing")
        void boundedDepth() {
            SchemaValidator shallow = new SchemaValidator(3);

            ValidationResult result = shallow.validate(withView("""
                    { "kind": "element", "tag": "a", "children": [
                      { "kind": "element", "tag": "b", "children": [
                        { "kind": "element", "tag": "c", "children": [
                          { "kind": "text", "value": { "expr": "lit", "value": "deep" } } ] } ] } ] }
                    """));

            assertThat(result.error().code()).isEqualTo(ErrorCode.MAX_NESTING_EXCEEDED);
            assertThat(result.error().path()).isEqualTo("/view/children/0/children/0/children/0");
        }

        @Test
        @DisplayName("Very deep documents are rejected without a stack overflow")
        void veryDeepDocument() {
            StringBuilder view = new StringBuilder();
            int levels = 900;
            for (int i = 0; i < levels; i++) {
                view.append("{\"expr\": \"not\", \"operand\": ");
            }
            view.append("{\"expr\": \"lit\", \"value\": true}");
            view.append("}".repeat(levels));

            ValidationResult result = validator.validate(withView("{\"kind\": \"text\", \"value\": " + view + "}"));

            assertThat(result.error().code()).isEqualTo(ErrorCode.MAX_NESTING_EXCEEDED);
        }
    }
}
