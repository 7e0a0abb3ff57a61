package io.constela.core.engine;

import static io.constela.core.testkit.TestPrograms.json;
import static io.constela.core.testkit.TestPrograms.load;
import static io.constela.core.testkit.TestPrograms.withView;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.error.ProgramReadException;
import io.constela.core.error.Severity;
import io.constela.core.ir.CompiledNode;
import io.constela.core.ir.CompiledProgram;
import io.constela.core.ir.CompiledProgramWriter;
import io.constela.core.model.Expression;
import io.constela.core.schema.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConstelaCompiler")
class ConstelaCompilerTest {

    private final ConstelaCompiler compiler = new ConstelaCompiler();

    @Test
    void compilesValidProgram() {
        CompileResult result = compiler.compile(load("components.json"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.program().route().params()).containsExactly("id");
        assertThat(result).hasToString("CompileResult[OK]");
    }

    @Test
    @DisplayName("Validation failure stops the pipeline with exactly one error")
    void validationFailureIsFailFast() {
        ObjectNode program = withView("""
                { "kind": "text", "value": { "expr": "state", "name": "missing" } }""");
        program.put("version", "2.0");

        CompileResult result = compiler.compile(program);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.UNSUPPORTED_VERSION);
            assertThat(error.path()).isEqualTo("/version");
        });
    }

    @Test
    @DisplayName("Null and non-object documents fail validation instead of throwing")
    void nullDocumentFailsValidation() {
        for (JsonNode raw : new JsonNode[] {null, NullNode.getInstance(), json("[1, 2]")}) {
            CompileResult result = compiler.compile(raw);

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ErrorCode.SCHEMA_INVALID);
                assertThat(error.path()).isEmpty();
            });
        }
    }

    @Test
    void objectLiteralsFeedMergeAndSet() {
        ObjectNode program = withView("""
                { "kind": "text", "value": { "expr": "state", "name": "user", "path": "name" } }""");
        program.set("state", json("""
                { "user": { "type": "object", "initial": { "name": "" } } }"""));
        program.set("actions", json("""
                [ { "name": "rename",
                    "steps": [ { "do": "update", "target": "user", "operation": "merge",
                                 "value": { "expr": "lit", "value": { "name": "x" } } } ] },
                  { "name": "reset",
                    "steps": [ { "do": "set", "target": "user",
                                 "value": { "expr": "lit", "value": { "name": "" } } } ] } ]"""));

        CompileResult result = compiler.compile(program);

        assertThat(result.isSuccess()).as("errors: %s", result.errors()).isTrue();
        JsonNode tree = CompiledProgramWriter.toTree(result.program());
        assertThat(tree.at("/actions/rename/steps/0/value/value/name").asText()).isEqualTo("x");
        assertThat(tree.at("/actions/reset/steps/0/value/value").isObject()).isTrue();
    }

    @Test
    @DisplayName("Mutating the input after compiling leaves the compiled program untouched")
    void compiledProgramIsDetachedFromInput() {
        ObjectNode program = withView("""
                { "kind": "island", "id": "tags", "strategy": "media",
                  "strategyOptions": { "media": "(min-width: 600px)" },
                  "content": { "kind": "text", "value": { "expr": "lit", "value": [1, 2] } } }""");
        program.set("state", json("""
                { "count": { "type": "number", "initial": 0 },
                  "items": { "type": "list", "initial": [1, 2] } }"""));
        CompileResult result = compiler.compile(program);
        assertThat(result.isSuccess()).as("errors: %s", result.errors()).isTrue();
        JsonNode before = CompiledProgramWriter.toTree(result.program());

        ((ArrayNode) program.at("/state/items/initial")).add(99);
        ((ArrayNode) program.at("/view/content/value/value")).add(99);
        ((ObjectNode) program.at("/view/strategyOptions")).put("media", "print");

        assertThat(CompiledProgramWriter.toTree(result.program())).isEqualTo(before);
        assertThat(result.program().state().get("items").initial().size()).isEqualTo(2);
    }

    @Test
    void analysisFailureReturnsEveryError() {
        CompileResult result = compiler.compile(load("three-errors.json"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors()).hasSize(3);
        assertThat(result.errors()).extracting(ConstelaError::path).doesNotHaveDuplicates();
        assertThat(result).hasToString("CompileResult[3 error(s)]");
    }

    @Test
    void knownLayoutsAreForwardedToAnalysis() {
        ObjectNode program = withView("""
                { "kind": "text", "value": { "expr": "lit", "value": "home" } }""");
        program.set("route", json("""
                { "path": "/", "layout": "docs" }"""));

        assertThat(compiler.compile(program).isSuccess()).isTrue();
        assertThat(compiler.compile(program, Set.of("docs")).isSuccess()).isTrue();
        assertThat(compiler.compile(program, Set.of("blog")).errors())
                .extracting(ConstelaError::code)
                .containsExactly(ErrorCode.LAYOUT_NOT_FOUND);
    }

    @Test
    void configuredLimitsApply() {
        ConstelaCompiler strict = new ConstelaCompiler(new CompilerConfig(2, 1024, 2));

        CompileResult result = strict.compile(load("counter.json"));

        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.MAX_NESTING_EXCEEDED);
            assertThat(strict.config().maxDepth()).isEqualTo(2);
        });
    }

    @Test
    void compilesFromJsonText() {
        CompileResult result = compiler.compile("""
                { "version": "1.0", "state": {}, "actions": [],
                  "view": { "kind": "text", "value": { "expr": "lit", "value": "hi" } } }""");

        assertThat(result.isSuccess()).isTrue();
        assertThatThrownBy(() -> compiler.compile("{ not json"))
                .isInstanceOf(ProgramReadException.class);
    }

    @Test
    @DisplayName("Compiling the same input twice yields equal output")
    void deterministicOutput() {
        JsonNode first = CompiledProgramWriter.toTree(compiler.compile(load("components.json")).program());
        JsonNode second = CompiledProgramWriter.toTree(compiler.compile(load("components.json")).program());

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("One compiler instance serves concurrent callers")
    void concurrentCompiles() throws Exception {
        JsonNode expected = CompiledProgramWriter.toTree(compiler.compile(load("components.json")).program());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<JsonNode>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                futures.add(pool.submit(() ->
                        CompiledProgramWriter.toTree(compiler.compile(load("components.json")).program())));
            }
            for (Future<JsonNode> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void passesAreExposedIndividually() {
        JsonNode raw = load("layout.json");

        ValidationResult validation = compiler.validate(raw);
        assertThat(validation.isSuccess()).isTrue();
        assertThat(compiler.analyze(validation.program()).isSuccess()).isTrue();
        assertThat(compiler.analyzeLayout(validation.program()).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Accessibility findings are returned as warnings with a successful result")
    void warningsAccompanySuccess() {
        CompileResult result = compiler.compile(withView("""
                { "kind": "element", "tag": "div", "children": [
                  { "kind": "element", "tag": "img" },
                  { "kind": "element", "tag": "button",
                    "props": { "onClick": { "event": "click", "action": "increment" } } } ] }"""));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings())
                .extracting(ConstelaError::code, ConstelaError::path)
                .containsExactly(
                        tuple(ErrorCode.A11Y_IMG_NO_ALT, "/view/children/0"),
                        tuple(ErrorCode.A11Y_BUTTON_NO_LABEL, "/view/children/1"));
        assertThat(result.warnings()).allSatisfy(w -> assertThat(w.severity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void failuresCarryNoWarnings() {
        CompileResult result = compiler.compile(withView("""
                { "kind": "element", "tag": "img",
                  "props": { "src": { "expr": "state", "name": "missing" } } }"""));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void layoutIsCompiledAndComposedWithPage() {
        CompileResult layout = compiler.compileLayout(load("layout.json"));
        CompileResult page = compiler.compile(withView("""
                { "kind": "text", "value": { "expr": "state", "name": "count" } }"""));
        assertThat(layout.isSuccess()).as("%s", layout.errors()).isTrue();
        assertThat(page.isSuccess()).as("%s", page.errors()).isTrue();

        CompiledProgram composed = compiler.composeLayout(
                layout.program(),
                page.program(),
                null,
                Map.of("header", new CompiledNode.Text(new Expression.Lit(TextNode.valueOf("Site")))));
        JsonNode tree = CompiledProgramWriter.toTree(composed);

        assertThat(tree.at("/view/children/0/children/0/value/value").asText()).isEqualTo("Site");
        assertThat(tree.at("/view/children/1/children/0/value/expr").asText()).isEqualTo("state");
        assertThat(tree.at("/state").has("count")).isTrue();
    }

    @Test
    void layoutWithoutSlotIsRejected() {
        CompileResult result = compiler.compileLayout(withView("""
                { "kind": "element", "tag": "div" }"""));

        assertThat(result.errors())
                .extracting(ConstelaError::code, ConstelaError::path)
                .containsExactly(tuple(ErrorCode.LAYOUT_MISSING_SLOT, "/view"));
    }

    @Test
    void nodeBudgetComesFromConfig() {
        ObjectNode program = withView("""
                { "kind": "element", "tag": "div", "children": [
                  { "kind": "component", "name": "Row" }, { "kind": "component", "name": "Row" },
                  { "kind": "component", "name": "Row" }, { "kind": "component", "name": "Row" } ] }""");
        program.set("components", json("""
                { "Row": { "view": { "kind": "element", "tag": "p", "children": [
                  { "kind": "text", "value": { "expr": "lit", "value": "a" } },
                  { "kind": "text", "value": { "expr": "lit", "value": "b" } } ] } } }"""));

        assertThat(compiler.compile(program).isSuccess()).isTrue();
        CompileResult result = new ConstelaCompiler(new CompilerConfig(256, 1024, 2, 10)).compile(program);

        assertThat(result.errors())
                .extracting(ConstelaError::code, ConstelaError::path)
                .containsExactly(tuple(ErrorCode.MAX_EXPANDED_NODES_EXCEEDED, "/view"));
    }
}
