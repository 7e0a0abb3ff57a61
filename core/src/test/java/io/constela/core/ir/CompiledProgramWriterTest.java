package io.constela.core.ir;

import static io.constela.core.testkit.TestPrograms.json;
import static io.constela.core.testkit.TestPrograms.load;
import static io.constela.core.testkit.TestPrograms.withView;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constela.core.engine.CompileResult;
import io.constela.core.engine.ConstelaCompiler;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ErrorCode;
import io.constela.core.testkit.TestPrograms;
import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class CompiledProgramWriterTest {

    private final ConstelaCompiler compiler = new ConstelaCompiler();

    private CompiledProgram compile(JsonNode raw) {
        CompileResult result = compiler.compile(raw);
        assertThat(result.isSuccess()).as("%s", result.errors()).isTrue();
        return result.program();
    }

    @Test
    void writesDiscriminatorsAndOmitsAbsentSections() {
        JsonNode tree = CompiledProgramWriter.toTree(compile(load("counter.json")));

        assertThat(tree.get("version").asText()).isEqualTo("1.0");
        assertThat(tree.has("route")).isFalse();
        assertThat(tree.has("components")).isFalse();
        assertThat(tree.at("/state/count/type").asText()).isEqualTo("number");
        assertThat(tree.at("/actions/increment/steps/0/do").asText()).isEqualTo("update");
        assertThat(tree.at("/actions/increment/steps/0/operation").asText()).isEqualTo("increment");
        assertThat(tree.at("/actions/increment/steps/0").has("value")).isFalse();
        assertThat(tree.at("/view/kind").asText()).isEqualTo("element");
        assertThat(tree.at("/view/children/0/value/expr").asText()).isEqualTo("state");
        assertThat(tree.at("/view/children/1/props/onClick/action").asText()).isEqualTo("increment");
    }

    @Test
    void localStateWrapperIsWritten() {
        JsonNode tree = CompiledProgramWriter.toTree(compile(load("components.json")));

        assertThat(tree.at("/view/children/0/kind").asText()).isEqualTo("localState");
        assertThat(tree.at("/view/children/0/state/open/initial").asBoolean(true)).isFalse();
        assertThat(tree.at("/view/children/0/child/tag").asText()).isEqualTo("button");
        assertThat(tree.at("/route/params/0").asText()).isEqualTo("id");
    }

    @Test
    void transitionDurationStaysOmittedWhenNotDeclared() {
        CompiledProgram program = compile(withView("""
                { "kind": "if", "condition": { "expr": "lit", "value": true },
                  "then": { "kind": "text", "value": { "expr": "lit", "value": null } },
                  "transition": { "enter": "fade-in", "enterActive": "fading-in",
                                  "exit": "fade-out", "exitActive": "fading-out" } }"""));
        JsonNode tree = CompiledProgramWriter.toTree(program);

        assertThat(((CompiledNode.If) program.view()).transition().effectiveDuration()).isEqualTo(300);
        JsonNode transition = tree.at("/view/transition");
        assertThat(transition.get("enter").asText()).isEqualTo("fade-in");
        assertThat(transition.has("duration")).isFalse();
        assertThat(tree.at("/view/then/value").has("value")).isTrue();
        assertThat(tree.at("/view/then/value/value").isNull()).isTrue();
    }

    @Test
    void serializesErrorsWithoutNullFields() {
        JsonNode tree = CompiledProgramWriter.toTree(
                List.of(new ConstelaError(ErrorCode.UNDEFINED_STATE, "Undefined state: cout", "/view/value")));

        assertThat(tree.get(0).get("code").asText()).isEqualTo("UNDEFINED_STATE");
        assertThat(tree.get(0).has("suggestion")).isFalse();
        assertThat(tree.get(0).has("context")).isFalse();
    }

    @Test
    void jsonOutputRoundTripsThroughTheReader() throws Exception {
        CompiledProgram program = compile(load("counter.json"));

        String compact = CompiledProgramWriter.toJson(program, false);
        String pretty = CompiledProgramWriter.toJson(program, true);

        assertThat(compact).doesNotContain("\n");
        assertThat(pretty).contains("\n");
        assertThat(TestPrograms.JSON.readTree(compact)).isEqualTo(CompiledProgramWriter.toTree(program));
    }

    /** Root view calls C0; each Ci wraps C(i+1) in a div and the last one wraps a text node. */
    private static ObjectNode componentChain(int length) {
        ObjectNode program = withView("""
                { "kind": "component", "name": "C0" }""");
        ObjectNode components = program.putObject("components");
        for (int i = 0; i < length - 1; i++) {
            components.set("C" + i, json("""
                    { "view": { "kind": "element", "tag": "div",
                                "children": [{ "kind": "component", "name": "C%d" }] } }""".formatted(i + 1)));
        }
        components.set("C" + (length - 1), json("""
                { "view": { "kind": "element", "tag": "div",
                            "children": [{ "kind": "text", "value": { "expr": "lit", "value": "leaf" } }] } }"""));
        return program;
    }

    @Test
    void deepestAcceptedViewIsWritten() {
        CompiledProgram program = compile(componentChain(511));

        String compact = CompiledProgramWriter.toJson(program, false);
        String pretty = CompiledProgramWriter.toJson(program, true);

        assertThat(Pattern.compile("\"tag\":\"div\"").matcher(compact).results().count()).isEqualTo(511);
        assertThat(compact).endsWith("}");
        assertThat(pretty).contains("\"leaf\"");
    }

    @Test
    void oneLevelDeeperIsRejectedBeforeWriting() {
        CompileResult result = compiler.compile(componentChain(512));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors())
                .extracting(ConstelaError::code, ConstelaError::path)
                .containsExactly(tuple(ErrorCode.MAX_NESTING_EXCEEDED, "/view"));
    }
}
