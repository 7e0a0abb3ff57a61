package io.constela.core.transform;

import static io.constela.core.testkit.TestPrograms.json;
import static io.constela.core.testkit.TestPrograms.load;
import static io.constela.core.testkit.TestPrograms.parse;
import static io.constela.core.testkit.TestPrograms.withView;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.analysis.AnalysisResult;
import io.constela.core.analysis.Analyzer;
import io.constela.core.analysis.LayoutAnalyzer;
import io.constela.core.ir.CompiledNode;
import io.constela.core.ir.CompiledProgram;
import io.constela.core.model.Expression;
import io.constela.core.model.Program;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LayoutComposer")
class LayoutComposerTest {

    private static final CompiledNode PAGE_TEXT = new CompiledNode.Text(new Expression.State("count", null));

    private final Analyzer analyzer = new Analyzer(1024, 2);
    private final LayoutAnalyzer layoutAnalyzer = new LayoutAnalyzer(analyzer);
    private final Transformer transformer = new Transformer(1024);

    private CompiledProgram layout(JsonNode raw) {
        Program program = parse(raw);
        AnalysisResult analysis = layoutAnalyzer.analyze(program);
        assertThat(analysis.isSuccess()).as("layout errors: %s", analysis.errors()).isTrue();
        return transformer.lowerLayout(program, analysis.context()).program();
    }

    private CompiledProgram page(JsonNode raw) {
        Program program = parse(raw);
        AnalysisResult analysis = analyzer.analyze(program);
        assertThat(analysis.isSuccess()).as("page errors: %s", analysis.errors()).isTrue();
        return transformer.transform(program, analysis.context());
    }

    private static Expression lit(String value) {
        return new Expression.Lit(TextNode.valueOf(value));
    }

    private static CompiledNode.Element element(CompiledNode node) {
        assertThat(node).isInstanceOf(CompiledNode.Element.class);
        return (CompiledNode.Element) node;
    }

    private CompiledProgram countPage() {
        return page(withView("""
                { "kind": "text", "value": { "expr": "state", "name": "count" } }"""));
    }

    @Test
    @DisplayName("Lowering a layout keeps its slots and top-level params")
    void loweredLayoutKeepsSlotsAndParams() {
        CompiledProgram lowered = layout(withView("""
                { "kind": "element", "tag": "div", "children": [
                  { "kind": "text", "value": { "expr": "param", "name": "title" } },
                  { "kind": "slot" } ] }"""));

        CompiledNode.Element root = element(lowered.view());
        assertThat(root.children()).containsExactly(
                new CompiledNode.Text(new Expression.Param("title", null)), new CompiledNode.Slot(null));
    }

    @Nested
    @DisplayName("slots")
    class Slots {

        @Test
        void pageViewFillsDefaultSlotAndUnfilledNamedSlotIsDropped() {
            CompiledProgram composed = LayoutComposer.compose(layout(load("layout.json")), countPage());

            CompiledNode.Element root = element(composed.view());
            assertThat(element(root.children().get(0)).children()).isEmpty();
            assertThat(element(root.children().get(1)).children()).containsExactly(PAGE_TEXT);
        }

        @Test
        void namedContentIsRoutedByName() {
            CompiledNode title = new CompiledNode.Text(lit("Docs"));

            CompiledProgram composed = LayoutComposer.compose(
                    layout(load("layout.json")), countPage(), null, Map.of("header", title));

            CompiledNode.Element root = element(composed.view());
            assertThat(element(root.children().get(0)).children()).containsExactly(title);
            assertThat(element(root.children().get(1)).children()).containsExactly(PAGE_TEXT);
        }

        @Test
        void slotAsRootViewIsReplacedByThePage() {
            CompiledProgram composed = LayoutComposer.compose(layout(withView("{ \"kind\": \"slot\" }")), countPage());

            assertThat(composed.view()).isEqualTo(PAGE_TEXT);
        }

        @Test
        void slotUnderConditionalIsFilled() {
            CompiledProgram composed = LayoutComposer.compose(layout(withView("""
                    { "kind": "if", "condition": { "expr": "lit", "value": true },
                      "then": { "kind": "slot" } }""")), countPage());

            assertThat(((CompiledNode.If) composed.view()).then()).isEqualTo(PAGE_TEXT);
        }

        @Test
        @DisplayName("A layout composed into another layout keeps its default slot open")
        void nestedLayouts() {
            CompiledProgram outer = layout(withView("""
                    { "kind": "element", "tag": "body", "children": [{ "kind": "slot" }] }"""));
            CompiledProgram inner = layout(withView("""
                    { "kind": "element", "tag": "section", "children": [
                      { "kind": "slot", "name": "aside" }, { "kind": "slot" } ] }"""));
            CompiledNode aside = new CompiledNode.Text(lit("menu"));

            CompiledProgram shell = LayoutComposer.compose(outer, inner, null, Map.of("aside", aside));
            CompiledNode.Element section = element(element(shell.view()).children().get(0));
            assertThat(section.children()).containsExactly(aside, new CompiledNode.Slot(null));

            CompiledProgram composed = LayoutComposer.compose(shell, countPage());
            CompiledNode.Element filled = element(element(composed.view()).children().get(0));
            assertThat(filled.children()).containsExactly(aside, PAGE_TEXT);
        }
    }

    @Nested
    @DisplayName("layout params")
    class LayoutParams {

        private CompiledProgram paramLayout() {
            return layout(withView("""
                    { "kind": "element", "tag": "div",
                      "props": { "title": { "expr": "param", "name": "title" } },
                      "children": [
                        { "kind": "text", "value": { "expr": "param", "name": "user", "path": "name" } },
                        { "kind": "text", "value": { "expr": "param", "name": "missing" } },
                        { "kind": "slot" } ] }"""));
        }

        @Test
        void routeLayoutParamsAreUsedByDefault() {
            ObjectNode raw = withView("""
                    { "kind": "text", "value": { "expr": "state", "name": "count" } }""");
            raw.set("route", json("""
                    { "path": "/docs",
                      "layoutParams": { "title": { "expr": "lit", "value": "Docs" },
                                        "user": { "expr": "state", "name": "count" } } }"""));

            CompiledProgram composed = LayoutComposer.compose(paramLayout(), page(raw));

            CompiledNode.Element root = element(composed.view());
            assertThat(root.props()).containsEntry("title", lit("Docs"));
            assertThat(root.children()).containsExactly(
                    new CompiledNode.Text(new Expression.State("count", "name")),
                    new CompiledNode.Text(new Expression.Lit(NullNode.getInstance())),
                    PAGE_TEXT);
            assertThat(composed.route().path()).isEqualTo("/docs");
        }

        @Test
        void explicitParamsOverrideTheRoute() {
            Expression user = new Expression.Lit(json("{ \"name\": \"Ada\" }"));

            CompiledProgram composed = LayoutComposer.compose(
                    paramLayout(), countPage(), Map.of("user", user), null);

            CompiledNode.Element root = element(composed.view());
            assertThat(root.props()).containsEntry("title", new Expression.Lit(NullNode.getInstance()));
            assertThat(root.children().get(0)).isEqualTo(new CompiledNode.Text(new Expression.Get(user, "name")));
        }

        @Test
        void paramsPassedIntoLayoutComponentsAreResolved() {
            ObjectNode raw = withView("""
                    { "kind": "element", "tag": "div", "children": [
                      { "kind": "component", "name": "Header",
                        "props": { "title": { "expr": "param", "name": "title" } } },
                      { "kind": "slot" } ] }""");
            raw.set("components", json("""
                    { "Header": { "params": { "title": { "type": "string" } },
                                  "view": { "kind": "element", "tag": "h1", "children": [
                                    { "kind": "text", "value": { "expr": "param", "name": "title" } } ] } } }"""));

            CompiledProgram composed = LayoutComposer.compose(
                    layout(raw), countPage(), Map.of("title", lit("Guide")), null);

            CompiledNode.Element heading = element(element(composed.view()).children().get(0));
            assertThat(heading.tag()).isEqualTo("h1");
            assertThat(heading.children()).containsExactly(new CompiledNode.Text(lit("Guide")));
        }
    }

    @Test
    @DisplayName("Colliding layout state and actions are kept under the $layout. prefix")
    void stateAndActionsAreMerged() {
        ObjectNode raw = withView("""
                { "kind": "element", "tag": "div", "children": [{ "kind": "slot" }] }""");
        ((ObjectNode) raw.get("state")).set("menuOpen", json("""
                { "type": "boolean", "initial": false }"""));
        ((ArrayNode) raw.get("actions")).add(json("""
                { "name": "openMenu",
                  "steps": [{ "do": "set", "target": "menuOpen", "value": { "expr": "lit", "value": true } }] }"""));

        CompiledProgram composed = LayoutComposer.compose(layout(raw), countPage());

        assertThat(composed.state()).containsOnlyKeys("count", "$layout.count", "menuOpen");
        assertThat(composed.actions()).containsOnlyKeys("increment", "$layout.increment", "openMenu");
        assertThat(composed.actions().get("$layout.increment").name()).isEqualTo("$layout.increment");
        assertThat(composed.route()).isNull();
    }

    @Test
    void pageStylesWinOverLayoutStyles() {
        ObjectNode layoutRaw = withView("""
                { "kind": "element", "tag": "div", "children": [{ "kind": "slot" }] }""");
        layoutRaw.set("styles", json("""
                { "button": { "base": "layout-btn" }, "nav": { "base": "nav" } }"""));
        ObjectNode pageRaw = withView("""
                { "kind": "text", "value": { "expr": "state", "name": "count" } }""");
        pageRaw.set("styles", json("""
                { "button": { "base": "page-btn" } }"""));

        CompiledProgram composed = LayoutComposer.compose(layout(layoutRaw), page(pageRaw));

        assertThat(composed.styles()).containsOnlyKeys("button", "nav");
        assertThat(composed.styles().get("button").base()).isEqualTo("page-btn");
    }
}
