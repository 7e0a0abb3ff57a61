package io.constela.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the source view tree, discriminated by {@code kind}. Optional scalar fields are
 * {@code null} when absent; props and children lists are empty rather than null.
 *
 * <p>
 * Thread-safe and immutable.
 */
@JsonPropertyOrder({"kind"})
public sealed interface ViewNode {

    @JsonProperty("kind")
    String kind();

    <R, A> R accept(Visitor<R, A> visitor, A arg);

    /** One method per view node kind. */
    interface Visitor<R, A> {
        R visit(Element node, A arg);

        R visit(Text node, A arg);

        R visit(If node, A arg);

        R visit(Each node, A arg);

        R visit(Component node, A arg);

        R visit(Slot node, A arg);

        R visit(Markdown node, A arg);

        R visit(Code node, A arg);

        R visit(Portal node, A arg);

        R visit(Island node, A arg);

        R visit(Suspense node, A arg);

        R visit(ErrorBoundary node, A arg);
    }

    record Element(String tag, String ref, Map<String, PropValue> props, List<ViewNode> children)
            implements ViewNode {
        public Element {
            Objects.requireNonNull(tag, "tag must not be null");
            props = Immutables.orderedMap(Objects.requireNonNull(props, "props must not be null"));
            children = List.copyOf(children);
        }

        @Override
        public String kind() {
            return "element";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Text(Expression value) implements ViewNode {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "text";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record If(
            Expression condition,
            ViewNode then,
            @JsonProperty("else") ViewNode otherwise,
            TransitionConfig transition)
            implements ViewNode {
        public If {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(then, "then must not be null");
        }

        @Override
        public String kind() {
            return "if";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Repeats {@code body} for each item, binding {@code as} (and {@code index}) as vars. */
    record Each(
            Expression items, String as, String index, Expression key, ViewNode body, TransitionConfig transition)
            implements ViewNode {
        public Each {
            Objects.requireNonNull(items, "items must not be null");
            Objects.requireNonNull(as, "as must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public String kind() {
            return "each";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** A component invocation. {@code children} fill the component's slots. */
    record Component(String name, Map<String, PropValue> props, List<ViewNode> children) implements ViewNode {
        public Component {
            Objects.requireNonNull(name, "name must not be null");
            props = Immutables.orderedMap(Objects.requireNonNull(props, "props must not be null"));
            children = List.copyOf(children);
        }

        @Override
        public String kind() {
            return "component";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Placeholder for caller children. {@code name} is {@code null} for the default slot. */
    record Slot(String name) implements ViewNode {
        @Override
        public String kind() {
            return "slot";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Markdown(Expression content) implements ViewNode {
        public Markdown {
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public String kind() {
            return "markdown";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Code(Expression language, Expression content) implements ViewNode {
        public Code {
            Objects.requireNonNull(language, "language must not be null");
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public String kind() {
            return "code";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Renders children into another DOM container ({@code body}, {@code head} or a selector). */
    record Portal(String target, List<ViewNode> children) implements ViewNode {
        public Portal {
            Objects.requireNonNull(target, "target must not be null");
            children = List.copyOf(children);
        }

        @Override
        public String kind() {
            return "portal";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * An independently hydrated region. {@code state} and {@code actions} form its own namespace,
     * like a component's local state.
     */
    record Island(
            String id,
            String strategy,
            JsonNode strategyOptions,
            ViewNode content,
            Map<String, StateField> state,
            List<ActionDef> actions)
            implements ViewNode {
        public Island {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(strategy, "strategy must not be null");
            Objects.requireNonNull(content, "content must not be null");
            strategyOptions = Immutables.json(strategyOptions);
            state = Immutables.orderedMap(Objects.requireNonNull(state, "state must not be null"));
            actions = List.copyOf(actions);
        }

        @Override
        public String kind() {
            return "island";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Suspense(String id, ViewNode fallback, ViewNode content) implements ViewNode {
        public Suspense {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(fallback, "fallback must not be null");
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public String kind() {
            return "suspense";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record ErrorBoundary(ViewNode fallback, ViewNode content) implements ViewNode {
        public ErrorBoundary {
            Objects.requireNonNull(fallback, "fallback must not be null");
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public String kind() {
            return "errorBoundary";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }
}
