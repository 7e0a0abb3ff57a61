package io.constela.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.model.Expression;
import io.constela.core.model.Immutables;
import io.constela.core.model.PropValue;
import io.constela.core.model.StateField;
import io.constela.core.model.TransitionConfig;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the lowered view tree. Unlike the source tree there are no {@code component} kinds;
 * component instances with their own state appear as {@link LocalState} wrappers. {@link Slot}
 * only occurs in a lowered layout, where it marks the spot page content is composed into.
 */
@JsonPropertyOrder({"kind"})
public sealed interface CompiledNode {

    @JsonProperty("kind")
    String kind();

    <R, A> R accept(Visitor<R, A> visitor, A arg);

    interface Visitor<R, A> {
        R visit(Element node, A arg);

        R visit(Text node, A arg);

        R visit(If node, A arg);

        R visit(Each node, A arg);

        R visit(Markdown node, A arg);

        R visit(Code node, A arg);

        R visit(Portal node, A arg);

        R visit(LocalState node, A arg);

        R visit(Island node, A arg);

        R visit(Suspense node, A arg);

        R visit(ErrorBoundary node, A arg);

        R visit(Slot node, A arg);
    }

    record Element(
            String tag,
            String ref,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, PropValue> props,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) List<CompiledNode> children)
            implements CompiledNode {
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

    record Text(Expression value) implements CompiledNode {
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
            CompiledNode then,
            @JsonProperty("else") CompiledNode otherwise,
            TransitionConfig transition)
            implements CompiledNode {
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

    record Each(
            Expression items,
            String as,
            String index,
            Expression key,
            CompiledNode body,
            TransitionConfig transition)
            implements CompiledNode {
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

    record Markdown(Expression content) implements CompiledNode {
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

    record Code(Expression language, Expression content) implements CompiledNode {
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

    record Portal(String target, List<CompiledNode> children) implements CompiledNode {
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
     * Synthetic wrapper giving one component instance its own state and action namespace. Every
     * instance gets a distinct wrapper, even when the state shape is identical.
     */
    record LocalState(Map<String, StateField> state, Map<String, CompiledAction> actions, CompiledNode child)
            implements CompiledNode {
        public LocalState {
            state = Immutables.orderedMap(Objects.requireNonNull(state, "state must not be null"));
            actions = Immutables.orderedMap(Objects.requireNonNull(actions, "actions must not be null"));
            Objects.requireNonNull(child, "child must not be null");
        }

        @Override
        public String kind() {
            return "localState";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Island(
            String id,
            String strategy,
            JsonNode strategyOptions,
            CompiledNode content,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, StateField> state,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, CompiledAction> actions)
            implements CompiledNode {
        public Island {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(strategy, "strategy must not be null");
            Objects.requireNonNull(content, "content must not be null");
            strategyOptions = Immutables.json(strategyOptions);
            state = Immutables.orderedMap(Objects.requireNonNull(state, "state must not be null"));
            actions = Immutables.orderedMap(Objects.requireNonNull(actions, "actions must not be null"));
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

    record Suspense(String id, CompiledNode fallback, CompiledNode content) implements CompiledNode {
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

    record ErrorBoundary(CompiledNode fallback, CompiledNode content) implements CompiledNode {
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

    /** Insertion point of a lowered layout; {@code name} is {@code null} for the default slot. */
    record Slot(String name) implements CompiledNode {

        @Override
        public String kind() {
            return "slot";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }
}
