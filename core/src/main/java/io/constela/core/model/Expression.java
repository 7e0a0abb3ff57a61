package io.constela.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A Constela expression: a closed, recursive tagged union discriminated by the {@code expr} field.
 *
 * <p>
 * Every variant is a record nested in this interface. Code that needs to handle all variants
 * implements {@link Visitor}, so adding a variant breaks every visitor at compile time.
 *
 * <p>
 * Thread-safe and immutable.
 */
@JsonPropertyOrder({"expr"})
public sealed interface Expression extends PropValue {

    /** The wire discriminant ({@code lit}, {@code state}, ...). */
    @JsonProperty("expr")
    String kind();

    <R, A> R accept(Visitor<R, A> visitor, A arg);

    /** One method per expression kind. */
    interface Visitor<R, A> {
        R visit(Lit expr, A arg);

        R visit(State expr, A arg);

        R visit(Var expr, A arg);

        R visit(Param expr, A arg);

        R visit(Route expr, A arg);

        R visit(Import expr, A arg);

        R visit(Data expr, A arg);

        R visit(Ref expr, A arg);

        R visit(Bin expr, A arg);

        R visit(Not expr, A arg);

        R visit(Cond expr, A arg);

        R visit(Get expr, A arg);

        R visit(Index expr, A arg);

        R visit(Concat expr, A arg);

        R visit(Array expr, A arg);

        R visit(Style expr, A arg);

        R visit(Validity expr, A arg);

        R visit(Call expr, A arg);

        R visit(Lambda expr, A arg);
    }

    // ── Named lookups ──

    /**
     * A constant: any JSON value, including {@code null} nodes, arrays and objects. The node is a
     * private copy of the parsed value and must be treated as read-only.
     */
    record Lit(JsonNode value) implements Expression {
        public Lit {
            value = Immutables.json(Objects.requireNonNull(value, "value must not be null (use NullNode)"));
        }

        @Override
        public String kind() {
            return "lit";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Reads a global (or component-local) state field, optionally drilling into a dotted path. */
    record State(String name, String path) implements Expression {
        public State {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String kind() {
            return "state";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Reads a loop or lambda variable. */
    record Var(String name, String path) implements Expression {
        public Var {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String kind() {
            return "var";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Reads a component param. Only meaningful inside a component body. */
    record Param(String name, String path) implements Expression {
        public Param {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String kind() {
            return "param";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Reads a route value. {@code source} is {@code null} when omitted, meaning {@code param}. */
    record Route(String name, RouteSource source) implements Expression {
        public Route {
            Objects.requireNonNull(name, "name must not be null");
        }

        public RouteSource effectiveSource() {
            return source == null ? RouteSource.PARAM : source;
        }

        @Override
        public String kind() {
            return "route";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Import(String name, String path) implements Expression {
        public Import {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String kind() {
            return "import";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Data(String name, String path) implements Expression {
        public Data {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String kind() {
            return "data";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Reads a DOM element registered with {@code ref} on an element node. */
    record Ref(String name) implements Expression {
        public Ref {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String kind() {
            return "ref";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    // ── Operators ──

    record Bin(BinaryOperator op, Expression left, Expression right) implements Expression {
        public Bin {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String kind() {
            return "bin";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Not(Expression operand) implements Expression {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public String kind() {
            return "not";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Cond(
            @JsonProperty("if") Expression condition,
            Expression then,
            @JsonProperty("else") Expression otherwise)
            implements Expression {
        public Cond {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(then, "then must not be null");
            Objects.requireNonNull(otherwise, "otherwise must not be null");
        }

        @Override
        public String kind() {
            return "cond";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    // ── Access ──

    /** Static property access with a dotted path. */
    record Get(Expression base, String path) implements Expression {
        public Get {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String kind() {
            return "get";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Dynamic property or element access. */
    record Index(Expression base, Expression key) implements Expression {
        public Index {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public String kind() {
            return "index";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    // ── Collections ──

    record Concat(List<Expression> items) implements Expression {
        public Concat {
            items = List.copyOf(items);
        }

        @Override
        public String kind() {
            return "concat";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Array(List<Expression> elements) implements Expression {
        public Array {
            elements = List.copyOf(elements);
        }

        @Override
        public String kind() {
            return "array";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    // ── Styling, forms, interop ──

    /** Resolves a style preset to a class string. {@code variants} may be {@code null}. */
    record Style(String name, Map<String, Expression> variants) implements Expression {
        public Style {
            Objects.requireNonNull(name, "name must not be null");
            variants = Immutables.orderedMap(variants);
        }

        @Override
        public String kind() {
            return "style";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Reads the validity state of a form element registered with {@code ref}. */
    record Validity(String ref, String property) implements Expression {
        public Validity {
            Objects.requireNonNull(ref, "ref must not be null");
        }

        @Override
        public String kind() {
            return "validity";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Calls a method on {@code target}, or a global helper when {@code target} is {@code null}. */
    record Call(Expression target, String method, List<Expression> args) implements Expression {
        public Call {
            Objects.requireNonNull(method, "method must not be null");
            args = Immutables.list(args);
        }

        @Override
        public String kind() {
            return "call";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** An inline function, typically passed to {@code call}. Binds {@code param} and {@code index}. */
    record Lambda(String param, String index, Expression body) implements Expression {
        public Lambda {
            Objects.requireNonNull(param, "param must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public String kind() {
            return "lambda";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }
}
