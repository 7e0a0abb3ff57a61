package io.constela.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of an action, discriminated by {@code do}. Optional fields are {@code null} when absent
 * so the lowered program reproduces the source shape.
 *
 * <p>
 * Steps that perform asynchronous work carry {@code onSuccess}/{@code onError} sub-sequences,
 * which are themselves step lists.
 *
 * <p>
 * Thread-safe and immutable.
 */
@JsonPropertyOrder({"do"})
public sealed interface ActionStep {

    @JsonProperty("do")
    String kind();

    <R, A> R accept(Visitor<R, A> visitor, A arg);

    /** One method per step kind. */
    interface Visitor<R, A> {
        R visit(Set step, A arg);

        R visit(Update step, A arg);

        R visit(SetPath step, A arg);

        R visit(Fetch step, A arg);

        R visit(Storage step, A arg);

        R visit(Clipboard step, A arg);

        R visit(Navigate step, A arg);

        R visit(Import step, A arg);

        R visit(Call step, A arg);

        R visit(Subscribe step, A arg);

        R visit(Dispose step, A arg);

        R visit(Dom step, A arg);

        R visit(Send step, A arg);

        R visit(Close step, A arg);

        R visit(Delay step, A arg);

        R visit(Interval step, A arg);

        R visit(ClearTimer step, A arg);

        R visit(Focus step, A arg);

        R visit(If step, A arg);

        R visit(Generate step, A arg);

        R visit(SseConnect step, A arg);

        R visit(SseClose step, A arg);

        R visit(Optimistic step, A arg);

        R visit(Confirm step, A arg);

        R visit(Reject step, A arg);

        R visit(Bind step, A arg);

        R visit(Unbind step, A arg);
    }

    /** Replaces a state field. */
    record Set(String target, Expression value) implements ActionStep {
        public Set {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "set";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Applies an {@link UpdateOperation} to a state field. */
    record Update(
            String target,
            UpdateOperation operation,
            Expression value,
            Expression index,
            Expression deleteCount)
            implements ActionStep {
        public Update {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(operation, "operation must not be null");
        }

        @Override
        public String kind() {
            return "update";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Writes into a nested location of a state field. */
    record SetPath(String target, Expression path, Expression value) implements ActionStep {
        public SetPath {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "setPath";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** HTTP request. */
    record Fetch(
            Expression url,
            String method,
            Map<String, Expression> headers,
            Expression body,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public Fetch {
            Objects.requireNonNull(url, "url must not be null");
            headers = Immutables.orderedMap(headers);
            onSuccess = Immutables.list(onSuccess);
            onError = Immutables.list(onError);
        }

        @Override
        public String kind() {
            return "fetch";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Reads or writes web storage. */
    record Storage(
            String operation,
            Expression key,
            Expression value,
            String storage,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public Storage {
            Objects.requireNonNull(operation, "operation must not be null");
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(storage, "storage must not be null");
            onSuccess = Immutables.list(onSuccess);
            onError = Immutables.list(onError);
        }

        @Override
        public String kind() {
            return "storage";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Clipboard(
            String operation,
            Expression value,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public Clipboard {
            Objects.requireNonNull(operation, "operation must not be null");
            onSuccess = Immutables.list(onSuccess);
            onError = Immutables.list(onError);
        }

        @Override
        public String kind() {
            return "clipboard";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Navigate(Expression url, String target, Boolean replace) implements ActionStep {
        public Navigate {
            Objects.requireNonNull(url, "url must not be null");
        }

        @Override
        public String kind() {
            return "navigate";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Dynamically imports an external module. */
    record Import(
            String module,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public Import {
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(result, "result must not be null");
            onSuccess = Immutables.list(onSuccess);
            onError = Immutables.list(onError);
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

    /** Calls an external function. */
    record Call(
            Expression target,
            List<Expression> args,
            String result,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public Call {
            Objects.requireNonNull(target, "target must not be null");
            args = Immutables.list(args);
            onSuccess = Immutables.list(onSuccess);
            onError = Immutables.list(onError);
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

    /** Subscribes an action to an external event source. */
    record Subscribe(Expression target, String event, String action) implements ActionStep {
        public Subscribe {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(event, "event must not be null");
            Objects.requireNonNull(action, "action must not be null");
        }

        @Override
        public String kind() {
            return "subscribe";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Dispose(Expression target) implements ActionStep {
        public Dispose {
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public String kind() {
            return "dispose";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Manipulates DOM classes and attributes. */
    record Dom(
            String operation,
            Expression selector,
            Expression value,
            String attribute)
            implements ActionStep {
        public Dom {
            Objects.requireNonNull(operation, "operation must not be null");
            Objects.requireNonNull(selector, "selector must not be null");
        }

        @Override
        public String kind() {
            return "dom";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Sends data over a named connection. */
    record Send(String connection, Expression data) implements ActionStep {
        public Send {
            Objects.requireNonNull(connection, "connection must not be null");
            Objects.requireNonNull(data, "data must not be null");
        }

        @Override
        public String kind() {
            return "send";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Close(String connection) implements ActionStep {
        public Close {
            Objects.requireNonNull(connection, "connection must not be null");
        }

        @Override
        public String kind() {
            return "close";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Runs {@code then} after {@code ms}. */
    record Delay(Expression ms, List<ActionStep> then, String result) implements ActionStep {
        public Delay {
            Objects.requireNonNull(ms, "ms must not be null");
            then = List.copyOf(then);
        }

        @Override
        public String kind() {
            return "delay";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Dispatches {@code action} every {@code ms}. */
    record Interval(Expression ms, String action, String result) implements ActionStep {
        public Interval {
            Objects.requireNonNull(ms, "ms must not be null");
            Objects.requireNonNull(action, "action must not be null");
        }

        @Override
        public String kind() {
            return "interval";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record ClearTimer(Expression target) implements ActionStep {
        public ClearTimer {
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public String kind() {
            return "clearTimer";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Focus(
            Expression target,
            String operation,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public Focus {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(operation, "operation must not be null");
            onSuccess = Immutables.list(onSuccess);
            onError = Immutables.list(onError);
        }

        @Override
        public String kind() {
            return "focus";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Conditional step sequence. */
    record If(
            Expression condition,
            List<ActionStep> then,
            @JsonProperty("else") List<ActionStep> otherwise)
            implements ActionStep {
        public If {
            Objects.requireNonNull(condition, "condition must not be null");
            then = List.copyOf(then);
            otherwise = Immutables.list(otherwise);
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

    /** AI generation request. */
    record Generate(
            String provider,
            Expression prompt,
            String output,
            String result,
            String model,
            List<ActionStep> onSuccess,
            List<ActionStep> onError)
            implements ActionStep {
        public Generate {
            Objects.requireNonNull(provider, "provider must not be null");
            Objects.requireNonNull(prompt, "prompt must not be null");
            Objects.requireNonNull(output, "output must not be null");
            Objects.requireNonNull(result, "result must not be null");
            onSuccess = Immutables.list(onSuccess);
            onError = Immutables.list(onError);
        }

        @Override
        public String kind() {
            return "generate";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Opens a server-sent events connection. {@code reconnect} is kept as parsed. */
    record SseConnect(
            String connection,
            Expression url,
            List<String> eventTypes,
            JsonNode reconnect,
            List<ActionStep> onOpen,
            List<ActionStep> onMessage,
            List<ActionStep> onError)
            implements ActionStep {
        public SseConnect {
            Objects.requireNonNull(connection, "connection must not be null");
            Objects.requireNonNull(url, "url must not be null");
            eventTypes = Immutables.list(eventTypes);
            reconnect = Immutables.json(reconnect);
            onOpen = Immutables.list(onOpen);
            onMessage = Immutables.list(onMessage);
            onError = Immutables.list(onError);
        }

        @Override
        public String kind() {
            return "sseConnect";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record SseClose(String connection) implements ActionStep {
        public SseClose {
            Objects.requireNonNull(connection, "connection must not be null");
        }

        @Override
        public String kind() {
            return "sseClose";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Applies an optimistic update that a later {@code confirm} or {@code reject} settles. */
    record Optimistic(
            String target,
            Expression path,
            Expression value,
            String result,
            Integer timeout)
            implements ActionStep {
        public Optimistic {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "optimistic";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Confirm(Expression id) implements ActionStep {
        public Confirm {
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public String kind() {
            return "confirm";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Reject(Expression id) implements ActionStep {
        public Reject {
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public String kind() {
            return "reject";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /** Binds messages of a connection to a state field. */
    record Bind(
            String connection,
            String eventType,
            String target,
            Expression path,
            Expression transform,
            Boolean patch)
            implements ActionStep {
        public Bind {
            Objects.requireNonNull(connection, "connection must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public String kind() {
            return "bind";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Unbind(String connection, String target) implements ActionStep {
        public Unbind {
            Objects.requireNonNull(connection, "connection must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public String kind() {
            return "unbind";
        }

        @Override
        public <R, A> R accept(Visitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }
}
