package io.constela.core.schema;

import static io.constela.core.error.JsonPointers.append;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ConstelaErrors;
import io.constela.core.model.ActionDef;
import io.constela.core.model.ActionStep;
import io.constela.core.model.BinaryOperator;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.DataSource;
import io.constela.core.model.EventHandler;
import io.constela.core.model.EventOptions;
import io.constela.core.model.EventPayload;
import io.constela.core.model.Expression;
import io.constela.core.model.Lifecycle;
import io.constela.core.model.ParamDef;
import io.constela.core.model.ParamType;
import io.constela.core.model.Program;
import io.constela.core.model.PropValue;
import io.constela.core.model.RouteDef;
import io.constela.core.model.RouteSource;
import io.constela.core.model.StateField;
import io.constela.core.model.StateType;
import io.constela.core.model.StylePreset;
import io.constela.core.model.TransitionConfig;
import io.constela.core.model.UpdateOperation;
import io.constela.core.model.ViewNode;
import io.constela.core.model.WidgetRef;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Recursive structural check that turns a raw JSON tree into the typed {@link Program}. Stops at
 * the first violation by throwing {@link Violation}; {@link SchemaValidator} converts it into a
 * {@link ConstelaError}.
 *
 * <p>
 * Every nested expression, view node and action step counts against {@code maxDepth}, so hostile
 * input fails with {@code MAX_NESTING_EXCEEDED} instead of exhausting the call stack.
 *
 * <p>
 * Not thread-safe (tracks the current depth); create one per validation.
 */
final class ProgramParser {

    static final List<String> EXPRESSION_KINDS = List.of(
            "lit", "state", "var", "param", "route", "import", "data", "ref", "bin", "not", "cond", "get", "index",
            "concat", "array", "style", "validity", "call", "lambda");

    static final List<String> VIEW_KINDS = List.of(
            "element", "text", "if", "each", "component", "slot", "markdown", "code", "portal", "island",
            "suspense", "errorBoundary");

    static final List<String> STEP_KINDS = List.of(
            "set", "update", "setPath", "fetch", "storage", "clipboard", "navigate", "import", "call", "subscribe",
            "dispose", "dom", "send", "close", "delay", "interval", "clearTimer", "focus", "if", "generate",
            "sseConnect", "sseClose", "optimistic", "confirm", "reject", "bind", "unbind");

    private static final List<String> HTTP_METHODS = List.of("GET", "POST", "PUT", "PATCH", "DELETE");
    private static final List<String> STORAGE_OPERATIONS = List.of("get", "set", "remove");
    private static final List<String> STORAGE_TYPES = List.of("local", "session");
    private static final List<String> CLIPBOARD_OPERATIONS = List.of("write", "read");
    private static final List<String> NAVIGATE_TARGETS = List.of("_self", "_blank");
    private static final List<String> DOM_OPERATIONS =
            List.of("addClass", "removeClass", "toggleClass", "setAttribute", "removeAttribute");
    private static final List<String> FOCUS_OPERATIONS = List.of("focus", "blur", "select");
    private static final List<String> AI_PROVIDERS = List.of("anthropic", "openai");
    private static final List<String> AI_OUTPUTS = List.of("component", "view");
    private static final List<String> ISLAND_STRATEGIES =
            List.of("load", "idle", "visible", "interaction", "media", "never");

    private final int maxDepth;
    private int depth;

    ProgramParser(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /** Signals the first structural violation. Carries the finished error. */
    static final class Violation extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private final transient ConstelaError error;

        Violation(ConstelaError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }

        ConstelaError error() {
            return error;
        }
    }

    // ── Program ──

    Program parse(JsonNode root) {
        String version = requireString(root, "version", "");
        Map<String, StateField> state = parseStateMap(requireObject(root, "state", ""), "/state");
        List<ActionDef> actions = parseActions(requireArray(root, "actions", ""), "/actions");
        ViewNode view = parseView(require(root, "view", ""), "/view");

        RouteDef route = root.has("route") ? parseRoute(requireObject(root, "route", ""), "/route") : null;
        Lifecycle lifecycle =
                root.has("lifecycle") ? parseLifecycle(requireObject(root, "lifecycle", ""), "/lifecycle") : null;

        Map<String, ComponentDef> components = null;
        if (root.has("components")) {
            components = mapOf(requireObject(root, "components", ""), "/components", this::parseComponent);
        }
        Map<String, StylePreset> styles = null;
        if (root.has("styles")) {
            styles = mapOf(requireObject(root, "styles", ""), "/styles", this::parseStyle);
        }
        Map<String, String> imports = null;
        if (root.has("imports")) {
            imports = mapOf(requireObject(root, "imports", ""), "/imports", this::stringValue);
        }
        Map<String, DataSource> data = null;
        if (root.has("data")) {
            data = mapOf(requireObject(root, "data", ""), "/data", this::parseDataSource);
        }
        List<WidgetRef> widgets = null;
        if (root.has("widgets")) {
            widgets = listOf(requireArray(root, "widgets", ""), "/widgets", this::parseWidget);
        }
        return new Program(
                version, route, lifecycle, state, actions, view, components, styles, imports, data, widgets);
    }

    private Map<String, StateField> parseStateMap(JsonNode node, String path) {
        return mapOf(node, path, this::parseStateField);
    }

    private StateField parseStateField(JsonNode node, String path) {
        requireObjectNode(node, path);
        String typeName = requireString(node, "type", path);
        StateType type = StateType.fromWireName(typeName)
                .orElseThrow(() -> violation(append(path, "type"), "must be one of: number, string, list, boolean, object"));
        JsonNode initial = require(node, "initial", path);
        String initialPath = append(path, "initial");
        if (StateField.isCookieExpression(initial)) {
            requireString(initial, "key", initialPath);
            JsonNode fallback = require(initial, "default", initialPath);
            if (!type.accepts(fallback)) {
                throw violation(append(initialPath, "default"), mustBe(type));
            }
        } else if (!type.accepts(initial)) {
            throw violation(initialPath, mustBe(type));
        }
        return new StateField(type, initial);
    }

    private static String mustBe(StateType type) {
        return switch (type) {
            case NUMBER -> "must be a number";
            case STRING -> "must be a string";
            case LIST -> "must be an array";
            case BOOLEAN -> "must be a boolean";
            case OBJECT -> "must be an object";
        };
    }

    private List<ActionDef> parseActions(JsonNode node, String path) {
        return listOf(node, path, this::parseAction);
    }

    private ActionDef parseAction(JsonNode node, String path) {
        requireObjectNode(node, path);
        String name = requireString(node, "name", path);
        List<ActionStep> steps = parseSteps(requireArray(node, "steps", path), append(path, "steps"));
        return new ActionDef(name, steps);
    }

    private ComponentDef parseComponent(JsonNode node, String path) {
        requireObjectNode(node, path);
        Map<String, ParamDef> params = node.has("params")
                ? mapOf(requireObject(node, "params", path), append(path, "params"), this::parseParam)
                : Map.of();
        Map<String, StateField> localState = node.has("localState")
                ? parseStateMap(requireObject(node, "localState", path), append(path, "localState"))
                : Map.of();
        List<ActionDef> localActions = node.has("localActions")
                ? parseActions(requireArray(node, "localActions", path), append(path, "localActions"))
                : List.of();
        ViewNode view = parseView(require(node, "view", path), append(path, "view"));
        return new ComponentDef(params, localState, localActions, view);
    }

    private ParamDef parseParam(JsonNode node, String path) {
        requireObjectNode(node, path);
        String typeName = requireString(node, "type", path);
        ParamType type = ParamType.fromWireName(typeName)
                .orElseThrow(() -> violation(append(path, "type"), "must be one of: string, number, boolean, json"));
        Boolean required = optionalBoolean(node, "required", path);
        return new ParamDef(type, required == null || required);
    }

    private StylePreset parseStyle(JsonNode node, String path) {
        requireObjectNode(node, path);
        String base = requireString(node, "base", path);
        Map<String, Map<String, String>> variants = null;
        if (node.has("variants")) {
            variants = mapOf(
                    requireObject(node, "variants", path),
                    append(path, "variants"),
                    (options, optionsPath) -> mapOf(requireObjectNode(options, optionsPath), optionsPath, this::stringValue));
        }
        Map<String, String> defaults = null;
        if (node.has("defaultVariants")) {
            defaults = mapOf(
                    requireObject(node, "defaultVariants", path), append(path, "defaultVariants"), this::stringValue);
        }
        JsonNode compound = node.has("compoundVariants") ? requireArray(node, "compoundVariants", path) : null;
        return new StylePreset(base, variants, defaults, compound);
    }

    private RouteDef parseRoute(JsonNode node, String path) {
        String routePath = requireString(node, "path", path);
        Expression title = optionalExpression(node, "title", path);
        String layout = optionalString(node, "layout", path);
        Map<String, Expression> layoutParams = optionalExpressionMap(node, "layoutParams", path);
        Map<String, Expression> meta = optionalExpressionMap(node, "meta", path);
        Expression canonical = optionalExpression(node, "canonical", path);
        RouteDef.JsonLd jsonLd = null;
        if (node.has("jsonLd")) {
            JsonNode ld = requireObject(node, "jsonLd", path);
            String ldPath = append(path, "jsonLd");
            jsonLd = new RouteDef.JsonLd(
                    requireString(ld, "type", ldPath),
                    expressionMap(requireObject(ld, "properties", ldPath), append(ldPath, "properties")));
        }
        RouteDef.StaticPaths staticPaths = null;
        if (node.has("getStaticPaths")) {
            JsonNode sp = requireObject(node, "getStaticPaths", path);
            String spPath = append(path, "getStaticPaths");
            staticPaths = new RouteDef.StaticPaths(
                    requireString(sp, "source", spPath),
                    expressionMap(requireObject(sp, "params", spPath), append(spPath, "params")));
        }
        return new RouteDef(routePath, title, layout, layoutParams, meta, canonical, jsonLd, staticPaths);
    }

    private Lifecycle parseLifecycle(JsonNode node, String path) {
        return new Lifecycle(
                optionalString(node, "onMount", path),
                optionalString(node, "onUnmount", path),
                optionalString(node, "onRouteEnter", path),
                optionalString(node, "onRouteLeave", path));
    }

    private DataSource parseDataSource(JsonNode node, String path) {
        requireObjectNode(node, path);
        return new DataSource(
                requireString(node, "type", path),
                optionalString(node, "pattern", path),
                optionalString(node, "path", path),
                optionalString(node, "url", path),
                optionalString(node, "transform", path));
    }

    private WidgetRef parseWidget(JsonNode node, String path) {
        requireObjectNode(node, path);
        return new WidgetRef(requireString(node, "id", path), requireString(node, "src", path));
    }

    // ── View nodes ──

    ViewNode parseView(JsonNode node, String path) {
        enter(path);
        try {
            requireObjectNode(node, path);
            String kind = requireString(node, "kind", path);
            return switch (kind) {
                case "element" -> new ViewNode.Element(
                        requireString(node, "tag", path),
                        optionalString(node, "ref", path),
                        parseProps(node, path),
                        parseChildren(node, path));
                case "text" -> new ViewNode.Text(parseExpression(require(node, "value", path), append(path, "value")));
                case "if" -> new ViewNode.If(
                        parseExpression(require(node, "condition", path), append(path, "condition")),
                        parseView(require(node, "then", path), append(path, "then")),
                        node.has("else") ? parseView(node.get("else"), append(path, "else")) : null,
                        parseTransition(node, path));
                case "each" -> new ViewNode.Each(
                        parseExpression(require(node, "items", path), append(path, "items")),
                        requireString(node, "as", path),
                        optionalString(node, "index", path),
                        optionalExpression(node, "key", path),
                        parseView(require(node, "body", path), append(path, "body")),
                        parseTransition(node, path));
                case "component" -> new ViewNode.Component(
                        requireString(node, "name", path), parseProps(node, path), parseChildren(node, path));
                case "slot" -> new ViewNode.Slot(optionalString(node, "name", path));
                case "markdown" -> new ViewNode.Markdown(
                        parseExpression(require(node, "content", path), append(path, "content")));
                case "code" -> new ViewNode.Code(
                        parseExpression(require(node, "language", path), append(path, "language")),
                        parseExpression(require(node, "content", path), append(path, "content")));
                case "portal" -> new ViewNode.Portal(requireString(node, "target", path), parseChildren(node, path));
                case "island" -> parseIsland(node, path);
                case "suspense" -> new ViewNode.Suspense(
                        requireString(node, "id", path),
                        parseView(require(node, "fallback", path), append(path, "fallback")),
                        parseView(require(node, "content", path), append(path, "content")));
                case "errorBoundary" -> new ViewNode.ErrorBoundary(
                        parseView(require(node, "fallback", path), append(path, "fallback")),
                        parseView(require(node, "content", path), append(path, "content")));
                default -> throw violation(append(path, "kind"), "must be one of: " + String.join(", ", VIEW_KINDS));
            };
        } finally {
            depth--;
        }
    }

    private ViewNode.Island parseIsland(JsonNode node, String path) {
        String id = requireString(node, "id", path);
        String strategy = requireString(node, "strategy", path);
        if (!ISLAND_STRATEGIES.contains(strategy)) {
            throw violation(append(path, "strategy"), "must be one of: " + String.join(", ", ISLAND_STRATEGIES));
        }
        JsonNode options = node.has("strategyOptions") ? requireObject(node, "strategyOptions", path) : null;
        ViewNode content = parseView(require(node, "content", path), append(path, "content"));
        Map<String, StateField> state = node.has("state")
                ? parseStateMap(requireObject(node, "state", path), append(path, "state"))
                : Map.of();
        List<ActionDef> actions = node.has("actions")
                ? parseActions(requireArray(node, "actions", path), append(path, "actions"))
                : List.of();
        return new ViewNode.Island(id, strategy, options, content, state, actions);
    }

    private List<ViewNode> parseChildren(JsonNode node, String path) {
        if (!node.has("children")) {
            return List.of();
        }
        return listOf(requireArray(node, "children", path), append(path, "children"), this::parseView);
    }

    private Map<String, PropValue> parseProps(JsonNode node, String path) {
        if (!node.has("props")) {
            return Map.of();
        }
        return mapOf(requireObject(node, "props", path), append(path, "props"), this::parsePropValue);
    }

    private PropValue parsePropValue(JsonNode node, String path) {
        if (node.isObject() && node.has("event")) {
            return parseEventHandler(node, path);
        }
        return parseExpression(node, path);
    }

    private EventHandler parseEventHandler(JsonNode node, String path) {
        String event = requireString(node, "event", path);
        String action = requireString(node, "action", path);
        EventPayload payload = null;
        if (node.has("payload")) {
            JsonNode raw = node.get("payload");
            String payloadPath = append(path, "payload");
            if (raw.isObject() && raw.has("expr")) {
                payload = new EventPayload.Single(parseExpression(raw, payloadPath));
            } else if (raw.isObject()) {
                payload = new EventPayload.Fields(expressionMap(raw, payloadPath));
            } else {
                throw violation(payloadPath, "must be an expression or an object of expressions");
            }
        }
        Integer debounce = optionalNonNegativeInt(node, "debounce", path);
        Integer throttle = optionalNonNegativeInt(node, "throttle", path);
        EventOptions options = null;
        if (node.has("options")) {
            JsonNode raw = requireObject(node, "options", path);
            String optionsPath = append(path, "options");
            Double threshold = null;
            if (raw.has("threshold")) {
                JsonNode t = raw.get("threshold");
                if (!t.isNumber() || t.asDouble() < 0 || t.asDouble() > 1) {
                    throw violation(append(optionsPath, "threshold"), "must be a number between 0 and 1");
                }
                threshold = t.asDouble();
            }
            options = new EventOptions(
                    threshold, optionalString(raw, "rootMargin", optionsPath), optionalBoolean(raw, "once", optionsPath));
        }
        return new EventHandler(event, action, payload, debounce, throttle, options);
    }

    private TransitionConfig parseTransition(JsonNode node, String path) {
        if (!node.has("transition")) {
            return null;
        }
        JsonNode t = requireObject(node, "transition", path);
        String tPath = append(path, "transition");
        return new TransitionConfig(
                requireString(t, "enter", tPath),
                requireString(t, "enterActive", tPath),
                requireString(t, "exit", tPath),
                requireString(t, "exitActive", tPath),
                optionalNonNegativeNumber(t, "duration", tPath));
    }

    // ── Expressions ──

    Expression parseExpression(JsonNode node, String path) {
        enter(path);
        try {
            requireObjectNode(node, path);
            String kind = requireString(node, "expr", path);
            return switch (kind) {
                case "lit" -> new Expression.Lit(require(node, "value", path));
                case "state" -> new Expression.State(requireString(node, "name", path), optionalString(node, "path", path));
                case "var" -> new Expression.Var(requireString(node, "name", path), optionalString(node, "path", path));
                case "param" -> new Expression.Param(requireString(node, "name", path), optionalString(node, "path", path));
                case "import" -> new Expression.Import(requireString(node, "name", path), optionalString(node, "path", path));
                case "data" -> new Expression.Data(requireString(node, "name", path), optionalString(node, "path", path));
                case "ref" -> new Expression.Ref(requireString(node, "name", path));
                case "route" -> parseRouteExpression(node, path);
                case "bin" -> parseBinary(node, path);
                case "not" -> new Expression.Not(child(node, "operand", path));
                case "cond" -> new Expression.Cond(child(node, "if", path), child(node, "then", path), child(node, "else", path));
                case "get" -> new Expression.Get(child(node, "base", path), requireString(node, "path", path));
                case "index" -> new Expression.Index(child(node, "base", path), child(node, "key", path));
                case "concat" -> new Expression.Concat(expressionList(requireArray(node, "items", path), append(path, "items")));
                case "array" -> new Expression.Array(
                        expressionList(requireArray(node, "elements", path), append(path, "elements")));
                case "style" -> new Expression.Style(
                        requireString(node, "name", path), optionalExpressionMap(node, "variants", path));
                case "validity" -> new Expression.Validity(
                        requireString(node, "ref", path), optionalString(node, "property", path));
                case "call" -> parseCall(node, path);
                case "lambda" -> new Expression.Lambda(
                        requireString(node, "param", path),
                        optionalString(node, "index", path),
                        child(node, "body", path));
                default -> throw violation(append(path, "expr"), "must be one of: " + String.join(", ", EXPRESSION_KINDS));
            };
        } finally {
            depth--;
        }
    }

    private Expression.Route parseRouteExpression(JsonNode node, String path) {
        String name = requireString(node, "name", path);
        RouteSource source = null;
        String sourceName = optionalString(node, "source", path);
        if (sourceName != null) {
            source = RouteSource.fromWireName(sourceName)
                    .orElseThrow(() -> violation(append(path, "source"), "must be one of: param, query, path"));
        }
        return new Expression.Route(name, source);
    }

    private Expression.Bin parseBinary(JsonNode node, String path) {
        String symbol = requireString(node, "op", path);
        BinaryOperator op = BinaryOperator.fromSymbol(symbol)
                .orElseThrow(() -> violation(append(path, "op"), "must be a valid operator"));
        return new Expression.Bin(op, child(node, "left", path), child(node, "right", path));
    }

    private Expression.Call parseCall(JsonNode node, String path) {
        Expression target = null;
        JsonNode rawTarget = node.get("target");
        if (rawTarget != null && !rawTarget.isNull()) {
            target = parseExpression(rawTarget, append(path, "target"));
        }
        String method = requireString(node, "method", path);
        List<Expression> args =
                node.has("args") ? expressionList(requireArray(node, "args", path), append(path, "args")) : null;
        return new Expression.Call(target, method, args);
    }

    private Expression child(JsonNode node, String field, String path) {
        return parseExpression(require(node, field, path), append(path, field));
    }

    private Expression optionalExpression(JsonNode node, String field, String path) {
        return node.has(field) ? child(node, field, path) : null;
    }

    private List<Expression> expressionList(JsonNode array, String path) {
        return listOf(array, path, this::parseExpression);
    }

    private Map<String, Expression> expressionMap(JsonNode object, String path) {
        return mapOf(object, path, this::parseExpression);
    }

    private Map<String, Expression> optionalExpressionMap(JsonNode node, String field, String path) {
        return node.has(field) ? expressionMap(requireObject(node, field, path), append(path, field)) : null;
    }

    // ── Action steps ──

    private List<ActionStep> parseSteps(JsonNode array, String path) {
        return listOf(array, path, this::parseStep);
    }

    private List<ActionStep> optionalSteps(JsonNode node, String field, String path) {
        return node.has(field) ? parseSteps(requireArray(node, field, path), append(path, field)) : null;
    }

    ActionStep parseStep(JsonNode node, String path) {
        enter(path);
        try {
            requireObjectNode(node, path);
            String kind = requireString(node, "do", path);
            return switch (kind) {
                case "set" -> new ActionStep.Set(requireString(node, "target", path), child(node, "value", path));
                case "update" -> parseUpdate(node, path);
                case "setPath" -> new ActionStep.SetPath(
                        requireString(node, "target", path), child(node, "path", path), child(node, "value", path));
                case "fetch" -> new ActionStep.Fetch(
                        child(node, "url", path),
                        optionalEnum(node, "method", HTTP_METHODS, path),
                        optionalExpressionMap(node, "headers", path),
                        optionalExpression(node, "body", path),
                        optionalString(node, "result", path),
                        optionalSteps(node, "onSuccess", path),
                        optionalSteps(node, "onError", path));
                case "storage" -> new ActionStep.Storage(
                        requireEnum(node, "operation", STORAGE_OPERATIONS, path),
                        child(node, "key", path),
                        optionalExpression(node, "value", path),
                        requireEnum(node, "storage", STORAGE_TYPES, path),
                        optionalString(node, "result", path),
                        optionalSteps(node, "onSuccess", path),
                        optionalSteps(node, "onError", path));
                case "clipboard" -> new ActionStep.Clipboard(
                        requireEnum(node, "operation", CLIPBOARD_OPERATIONS, path),
                        optionalExpression(node, "value", path),
                        optionalString(node, "result", path),
                        optionalSteps(node, "onSuccess", path),
                        optionalSteps(node, "onError", path));
                case "navigate" -> new ActionStep.Navigate(
                        child(node, "url", path),
                        optionalEnum(node, "target", NAVIGATE_TARGETS, path),
                        optionalBoolean(node, "replace", path));
                case "import" -> new ActionStep.Import(
                        requireString(node, "module", path),
                        requireString(node, "result", path),
                        optionalSteps(node, "onSuccess", path),
                        optionalSteps(node, "onError", path));
                case "call" -> new ActionStep.Call(
                        child(node, "target", path),
                        node.has("args") ? expressionList(requireArray(node, "args", path), append(path, "args")) : null,
                        optionalString(node, "result", path),
                        optionalSteps(node, "onSuccess", path),
                        optionalSteps(node, "onError", path));
                case "subscribe" -> new ActionStep.Subscribe(
                        child(node, "target", path),
                        requireString(node, "event", path),
                        requireString(node, "action", path));
                case "dispose" -> new ActionStep.Dispose(child(node, "target", path));
                case "dom" -> new ActionStep.Dom(
                        requireEnum(node, "operation", DOM_OPERATIONS, path),
                        child(node, "selector", path),
                        optionalExpression(node, "value", path),
                        optionalString(node, "attribute", path));
                case "send" -> new ActionStep.Send(requireString(node, "connection", path), child(node, "data", path));
                case "close" -> new ActionStep.Close(requireString(node, "connection", path));
                case "delay" -> new ActionStep.Delay(
                        child(node, "ms", path),
                        parseSteps(requireArray(node, "then", path), append(path, "then")),
                        optionalString(node, "result", path));
                case "interval" -> new ActionStep.Interval(
                        child(node, "ms", path),
                        requireString(node, "action", path),
                        optionalString(node, "result", path));
                case "clearTimer" -> new ActionStep.ClearTimer(child(node, "target", path));
                case "focus" -> new ActionStep.Focus(
                        child(node, "target", path),
                        requireEnum(node, "operation", FOCUS_OPERATIONS, path),
                        optionalSteps(node, "onSuccess", path),
                        optionalSteps(node, "onError", path));
                case "if" -> new ActionStep.If(
                        child(node, "condition", path),
                        parseSteps(requireArray(node, "then", path), append(path, "then")),
                        optionalSteps(node, "else", path));
                case "generate" -> new ActionStep.Generate(
                        requireEnum(node, "provider", AI_PROVIDERS, path),
                        child(node, "prompt", path),
                        requireEnum(node, "output", AI_OUTPUTS, path),
                        requireString(node, "result", path),
                        optionalString(node, "model", path),
                        optionalSteps(node, "onSuccess", path),
                        optionalSteps(node, "onError", path));
                case "sseConnect" -> parseSseConnect(node, path);
                case "sseClose" -> new ActionStep.SseClose(requireString(node, "connection", path));
                case "optimistic" -> new ActionStep.Optimistic(
                        requireString(node, "target", path),
                        optionalExpression(node, "path", path),
                        child(node, "value", path),
                        optionalString(node, "result", path),
                        optionalNonNegativeInt(node, "timeout", path));
                case "confirm" -> new ActionStep.Confirm(child(node, "id", path));
                case "reject" -> new ActionStep.Reject(child(node, "id", path));
                case "bind" -> new ActionStep.Bind(
                        requireString(node, "connection", path),
                        optionalString(node, "eventType", path),
                        requireString(node, "target", path),
                        optionalExpression(node, "path", path),
                        optionalExpression(node, "transform", path),
                        optionalBoolean(node, "patch", path));
                case "unbind" -> new ActionStep.Unbind(
                        requireString(node, "connection", path), requireString(node, "target", path));
                default -> throw violation(append(path, "do"), "must be one of: " + String.join(", ", STEP_KINDS));
            };
        } finally {
            depth--;
        }
    }

    private ActionStep.Update parseUpdate(JsonNode node, String path) {
        String target = requireString(node, "target", path);
        String operationName = requireString(node, "operation", path);
        UpdateOperation operation = UpdateOperation.fromWireName(operationName)
                .orElseThrow(() -> violation(append(path, "operation"), "must be a valid operation"));
        return new ActionStep.Update(
                target,
                operation,
                optionalExpression(node, "value", path),
                optionalExpression(node, "index", path),
                optionalExpression(node, "deleteCount", path));
    }

    private ActionStep.SseConnect parseSseConnect(JsonNode node, String path) {
        String connection = requireString(node, "connection", path);
        Expression url = child(node, "url", path);
        List<String> eventTypes = null;
        if (node.has("eventTypes")) {
            eventTypes = listOf(requireArray(node, "eventTypes", path), append(path, "eventTypes"), this::stringValue);
        }
        JsonNode reconnect = node.has("reconnect") ? requireObject(node, "reconnect", path) : null;
        return new ActionStep.SseConnect(
                connection,
                url,
                eventTypes,
                reconnect,
                optionalSteps(node, "onOpen", path),
                optionalSteps(node, "onMessage", path),
                optionalSteps(node, "onError", path));
    }

    // ── Primitive helpers ──

    private void enter(String path) {
        if (++depth > maxDepth) {
            depth--;
            throw new Violation(ConstelaErrors.maxNesting(maxDepth, path));
        }
    }

    private static Violation violation(String path, String message) {
        return new Violation(ConstelaErrors.schema(message, path));
    }

    private static JsonNode requireObjectNode(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw violation(path, "must be an object");
        }
        return node;
    }

    private static JsonNode require(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw violation(append(path, field), field + " is required");
        }
        return value;
    }

    private static JsonNode requireObject(JsonNode node, String field, String path) {
        JsonNode value = require(node, field, path);
        if (!value.isObject()) {
            throw violation(append(path, field), field + " must be an object");
        }
        return value;
    }

    private static JsonNode requireArray(JsonNode node, String field, String path) {
        JsonNode value = require(node, field, path);
        if (!value.isArray()) {
            throw violation(append(path, field), field + " must be an array");
        }
        return value;
    }

    private static String requireString(JsonNode node, String field, String path) {
        JsonNode value = require(node, field, path);
        if (!value.isTextual()) {
            throw violation(append(path, field), field + " must be a string");
        }
        return value.asText();
    }

    private static String optionalString(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw violation(append(path, field), field + " must be a string");
        }
        return value.asText();
    }

    private static Boolean optionalBoolean(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isBoolean()) {
            throw violation(append(path, field), field + " must be a boolean");
        }
        return value.asBoolean();
    }

    private static Integer optionalNonNegativeInt(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt() || value.asInt() < 0) {
            throw violation(append(path, field), field + " must be a non-negative integer");
        }
        return value.asInt();
    }

    private static Number optionalNonNegativeNumber(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (!value.isNumber() || !(value.asDouble() >= 0) || Double.isInfinite(value.asDouble())) {
            throw violation(append(path, field), field + " must be a non-negative number");
        }
        return value.numberValue();
    }

    private static String requireEnum(JsonNode node, String field, List<String> allowed, String path) {
        String value = requireString(node, field, path);
        if (!allowed.contains(value)) {
            throw violation(append(path, field), "must be one of: " + String.join(", ", allowed));
        }
        return value;
    }

    private static String optionalEnum(JsonNode node, String field, List<String> allowed, String path) {
        String value = optionalString(node, field, path);
        if (value != null && !allowed.contains(value)) {
            throw violation(append(path, field), "must be one of: " + String.join(", ", allowed));
        }
        return value;
    }

    private String stringValue(JsonNode node, String path) {
        if (!node.isTextual()) {
            throw violation(path, "must be a string");
        }
        return node.asText();
    }

    private static <T> Map<String, T> mapOf(JsonNode object, String path, BiFunction<JsonNode, String, T> parser) {
        Map<String, T> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            result.put(entry.getKey(), parser.apply(entry.getValue(), append(path, entry.getKey())));
        }
        return result;
    }

    private static <T> List<T> listOf(JsonNode array, String path, BiFunction<JsonNode, String, T> parser) {
        List<T> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            result.add(parser.apply(array.get(i), append(path, i)));
        }
        return result;
    }
}
