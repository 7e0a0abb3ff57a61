package io.constela.core.analysis;

import static io.constela.core.error.JsonPointers.append;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ConstelaErrors;
import io.constela.core.model.ActionDef;
import io.constela.core.model.ActionStep;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.DataSource;
import io.constela.core.model.EventHandler;
import io.constela.core.model.EventPayload;
import io.constela.core.model.Expression;
import io.constela.core.model.ExpressionWalker;
import io.constela.core.model.Lifecycle;
import io.constela.core.model.ParamDef;
import io.constela.core.model.Program;
import io.constela.core.model.PropValue;
import io.constela.core.model.RouteDef;
import io.constela.core.model.RouteSource;
import io.constela.core.model.StateField;
import io.constela.core.model.StylePreset;
import io.constela.core.model.UpdateOperation;
import io.constela.core.model.ViewNode;
import io.constela.core.model.ViewWalker;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second compiler pass: scope-aware reference resolution over a validated {@link Program}.
 *
 * <p>
 * Unlike the schema validator this pass collects every error it can find in one traversal. Each
 * component definition is analyzed exactly once, in a fresh scope holding its params, the global
 * state and actions, and its own local state and actions; call sites only check the invocation
 * itself (known component, required props, literal prop types). Inclusion cycles and the inlined
 * view depth come from {@link ComponentGraph}.
 *
 * <p>
 * Thread-safe: all per-program state lives in a private run object.
 */
public final class Analyzer {

    private static final Logger LOG = LoggerFactory.getLogger(Analyzer.class);

    private static final Set<String> DATA_SOURCE_TYPES = Set.of("glob", "file", "api");
    private static final Set<String> DATA_TRANSFORMS = Set.of("mdx", "yaml", "csv");

    private final int maxExpandedDepth;
    private final int maxExpandedNodes;
    private final Suggestions suggestions;

    /** Analyzer without a node budget. */
    public Analyzer(int maxExpandedDepth, int suggestionDistance) {
        this(maxExpandedDepth, suggestionDistance, Integer.MAX_VALUE);
    }

    /**
     * @param maxExpandedDepth   largest allowed depth of the view once components are inlined
     * @param suggestionDistance largest edit distance for "Did you mean" hints
     * @param maxExpandedNodes   largest allowed node count of the view once components are inlined
     */
    public Analyzer(int maxExpandedDepth, int suggestionDistance, int maxExpandedNodes) {
        if (maxExpandedDepth <= 0) {
            throw new IllegalArgumentException("maxExpandedDepth must be positive, got: " + maxExpandedDepth);
        }
        if (maxExpandedNodes <= 0) {
            throw new IllegalArgumentException("maxExpandedNodes must be positive, got: " + maxExpandedNodes);
        }
        this.maxExpandedDepth = maxExpandedDepth;
        this.maxExpandedNodes = maxExpandedNodes;
        this.suggestions = new Suggestions(suggestionDistance);
    }

    public AnalysisResult analyze(Program program) {
        return analyze(program, null);
    }

    /**
     * Analyzes {@code program}.
     *
     * @param knownLayouts layout names available to {@code route.layout}, or {@code null} to skip
     *                     the layout check
     */
    public AnalysisResult analyze(Program program, Set<String> knownLayouts) {
        return analyze(program, knownLayouts, false);
    }

    /**
     * Analyzes a layout. A {@code param} outside every component names a layout param supplied at
     * composition time, so it is not reported.
     */
    AnalysisResult analyzeLayout(Program layout) {
        return analyze(layout, null, true);
    }

    private AnalysisResult analyze(Program program, Set<String> knownLayouts, boolean layout) {
        Objects.requireNonNull(program, "program must not be null");
        Run run = new Run(program, knownLayouts, layout);
        run.execute();
        if (!run.errors.isEmpty()) {
            LOG.debug("Analysis found {} error(s)", run.errors.size());
            return AnalysisResult.failure(run.errors);
        }
        AnalysisContext context = run.context();
        LOG.debug(
                "Analysis passed: {} state field(s), {} action(s), {} component(s)",
                context.stateNames().size(),
                context.actionNames().size(),
                context.componentRegistry().size());
        return AnalysisResult.success(context);
    }

    /** Where a check runs: the JSON Pointer of the node plus the names visible there. */
    private record Site(String path, Env env) {
        Site at(String... segments) {
            return new Site(append(path, segments), env);
        }

        Site with(Env newEnv) {
            return new Site(path, newEnv);
        }
    }

    /**
     * Names visible at a point of the tree.
     *
     * @param params       declared params, or {@code null} outside a component
     * @param localTargets when non-null, steps are restricted to local-state writes into these fields
     * @param checkVars    {@code false} in actions and event payloads, where vars are bound at runtime
     */
    private record Env(
            Map<String, StateField> states,
            Set<String> actions,
            Map<String, ParamDef> params,
            Map<String, StateField> localTargets,
            Scope vars,
            boolean checkVars) {

        Env withVars(Scope newVars) {
            return new Env(states, actions, params, localTargets, newVars, checkVars);
        }

        Env runtimeBound() {
            return new Env(states, actions, params, localTargets, vars, false);
        }

        Env restrictedTo(Map<String, StateField> targets) {
            return new Env(states, actions, params, targets, vars, false);
        }
    }

    private final class Run {
        private final Program program;
        private final Set<String> knownLayouts;
        private final boolean layout;
        private final List<ConstelaError> errors = new ArrayList<>();
        private final Set<String> actionNames = new LinkedHashSet<>();
        private final Set<String> refNames = new LinkedHashSet<>();
        private List<String> routeParams = List.of();
        private ComponentGraph graph;

        private final ExpressionChecker expressions = new ExpressionChecker();
        private final StepChecker steps = new StepChecker();
        private final ViewChecker views = new ViewChecker();

        Run(Program program, Set<String> knownLayouts, boolean layout) {
            this.program = program;
            this.knownLayouts = knownLayouts;
            this.layout = layout;
        }

        void execute() {
            collectActionNames(program.actions(), "/actions", actionNames);
            if (program.route() != null) {
                routeParams = RoutePaths.extractParams(program.route().path());
            }
            collectRefs();
            graph = ComponentGraph.build(program.componentsOrEmpty());

            Env global = new Env(program.state(), actionNames, null, null, Scope.empty(), true);
            checkRoute(global.runtimeBound());
            checkLifecycle();
            checkDataSources();
            checkStyles();
            checkActions(program.actions(), "/actions", global.runtimeBound());
            views.walk(program.view(), new Site("/view", global));
            checkComponents();
            checkExpandedDepth();
        }

        AnalysisContext context() {
            return new AnalysisContext(
                    program.state().keySet(),
                    actionNames,
                    routeParams,
                    program.componentsOrEmpty(),
                    program.imports() == null ? Set.of() : program.imports().keySet(),
                    program.data() == null ? Set.of() : program.data().keySet(),
                    program.stylesOrEmpty().keySet(),
                    refNames);
        }

        private void report(ConstelaError error) {
            errors.add(error);
        }

        private void report(ConstelaError error, String name, Collection<String> candidates) {
            errors.add(suggestions.decorate(error, name, candidates));
        }

        // ── Program sections ──

        private void collectActionNames(List<ActionDef> actions, String path, Set<String> into) {
            for (int i = 0; i < actions.size(); i++) {
                String name = actions.get(i).name();
                if (!into.add(name)) {
                    report(ConstelaErrors.duplicateAction(name, append(path, String.valueOf(i), "name")));
                }
            }
        }

        private void collectRefs() {
            ViewWalker<String> collector = new ViewWalker<>() {
                @Override
                protected String descend(String path, String... segments) {
                    return path;
                }

                @Override
                public Void visit(ViewNode.Element node, String path) {
                    if (node.ref() != null) {
                        refNames.add(node.ref());
                    }
                    return super.visit(node, path);
                }
            };
            collector.walk(program.view(), "");
            program.componentsOrEmpty().values().forEach(def -> collector.walk(def.view(), ""));
        }

        private void checkRoute(Env env) {
            RouteDef route = program.route();
            if (route == null) {
                return;
            }
            Site site = new Site("/route", env);
            if (route.layout() != null && knownLayouts != null && !knownLayouts.contains(route.layout())) {
                report(ConstelaErrors.layoutNotFound(route.layout(), "/route/layout"), route.layout(), knownLayouts);
            }
            checkOptional(route.title(), site.at("title"));
            checkValues(route.layoutParams(), site.at("layoutParams"));
            checkValues(route.meta(), site.at("meta"));
            checkOptional(route.canonical(), site.at("canonical"));
            if (route.jsonLd() != null) {
                checkValues(route.jsonLd().properties(), site.at("jsonLd", "properties"));
            }
            RouteDef.StaticPaths staticPaths = route.getStaticPaths();
            if (staticPaths != null) {
                Map<String, DataSource> data = program.data();
                if (data == null || !data.containsKey(staticPaths.source())) {
                    report(
                            ConstelaErrors.undefinedDataSource(
                                    staticPaths.source(), "/route/getStaticPaths/source"),
                            staticPaths.source(),
                            data == null ? List.of() : data.keySet());
                }
                checkValues(staticPaths.params(), site.at("getStaticPaths", "params"));
            }
        }

        private void checkLifecycle() {
            Lifecycle lifecycle = program.lifecycle();
            if (lifecycle == null) {
                return;
            }
            checkActionName(lifecycle.onMount(), "/lifecycle/onMount", actionNames);
            checkActionName(lifecycle.onUnmount(), "/lifecycle/onUnmount", actionNames);
            checkActionName(lifecycle.onRouteEnter(), "/lifecycle/onRouteEnter", actionNames);
            checkActionName(lifecycle.onRouteLeave(), "/lifecycle/onRouteLeave", actionNames);
        }

        private void checkActionName(String name, String path, Set<String> available) {
            if (name != null && !available.contains(name)) {
                report(ConstelaErrors.undefinedAction(name, path), name, available);
            }
        }

        private void checkDataSources() {
            if (program.data() == null) {
                return;
            }
            program.data().forEach((name, source) -> {
                String path = append("/data", name);
                String problem = dataSourceProblem(source);
                if (problem != null) {
                    report(ConstelaErrors.invalidDataSource(name, problem, path));
                }
            });
        }

        private String dataSourceProblem(DataSource source) {
            if (!DATA_SOURCE_TYPES.contains(source.type())) {
                return "type must be one of: glob, file, api";
            }
            if ("glob".equals(source.type()) && source.pattern() == null) {
                return "glob source requires 'pattern'";
            }
            if ("file".equals(source.type()) && source.path() == null) {
                return "file source requires 'path'";
            }
            if ("api".equals(source.type()) && source.url() == null) {
                return "api source requires 'url'";
            }
            if (source.transform() != null && !DATA_TRANSFORMS.contains(source.transform())) {
                return "transform must be one of: mdx, yaml, csv";
            }
            return null;
        }

        private void checkStyles() {
            program.stylesOrEmpty().forEach((name, preset) -> {
                if (preset.defaultVariants() == null) {
                    return;
                }
                for (String key : preset.defaultVariants().keySet()) {
                    if (!preset.declaresVariant(key)) {
                        report(
                                ConstelaErrors.undefinedVariant(
                                        name, key, append("/styles", name, "defaultVariants", key)),
                                key,
                                variantKeys(preset));
                    }
                }
            });
        }

        private void checkActions(List<ActionDef> actions, String path, Env env) {
            for (int i = 0; i < actions.size(); i++) {
                Site site = new Site(append(path, String.valueOf(i), "steps"), env);
                checkSteps(actions.get(i).steps(), site);
            }
        }

        private void checkComponents() {
            program.componentsOrEmpty().forEach((name, def) -> {
                String path = append("/components", name);
                Map<String, StateField> states = new LinkedHashMap<>(program.state());
                states.putAll(def.localState());
                Set<String> localActionNames = new LinkedHashSet<>();
                collectActionNames(def.localActions(), append(path, "localActions"), localActionNames);
                Set<String> actions = new LinkedHashSet<>(actionNames);
                actions.addAll(localActionNames);

                Env env = new Env(states, actions, def.params(), null, Scope.empty(), true);
                checkActions(def.localActions(), append(path, "localActions"), env.restrictedTo(def.localState()));
                views.walk(def.view(), new Site(append(path, "view"), env));
            });
            for (ComponentGraph.Cycle cycle : graph.cycles()) {
                report(ConstelaErrors.componentCycle(cycle.components(), cycle.path()));
            }
        }

        private void checkExpandedDepth() {
            int depth = graph.measure(program.view());
            if (depth > maxExpandedDepth) {
                LOG.debug("Inlined view depth bound {} exceeds limit {}", depth, maxExpandedDepth);
                report(ConstelaErrors.maxNesting(maxExpandedDepth, "/view"));
            }
            int size = graph.measureSize(program.view());
            if (size > maxExpandedNodes) {
                LOG.debug("Inlined view size bound {} exceeds limit {}", size, maxExpandedNodes);
                report(ConstelaErrors.maxExpandedNodes(maxExpandedNodes, "/view"));
            }
        }

        // ── Shared helpers ──

        private void check(Expression expression, Site site) {
            expressions.walk(expression, site);
        }

        private void checkOptional(Expression expression, Site site) {
            if (expression != null) {
                check(expression, site);
            }
        }

        private void checkAll(List<Expression> list, Site site) {
            if (list == null) {
                return;
            }
            for (int i = 0; i < list.size(); i++) {
                check(list.get(i), site.at(String.valueOf(i)));
            }
        }

        private void checkValues(Map<String, Expression> values, Site site) {
            if (values != null) {
                values.forEach((key, value) -> check(value, site.at(key)));
            }
        }

        private void checkSteps(List<ActionStep> list, Site site) {
            if (list == null) {
                return;
            }
            for (int i = 0; i < list.size(); i++) {
                ActionStep step = list.get(i);
                Site stepSite = site.at(String.valueOf(i));
                if (stepSite.env().localTargets() != null && !isLocalWrite(step)) {
                    report(ConstelaErrors.localActionInvalidStep(step.kind(), append(stepSite.path(), "do")));
                    continue;
                }
                step.accept(steps, stepSite);
            }
        }

        private boolean isLocalWrite(ActionStep step) {
            return step instanceof ActionStep.Set
                    || step instanceof ActionStep.Update
                    || step instanceof ActionStep.SetPath;
        }

        /** Resolves a state write target, reporting it when unknown; returns the field or null. */
        private StateField resolveTarget(String target, Site site) {
            Map<String, StateField> local = site.env().localTargets();
            String path = append(site.path(), "target");
            if (local != null) {
                StateField field = local.get(target);
                if (field == null) {
                    report(ConstelaErrors.undefinedLocalState(target, path), target, local.keySet());
                }
                return field;
            }
            StateField field = site.env().states().get(target);
            if (field == null) {
                report(ConstelaErrors.undefinedState(target, path), target, site.env().states().keySet());
            }
            return field;
        }

        private void checkProps(Map<String, PropValue> props, Site site) {
            props.forEach((key, value) -> {
                Site propSite = site.at(key);
                if (value instanceof EventHandler handler) {
                    checkHandler(handler, propSite);
                } else {
                    check((Expression) value, propSite);
                }
            });
        }

        private void checkHandler(EventHandler handler, Site site) {
            if (!site.env().actions().contains(handler.action())) {
                report(
                        ConstelaErrors.undefinedAction(handler.action(), site.path()),
                        handler.action(),
                        site.env().actions());
            }
            EventPayload payload = handler.payload();
            Site payloadSite = site.at("payload").with(site.env().runtimeBound());
            if (payload instanceof EventPayload.Single single) {
                check(single.expression(), payloadSite);
            } else if (payload instanceof EventPayload.Fields fields) {
                checkValues(fields.fields(), payloadSite);
            }
        }

        private List<String> variantKeys(StylePreset preset) {
            return preset.variants() == null ? List.of() : new ArrayList<>(preset.variants().keySet());
        }

        private String jsonTypeName(JsonNode value) {
            if (value.isTextual()) {
                return "string";
            }
            if (value.isNumber()) {
                return "number";
            }
            if (value.isBoolean()) {
                return "boolean";
            }
            if (value.isArray()) {
                return "array";
            }
            return value.isNull() ? "null" : "object";
        }

        // ── Expressions ──

        private final class ExpressionChecker extends ExpressionWalker<Site> {

            @Override
            protected Site descend(Site site, String... segments) {
                return site.at(segments);
            }

            @Override
            public Void visit(Expression.State expr, Site site) {
                Map<String, StateField> states = site.env().states();
                if (!states.containsKey(expr.name())) {
                    report(ConstelaErrors.undefinedState(expr.name(), site.path()), expr.name(), states.keySet());
                }
                return null;
            }

            @Override
            public Void visit(Expression.Var expr, Site site) {
                Scope vars = site.env().vars();
                if (site.env().checkVars() && !vars.contains(expr.name())) {
                    report(ConstelaErrors.undefinedVar(expr.name(), site.path()), expr.name(), vars.visibleNames());
                }
                return null;
            }

            @Override
            public Void visit(Expression.Param expr, Site site) {
                Map<String, ParamDef> params = site.env().params();
                if (params == null) {
                    if (!layout) {
                        report(ConstelaErrors.undefinedParam(expr.name(), site.path()));
                    }
                } else if (!params.containsKey(expr.name())) {
                    report(ConstelaErrors.undefinedParam(expr.name(), site.path()), expr.name(), params.keySet());
                }
                return null;
            }

            @Override
            public Void visit(Expression.Route expr, Site site) {
                if (program.route() == null) {
                    report(ConstelaErrors.routeNotDefined(site.path()));
                } else if (expr.effectiveSource() == RouteSource.PARAM && !routeParams.contains(expr.name())) {
                    report(ConstelaErrors.undefinedRouteParam(expr.name(), site.path()), expr.name(), routeParams);
                }
                return null;
            }

            @Override
            public Void visit(Expression.Import expr, Site site) {
                Map<String, String> imports = program.imports();
                if (imports == null) {
                    report(ConstelaErrors.importsNotDefined(site.path()));
                } else if (!imports.containsKey(expr.name())) {
                    report(ConstelaErrors.undefinedImport(expr.name(), site.path()), expr.name(), imports.keySet());
                }
                return null;
            }

            @Override
            public Void visit(Expression.Data expr, Site site) {
                Map<String, DataSource> data = program.data();
                if (data == null) {
                    report(ConstelaErrors.dataNotDefined(site.path()));
                } else if (!data.containsKey(expr.name())) {
                    report(ConstelaErrors.undefinedData(expr.name(), site.path()), expr.name(), data.keySet());
                }
                return null;
            }

            @Override
            public Void visit(Expression.Ref expr, Site site) {
                if (!refNames.contains(expr.name())) {
                    report(ConstelaErrors.undefinedRef(expr.name(), site.path()), expr.name(), refNames);
                }
                return null;
            }

            @Override
            public Void visit(Expression.Validity expr, Site site) {
                if (!refNames.contains(expr.ref())) {
                    report(ConstelaErrors.undefinedRef(expr.ref(), append(site.path(), "ref")), expr.ref(), refNames);
                }
                return null;
            }

            @Override
            public Void visit(Expression.Style expr, Site site) {
                StylePreset preset = program.stylesOrEmpty().get(expr.name());
                if (preset == null) {
                    report(
                            ConstelaErrors.undefinedStyle(expr.name(), site.path()),
                            expr.name(),
                            program.stylesOrEmpty().keySet());
                } else if (expr.variants() != null) {
                    for (String key : expr.variants().keySet()) {
                        if (!preset.declaresVariant(key)) {
                            report(
                                    ConstelaErrors.undefinedVariant(
                                            expr.name(), key, append(site.path(), "variants", key)),
                                    key,
                                    variantKeys(preset));
                        }
                    }
                }
                return super.visit(expr, site);
            }

            @Override
            public Void visit(Expression.Lambda expr, Site site) {
                Env inner = site.env().withVars(site.env().vars().push(expr.param(), expr.index()));
                walk(expr.body(), site.at("body").with(inner));
                return null;
            }
        }

        // ── Action steps ──

        private final class StepChecker implements ActionStep.Visitor<Void, Site> {

            private void actionRef(String action, Site site) {
                checkActionName(action, append(site.path(), "action"), site.env().actions());
            }

            @Override
            public Void visit(ActionStep.Set step, Site site) {
                resolveTarget(step.target(), site);
                checkOptional(step.value(), site.at("value"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Update step, Site site) {
                StateField field = resolveTarget(step.target(), site);
                UpdateOperation op = step.operation();
                if (field != null && field.type() != op.targetType()) {
                    report(ConstelaErrors.operationInvalidForType(
                            op.wireName(), field.type().wireName(), append(site.path(), "operation")));
                }
                for (String required : op.requiredFields()) {
                    if (fieldOf(step, required) == null) {
                        report(ConstelaErrors.operationMissingField(op.wireName(), required, site.path()));
                    }
                }
                checkOptional(step.value(), site.at("value"));
                checkOptional(step.index(), site.at("index"));
                checkOptional(step.deleteCount(), site.at("deleteCount"));
                return null;
            }

            private Expression fieldOf(ActionStep.Update step, String field) {
                return switch (field) {
                    case "value" -> step.value();
                    case "index" -> step.index();
                    case "deleteCount" -> step.deleteCount();
                    default -> throw new IllegalStateException("Unknown update field: " + field);
                };
            }

            @Override
            public Void visit(ActionStep.SetPath step, Site site) {
                resolveTarget(step.target(), site);
                checkOptional(step.path(), site.at("path"));
                checkOptional(step.value(), site.at("value"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Fetch step, Site site) {
                checkOptional(step.url(), site.at("url"));
                checkValues(step.headers(), site.at("headers"));
                checkOptional(step.body(), site.at("body"));
                checkSteps(step.onSuccess(), site.at("onSuccess"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Storage step, Site site) {
                checkOptional(step.key(), site.at("key"));
                checkOptional(step.value(), site.at("value"));
                checkSteps(step.onSuccess(), site.at("onSuccess"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Clipboard step, Site site) {
                checkOptional(step.value(), site.at("value"));
                checkSteps(step.onSuccess(), site.at("onSuccess"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Navigate step, Site site) {
                checkOptional(step.url(), site.at("url"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Import step, Site site) {
                checkSteps(step.onSuccess(), site.at("onSuccess"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Call step, Site site) {
                checkOptional(step.target(), site.at("target"));
                checkAll(step.args(), site.at("args"));
                checkSteps(step.onSuccess(), site.at("onSuccess"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Subscribe step, Site site) {
                checkOptional(step.target(), site.at("target"));
                actionRef(step.action(), site);
                return null;
            }

            @Override
            public Void visit(ActionStep.Dispose step, Site site) {
                checkOptional(step.target(), site.at("target"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Dom step, Site site) {
                checkOptional(step.selector(), site.at("selector"));
                checkOptional(step.value(), site.at("value"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Send step, Site site) {
                checkOptional(step.data(), site.at("data"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Close step, Site site) {
                return null;
            }

            @Override
            public Void visit(ActionStep.Delay step, Site site) {
                checkOptional(step.ms(), site.at("ms"));
                checkSteps(step.then(), site.at("then"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Interval step, Site site) {
                checkOptional(step.ms(), site.at("ms"));
                actionRef(step.action(), site);
                return null;
            }

            @Override
            public Void visit(ActionStep.ClearTimer step, Site site) {
                checkOptional(step.target(), site.at("target"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Focus step, Site site) {
                checkOptional(step.target(), site.at("target"));
                checkSteps(step.onSuccess(), site.at("onSuccess"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.If step, Site site) {
                checkOptional(step.condition(), site.at("condition"));
                checkSteps(step.then(), site.at("then"));
                checkSteps(step.otherwise(), site.at("else"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Generate step, Site site) {
                checkOptional(step.prompt(), site.at("prompt"));
                checkSteps(step.onSuccess(), site.at("onSuccess"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.SseConnect step, Site site) {
                checkOptional(step.url(), site.at("url"));
                checkSteps(step.onOpen(), site.at("onOpen"));
                checkSteps(step.onMessage(), site.at("onMessage"));
                checkSteps(step.onError(), site.at("onError"));
                return null;
            }

            @Override
            public Void visit(ActionStep.SseClose step, Site site) {
                return null;
            }

            @Override
            public Void visit(ActionStep.Optimistic step, Site site) {
                resolveTarget(step.target(), site);
                checkOptional(step.path(), site.at("path"));
                checkOptional(step.value(), site.at("value"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Confirm step, Site site) {
                checkOptional(step.id(), site.at("id"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Reject step, Site site) {
                checkOptional(step.id(), site.at("id"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Bind step, Site site) {
                resolveTarget(step.target(), site);
                checkOptional(step.path(), site.at("path"));
                checkOptional(step.transform(), site.at("transform"));
                return null;
            }

            @Override
            public Void visit(ActionStep.Unbind step, Site site) {
                resolveTarget(step.target(), site);
                return null;
            }
        }

        // ── Views ──

        private final class ViewChecker extends ViewWalker<Site> {

            @Override
            protected Site descend(Site site, String... segments) {
                return site.at(segments);
            }

            @Override
            public Void visit(ViewNode.Element node, Site site) {
                checkProps(node.props(), site.at("props"));
                return super.visit(node, site);
            }

            @Override
            public Void visit(ViewNode.Text node, Site site) {
                check(node.value(), site.at("value"));
                return null;
            }

            @Override
            public Void visit(ViewNode.If node, Site site) {
                check(node.condition(), site.at("condition"));
                return super.visit(node, site);
            }

            @Override
            public Void visit(ViewNode.Each node, Site site) {
                check(node.items(), site.at("items"));
                Site inner = site.with(site.env().withVars(site.env().vars().push(node.as(), node.index())));
                checkOptional(node.key(), inner.at("key"));
                walk(node.body(), inner.at("body"));
                return null;
            }

            @Override
            public Void visit(ViewNode.Component node, Site site) {
                ComponentDef def = program.componentsOrEmpty().get(node.name());
                if (def == null) {
                    report(
                            ConstelaErrors.componentNotFound(node.name(), site.path()),
                            node.name(),
                            program.componentsOrEmpty().keySet());
                } else {
                    checkInvocation(node, def, site);
                }
                checkProps(node.props(), site.at("props"));
                return super.visit(node, site);
            }

            private void checkInvocation(ViewNode.Component node, ComponentDef def, Site site) {
                def.params().forEach((name, param) -> {
                    PropValue supplied = node.props().get(name);
                    if (supplied == null) {
                        if (param.required()) {
                            report(ConstelaErrors.componentPropMissing(node.name(), name, site.path()));
                        }
                        return;
                    }
                    if (supplied instanceof Expression.Lit lit
                            && !lit.value().isNull()
                            && !param.type().accepts(lit.value())) {
                        report(ConstelaErrors.componentPropType(
                                node.name(),
                                name,
                                param.type().wireName(),
                                jsonTypeName(lit.value()),
                                append(site.path(), "props", name)));
                    }
                });
            }

            @Override
            public Void visit(ViewNode.Markdown node, Site site) {
                check(node.content(), site.at("content"));
                return null;
            }

            @Override
            public Void visit(ViewNode.Code node, Site site) {
                check(node.language(), site.at("language"));
                check(node.content(), site.at("content"));
                return null;
            }

            @Override
            public Void visit(ViewNode.Island node, Site site) {
                Env outer = site.env();
                Map<String, StateField> states = new LinkedHashMap<>(outer.states());
                states.putAll(node.state());
                Set<String> islandActions = new LinkedHashSet<>();
                collectActionNames(node.actions(), append(site.path(), "actions"), islandActions);
                Set<String> actions = new LinkedHashSet<>(outer.actions());
                actions.addAll(islandActions);
                Env inner = new Env(states, actions, outer.params(), null, outer.vars(), outer.checkVars());
                checkActions(node.actions(), append(site.path(), "actions"), inner.runtimeBound());
                walk(node.content(), site.at("content").with(inner));
                return null;
            }
        }
    }
}
