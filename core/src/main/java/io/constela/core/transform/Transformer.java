package io.constela.core.transform;

import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.analysis.AnalysisContext;
import io.constela.core.error.InternalCompilerException;
import io.constela.core.ir.CompiledAction;
import io.constela.core.ir.CompiledNode;
import io.constela.core.ir.CompiledProgram;
import io.constela.core.ir.CompiledRoute;
import io.constela.core.model.ActionDef;
import io.constela.core.model.ActionStep;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.Expression;
import io.constela.core.model.Program;
import io.constela.core.model.PropValue;
import io.constela.core.model.RouteDef;
import io.constela.core.model.ViewNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Third compiler pass: lowers an analyzed {@link Program} into a {@link CompiledProgram}.
 *
 * <p>
 * Every component invocation is replaced by a copy of the component's view with params
 * substituted and slots filled with the caller's children. Props and children are lowered in the
 * caller's frame before binding, so a component never sees its caller's params. Instances of
 * components that declare local state or local actions are wrapped in their own
 * {@link CompiledNode.LocalState} node; two instances never share one.
 *
 * <p>
 * {@link #lowerLayout} lowers a layout the same way except that its own slots and top-level
 * {@code param} expressions survive, to be resolved later by {@link LayoutComposer}.
 *
 * <p>
 * The pass assumes its input was accepted by the analyzer and never reports user errors. Meeting
 * an unknown component or a tree deeper than {@code maxExpandedDepth} throws
 * {@link InternalCompilerException}.
 *
 * <p>
 * Thread-safe: each call works on its own lowering state.
 */
public final class Transformer {

    private static final Logger LOG = LoggerFactory.getLogger(Transformer.class);

    private final int maxExpandedDepth;

    public Transformer(int maxExpandedDepth) {
        if (maxExpandedDepth <= 0) {
            throw new IllegalArgumentException("maxExpandedDepth must be positive, got: " + maxExpandedDepth);
        }
        this.maxExpandedDepth = maxExpandedDepth;
    }

    /**
     * Lowered program plus the number of component instances that were inlined.
     *
     * @param program           the lowered program
     * @param inlinedComponents component invocations replaced by their definitions
     */
    public record Lowering(CompiledProgram program, int inlinedComponents) {
        public Lowering {
            Objects.requireNonNull(program, "program must not be null");
        }
    }

    public CompiledProgram transform(Program program, AnalysisContext context) {
        return lower(program, context).program();
    }

    public Lowering lower(Program program, AnalysisContext context) {
        return lower(program, context, false);
    }

    /** Lowers a layout program, keeping its slots and its top-level params in place. */
    public Lowering lowerLayout(Program layout, AnalysisContext context) {
        return lower(layout, context, true);
    }

    private Lowering lower(Program program, AnalysisContext context, boolean layout) {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Run run = new Run(context.componentRegistry(), layout);
        CompiledNode view = run.lowerView(program.view(), Frame.ROOT);
        CompiledProgram compiled = new CompiledProgram(
                program.version(),
                lowerRoute(program.route(), context),
                program.lifecycle(),
                program.state(),
                indexActions(program.actions(), null),
                view,
                program.styles(),
                program.imports(),
                program.data(),
                program.widgets());
        LOG.debug("Lowered view with {} inlined component instance(s)", run.inlined);
        return new Lowering(compiled, run.inlined);
    }

    private static CompiledRoute lowerRoute(RouteDef route, AnalysisContext context) {
        if (route == null) {
            return null;
        }
        return new CompiledRoute(
                route.path(),
                context.routeParams(),
                route.title(),
                route.layout(),
                route.layoutParams(),
                route.meta(),
                route.canonical(),
                route.jsonLd(),
                route.getStaticPaths());
    }

    /** Keys actions by name, rewriting step expressions when a rewriter is given. */
    private static Map<String, CompiledAction> indexActions(List<ActionDef> actions, StepRewriter rewriter) {
        Map<String, CompiledAction> result = new LinkedHashMap<>();
        for (ActionDef action : actions) {
            List<ActionStep> steps =
                    rewriter == null ? action.steps() : rewriter.rewriteAll(action.steps());
            result.put(action.name(), new CompiledAction(action.name(), steps));
        }
        return result;
    }

    /**
     * Lowering frame of one component instance.
     *
     * @param bindings lowered props of the instance, or {@code null} outside any component
     * @param slotted  lowered caller children filling the instance's slots
     * @param depth    recursion depth of the lowering
     */
    private record Frame(Map<String, PropValue> bindings, List<CompiledNode> slotted, int depth) {
        static final Frame ROOT = new Frame(null, List.of(), 0);

        Frame deeper() {
            return new Frame(bindings, slotted, depth + 1);
        }
    }

    private final class Run implements ViewNode.Visitor<CompiledNode, Frame> {
        private final Map<String, ComponentDef> components;
        private final boolean layout;
        private int inlined;

        Run(Map<String, ComponentDef> components, boolean layout) {
            this.components = components;
            this.layout = layout;
        }

        /** A slot of the layout itself rather than of a component being inlined. */
        private boolean isLayoutSlot(Frame frame) {
            return layout && frame.bindings() == null;
        }

        CompiledNode lowerView(ViewNode node, Frame frame) {
            Frame next = frame.deeper();
            if (next.depth() > maxExpandedDepth) {
                LOG.debug("Lowering depth guard tripped at {}", next.depth());
                throw new InternalCompilerException(
                        "Inlined view exceeds maximum depth of " + maxExpandedDepth + " after analysis");
            }
            return node.accept(this, next);
        }

        private CompiledNode lowerOptional(ViewNode node, Frame frame) {
            return node == null ? null : lowerView(node, frame);
        }

        private Expression expr(Expression expression, Frame frame) {
            return frame.bindings() == null
                    ? expression
                    : ParamSubstitution.INSTANCE.rewrite(expression, frame.bindings());
        }

        private Map<String, PropValue> props(Map<String, PropValue> props, Frame frame) {
            if (frame.bindings() == null) {
                return props;
            }
            Map<String, PropValue> result = new LinkedHashMap<>();
            props.forEach((name, value) ->
                    result.put(name, ParamSubstitution.INSTANCE.substituteProp(value, frame.bindings())));
            return result;
        }

        /** Lowers a children list; a direct slot child is replaced by all slotted nodes. */
        private List<CompiledNode> children(List<ViewNode> children, Frame frame) {
            List<CompiledNode> result = new ArrayList<>(children.size());
            for (ViewNode child : children) {
                if (child instanceof ViewNode.Slot && !isLayoutSlot(frame)) {
                    result.addAll(frame.slotted());
                } else {
                    result.add(lowerView(child, frame));
                }
            }
            return result;
        }

        private StepRewriter stepRewriter(Frame frame) {
            return new StepRewriter(e -> expr(e, frame));
        }

        @Override
        public CompiledNode visit(ViewNode.Element node, Frame frame) {
            return new CompiledNode.Element(
                    node.tag(), node.ref(), props(node.props(), frame), children(node.children(), frame));
        }

        @Override
        public CompiledNode visit(ViewNode.Text node, Frame frame) {
            return new CompiledNode.Text(expr(node.value(), frame));
        }

        @Override
        public CompiledNode visit(ViewNode.If node, Frame frame) {
            return new CompiledNode.If(
                    expr(node.condition(), frame),
                    lowerView(node.then(), frame),
                    lowerOptional(node.otherwise(), frame),
                    node.transition());
        }

        @Override
        public CompiledNode visit(ViewNode.Each node, Frame frame) {
            return new CompiledNode.Each(
                    expr(node.items(), frame),
                    node.as(),
                    node.index(),
                    node.key() == null ? null : expr(node.key(), frame),
                    lowerView(node.body(), frame),
                    node.transition());
        }

        @Override
        public CompiledNode visit(ViewNode.Component node, Frame frame) {
            ComponentDef def = components.get(node.name());
            if (def == null) {
                throw new InternalCompilerException("Component '" + node.name() + "' reached lowering unresolved");
            }
            Map<String, PropValue> bindings = props(node.props(), frame);
            List<CompiledNode> slotted = List.copyOf(children(node.children(), frame));
            Frame instance = new Frame(bindings, slotted, frame.depth());
            inlined++;
            LOG.debug("Inlining component '{}' at depth {}", node.name(), frame.depth());

            CompiledNode body = lowerView(def.view(), instance);
            if (!def.hasLocalScope()) {
                return body;
            }
            return new CompiledNode.LocalState(
                    def.localState(), indexActions(def.localActions(), stepRewriter(instance)), body);
        }

        @Override
        public CompiledNode visit(ViewNode.Slot node, Frame frame) {
            if (isLayoutSlot(frame)) {
                return new CompiledNode.Slot(node.name());
            }
            List<CompiledNode> slotted = frame.slotted();
            if (slotted.size() == 1) {
                return slotted.get(0);
            }
            if (slotted.isEmpty()) {
                return new CompiledNode.Text(new Expression.Lit(TextNode.valueOf("")));
            }
            return new CompiledNode.Element("span", null, Map.of(), slotted);
        }

        @Override
        public CompiledNode visit(ViewNode.Markdown node, Frame frame) {
            return new CompiledNode.Markdown(expr(node.content(), frame));
        }

        @Override
        public CompiledNode visit(ViewNode.Code node, Frame frame) {
            return new CompiledNode.Code(expr(node.language(), frame), expr(node.content(), frame));
        }

        @Override
        public CompiledNode visit(ViewNode.Portal node, Frame frame) {
            return new CompiledNode.Portal(node.target(), children(node.children(), frame));
        }

        @Override
        public CompiledNode visit(ViewNode.Island node, Frame frame) {
            return new CompiledNode.Island(
                    node.id(),
                    node.strategy(),
                    node.strategyOptions(),
                    lowerView(node.content(), frame),
                    node.state(),
                    indexActions(node.actions(), frame.bindings() == null ? null : stepRewriter(frame)));
        }

        @Override
        public CompiledNode visit(ViewNode.Suspense node, Frame frame) {
            return new CompiledNode.Suspense(
                    node.id(), lowerView(node.fallback(), frame), lowerView(node.content(), frame));
        }

        @Override
        public CompiledNode visit(ViewNode.ErrorBoundary node, Frame frame) {
            return new CompiledNode.ErrorBoundary(lowerView(node.fallback(), frame), lowerView(node.content(), frame));
        }
    }
}
