package io.constela.core.transform;

import com.fasterxml.jackson.databind.node.TextNode;
import io.constela.core.ir.CompiledAction;
import io.constela.core.ir.CompiledNode;
import io.constela.core.ir.CompiledProgram;
import io.constela.core.model.Expression;
import io.constela.core.model.PropValue;
import io.constela.core.model.StateField;
import io.constela.core.model.WidgetRef;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes a lowered layout (see {@link Transformer#lowerLayout}) with a lowered page.
 *
 * <p>
 * Layout params left in the layout are resolved against the supplied expressions with the same
 * rules as component params: an unsupplied param becomes {@code lit null} and a pathed param
 * extends the bound value. The default slot receives the page view and a named slot receives the
 * content supplied under its name. A named slot without content is dropped from its children list,
 * or becomes empty text where it stands alone. Named slots inside the page view (a page that is
 * itself a lowered layout) are filled from the same content, while its default slot and unfilled
 * named slots stay open for the next composition.
 *
 * <p>
 * State and actions are merged with the page first. A layout entry whose name the page already
 * uses is kept under {@code $layout.<name>}. Route and lifecycle come from the page; styles,
 * imports and data sources are merged with the page winning on conflicts.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class LayoutComposer {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutComposer.class);

    /** Prefix given to layout state fields and actions that collide with page names. */
    public static final String LAYOUT_PREFIX = "$layout.";

    private LayoutComposer() {}

    /** Composes with the page's own {@code route.layoutParams} and no named slot content. */
    public static CompiledProgram compose(CompiledProgram layout, CompiledProgram page) {
        return compose(layout, page, null, null);
    }

    /**
     * @param layoutParams expressions bound to the layout's params, or {@code null} to use the
     *                     page's {@code route.layoutParams}
     * @param namedSlots   content for named slots, or {@code null}
     */
    public static CompiledProgram compose(
            CompiledProgram layout,
            CompiledProgram page,
            Map<String, Expression> layoutParams,
            Map<String, CompiledNode> namedSlots) {
        Objects.requireNonNull(layout, "layout must not be null");
        Objects.requireNonNull(page, "page must not be null");
        Map<String, PropValue> bindings = new LinkedHashMap<>();
        Map<String, Expression> params = layoutParams != null ? layoutParams : routeLayoutParams(page);
        if (params != null) {
            bindings.putAll(params);
        }
        Map<String, CompiledNode> named = namedSlots == null ? Map.of() : namedSlots;

        CompiledNode pageView = page.view().accept(new Filler(null, named, null), null);
        Filler layoutFiller = new Filler(bindings, named, pageView);
        CompiledNode view = layout.view().accept(layoutFiller, null);

        Map<String, StateField> state = new LinkedHashMap<>(page.state());
        layout.state().forEach((name, field) -> state.put(free(name, page.state()), field));

        StepRewriter steps = layoutFiller.steps();
        Map<String, CompiledAction> actions = new LinkedHashMap<>(page.actions());
        layout.actions().forEach((name, action) -> {
            String key = free(name, page.actions());
            actions.put(key, new CompiledAction(key, steps.rewriteAll(action.steps())));
        });
        LOG.debug(
                "Composed layout: {} slot(s) filled, {} state field(s), {} action(s)",
                layoutFiller.filled,
                state.size(),
                actions.size());

        return new CompiledProgram(
                page.version(),
                page.route(),
                page.lifecycle(),
                state,
                actions,
                view,
                merge(layout.styles(), page.styles()),
                merge(layout.imports(), page.imports()),
                merge(layout.data(), page.data()),
                widgets(layout.widgets(), page.widgets()));
    }

    private static Map<String, Expression> routeLayoutParams(CompiledProgram page) {
        return page.route() == null ? null : page.route().layoutParams();
    }

    private static String free(String name, Map<String, ?> taken) {
        return taken.containsKey(name) ? LAYOUT_PREFIX + name : name;
    }

    private static <V> Map<String, V> merge(Map<String, V> layout, Map<String, V> page) {
        if (layout == null) {
            return page;
        }
        Map<String, V> result = new LinkedHashMap<>(layout);
        if (page != null) {
            result.putAll(page);
        }
        return result;
    }

    private static List<WidgetRef> widgets(List<WidgetRef> layout, List<WidgetRef> page) {
        if (layout == null) {
            return page;
        }
        List<WidgetRef> result = new ArrayList<>(page == null ? List.of() : page);
        result.addAll(layout);
        return result;
    }

    /**
     * Rebuilds a tree with slots filled.
     *
     * <p>
     * {@code bindings} is {@code null} when the tree's params must stay untouched, and
     * {@code defaultContent} is {@code null} when unnamed slots must stay open.
     */
    private static final class Filler implements CompiledNode.Visitor<CompiledNode, Void> {
        private static final CompiledNode EMPTY = new CompiledNode.Text(new Expression.Lit(TextNode.valueOf("")));

        private final Map<String, PropValue> bindings;
        private final Map<String, CompiledNode> named;
        private final CompiledNode defaultContent;
        private int filled;

        Filler(Map<String, PropValue> bindings, Map<String, CompiledNode> named, CompiledNode defaultContent) {
            this.bindings = bindings;
            this.named = named;
            this.defaultContent = defaultContent;
        }

        StepRewriter steps() {
            return new StepRewriter(this::expr);
        }

        private Expression expr(Expression expression) {
            return bindings == null || expression == null
                    ? expression
                    : ParamSubstitution.INSTANCE.rewrite(expression, bindings);
        }

        private Map<String, PropValue> props(Map<String, PropValue> props) {
            if (bindings == null) {
                return props;
            }
            Map<String, PropValue> result = new LinkedHashMap<>();
            props.forEach((name, value) ->
                    result.put(name, ParamSubstitution.INSTANCE.substituteProp(value, bindings)));
            return result;
        }

        private List<CompiledNode> all(List<CompiledNode> nodes) {
            List<CompiledNode> result = new ArrayList<>(nodes.size());
            for (CompiledNode node : nodes) {
                if (!(node instanceof CompiledNode.Slot slot && isUnfilled(slot))) {
                    result.add(node.accept(this, null));
                }
            }
            return result;
        }

        /** A named slot of the layout being composed that has no content. */
        private boolean isUnfilled(CompiledNode.Slot slot) {
            return defaultContent != null && slot.name() != null && !named.containsKey(slot.name());
        }

        private CompiledNode optional(CompiledNode node) {
            return node == null ? null : node.accept(this, null);
        }

        private Map<String, CompiledAction> actions(Map<String, CompiledAction> actions) {
            if (bindings == null) {
                return actions;
            }
            StepRewriter rewriter = steps();
            Map<String, CompiledAction> result = new LinkedHashMap<>();
            actions.forEach((name, action) ->
                    result.put(name, new CompiledAction(name, rewriter.rewriteAll(action.steps()))));
            return result;
        }

        @Override
        public CompiledNode visit(CompiledNode.Slot node, Void arg) {
            if (isUnfilled(node)) {
                return EMPTY;
            }
            CompiledNode content = node.name() == null ? defaultContent : named.get(node.name());
            if (content == null) {
                return node;
            }
            filled++;
            return content;
        }

        @Override
        public CompiledNode visit(CompiledNode.Element node, Void arg) {
            return new CompiledNode.Element(node.tag(), node.ref(), props(node.props()), all(node.children()));
        }

        @Override
        public CompiledNode visit(CompiledNode.Text node, Void arg) {
            return new CompiledNode.Text(expr(node.value()));
        }

        @Override
        public CompiledNode visit(CompiledNode.If node, Void arg) {
            return new CompiledNode.If(
                    expr(node.condition()),
                    node.then().accept(this, null),
                    optional(node.otherwise()),
                    node.transition());
        }

        @Override
        public CompiledNode visit(CompiledNode.Each node, Void arg) {
            return new CompiledNode.Each(
                    expr(node.items()),
                    node.as(),
                    node.index(),
                    expr(node.key()),
                    node.body().accept(this, null),
                    node.transition());
        }

        @Override
        public CompiledNode visit(CompiledNode.Markdown node, Void arg) {
            return new CompiledNode.Markdown(expr(node.content()));
        }

        @Override
        public CompiledNode visit(CompiledNode.Code node, Void arg) {
            return new CompiledNode.Code(expr(node.language()), expr(node.content()));
        }

        @Override
        public CompiledNode visit(CompiledNode.Portal node, Void arg) {
            return new CompiledNode.Portal(node.target(), all(node.children()));
        }

        @Override
        public CompiledNode visit(CompiledNode.LocalState node, Void arg) {
            return new CompiledNode.LocalState(
                    node.state(), actions(node.actions()), node.child().accept(this, null));
        }

        @Override
        public CompiledNode visit(CompiledNode.Island node, Void arg) {
            return new CompiledNode.Island(
                    node.id(),
                    node.strategy(),
                    node.strategyOptions(),
                    node.content().accept(this, null),
                    node.state(),
                    actions(node.actions()));
        }

        @Override
        public CompiledNode visit(CompiledNode.Suspense node, Void arg) {
            return new CompiledNode.Suspense(
                    node.id(), node.fallback().accept(this, null), node.content().accept(this, null));
        }

        @Override
        public CompiledNode visit(CompiledNode.ErrorBoundary node, Void arg) {
            return new CompiledNode.ErrorBoundary(
                    node.fallback().accept(this, null), node.content().accept(this, null));
        }
    }
}
