package io.constela.core.transform;

import com.fasterxml.jackson.databind.node.NullNode;
import io.constela.core.model.EventHandler;
import io.constela.core.model.EventPayload;
import io.constela.core.model.Expression;
import io.constela.core.model.ExpressionRewriter;
import io.constela.core.model.PropValue;
import java.util.Map;

/**
 * Replaces {@code param} references with the values bound at a component call site. Bound values
 * are already lowered in the caller's frame, so substitution never recurses into them.
 *
 * <p>
 * A param with a {@code path} extends the bound value: a bound {@code var} or {@code state} gets
 * the joined path, anything else is wrapped in {@code get}. Unbound params (optional and not
 * supplied) and event handlers reached in expression position become {@code lit null}.
 */
final class ParamSubstitution extends ExpressionRewriter<Map<String, PropValue>> {

    static final ParamSubstitution INSTANCE = new ParamSubstitution();

    private static final Expression.Lit UNDEFINED = new Expression.Lit(NullNode.getInstance());

    private ParamSubstitution() {}

    @Override
    public Expression visit(Expression.Param expr, Map<String, PropValue> bindings) {
        PropValue bound = bindings == null ? null : bindings.get(expr.name());
        if (!(bound instanceof Expression)) {
            return UNDEFINED;
        }
        Expression value = (Expression) bound;
        if (expr.path() == null) {
            return value;
        }
        if (value instanceof Expression.Var var) {
            return new Expression.Var(var.name(), joinPath(var.path(), expr.path()));
        }
        if (value instanceof Expression.State state) {
            return new Expression.State(state.name(), joinPath(state.path(), expr.path()));
        }
        return new Expression.Get(value, expr.path());
    }

    /**
     * Resolves a prop value written directly in a view. An unpathed param bound to an event handler
     * forwards the handler itself.
     */
    PropValue substituteProp(PropValue value, Map<String, PropValue> bindings) {
        if (value instanceof EventHandler handler) {
            return substituteHandler(handler, bindings);
        }
        if (value instanceof Expression.Param param && param.path() == null && bindings != null) {
            PropValue bound = bindings.get(param.name());
            if (bound instanceof EventHandler) {
                return bound;
            }
        }
        return rewrite((Expression) value, bindings);
    }

    EventHandler substituteHandler(EventHandler handler, Map<String, PropValue> bindings) {
        if (bindings == null || handler.payload() == null) {
            return handler;
        }
        return new EventHandler(
                handler.event(),
                handler.action(),
                rewritePayload(handler.payload(), bindings),
                handler.debounce(),
                handler.throttle(),
                handler.options());
    }

    private EventPayload rewritePayload(EventPayload payload, Map<String, PropValue> bindings) {
        if (payload instanceof EventPayload.Single single) {
            return new EventPayload.Single(rewrite(single.expression(), bindings));
        }
        return new EventPayload.Fields(rewriteValues(((EventPayload.Fields) payload).fields(), bindings));
    }

    private static String joinPath(String base, String extra) {
        return base == null ? extra : base + "." + extra;
    }
}
