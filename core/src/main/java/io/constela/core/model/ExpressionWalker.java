package io.constela.core.model;

import java.util.List;
import java.util.Map;

/**
 * Depth-first traversal of an expression tree. By default every composite kind walks its
 * children and every leaf kind does nothing; subclasses override the kinds they check.
 *
 * <p>
 * {@code A} is the traversal context. {@link #descend} derives the context for a child, which
 * lets subclasses track JSON Pointer locations without the walker knowing about them.
 *
 * @param <A> per-node context type
 */
public abstract class ExpressionWalker<A> implements Expression.Visitor<Void, A> {

    /** Returns the context for the child reached through the given field segments. */
    protected abstract A descend(A arg, String... segments);

    public final void walk(Expression expression, A arg) {
        expression.accept(this, arg);
    }

    protected final void walkAll(List<Expression> expressions, A arg) {
        for (int i = 0; i < expressions.size(); i++) {
            walk(expressions.get(i), descend(arg, String.valueOf(i)));
        }
    }

    protected final void walkValues(Map<String, Expression> expressions, A arg) {
        for (Map.Entry<String, Expression> entry : expressions.entrySet()) {
            walk(entry.getValue(), descend(arg, entry.getKey()));
        }
    }

    @Override
    public Void visit(Expression.Lit expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.State expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Var expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Param expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Route expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Import expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Data expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Ref expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Bin expr, A arg) {
        walk(expr.left(), descend(arg, "left"));
        walk(expr.right(), descend(arg, "right"));
        return null;
    }

    @Override
    public Void visit(Expression.Not expr, A arg) {
        walk(expr.operand(), descend(arg, "operand"));
        return null;
    }

    @Override
    public Void visit(Expression.Cond expr, A arg) {
        walk(expr.condition(), descend(arg, "if"));
        walk(expr.then(), descend(arg, "then"));
        walk(expr.otherwise(), descend(arg, "else"));
        return null;
    }

    @Override
    public Void visit(Expression.Get expr, A arg) {
        walk(expr.base(), descend(arg, "base"));
        return null;
    }

    @Override
    public Void visit(Expression.Index expr, A arg) {
        walk(expr.base(), descend(arg, "base"));
        walk(expr.key(), descend(arg, "key"));
        return null;
    }

    @Override
    public Void visit(Expression.Concat expr, A arg) {
        walkAll(expr.items(), descend(arg, "items"));
        return null;
    }

    @Override
    public Void visit(Expression.Array expr, A arg) {
        walkAll(expr.elements(), descend(arg, "elements"));
        return null;
    }

    @Override
    public Void visit(Expression.Style expr, A arg) {
        if (expr.variants() != null) {
            walkValues(expr.variants(), descend(arg, "variants"));
        }
        return null;
    }

    @Override
    public Void visit(Expression.Validity expr, A arg) {
        return null;
    }

    @Override
    public Void visit(Expression.Call expr, A arg) {
        if (expr.target() != null) {
            walk(expr.target(), descend(arg, "target"));
        }
        if (expr.args() != null) {
            walkAll(expr.args(), descend(arg, "args"));
        }
        return null;
    }

    @Override
    public Void visit(Expression.Lambda expr, A arg) {
        walk(expr.body(), descend(arg, "body"));
        return null;
    }
}
