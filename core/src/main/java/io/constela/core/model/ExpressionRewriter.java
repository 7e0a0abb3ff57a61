package io.constela.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bottom-up rebuild of an expression tree. By default every node is reproduced with rewritten
 * children and leaves are returned as-is (records are immutable, so sharing is safe). Subclasses
 * override the kinds they replace.
 *
 * @param <A> per-node context type
 */
public abstract class ExpressionRewriter<A> implements Expression.Visitor<Expression, A> {

    public final Expression rewrite(Expression expression, A arg) {
        return expression == null ? null : expression.accept(this, arg);
    }

    public final List<Expression> rewriteAll(List<Expression> expressions, A arg) {
        if (expressions == null) {
            return null;
        }
        List<Expression> result = new ArrayList<>(expressions.size());
        for (Expression e : expressions) {
            result.add(rewrite(e, arg));
        }
        return result;
    }

    public final Map<String, Expression> rewriteValues(Map<String, Expression> expressions, A arg) {
        if (expressions == null) {
            return null;
        }
        Map<String, Expression> result = new LinkedHashMap<>();
        expressions.forEach((k, v) -> result.put(k, rewrite(v, arg)));
        return result;
    }

    @Override
    public Expression visit(Expression.Lit expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.State expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Var expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Param expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Route expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Import expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Data expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Ref expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Bin expr, A arg) {
        return new Expression.Bin(expr.op(), rewrite(expr.left(), arg), rewrite(expr.right(), arg));
    }

    @Override
    public Expression visit(Expression.Not expr, A arg) {
        return new Expression.Not(rewrite(expr.operand(), arg));
    }

    @Override
    public Expression visit(Expression.Cond expr, A arg) {
        return new Expression.Cond(
                rewrite(expr.condition(), arg), rewrite(expr.then(), arg), rewrite(expr.otherwise(), arg));
    }

    @Override
    public Expression visit(Expression.Get expr, A arg) {
        return new Expression.Get(rewrite(expr.base(), arg), expr.path());
    }

    @Override
    public Expression visit(Expression.Index expr, A arg) {
        return new Expression.Index(rewrite(expr.base(), arg), rewrite(expr.key(), arg));
    }

    @Override
    public Expression visit(Expression.Concat expr, A arg) {
        return new Expression.Concat(rewriteAll(expr.items(), arg));
    }

    @Override
    public Expression visit(Expression.Array expr, A arg) {
        return new Expression.Array(rewriteAll(expr.elements(), arg));
    }

    @Override
    public Expression visit(Expression.Style expr, A arg) {
        return new Expression.Style(expr.name(), rewriteValues(expr.variants(), arg));
    }

    @Override
    public Expression visit(Expression.Validity expr, A arg) {
        return expr;
    }

    @Override
    public Expression visit(Expression.Call expr, A arg) {
        return new Expression.Call(rewrite(expr.target(), arg), expr.method(), rewriteAll(expr.args(), arg));
    }

    @Override
    public Expression visit(Expression.Lambda expr, A arg) {
        return new Expression.Lambda(expr.param(), expr.index(), rewrite(expr.body(), arg));
    }
}
