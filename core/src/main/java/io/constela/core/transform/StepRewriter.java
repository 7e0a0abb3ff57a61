package io.constela.core.transform;

import io.constela.core.model.ActionStep;
import io.constela.core.model.Expression;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Rebuilds action steps with every embedded expression passed through a rewrite function. Nested
 * step lists ({@code onSuccess}, {@code then}, ...) are rewritten recursively. Null optional fields
 * stay null.
 */
final class StepRewriter implements ActionStep.Visitor<ActionStep, Void> {

    private final UnaryOperator<Expression> expressions;

    StepRewriter(UnaryOperator<Expression> expressions) {
        this.expressions = expressions;
    }

    List<ActionStep> rewriteAll(List<ActionStep> steps) {
        if (steps == null) {
            return null;
        }
        List<ActionStep> result = new ArrayList<>(steps.size());
        for (ActionStep step : steps) {
            result.add(step.accept(this, null));
        }
        return result;
    }

    private Expression e(Expression expression) {
        return expression == null ? null : expressions.apply(expression);
    }

    private List<Expression> all(List<Expression> list) {
        if (list == null) {
            return null;
        }
        List<Expression> result = new ArrayList<>(list.size());
        list.forEach(item -> result.add(e(item)));
        return result;
    }

    private Map<String, Expression> values(Map<String, Expression> map) {
        if (map == null) {
            return null;
        }
        Map<String, Expression> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(k, e(v)));
        return result;
    }

    @Override
    public ActionStep visit(ActionStep.Set s, Void arg) {
        return new ActionStep.Set(s.target(), e(s.value()));
    }

    @Override
    public ActionStep visit(ActionStep.Update s, Void arg) {
        return new ActionStep.Update(s.target(), s.operation(), e(s.value()), e(s.index()), e(s.deleteCount()));
    }

    @Override
    public ActionStep visit(ActionStep.SetPath s, Void arg) {
        return new ActionStep.SetPath(s.target(), e(s.path()), e(s.value()));
    }

    @Override
    public ActionStep visit(ActionStep.Fetch s, Void arg) {
        return new ActionStep.Fetch(
                e(s.url()),
                s.method(),
                values(s.headers()),
                e(s.body()),
                s.result(),
                rewriteAll(s.onSuccess()),
                rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.Storage s, Void arg) {
        return new ActionStep.Storage(
                s.operation(),
                e(s.key()),
                e(s.value()),
                s.storage(),
                s.result(),
                rewriteAll(s.onSuccess()),
                rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.Clipboard s, Void arg) {
        return new ActionStep.Clipboard(
                s.operation(), e(s.value()), s.result(), rewriteAll(s.onSuccess()), rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.Navigate s, Void arg) {
        return new ActionStep.Navigate(e(s.url()), s.target(), s.replace());
    }

    @Override
    public ActionStep visit(ActionStep.Import s, Void arg) {
        return new ActionStep.Import(s.module(), s.result(), rewriteAll(s.onSuccess()), rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.Call s, Void arg) {
        return new ActionStep.Call(
                e(s.target()), all(s.args()), s.result(), rewriteAll(s.onSuccess()), rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.Subscribe s, Void arg) {
        return new ActionStep.Subscribe(e(s.target()), s.event(), s.action());
    }

    @Override
    public ActionStep visit(ActionStep.Dispose s, Void arg) {
        return new ActionStep.Dispose(e(s.target()));
    }

    @Override
    public ActionStep visit(ActionStep.Dom s, Void arg) {
        return new ActionStep.Dom(s.operation(), e(s.selector()), e(s.value()), s.attribute());
    }

    @Override
    public ActionStep visit(ActionStep.Send s, Void arg) {
        return new ActionStep.Send(s.connection(), e(s.data()));
    }

    @Override
    public ActionStep visit(ActionStep.Close s, Void arg) {
        return s;
    }

    @Override
    public ActionStep visit(ActionStep.Delay s, Void arg) {
        return new ActionStep.Delay(e(s.ms()), rewriteAll(s.then()), s.result());
    }

    @Override
    public ActionStep visit(ActionStep.Interval s, Void arg) {
        return new ActionStep.Interval(e(s.ms()), s.action(), s.result());
    }

    @Override
    public ActionStep visit(ActionStep.ClearTimer s, Void arg) {
        return new ActionStep.ClearTimer(e(s.target()));
    }

    @Override
    public ActionStep visit(ActionStep.Focus s, Void arg) {
        return new ActionStep.Focus(e(s.target()), s.operation(), rewriteAll(s.onSuccess()), rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.If s, Void arg) {
        return new ActionStep.If(e(s.condition()), rewriteAll(s.then()), rewriteAll(s.otherwise()));
    }

    @Override
    public ActionStep visit(ActionStep.Generate s, Void arg) {
        return new ActionStep.Generate(
                s.provider(),
                e(s.prompt()),
                s.output(),
                s.result(),
                s.model(),
                rewriteAll(s.onSuccess()),
                rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.SseConnect s, Void arg) {
        return new ActionStep.SseConnect(
                s.connection(),
                e(s.url()),
                s.eventTypes(),
                s.reconnect(),
                rewriteAll(s.onOpen()),
                rewriteAll(s.onMessage()),
                rewriteAll(s.onError()));
    }

    @Override
    public ActionStep visit(ActionStep.SseClose s, Void arg) {
        return s;
    }

    @Override
    public ActionStep visit(ActionStep.Optimistic s, Void arg) {
        return new ActionStep.Optimistic(s.target(), e(s.path()), e(s.value()), s.result(), s.timeout());
    }

    @Override
    public ActionStep visit(ActionStep.Confirm s, Void arg) {
        return new ActionStep.Confirm(e(s.id()));
    }

    @Override
    public ActionStep visit(ActionStep.Reject s, Void arg) {
        return new ActionStep.Reject(e(s.id()));
    }

    @Override
    public ActionStep visit(ActionStep.Bind s, Void arg) {
        return new ActionStep.Bind(
                s.connection(), s.eventType(), s.target(), e(s.path()), e(s.transform()), s.patch());
    }

    @Override
    public ActionStep visit(ActionStep.Unbind s, Void arg) {
        return s;
    }
}
