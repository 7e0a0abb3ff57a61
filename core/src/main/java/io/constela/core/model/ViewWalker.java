package io.constela.core.model;

import java.util.List;

/**
 * Depth-first traversal over view nodes only (expressions are not visited). Composite kinds walk
 * their child views by default; subclasses override the kinds they care about and call the super
 * method to keep descending.
 *
 * @param <A> per-node context type
 */
public abstract class ViewWalker<A> implements ViewNode.Visitor<Void, A> {

    protected abstract A descend(A arg, String... segments);

    public final void walk(ViewNode node, A arg) {
        node.accept(this, arg);
    }

    protected final void walkAll(List<ViewNode> nodes, A arg) {
        for (int i = 0; i < nodes.size(); i++) {
            walk(nodes.get(i), descend(arg, String.valueOf(i)));
        }
    }

    @Override
    public Void visit(ViewNode.Element node, A arg) {
        walkAll(node.children(), descend(arg, "children"));
        return null;
    }

    @Override
    public Void visit(ViewNode.Text node, A arg) {
        return null;
    }

    @Override
    public Void visit(ViewNode.If node, A arg) {
        walk(node.then(), descend(arg, "then"));
        if (node.otherwise() != null) {
            walk(node.otherwise(), descend(arg, "else"));
        }
        return null;
    }

    @Override
    public Void visit(ViewNode.Each node, A arg) {
        walk(node.body(), descend(arg, "body"));
        return null;
    }

    @Override
    public Void visit(ViewNode.Component node, A arg) {
        walkAll(node.children(), descend(arg, "children"));
        return null;
    }

    @Override
    public Void visit(ViewNode.Slot node, A arg) {
        return null;
    }

    @Override
    public Void visit(ViewNode.Markdown node, A arg) {
        return null;
    }

    @Override
    public Void visit(ViewNode.Code node, A arg) {
        return null;
    }

    @Override
    public Void visit(ViewNode.Portal node, A arg) {
        walkAll(node.children(), descend(arg, "children"));
        return null;
    }

    @Override
    public Void visit(ViewNode.Island node, A arg) {
        walk(node.content(), descend(arg, "content"));
        return null;
    }

    @Override
    public Void visit(ViewNode.Suspense node, A arg) {
        walk(node.fallback(), descend(arg, "fallback"));
        walk(node.content(), descend(arg, "content"));
        return null;
    }

    @Override
    public Void visit(ViewNode.ErrorBoundary node, A arg) {
        walk(node.fallback(), descend(arg, "fallback"));
        walk(node.content(), descend(arg, "content"));
        return null;
    }
}
