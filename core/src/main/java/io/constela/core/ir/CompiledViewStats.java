package io.constela.core.ir;

/**
 * Counts nodes of a lowered view tree. Used for diagnostics logging and by tests asserting the
 * shape of inlined output.
 *
 * @param nodes       total node count
 * @param localStates number of {@link CompiledNode.LocalState} wrappers
 * @param maxDepth    depth of the deepest node (root is 1)
 */
public record CompiledViewStats(int nodes, int localStates, int maxDepth) {

    public static CompiledViewStats of(CompiledNode root) {
        Counter counter = new Counter();
        root.accept(counter, 1);
        return new CompiledViewStats(counter.nodes, counter.localStates, counter.maxDepth);
    }

    private static final class Counter implements CompiledNode.Visitor<Void, Integer> {
        private int nodes;
        private int localStates;
        private int maxDepth;

        private void enter(int depth) {
            nodes++;
            maxDepth = Math.max(maxDepth, depth);
        }

        private void all(Iterable<CompiledNode> children, int depth) {
            for (CompiledNode child : children) {
                child.accept(this, depth);
            }
        }

        @Override
        public Void visit(CompiledNode.Element node, Integer depth) {
            enter(depth);
            all(node.children(), depth + 1);
            return null;
        }

        @Override
        public Void visit(CompiledNode.Text node, Integer depth) {
            enter(depth);
            return null;
        }

        @Override
        public Void visit(CompiledNode.If node, Integer depth) {
            enter(depth);
            node.then().accept(this, depth + 1);
            if (node.otherwise() != null) {
                node.otherwise().accept(this, depth + 1);
            }
            return null;
        }

        @Override
        public Void visit(CompiledNode.Each node, Integer depth) {
            enter(depth);
            node.body().accept(this, depth + 1);
            return null;
        }

        @Override
        public Void visit(CompiledNode.Markdown node, Integer depth) {
            enter(depth);
            return null;
        }

        @Override
        public Void visit(CompiledNode.Code node, Integer depth) {
            enter(depth);
            return null;
        }

        @Override
        public Void visit(CompiledNode.Portal node, Integer depth) {
            enter(depth);
            all(node.children(), depth + 1);
            return null;
        }

        @Override
        public Void visit(CompiledNode.LocalState node, Integer depth) {
            enter(depth);
            localStates++;
            node.child().accept(this, depth + 1);
            return null;
        }

        @Override
        public Void visit(CompiledNode.Island node, Integer depth) {
            enter(depth);
            node.content().accept(this, depth + 1);
            return null;
        }

        @Override
        public Void visit(CompiledNode.Suspense node, Integer depth) {
            enter(depth);
            node.fallback().accept(this, depth + 1);
            node.content().accept(this, depth + 1);
            return null;
        }

        @Override
        public Void visit(CompiledNode.ErrorBoundary node, Integer depth) {
            enter(depth);
            node.fallback().accept(this, depth + 1);
            node.content().accept(this, depth + 1);
            return null;
        }

        @Override
        public Void visit(CompiledNode.Slot node, Integer depth) {
            enter(depth);
            return null;
        }
    }
}
