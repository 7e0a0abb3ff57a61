package io.constela.core.analysis;

import io.constela.core.error.JsonPointers;
import io.constela.core.model.ComponentDef;
import io.constela.core.model.ViewNode;
import io.constela.core.model.ViewWalker;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Call graph between component definitions. Finds inclusion cycles and computes, for every
 * component, upper bounds on the depth and on the node count of its fully inlined view.
 *
 * <p>
 * The search uses an explicit stack, so the number of components does not bound the native call
 * stack. Each view is measured once; callees still being explored (only possible on a cycle)
 * count as zero. Sizes saturate instead of overflowing, so a call fan-out that doubles at every
 * level of a long chain still yields a usable bound.
 */
final class ComponentGraph {

    /** One {@code component} node inside {@code from}'s view, located at {@code path}. */
    record Call(String from, String to, String path) {}

    /** An inclusion cycle, e.g. {@code [A, B, A]}, reported at the call that closes it. */
    record Cycle(List<String> components, String path) {}

    private final Map<String, ComponentDef> components;
    private final Map<String, List<Call>> calls = new LinkedHashMap<>();
    private final Map<String, Integer> expandedDepth = new HashMap<>();
    private final Map<String, Integer> expandedSize = new HashMap<>();
    private final Map<String, Integer> slotCounts = new HashMap<>();
    private final List<Cycle> cycles = new ArrayList<>();

    private ComponentGraph(Map<String, ComponentDef> components) {
        this.components = components;
    }

    static ComponentGraph build(Map<String, ComponentDef> components) {
        ComponentGraph graph = new ComponentGraph(components);
        components.forEach((name, def) -> {
            graph.calls.put(name, collectCalls(name, def.view()));
            graph.slotCounts.put(name, countSlots(def.view()));
        });
        graph.explore();
        return graph;
    }

    List<Cycle> cycles() {
        return cycles;
    }

    /** Upper bound on the inlined depth of {@code name}'s view, or 0 for unknown components. */
    int expandedDepth(String name) {
        return expandedDepth.getOrDefault(name, 0);
    }

    /** Upper bound on the inlined depth of an arbitrary view that may call the components. */
    int measure(ViewNode view) {
        return view.accept(new DepthMeasure(), null);
    }

    /** Upper bound on the inlined node count of {@code name}'s view, or 0 for unknown components. */
    int expandedSize(String name) {
        return expandedSize.getOrDefault(name, 0);
    }

    /** Upper bound on the inlined node count of an arbitrary view that may call the components. */
    int measureSize(ViewNode view) {
        return view.accept(new SizeMeasure(), null);
    }

    private void explore() {
        Set<String> visited = new HashSet<>();
        Set<String> seenCycles = new HashSet<>();
        for (String root : components.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            LinkedHashSet<String> onStack = new LinkedHashSet<>();
            visited.add(root);
            onStack.add(root);
            stack.push(new Frame(root, calls.get(root).iterator()));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.pending.hasNext()) {
                    Call call = frame.pending.next();
                    if (!components.containsKey(call.to())) {
                        continue;
                    }
                    if (onStack.contains(call.to())) {
                        recordCycle(onStack, call, seenCycles);
                    } else if (visited.add(call.to())) {
                        onStack.add(call.to());
                        stack.push(new Frame(call.to(), calls.get(call.to()).iterator()));
                    }
                } else {
                    stack.pop();
                    onStack.remove(frame.name);
                    ViewNode view = components.get(frame.name).view();
                    expandedDepth.put(frame.name, measure(view));
                    expandedSize.put(frame.name, measureSize(view));
                }
            }
        }
    }

    private void recordCycle(LinkedHashSet<String> onStack, Call closing, Set<String> seenCycles) {
        List<String> members = new ArrayList<>();
        boolean inCycle = false;
        for (String name : onStack) {
            inCycle = inCycle || name.equals(closing.to());
            if (inCycle) {
                members.add(name);
            }
        }
        if (!seenCycles.add(String.join(",", new TreeSet<>(members)))) {
            return;
        }
        members.add(closing.to());
        cycles.add(new Cycle(List.copyOf(members), closing.path()));
    }

    private static final class Frame {
        private final String name;
        private final Iterator<Call> pending;

        private Frame(String name, Iterator<Call> pending) {
            this.name = name;
            this.pending = pending;
        }
    }

    private static List<Call> collectCalls(String owner, ViewNode view) {
        List<Call> result = new ArrayList<>();
        new ViewWalker<String>() {
            @Override
            protected String descend(String path, String... segments) {
                return JsonPointers.append(path, segments);
            }

            @Override
            public Void visit(ViewNode.Component node, String path) {
                result.add(new Call(owner, node.name(), path));
                return super.visit(node, path);
            }
        }.walk(view, JsonPointers.append("/components", owner, "view"));
        return result;
    }

    private static int countSlots(ViewNode view) {
        int[] count = {0};
        new ViewWalker<Void>() {
            @Override
            protected Void descend(Void arg, String... segments) {
                return null;
            }

            @Override
            public Void visit(ViewNode.Slot node, Void arg) {
                count[0]++;
                return null;
            }
        }.walk(view, null);
        return count[0];
    }

    private static final int SATURATED = Integer.MAX_VALUE / 2;

    private static int add(int a, int b) {
        long sum = (long) a + b;
        return sum > SATURATED ? SATURATED : (int) sum;
    }

    private static int multiply(int a, int b) {
        long product = (long) a * b;
        return product > SATURATED ? SATURATED : (int) product;
    }

    /** Depth in output levels; component calls and local-state wrappers count as one level each. */
    private final class DepthMeasure implements ViewNode.Visitor<Integer, Void> {

        private int deepest(List<ViewNode> nodes) {
            int max = 0;
            for (ViewNode node : nodes) {
                max = Math.max(max, node.accept(this, null));
            }
            return max;
        }

        @Override
        public Integer visit(ViewNode.Element node, Void arg) {
            return add(1, deepest(node.children()));
        }

        @Override
        public Integer visit(ViewNode.Text node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.If node, Void arg) {
            int otherwise = node.otherwise() == null ? 0 : node.otherwise().accept(this, null);
            return add(1, Math.max(node.then().accept(this, null), otherwise));
        }

        @Override
        public Integer visit(ViewNode.Each node, Void arg) {
            return add(1, node.body().accept(this, null));
        }

        @Override
        public Integer visit(ViewNode.Component node, Void arg) {
            ComponentDef def = components.get(node.name());
            int callee = def == null ? 0 : add(expandedDepth(node.name()), def.hasLocalScope() ? 1 : 0);
            return add(add(1, callee), deepest(node.children()));
        }

        @Override
        public Integer visit(ViewNode.Slot node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.Markdown node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.Code node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.Portal node, Void arg) {
            return add(1, deepest(node.children()));
        }

        @Override
        public Integer visit(ViewNode.Island node, Void arg) {
            return add(1, node.content().accept(this, null));
        }

        @Override
        public Integer visit(ViewNode.Suspense node, Void arg) {
            return add(1, Math.max(node.fallback().accept(this, null), node.content().accept(this, null)));
        }

        @Override
        public Integer visit(ViewNode.ErrorBoundary node, Void arg) {
            return add(1, Math.max(node.fallback().accept(this, null), node.content().accept(this, null)));
        }
    }

    /**
     * Node count of the output. Caller children are copied into every slot of the callee, so they
     * count once per slot.
     */
    private final class SizeMeasure implements ViewNode.Visitor<Integer, Void> {

        private int total(List<ViewNode> nodes) {
            int sum = 0;
            for (ViewNode node : nodes) {
                sum = add(sum, node.accept(this, null));
            }
            return sum;
        }

        @Override
        public Integer visit(ViewNode.Element node, Void arg) {
            return add(1, total(node.children()));
        }

        @Override
        public Integer visit(ViewNode.Text node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.If node, Void arg) {
            int otherwise = node.otherwise() == null ? 0 : node.otherwise().accept(this, null);
            return add(1, add(node.then().accept(this, null), otherwise));
        }

        @Override
        public Integer visit(ViewNode.Each node, Void arg) {
            return add(1, node.body().accept(this, null));
        }

        @Override
        public Integer visit(ViewNode.Component node, Void arg) {
            ComponentDef def = components.get(node.name());
            if (def == null) {
                return add(1, total(node.children()));
            }
            int callee = add(expandedSize(node.name()), def.hasLocalScope() ? 1 : 0);
            int slots = Math.max(1, slotCounts.getOrDefault(node.name(), 0));
            return add(add(1, callee), multiply(total(node.children()), slots));
        }

        @Override
        public Integer visit(ViewNode.Slot node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.Markdown node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.Code node, Void arg) {
            return 1;
        }

        @Override
        public Integer visit(ViewNode.Portal node, Void arg) {
            return add(1, total(node.children()));
        }

        @Override
        public Integer visit(ViewNode.Island node, Void arg) {
            return add(1, node.content().accept(this, null));
        }

        @Override
        public Integer visit(ViewNode.Suspense node, Void arg) {
            return add(1, add(node.fallback().accept(this, null), node.content().accept(this, null)));
        }

        @Override
        public Integer visit(ViewNode.ErrorBoundary node, Void arg) {
            return add(1, add(node.fallback().accept(this, null), node.content().accept(this, null)));
        }
    }
}
