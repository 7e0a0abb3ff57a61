package io.constela.core.analysis;

import io.constela.core.error.ConstelaError;
import io.constela.core.error.ConstelaErrors;
import io.constela.core.error.JsonPointers;
import io.constela.core.model.Program;
import io.constela.core.model.ViewNode;
import io.constela.core.model.ViewWalker;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Analysis for layout programs: the regular reference checks plus the slot rules a layout must
 * satisfy. A layout's own view is where slots live, so only {@code program.view} is scanned.
 * Top-level {@code param} expressions are layout params and are resolved at composition.
 */
public final class LayoutAnalyzer {

    private final Analyzer analyzer;

    public LayoutAnalyzer(Analyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    public AnalysisResult analyze(Program layout) {
        Objects.requireNonNull(layout, "layout must not be null");
        List<ConstelaError> errors = new ArrayList<>(checkSlots(layout.view()));
        AnalysisResult base = analyzer.analyzeLayout(layout);
        errors.addAll(base.errors());
        return errors.isEmpty() ? base : AnalysisResult.failure(errors);
    }

    private static List<ConstelaError> checkSlots(ViewNode view) {
        SlotCollector collector = new SlotCollector();
        collector.walk(view, new Position("/view", false));
        if (collector.slotCount == 0) {
            collector.errors.add(0, ConstelaErrors.layoutMissingSlot("/view"));
        }
        return collector.errors;
    }

    private record Position(String path, boolean inLoop) {}

    private static final class SlotCollector extends ViewWalker<Position> {
        private final List<ConstelaError> errors = new ArrayList<>();
        private final Set<String> named = new HashSet<>();
        private boolean defaultSeen;
        private int slotCount;

        @Override
        protected Position descend(Position position, String... segments) {
            return new Position(JsonPointers.append(position.path(), segments), position.inLoop());
        }

        @Override
        public Void visit(ViewNode.Each node, Position position) {
            walk(node.body(), new Position(JsonPointers.append(position.path(), "body"), true));
            return null;
        }

        @Override
        public Void visit(ViewNode.Slot node, Position position) {
            slotCount++;
            if (position.inLoop()) {
                errors.add(ConstelaErrors.slotInLoop(position.path()));
            }
            if (node.name() == null) {
                if (defaultSeen) {
                    errors.add(ConstelaErrors.duplicateDefaultSlot(position.path()));
                }
                defaultSeen = true;
            } else if (!named.add(node.name())) {
                errors.add(ConstelaErrors.duplicateSlotName(node.name(), position.path()));
            }
            return null;
        }
    }
}
