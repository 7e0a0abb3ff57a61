package io.constela.core.ir;

import io.constela.core.model.ActionStep;
import java.util.List;
import java.util.Objects;

/** A lowered action. Steps are the source steps, after param substitution for component-local actions. */
public record CompiledAction(String name, List<ActionStep> steps) {

    public CompiledAction {
        Objects.requireNonNull(name, "name must not be null");
        steps = List.copyOf(steps);
    }
}
