package io.constela.core.model;

import java.util.List;
import java.util.Objects;

/** A named, ordered sequence of action steps. */
public record ActionDef(String name, List<ActionStep> steps) {

    public ActionDef {
        Objects.requireNonNull(name, "name must not be null");
        steps = List.copyOf(steps);
    }
}
