package io.constela.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A reusable view fragment. {@code params}, {@code localState} and {@code localActions} are never
 * null; absent sections are empty.
 */
public record ComponentDef(
        Map<String, ParamDef> params, Map<String, StateField> localState, List<ActionDef> localActions, ViewNode view) {

    public ComponentDef {
        params = Immutables.orderedMap(Objects.requireNonNull(params, "params must not be null"));
        localState = Immutables.orderedMap(Objects.requireNonNull(localState, "localState must not be null"));
        localActions = List.copyOf(localActions);
        Objects.requireNonNull(view, "view must not be null");
    }

    /** Returns {@code true} if instances need their own state namespace. */
    public boolean hasLocalScope() {
        return !localState.isEmpty() || !localActions.isEmpty();
    }
}
