package io.constela.core.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.constela.core.model.DataSource;
import io.constela.core.model.Immutables;
import io.constela.core.model.Lifecycle;
import io.constela.core.model.StateField;
import io.constela.core.model.StylePreset;
import io.constela.core.model.WidgetRef;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The lowered program handed to renderers: components inlined, actions keyed by name. Optional
 * sections are {@code null} when the source program omitted them.
 *
 * <p>
 * Thread-safe and immutable.
 */
@JsonPropertyOrder({"version", "route", "lifecycle", "state", "actions", "view"})
public record CompiledProgram(
        String version,
        CompiledRoute route,
        Lifecycle lifecycle,
        Map<String, StateField> state,
        Map<String, CompiledAction> actions,
        CompiledNode view,
        Map<String, StylePreset> styles,
        Map<String, String> imports,
        Map<String, DataSource> data,
        List<WidgetRef> widgets) {

    public CompiledProgram {
        Objects.requireNonNull(version, "version must not be null");
        state = Immutables.orderedMap(Objects.requireNonNull(state, "state must not be null"));
        actions = Immutables.orderedMap(Objects.requireNonNull(actions, "actions must not be null"));
        Objects.requireNonNull(view, "view must not be null");
        styles = Immutables.orderedMap(styles);
        imports = Immutables.orderedMap(imports);
        data = Immutables.orderedMap(data);
        widgets = Immutables.list(widgets);
    }
}
