package io.constela.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The validated, not yet analyzed program tree (the AST). Produced only by the schema validator.
 *
 * <p>
 * Required sections ({@code state}, {@code actions}, {@code view}) are non-null. Optional
 * sections are {@code null} when the source omits them, so that "absent" and "empty" stay
 * distinguishable for the analyzer ({@code imports: {}} is not the same as no imports at all).
 * All maps keep source key order.
 */
public record Program(
        String version,
        RouteDef route,
        Lifecycle lifecycle,
        Map<String, StateField> state,
        List<ActionDef> actions,
        ViewNode view,
        Map<String, ComponentDef> components,
        Map<String, StylePreset> styles,
        Map<String, String> imports,
        Map<String, DataSource> data,
        List<WidgetRef> widgets) {

    public Program {
        Objects.requireNonNull(version, "version must not be null");
        state = Immutables.orderedMap(Objects.requireNonNull(state, "state must not be null"));
        actions = List.copyOf(actions);
        Objects.requireNonNull(view, "view must not be null");
        components = Immutables.orderedMap(components);
        styles = Immutables.orderedMap(styles);
        imports = Immutables.orderedMap(imports);
        data = Immutables.orderedMap(data);
        widgets = Immutables.list(widgets);
    }

    /** Components declared by the program, or an empty map. */
    public Map<String, ComponentDef> componentsOrEmpty() {
        return components == null ? Map.of() : components;
    }

    /** Style presets declared by the program, or an empty map. */
    public Map<String, StylePreset> stylesOrEmpty() {
        return styles == null ? Map.of() : styles;
    }
}
