package io.constela.core.analysis;

import io.constela.core.model.ComponentDef;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the names resolved by the analyzer. Handed to the transformer so it never
 * re-derives them, and to editor tooling for completion.
 *
 * @param stateNames        global state field names
 * @param actionNames       global action names
 * @param routeParams       path parameter names of {@code route.path}, in order
 * @param componentRegistry component definitions by name
 * @param importNames       declared import names
 * @param dataNames         declared data source names
 * @param styleNames        declared style preset names
 * @param refNames          element refs declared anywhere in the program's views
 */
public record AnalysisContext(
        Set<String> stateNames,
        Set<String> actionNames,
        List<String> routeParams,
        Map<String, ComponentDef> componentRegistry,
        Set<String> importNames,
        Set<String> dataNames,
        Set<String> styleNames,
        Set<String> refNames) {

    public AnalysisContext {
        stateNames = orderedSet(stateNames);
        actionNames = orderedSet(actionNames);
        routeParams = List.copyOf(routeParams);
        componentRegistry = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(componentRegistry, "componentRegistry must not be null")));
        importNames = orderedSet(importNames);
        dataNames = orderedSet(dataNames);
        styleNames = orderedSet(styleNames);
        refNames = orderedSet(refNames);
    }

    private static Set<String> orderedSet(Set<String> source) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(source)));
    }
}
