package io.constela.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Objects;

/**
 * A named style preset: base classes plus variant-keyed class overrides.
 *
 * @param variants         variant key to (option value to classes), or {@code null}
 * @param defaultVariants  variant key to default option, or {@code null}
 * @param compoundVariants compound rules kept as parsed, or {@code null}
 */
public record StylePreset(
        String base,
        Map<String, Map<String, String>> variants,
        Map<String, String> defaultVariants,
        JsonNode compoundVariants) {

    public StylePreset {
        Objects.requireNonNull(base, "base must not be null");
        variants = Immutables.orderedMap(variants);
        defaultVariants = Immutables.orderedMap(defaultVariants);
        compoundVariants = Immutables.json(compoundVariants);
    }

    public boolean declaresVariant(String key) {
        return variants != null && variants.containsKey(key);
    }
}
