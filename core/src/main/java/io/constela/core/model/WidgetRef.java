package io.constela.core.model;

import java.util.Objects;

/** An embedded widget program mounted at the element with {@code id}. */
public record WidgetRef(String id, String src) {

    public WidgetRef {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(src, "src must not be null");
    }
}
