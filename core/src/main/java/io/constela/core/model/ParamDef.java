package io.constela.core.model;

import java.util.Objects;

/** A component param declaration. Params are required unless declared with {@code required: false}. */
public record ParamDef(ParamType type, boolean required) {

    public ParamDef {
        Objects.requireNonNull(type, "type must not be null");
    }
}
