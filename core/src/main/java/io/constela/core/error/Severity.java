package io.constela.core.error;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How a diagnostic affects compilation. Warnings never fail a compile. */
public enum Severity {
    ERROR,
    WARNING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
