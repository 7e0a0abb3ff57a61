package io.constela.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Where a {@code route} expression reads its value from. */
public enum RouteSource {
    PARAM("param"),
    QUERY("query"),
    PATH("path");

    private final String wireName;

    RouteSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<RouteSource> fromWireName(String name) {
        return Arrays.stream(values()).filter(s -> s.wireName.equals(name)).findFirst();
    }
}
