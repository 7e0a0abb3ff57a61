package io.constela.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Arrays;
import java.util.Optional;

/** Declared type of a state field. */
public enum StateType {
    NUMBER("number"),
    STRING("string"),
    LIST("list"),
    BOOLEAN("boolean"),
    OBJECT("object");

    private final String wireName;

    StateType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Returns {@code true} if {@code value} is a literal of this type. */
    public boolean accepts(JsonNode value) {
        return switch (this) {
            case NUMBER -> value.isNumber();
            case STRING -> value.isTextual();
            case LIST -> value.isArray();
            case BOOLEAN -> value.isBoolean();
            case OBJECT -> value.isObject();
        };
    }

    public static Optional<StateType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
