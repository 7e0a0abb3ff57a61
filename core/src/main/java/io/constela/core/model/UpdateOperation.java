package io.constela.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Operations of the {@code update} step, each tied to the state type it applies to and the step
 * fields it needs.
 */
public enum UpdateOperation {
    INCREMENT("increment", StateType.NUMBER),
    DECREMENT("decrement", StateType.NUMBER),
    PUSH("push", StateType.LIST, "value"),
    POP("pop", StateType.LIST),
    REMOVE("remove", StateType.LIST, "value"),
    TOGGLE("toggle", StateType.BOOLEAN),
    MERGE("merge", StateType.OBJECT, "value"),
    REPLACE_AT("replaceAt", StateType.LIST, "index", "value"),
    INSERT_AT("insertAt", StateType.LIST, "index", "value"),
    SPLICE("splice", StateType.LIST, "index", "deleteCount");

    private final String wireName;
    private final StateType targetType;
    private final List<String> requiredFields;

    UpdateOperation(String wireName, StateType targetType, String... requiredFields) {
        this.wireName = wireName;
        this.targetType = targetType;
        this.requiredFields = List.of(requiredFields);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** The only state type this operation may target. */
    public StateType targetType() {
        return targetType;
    }

    /** Step fields ({@code value}, {@code index}, {@code deleteCount}) that must be present. */
    public List<String> requiredFields() {
        return requiredFields;
    }

    public static Optional<UpdateOperation> fromWireName(String name) {
        return Arrays.stream(values()).filter(op -> op.wireName.equals(name)).findFirst();
    }
}
