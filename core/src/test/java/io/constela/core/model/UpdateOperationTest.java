package io.constela.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class UpdateOperationTest {

    @ParameterizedTest(name = "{0} targets {1}")
    @CsvSource({
        "increment, NUMBER",
        "decrement, NUMBER",
        "toggle, BOOLEAN",
        "push, LIST",
        "pop, LIST",
        "remove, LIST",
        "replaceAt, LIST",
        "insertAt, LIST",
        "splice, LIST",
        "merge, OBJECT"
    })
    void eachOperationTargetsOneStateType(String wireName, StateType expected) {
        assertThat(UpdateOperation.fromWireName(wireName))
                .get()
                .extracting(UpdateOperation::targetType)
                .isEqualTo(expected);
    }

    @Test
    void requiredFields() {
        assertThat(UpdateOperation.INCREMENT.requiredFields()).isEmpty();
        assertThat(UpdateOperation.PUSH.requiredFields()).containsExactly("value");
        assertThat(UpdateOperation.REPLACE_AT.requiredFields()).containsExactly("index", "value");
        assertThat(UpdateOperation.SPLICE.requiredFields()).containsExactly("index", "deleteCount");
    }

    @Test
    void unknownWireName() {
        assertThat(UpdateOperation.fromWireName("append")).isEmpty();
        assertThat(UpdateOperation.fromWireName("INCREMENT")).isEmpty();
    }
}
