package io.constela.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

class StateFieldTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void cookieInitialIsDeferred() throws Exception {
        JsonNode cookie = JSON.readTree("""
                { "expr": "cookie", "key": "theme", "default": "light" }""");

        StateField field = new StateField(StateType.STRING, cookie);

        assertThat(field.hasDeferredInitial()).isTrue();
        assertThat(new StateField(StateType.STRING, TextNode.valueOf("light")).hasDeferredInitial()).isFalse();
    }

    @Test
    void stateTypeAcceptsMatchingLiterals() throws Exception {
        assertThat(StateType.NUMBER.accepts(IntNode.valueOf(1))).isTrue();
        assertThat(StateType.NUMBER.accepts(TextNode.valueOf("1"))).isFalse();
        assertThat(StateType.LIST.accepts(JSON.readTree("[]"))).isTrue();
        assertThat(StateType.OBJECT.accepts(JSON.readTree("{}"))).isTrue();
        assertThat(StateType.fromWireName("boolean")).contains(StateType.BOOLEAN);
        assertThat(StateType.fromWireName("bool")).isEmpty();
    }

    @Test
    void initialIsRequired() {
        assertThatThrownBy(() -> new StateField(StateType.NUMBER, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("initial must not be null");
    }
}
