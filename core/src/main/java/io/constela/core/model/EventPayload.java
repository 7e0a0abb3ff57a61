package io.constela.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Map;
import java.util.Objects;

/** Event handler payload: one expression, or an object whose fields are expressions. */
public sealed interface EventPayload {

    record Single(Expression expression) implements EventPayload {
        public Single {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @JsonValue
        public Expression expression() {
            return expression;
        }
    }

    record Fields(Map<String, Expression> fields) implements EventPayload {
        public Fields {
            fields = Immutables.orderedMap(Objects.requireNonNull(fields, "fields must not be null"));
        }

        @JsonValue
        public Map<String, Expression> fields() {
            return fields;
        }
    }
}
