package io.constela.core.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.constela.core.model.Program;
import io.constela.core.schema.SchemaValidator;
import io.constela.core.schema.ValidationResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/** Fixture helpers: classpath programs, inline JSON and a minimal program skeleton. */
public final class TestPrograms {

    public static final ObjectMapper JSON = new ObjectMapper();

    private TestPrograms() {}

    /** Loads {@code /programs/<name>} from the test classpath. */
    public static JsonNode load(String name) {
        try (InputStream in = TestPrograms.class.getResourceAsStream("/programs/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture named " + name);
            }
            return JSON.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad test JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * A valid program with one number state field {@code count}, one action {@code increment} and
     * the given view. Tests mutate the returned tree to add sections.
     */
    public static ObjectNode withView(String viewJson) {
        return (ObjectNode) json("""
                {
                  "version": "1.0",
                  "state": { "count": { "type": "number", "initial": 0 } },
                  "actions": [
                    { "name": "increment",
                      "steps": [{ "do": "update", "target": "count", "operation": "increment" }] }
                  ],
                  "view": %s
                }
                """.formatted(viewJson));
    }

    /** Validates {@code raw} and returns the typed program, failing on any schema error. */
    public static Program parse(JsonNode raw) {
        ValidationResult result = new SchemaValidator(256).validate(raw);
        if (!result.isSuccess()) {
            throw new AssertionError("Fixture did not validate: " + result.error());
        }
        return result.program();
    }
}
