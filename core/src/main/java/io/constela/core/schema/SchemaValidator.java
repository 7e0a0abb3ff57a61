package io.constela.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ConstelaErrors;
import io.constela.core.error.InternalCompilerException;
import io.constela.core.model.Program;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First compiler pass: structural validation of an untyped JSON tree.
 *
 * <p>
 * Checks run in a fixed order and the first failure wins:
 *
 * <ol>
 * <li>the input is a JSON object;
 * <li>{@code version} is exactly {@code "1.0"} ({@code UNSUPPORTED_VERSION} otherwise);
 * <li>the bundled top-level JSON Schema ({@code program.schema.json}) accepts the document; a
 * missing required section is reported directly;
 * <li>a recursive walk checks every view node, expression and action step and builds the typed
 * {@link Program}.
 * </ol>
 *
 * <p>
 * Thread-safe: the compiled top-level schema is shared and read-only; the recursive walk uses a
 * fresh {@link ProgramParser} per call.
 */
public final class SchemaValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaValidator.class);

    /** The only program version this compiler understands. */
    public static final String SUPPORTED_VERSION = "1.0";

    private static final String SCHEMA_RESOURCE = "program.schema.json";
    private static final List<String> REQUIRED_SECTIONS = List.of("version", "state", "actions", "view");
    private static final JsonSchema PROGRAM_SCHEMA = loadProgramSchema();

    private final int maxDepth;

    public SchemaValidator(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Validates {@code raw}. Accepts any value, including {@code null} and non-object nodes.
     *
     * @return the typed program, or the single first error
     */
    public ValidationResult validate(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return ValidationResult.failure(ConstelaErrors.schema("Program must be an object", ""));
        }
        JsonNode version = raw.get("version");
        if (version != null && version.isTextual() && !SUPPORTED_VERSION.equals(version.asText())) {
            return ValidationResult.failure(ConstelaErrors.unsupportedVersion(version.asText()));
        }

        Set<ValidationMessage> messages = PROGRAM_SCHEMA.validate(raw);
        if (!messages.isEmpty()) {
            LOG.debug("Top-level schema reported {} message(s)", messages.size());
            for (String section : REQUIRED_SECTIONS) {
                if (!raw.has(section)) {
                    return ValidationResult.failure(ConstelaErrors.schema(section + " is required", "/" + section));
                }
            }
        }

        Program program;
        try {
            program = new ProgramParser(maxDepth).parse(raw);
        } catch (ProgramParser.Violation v) {
            LOG.debug("Schema validation failed at '{}': {}", v.error().path(), v.error().message());
            return ValidationResult.failure(v.error());
        }

        if (!messages.isEmpty()) {
            return ValidationResult.failure(toError(messages.iterator().next()));
        }
        return ValidationResult.success(program);
    }

    // Only reached when the top-level schema is stricter than the recursive walk.
    private static ConstelaError toError(ValidationMessage message) {
        return ConstelaErrors.schema(message.getMessage(), "");
    }

    private static JsonSchema loadProgramSchema() {
        try (InputStream in = SchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new InternalCompilerException("Missing bundled resource " + SCHEMA_RESOURCE);
            }
            JsonNode schema = new ObjectMapper().readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schema);
        } catch (IOException e) {
            throw new InternalCompilerException("Failed to load bundled " + SCHEMA_RESOURCE, e);
        }
    }
}
