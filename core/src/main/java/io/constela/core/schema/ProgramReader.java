package io.constela.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.constela.core.error.ProgramReadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a program source into an untyped {@link JsonNode}. JSON is the native format; {@code .yaml}
 * and {@code .yml} files are accepted for hand-written programs. No structural checks happen here.
 */
public final class ProgramReader {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ProgramReader() {
        // utility class
    }

    /**
     * Parses the file at {@code path}, choosing the format by extension.
     *
     * @throws ProgramReadException if the file is missing, unreadable or malformed
     */
    public static JsonNode read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ProgramReadException("Program file not found: " + path, path.toString());
        }
        ObjectMapper mapper = isYaml(path) ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode node = mapper.readTree(in);
            if (node == null || node.isMissingNode()) {
                throw new ProgramReadException("Program file is empty: " + path, path.toString());
            }
            return node;
        } catch (IOException e) {
            throw new ProgramReadException(
                    "Failed to parse program file " + path + ": " + e.getMessage(), e, path.toString());
        }
    }

    /**
     * Parses a JSON document held in memory.
     *
     * @throws ProgramReadException if {@code json} is not well-formed
     */
    public static JsonNode readJson(String json) {
        try {
            return JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProgramReadException("Malformed program JSON: " + e.getOriginalMessage(), e, null);
        }
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
