package io.constela.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.constela.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Loads {@link CompilerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Recognised keys live under a {@code compiler} section:
 *
 * <pre>
 * compiler:
 *   max-depth: 256
 *   max-expanded-depth: 1024
 *   suggestion-distance: 2
 *   max-expanded-nodes: 100000
 * </pre>
 *
 * <p>
 * Missing keys keep the {@link CompilerConfig#DEFAULT} values. {@code CONSTELA_MAX_DEPTH},
 * {@code CONSTELA_MAX_EXPANDED_DEPTH}, {@code CONSTELA_SUGGESTION_DISTANCE} and
 * {@code CONSTELA_MAX_EXPANDED_NODES} take precedence over the file. An env var counts as set only when its trimmed value is non-empty.
 */
public final class CompilerConfigLoader {

    static final String ENV_MAX_DEPTH = "CONSTELA_MAX_DEPTH";
    static final String ENV_MAX_EXPANDED_DEPTH = "CONSTELA_MAX_EXPANDED_DEPTH";
    static final String ENV_SUGGESTION_DISTANCE = "CONSTELA_SUGGESTION_DISTANCE";
    static final String ENV_MAX_EXPANDED_NODES = "CONSTELA_MAX_EXPANDED_NODES";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private CompilerConfigLoader() {
        // utility class
    }

    public static CompilerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file at {@code configPath}, then applies overrides from {@code envLookup}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static CompilerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, configPath.toString());
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return fromTree(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup, configPath.toString());
        } catch (IOException e) {
            throw new ConfigLoadException(
                    "Failed to parse YAML configuration: " + configPath, e, configPath.toString());
        }
    }

    /** Builds a configuration from environment variables alone. */
    public static CompilerConfig fromEnvironment(Function<String, String> envLookup) {
        return fromTree(YAML_MAPPER.createObjectNode(), envLookup, "<environment>");
    }

    private static CompilerConfig fromTree(JsonNode root, Function<String, String> envLookup, String source) {
        JsonNode compiler = root.path("compiler");
        int maxDepth = intOrDefault(compiler, "max-depth", CompilerConfig.DEFAULT_MAX_DEPTH, source);
        int maxExpandedDepth =
                intOrDefault(compiler, "max-expanded-depth", CompilerConfig.DEFAULT_MAX_EXPANDED_DEPTH, source);
        int suggestionDistance =
                intOrDefault(compiler, "suggestion-distance", CompilerConfig.DEFAULT_SUGGESTION_DISTANCE, source);
        int maxExpandedNodes =
                intOrDefault(compiler, "max-expanded-nodes", CompilerConfig.DEFAULT_MAX_EXPANDED_NODES, source);

        maxDepth = envIntOrDefault(envLookup, ENV_MAX_DEPTH, maxDepth);
        maxExpandedDepth = envIntOrDefault(envLookup, ENV_MAX_EXPANDED_DEPTH, maxExpandedDepth);
        suggestionDistance = envIntOrDefault(envLookup, ENV_SUGGESTION_DISTANCE, suggestionDistance);
        maxExpandedNodes = envIntOrDefault(envLookup, ENV_MAX_EXPANDED_NODES, maxExpandedNodes);

        try {
            return new CompilerConfig(maxDepth, maxExpandedDepth, suggestionDistance, maxExpandedNodes);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid compiler configuration: " + e.getMessage(), e, source);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static int envIntOrDefault(Function<String, String> envLookup, String envVar, int yamlDefault) {
        if (!isSet(envLookup, envVar)) {
            return yamlDefault;
        }
        String raw = envLookup.apply(envVar).trim();
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(envVar + " must be an integer, got: '" + raw + "'", e, envVar);
        }
    }

    private static int intOrDefault(JsonNode node, String field, int defaultValue, String source) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("compiler." + field + " must be an integer", source);
        }
        return value.asInt();
    }
}
