package io.segreg.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads {@link CompilerOptions} from YAML with an environment variable overlay.
 *
 * <pre>
 * compiler:
 *   dialect: jags
 *   segment-comments: true
 * simulation:
 *   seed: 42
 * </pre>
 *
 * <p>
 * Missing keys keep the values of {@link CompilerOptions#DEFAULT}; unknown keys are rejected.
 * Environment variables take precedence over YAML values:
 * <ul>
 * <li>{@code SEGREG_DIALECT}</li>
 * <li>{@code SEGREG_SEGMENT_COMMENTS}</li>
 * <li>{@code SEGREG_SIMULATION_SEED}</li>
 * </ul>
 * An env var counts as set only if it is defined and its trimmed value is non-empty.
 */
public final class CompilerOptionsLoader {

    static final String ENV_DIALECT = "SEGREG_DIALECT";
    static final String ENV_SEGMENT_COMMENTS = "SEGREG_SEGMENT_COMMENTS";
    static final String ENV_SIMULATION_SEED = "SEGREG_SIMULATION_SEED";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("compiler", "simulation");
    private static final Set<String> KNOWN_COMPILER_KEYS = Set.of("dialect", "segment-comments");
    private static final Set<String> KNOWN_SIMULATION_KEYS = Set.of("seed");

    private CompilerOptionsLoader() {
        // utility class
    }

    /**
     * Loads options from a YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, invalid or has unknown keys
     */
    public static CompilerOptions load(Path path) {
        return load(path, System::getenv);
    }

    /**
     * Loads options from a YAML file, applying overrides from {@code envLookup}. The lookup
     * returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, invalid or has unknown keys
     */
    public static CompilerOptions load(Path path, Function<String, String> envLookup) {
        if (!Files.exists(path)) {
            throw new ConfigLoadException("Configuration file not found: " + path);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + path, e);
        }
        return overlay(fromYaml(root, path.toString()), envLookup);
    }

    /** The defaults with environment overrides only. */
    public static CompilerOptions fromEnvironment(Function<String, String> envLookup) {
        return overlay(CompilerOptions.DEFAULT, envLookup);
    }

    private static CompilerOptions fromYaml(JsonNode root, String source) {
        CompilerOptions options = CompilerOptions.DEFAULT;
        if (root == null || root.isMissingNode() || root.isNull()) {
            return options;
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration must be a YAML mapping: " + source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "", source);

        JsonNode compiler = root.path("compiler");
        rejectUnknownKeys(compiler, KNOWN_COMPILER_KEYS, "compiler.", source);
        if (compiler.has("dialect")) {
            options = options.withDialect(compiler.get("dialect").asText());
        }
        if (compiler.has("segment-comments")) {
            JsonNode flag = compiler.get("segment-comments");
            if (!flag.isBoolean()) {
                throw new ConfigLoadException("compiler.segment-comments must be true or false in " + source);
            }
            options = options.withSegmentComments(flag.asBoolean());
        }

        JsonNode simulation = root.path("simulation");
        rejectUnknownKeys(simulation, KNOWN_SIMULATION_KEYS, "simulation.", source);
        if (simulation.has("seed")) {
            JsonNode seed = simulation.get("seed");
            if (!seed.canConvertToLong() || !seed.isIntegralNumber()) {
                throw new ConfigLoadException("simulation.seed must be an integer in " + source);
            }
            options = options.withSimulationSeed(seed.asLong());
        }
        return options;
    }

    private static CompilerOptions overlay(CompilerOptions options, Function<String, String> envLookup) {
        CompilerOptions result = options;
        if (isSet(envLookup, ENV_DIALECT)) {
            result = result.withDialect(envLookup.apply(ENV_DIALECT).trim());
        }
        if (isSet(envLookup, ENV_SEGMENT_COMMENTS)) {
            result = result.withSegmentComments(parseBoolean(ENV_SEGMENT_COMMENTS, envLookup.apply(ENV_SEGMENT_COMMENTS)));
        }
        if (isSet(envLookup, ENV_SIMULATION_SEED)) {
            String value = envLookup.apply(ENV_SIMULATION_SEED).trim();
            try {
                result = result.withSimulationSeed(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_SIMULATION_SEED + " must be an integer, got '" + value + "'", e);
            }
        }
        return result;
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String prefix, String source) {
        if (node.isMissingNode()) {
            return;
        }
        if (!node.isObject()) {
            throw new ConfigLoadException("'" + prefix.replaceAll("\\.$", "") + "' must be a mapping in " + source);
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new ConfigLoadException(
                        "Unknown configuration key '" + prefix + name + "' in " + source + "; known keys: "
                                + known.stream().sorted().toList());
            }
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static boolean parseBoolean(String envVar, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("true")) {
            return true;
        }
        if (value.equals("false")) {
            return false;
        }
        throw new ConfigLoadException(envVar + " must be true or false, got '" + raw.trim() + "'");
    }
}
