package io.quyaml.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.quyaml.core.engine.CompilerOptions;
import io.quyaml.core.engine.ControlFlowMode;
import io.quyaml.core.guard.GuardrailLimits;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads {@link CompilerConfiguration} from a YAML file with an optional
 * environment variable overlay.
 *
 * <p>
 * File layout, every key optional:
 *
 * <pre>
 * guardrails:
 *   max-bytes: 1000000
 *   max-nesting: 50
 *   max-register-width: 65536
 *   max-unrolled-copies: 100000
 * compiler:
 *   control-flow: native        # or: unrolled
 * compatibility:
 *   allow-legacy-versions: true
 * </pre>
 *
 * <p>
 * Environment variables take precedence over file values:
 * {@code QUYAML_MAX_BYTES}, {@code QUYAML_MAX_NESTING},
 * {@code QUYAML_MAX_REGISTER_WIDTH}, {@code QUYAML_MAX_UNROLLED_COPIES},
 * {@code QUYAML_CONTROL_FLOW}, {@code QUYAML_ALLOW_LEGACY_VERSIONS}. A variable
 * counts as set only if it is defined and non-blank after trimming.
 */
public final class CompilerOptionsLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MAX_BYTES = "QUYAML_MAX_BYTES";
    static final String ENV_MAX_NESTING = "QUYAML_MAX_NESTING";
    static final String ENV_MAX_REGISTER_WIDTH = "QUYAML_MAX_REGISTER_WIDTH";
    static final String ENV_MAX_UNROLLED_COPIES = "QUYAML_MAX_UNROLLED_COPIES";
    static final String ENV_CONTROL_FLOW = "QUYAML_CONTROL_FLOW";
    static final String ENV_ALLOW_LEGACY_VERSIONS = "QUYAML_ALLOW_LEGACY_VERSIONS";

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "on", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "off", "0");

    private CompilerOptionsLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML, or
     *                             holds an invalid value
     */
    public static CompilerConfiguration load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given file, applying overrides from the
     * supplied lookup. The lookup returns {@code null} for undefined variables.
     */
    public static CompilerConfiguration load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return fromTree(root, envLookup);
    }

    /** Builds configuration from defaults and the environment only. */
    public static CompilerConfiguration fromEnvironment(Function<String, String> envLookup) {
        return fromTree(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static CompilerConfiguration fromTree(JsonNode root, Function<String, String> envLookup) {
        JsonNode guardrails = root.path("guardrails");
        int maxBytes = intOrDefault(guardrails, "max-bytes", GuardrailLimits.DEFAULT.maxBytes());
        int maxNesting = intOrDefault(guardrails, "max-nesting", GuardrailLimits.DEFAULT.maxNesting());
        int maxRegisterWidth =
                intOrDefault(guardrails, "max-register-width", GuardrailLimits.DEFAULT.maxRegisterWidth());
        int maxUnrolledCopies =
                intOrDefault(guardrails, "max-unrolled-copies", GuardrailLimits.DEFAULT.maxUnrolledCopies());

        JsonNode compiler = root.path("compiler");
        String controlFlow = compiler.has("control-flow")
                ? compiler.get("control-flow").asText()
                : CompilerOptions.DEFAULT.controlFlowMode().name();

        JsonNode compatibility = root.path("compatibility");
        Boolean allowLegacy = null;
        if (compatibility.has("allow-legacy-versions")) {
            allowLegacy = parseBoolean(
                    compatibility.get("allow-legacy-versions").asText(), "compatibility.allow-legacy-versions");
        }

        // --- Environment variable overlay ---
        if (isSet(envLookup, ENV_MAX_BYTES)) {
            maxBytes = parseInt(envLookup.apply(ENV_MAX_BYTES), ENV_MAX_BYTES);
        }
        if (isSet(envLookup, ENV_MAX_NESTING)) {
            maxNesting = parseInt(envLookup.apply(ENV_MAX_NESTING), ENV_MAX_NESTING);
        }
        if (isSet(envLookup, ENV_MAX_REGISTER_WIDTH)) {
            maxRegisterWidth = parseInt(envLookup.apply(ENV_MAX_REGISTER_WIDTH), ENV_MAX_REGISTER_WIDTH);
        }
        if (isSet(envLookup, ENV_MAX_UNROLLED_COPIES)) {
            maxUnrolledCopies = parseInt(envLookup.apply(ENV_MAX_UNROLLED_COPIES), ENV_MAX_UNROLLED_COPIES);
        }
        if (isSet(envLookup, ENV_CONTROL_FLOW)) {
            controlFlow = envLookup.apply(ENV_CONTROL_FLOW);
        }
        if (isSet(envLookup, ENV_ALLOW_LEGACY_VERSIONS)) {
            allowLegacy = parseBoolean(envLookup.apply(ENV_ALLOW_LEGACY_VERSIONS), ENV_ALLOW_LEGACY_VERSIONS);
        }

        try {
            GuardrailLimits limits = new GuardrailLimits(maxBytes, maxNesting, maxRegisterWidth, maxUnrolledCopies);
            CompilerOptions options = new CompilerOptions(limits, ControlFlowMode.fromString(controlFlow));
            return new CompilerConfiguration(options, allowLegacy);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid compiler configuration: " + e.getMessage(), e);
        }
    }

    // --- Helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static int intOrDefault(JsonNode node, String field, int defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("Configuration value '" + field + "' must be an integer, got: " + value);
        }
        return value.intValue();
    }

    private static int parseInt(String value, String source) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(source + " must be an integer, got: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String value, String source) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        throw new ConfigLoadException(source + " must be a boolean, got: '" + value + "'");
    }
}
