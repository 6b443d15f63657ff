package io.formulagen.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.formulagen.core.model.DataAccessMode;
import io.formulagen.core.model.GeneratorOptions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link GeneratorOptions} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Recognised keys:
 *
 * <pre>
 * target: python            # FORMULAGEN_TARGET
 * data-access: attribute    # FORMULAGEN_DATA_ACCESS   (attribute | dict | camel-case)
 * null-safety: true         # FORMULAGEN_NULL_SAFETY
 * depth-comments: true      # FORMULAGEN_DEPTH_COMMENTS
 * module-name: computed_fields  # FORMULAGEN_MODULE_NAME
 * sql-schema: public        # FORMULAGEN_SQL_SCHEMA
 * </pre>
 *
 * Missing keys keep the defaults of {@link GeneratorOptions.Builder}. Environment variables take
 * precedence over YAML values. A variable counts as set only if it is defined and non-blank
 * after trimming.
 */
public final class GeneratorOptionsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorOptionsLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_PREFIX = "FORMULAGEN_";

    private GeneratorOptionsLoader() {
        // utility class
    }

    /**
     * Loads options from a YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static GeneratorOptions load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads options from a YAML file, applying overrides from the supplied lookup function.
     * Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static GeneratorOptions load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Options file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            GeneratorOptions options = map(root, envLookup);
            LOG.info(
                    "Generator options loaded: path={}, target={}, data_access={}",
                    configPath,
                    options.target(),
                    options.dataAccessMode());
            return options;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML options: " + configPath, e);
        }
    }

    /** Options from YAML text, applying overrides from the supplied lookup function. */
    public static GeneratorOptions fromYaml(String yaml, Function<String, String> envLookup) {
        try {
            return map(YAML_MAPPER.readTree(yaml), envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML options", e);
        }
    }

    /** Defaults with environment overrides only. */
    public static GeneratorOptions fromEnvironment(Function<String, String> envLookup) {
        return map(null, envLookup);
    }

    private static GeneratorOptions map(JsonNode root, Function<String, String> envLookup) {
        GeneratorOptions.Builder builder = GeneratorOptions.builder();

        // --- YAML mapping ---
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Options must be a YAML mapping");
            }
            if (root.has("target")) builder.target(root.get("target").asText());
            if (root.has("data-access")) builder.dataAccessMode(dataAccessMode(root.get("data-access").asText()));
            if (root.has("null-safety")) builder.nullSafety(bool("null-safety", root.get("null-safety").asText()));
            if (root.has("depth-comments"))
                builder.depthComments(bool("depth-comments", root.get("depth-comments").asText()));
            if (root.has("module-name")) builder.moduleName(root.get("module-name").asText());
            if (root.has("sql-schema")) builder.sqlSchema(root.get("sql-schema").asText());
        }

        // --- Environment variable overlay ---
        envString(envLookup, "TARGET", builder::target);
        envString(envLookup, "DATA_ACCESS", v -> builder.dataAccessMode(dataAccessMode(v)));
        envString(envLookup, "NULL_SAFETY", v -> builder.nullSafety(bool(ENV_PREFIX + "NULL_SAFETY", v)));
        envString(envLookup, "DEPTH_COMMENTS", v -> builder.depthComments(bool(ENV_PREFIX + "DEPTH_COMMENTS", v)));
        envString(envLookup, "MODULE_NAME", builder::moduleName);
        envString(envLookup, "SQL_SCHEMA", builder::sqlSchema);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid generator options: " + e.getMessage(), e);
        }
    }

    private static DataAccessMode dataAccessMode(String value) {
        try {
            return DataAccessMode.fromName(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage(), e);
        }
    }

    /** Strict boolean parsing: only {@code true} and {@code false}, case-insensitive. */
    private static boolean bool(String key, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new ConfigLoadException("Invalid boolean for " + key + ": '" + value + "'");
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies an env var override, named {@code FORMULAGEN_<suffix>}, if set. */
    private static void envString(Function<String, String> envLookup, String suffix, Consumer<String> setter) {
        String envVar = ENV_PREFIX + suffix;
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }
}
