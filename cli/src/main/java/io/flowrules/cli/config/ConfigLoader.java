package io.flowrules.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link RulesConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <pre>
 * rules:
 *   engine: strict        # or legacy
 *   parse-cache: true
 * flows:
 *   file: flows.yaml
 *   default: welcome
 * logging:
 *   format: text          # or json
 *   level: WARN
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable is
 * considered "set" if and only if it is defined AND its trimmed value is
 * non-empty. {@code ONBOARDING_RULES_V2} is the legacy toggle name:
 * {@code true} selects the strict engine, anything else the legacy one;
 * {@code RULES_ENGINE} wins when both are set.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file read when {@code --config} is absent, if it exists. */
    public static final String DEFAULT_CONFIG_FILE = "flow-rules.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the config at {@code configPath}, applying environment overrides
     * from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RulesConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the config at {@code configPath}, applying overrides from the
     * supplied lookup function ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RulesConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /** Defaults plus environment overrides, for runs without a config file. */
    public static RulesConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup);
    }

    /**
     * Loads {@code explicitPath} when given; otherwise {@link #DEFAULT_CONFIG_FILE}
     * if it exists, else defaults plus environment.
     */
    public static RulesConfig resolve(Path explicitPath, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? load(fallback, envLookup) : fromEnvironment(envLookup);
    }

    private static RulesConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        RulesConfig.Builder builder = RulesConfig.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a YAML mapping");
            }
            JsonNode rules = root.path("rules");
            if (rules.has("engine")) builder.engine(rules.get("engine").asText());
            if (rules.has("parse-cache")) builder.parseCache(boolOrDefault(rules, "parse-cache", true));

            JsonNode flows = root.path("flows");
            if (flows.has("file")) builder.flowsFile(flows.get("file").asText());
            if (flows.has("default")) builder.defaultFlow(flows.get("default").asText());

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(RulesConfig.Builder builder, Function<String, String> envLookup) {
        envBool(
                envLookup,
                "ONBOARDING_RULES_V2",
                enabled -> builder.engine(enabled ? RulesConfig.ENGINE_STRICT : RulesConfig.ENGINE_LEGACY));
        envString(envLookup, "RULES_ENGINE", builder::engine);
        envBool(envLookup, "RULES_PARSE_CACHE", builder::parseCache);
        envString(envLookup, "FLOWS_FILE", builder::flowsFile);
        envString(envLookup, "DEFAULT_FLOW", builder::defaultFlow);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.isBoolean() ? value.booleanValue() : Boolean.parseBoolean(value.asText().trim());
    }
}
