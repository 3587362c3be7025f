package io.batchconvert.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ConverterConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code batch-convert.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults from {@link ConverterConfig.Builder}.
 * Environment variables take precedence over YAML values. A variable is
 * considered set if and only if it is defined AND its trimmed value is
 * non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "batch-convert.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ConverterConfig}, applying overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ConverterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ConverterConfig}, applying overrides from the supplied
     * lookup function. Returning {@code null} means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ConverterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            } else if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        String value = optionValue(args, "--config");
        return value != null ? Path.of(value) : Path.of(DEFAULT_CONFIG_FILE);
    }

    /**
     * Resolves the batch job file from CLI arguments.
     *
     * @param args command-line arguments
     * @return the job file path
     * @throws IllegalArgumentException if {@code --job} is absent
     */
    public static Path resolveJobPath(String[] args) {
        String value = optionValue(args, "--job");
        if (value == null) {
            throw new IllegalArgumentException("--job <file> is required");
        }
        return Path.of(value);
    }

    /**
     * Returns the value following {@code option} in the CLI arguments.
     *
     * @throws IllegalArgumentException if the option is the last argument
     */
    public static Optional<String> resolveOption(String[] args, String option) {
        return Optional.ofNullable(optionValue(args, option));
    }

    private static String optionValue(String[] args, String option) {
        for (int i = 0; i < args.length; i++) {
            if (option.equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(option + " requires an argument");
                }
                return args[i + 1];
            }
        }
        return null;
    }

    private static ConverterConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ConverterConfig.Builder builder = ConverterConfig.builder();

        // Converter section
        JsonNode converter = root.path("converter");
        if (converter.has("style")) builder.stylePath(converter.get("style").asText());
        if (converter.has("force")) builder.forceMode(converter.get("force").asBoolean());
        if (converter.has("sound-profile"))
            builder.soundProfile(converter.get("sound-profile").asText());
        if (converter.has("extension")) builder.extension(converter.get("extension").asText());
        if (converter.has("page-kinds"))
            builder.pageSegmentedKinds(textList(converter.get("page-kinds"), "converter.page-kinds"));
        if (converter.has("part-kinds"))
            builder.partKinds(textList(converter.get("part-kinds"), "converter.part-kinds"));

        // Batch section
        JsonNode batch = root.path("batch");
        if (batch.has("parallelism")) builder.parallelism(batch.get("parallelism").asInt());

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        envString(envLookup, "CONVERTER_STYLE", builder::stylePath);
        envBool(envLookup, "CONVERTER_FORCE", builder::forceMode);
        envString(envLookup, "CONVERTER_SOUND_PROFILE", builder::soundProfile);
        envString(envLookup, "CONVERTER_EXTENSION", builder::extension);
        envInt(envLookup, "BATCH_PARALLELISM", builder::parallelism);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static List<String> textList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list of output kinds");
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> values.add(item.asText()));
        return values;
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

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
