package io.txnbox.standalone.config;

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
 * Loads {@link CheckerSettings} in three layers, later layers winning:
 * <ol>
 * <li>an optional settings YAML file ({@code --settings path})</li>
 * <li>environment variables ({@code TXNBOX_*})</li>
 * <li>command line options</li>
 * </ol>
 *
 * <p>
 * Settings file layout:
 *
 * <pre>
 * config: txn_box.yaml
 * key: meta.txn_box.global
 * remap: false
 * dump: false
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * An environment variable is "set" if and only if it is defined AND its
 * trimmed value is non-empty.
 */
public final class SettingsLoader {

    static final String ENV_CONFIG = "TXNBOX_CONFIG";
    static final String ENV_KEY = "TXNBOX_KEY";
    static final String ENV_REMAP = "TXNBOX_REMAP";
    static final String ENV_DUMP = "TXNBOX_DUMP";
    static final String ENV_LOG_FORMAT = "TXNBOX_LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "TXNBOX_LOG_LEVEL";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private SettingsLoader() {
        // utility class
    }

    /**
     * Loads settings from the command line, reading the process environment.
     *
     * @param args command-line arguments
     * @return the settings
     * @throws SettingsLoadException if the settings are incomplete or invalid
     */
    public static CheckerSettings load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Loads settings from the command line with the supplied environment.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup; {@code null} means not
     *                  defined
     * @return the settings
     * @throws SettingsLoadException if the settings are incomplete or invalid
     */
    public static CheckerSettings load(String[] args, Function<String, String> envLookup) {
        CheckerSettings.Builder builder = CheckerSettings.builder();

        String settingsFile = option(args, "--settings");
        if (settingsFile != null) {
            applyFile(builder, Path.of(settingsFile));
        }
        applyEnv(builder, envLookup);
        applyArgs(builder, args);
        return builder.build();
    }

    private static void applyFile(CheckerSettings.Builder builder, Path path) {
        if (!Files.exists(path)) {
            throw new SettingsLoadException("Settings file not found: " + path);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to parse settings file: " + path, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return;
        }
        if (!root.isObject()) {
            throw new SettingsLoadException("Settings file " + path + " must contain a YAML mapping");
        }

        if (root.has("config")) {
            // Relative to the settings file.
            Path config = Path.of(root.get("config").asText());
            Path base = path.toAbsolutePath().getParent();
            builder.configFile((config.isAbsolute() || base == null ? config : base.resolve(config)).toString());
        }
        if (root.has("key")) builder.keyPath(root.get("key").asText());
        if (root.has("remap")) builder.remap(root.get("remap").asBoolean());
        if (root.has("dump")) builder.dump(root.get("dump").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnv(CheckerSettings.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, ENV_CONFIG, builder::configFile);
        envString(envLookup, ENV_KEY, builder::keyPath);
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
        envBool(envLookup, ENV_REMAP, builder::remap);
        envBool(envLookup, ENV_DUMP, builder::dump);
    }

    private static void applyArgs(CheckerSettings.Builder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--settings" -> i++;
                case "--config" -> builder.configFile(value(args, i++));
                case "--key" -> builder.keyPath(value(args, i++));
                case "--remap" -> builder.remap(true);
                case "--dump" -> builder.dump(true);
                default -> throw new SettingsLoadException("Unknown option: " + args[i]);
            }
        }
    }

    private static String option(String[] args, String name) {
        for (int i = 0; i < args.length; i++) {
            if (name.equals(args[i])) {
                return value(args, i);
            }
        }
        return null;
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new SettingsLoadException(args[i] + " requires an argument");
        }
        return args[i + 1];
    }

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
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
}
