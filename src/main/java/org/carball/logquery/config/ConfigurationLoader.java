package org.carball.logquery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.function.LongConsumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > YAML file > defaults.
     */
    public CompilerSettings loadConfiguration(String configPath, String[] args) {
        log.debug("Loading configuration");

        // Start with the file, or defaults when there is none
        CompilerSettings settings = loadFile(configPath);

        // 1. Apply environment variables
        applyEnvironmentVariables(settings);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(settings, args);

        settings.validate();

        log.info("Configuration loaded: {}", settings.getSummary());
        return settings;
    }

    public CompilerSettings loadFile(String configPath) {
        if (configPath == null || configPath.trim().isEmpty()) {
            log.debug("No settings file provided, using defaults");
            return CompilerSettings.defaults();
        }

        File configFile = new File(configPath);
        if (!configFile.exists()) {
            log.warn("Settings file not found: {}, using defaults", configPath);
            return CompilerSettings.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            CompilerSettings settings = mapper.readValue(configFile, CompilerSettings.class);
            log.info("Loaded settings from: {}", configPath);
            return settings == null ? CompilerSettings.defaults() : settings;
        } catch (IOException e) {
            log.error("Failed to load settings from {}: {}, using defaults", configPath, e.getMessage());
            return CompilerSettings.defaults();
        }
    }

    private void applyEnvironmentVariables(CompilerSettings settings) {
        applyNumber("LOGQUERY_DEFAULT_LIMIT", environment.get("LOGQUERY_DEFAULT_LIMIT"), settings::setDefaultLimit);
        applyNumber("LOGQUERY_MAX_LIMIT", environment.get("LOGQUERY_MAX_LIMIT"), settings::setMaxLimit);

        if (environment.containsKey("LOGQUERY_TIMESTAMP_FIELD")) {
            settings.setTimestampField(environment.get("LOGQUERY_TIMESTAMP_FIELD"));
        }
        if (environment.containsKey("LOGQUERY_TABLE")) {
            settings.setDefaultTable(environment.get("LOGQUERY_TABLE"));
        }
    }

    private void applyCLIArguments(CompilerSettings settings, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--settings.default-limit" -> applyNumber(arg, value, settings::setDefaultLimit);
                case "--settings.max-limit" -> applyNumber(arg, value, settings::setMaxLimit);
                case "--settings.timestamp-field" -> settings.setTimestampField(value);
                case "--settings.table" -> settings.setDefaultTable(value);
                default -> {
                }
            }
        }
    }

    private void applyNumber(String source, String value, LongConsumer setter) {
        if (value == null) {
            return;
        }
        try {
            setter.accept(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --settings.default-limit <num>    Row limit when a request sets none (default: 100)
              --settings.max-limit <num>        Largest limit a request may ask for (default: 100000)
              --settings.timestamp-field <col>  Column used for time ranges (default: timestamp)
              --settings.table <db.table>       Table used when --table is not given

            Environment Variables:
              LOGQUERY_DEFAULT_LIMIT            Same as --settings.default-limit
              LOGQUERY_MAX_LIMIT                Same as --settings.max-limit
              LOGQUERY_TIMESTAMP_FIELD          Same as --settings.timestamp-field
              LOGQUERY_TABLE                    Same as --settings.table

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file (--config)
              4. Built-in defaults
            """;
    }
}
