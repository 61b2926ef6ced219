package org.carball.aql.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.registerModule(new JavaTimeModule());
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public ClientConfig loadConfiguration(String[] args) {
        log.debug("Loading client configuration");

        // Start with defaults
        ClientConfig.ClientConfigBuilder builder = ClientConfig.builder();

        // 1. Apply the YAML file, if one was named
        String configFile = findConfigFile(args);
        if (configFile != null) {
            applyConfigFile(builder, Paths.get(configFile));
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        ClientConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads a YAML configuration file on its own, without environment or CLI overrides.
     */
    public ClientConfig loadFile(Path path) {
        ClientConfig.ClientConfigBuilder builder = ClientConfig.builder();
        applyConfigFile(builder, path);
        ClientConfig config = builder.build();
        config.validate();
        return config;
    }

    private String findConfigFile(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return environment.get("AQL_CONFIG");
    }

    private void applyConfigFile(ClientConfig.ClientConfigBuilder builder, Path path) {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            log.warn("Configuration file {} is empty, using defaults", path);
            return;
        }

        if (root.hasNonNull("host")) {
            builder.host(root.get("host").asText());
        }
        if (root.hasNonNull("database")) {
            builder.database(root.get("database").asText());
        }
        if (root.hasNonNull("username")) {
            builder.username(root.get("username").asText());
        }
        if (root.hasNonNull("password")) {
            builder.password(root.get("password").asText());
        }
        if (root.hasNonNull("connect_timeout")) {
            builder.connectTimeout(readDuration(root.get("connect_timeout"), path));
        }
        if (root.hasNonNull("read_timeout")) {
            builder.readTimeout(readDuration(root.get("read_timeout"), path));
        }
        if (root.hasNonNull("transaction_lock_timeout")) {
            builder.transactionLockTimeout(readDuration(root.get("transaction_lock_timeout"), path));
        }

        log.info("Loaded client configuration from: {}", path);
    }

    private Duration readDuration(JsonNode node, Path path) {
        try {
            return yamlMapper.treeToValue(node, Duration.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid duration '" + node.asText() + "' in " + path, e);
        }
    }

    private void applyEnvironmentVariables(ClientConfig.ClientConfigBuilder builder) {
        if (environment.containsKey("AQL_HOST")) {
            builder.host(environment.get("AQL_HOST"));
        }
        if (environment.containsKey("AQL_DATABASE")) {
            builder.database(environment.get("AQL_DATABASE"));
        }
        if (environment.containsKey("AQL_USERNAME")) {
            builder.username(environment.get("AQL_USERNAME"));
        }
        if (environment.containsKey("AQL_PASSWORD")) {
            builder.password(environment.get("AQL_PASSWORD"));
        }
        try {
            if (environment.containsKey("AQL_CONNECT_TIMEOUT")) {
                builder.connectTimeout(Duration.ofSeconds(Long.parseLong(environment.get("AQL_CONNECT_TIMEOUT"))));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for AQL_CONNECT_TIMEOUT: {}", environment.get("AQL_CONNECT_TIMEOUT"));
        }
        try {
            if (environment.containsKey("AQL_READ_TIMEOUT")) {
                builder.readTimeout(Duration.ofSeconds(Long.parseLong(environment.get("AQL_READ_TIMEOUT"))));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for AQL_READ_TIMEOUT: {}", environment.get("AQL_READ_TIMEOUT"));
        }
    }

    private void applyCLIArguments(ClientConfig.ClientConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--host":
                        builder.host(value);
                        break;
                    case "--database":
                        builder.database(value);
                        break;
                    case "--username":
                        builder.username(value);
                        break;
                    case "--password":
                        builder.password(value);
                        break;
                    case "--connect-timeout":
                        builder.connectTimeout(Duration.ofSeconds(Long.parseLong(value)));
                        break;
                    case "--read-timeout":
                        builder.readTimeout(Duration.ofSeconds(Long.parseLong(value)));
                        break;
                    case "--lock-timeout":
                        builder.transactionLockTimeout(Duration.ofSeconds(Long.parseLong(value)));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for connection configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Connection Configuration Options:

            CLI Arguments:
              --host <url>                  Server URL (default: http://127.0.0.1:8529)
              --database <name>             Database name (default: _system)
              --username <name>             User name (default: root)
              --password <secret>           Password (default: empty)
              --connect-timeout <seconds>   Connect timeout (default: 10)
              --read-timeout <seconds>      Read timeout (default: 60)
              --lock-timeout <seconds>      Transaction lock timeout (default: server default)
              --config <file>               YAML file with the settings above

            Environment Variables:
              AQL_HOST                      Same as --host
              AQL_DATABASE                  Same as --database
              AQL_USERNAME                  Same as --username
              AQL_PASSWORD                  Same as --password
              AQL_CONNECT_TIMEOUT           Same as --connect-timeout
              AQL_READ_TIMEOUT              Same as --read-timeout
              AQL_CONFIG                    Same as --config

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML configuration file
              4. Built-in defaults
            """;
    }
}
