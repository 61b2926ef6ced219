package org.carball.aql.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Data
@Builder(toBuilder = true)
@Slf4j
public class ClientConfig {

    // Server location
    @Builder.Default
    private String host = "http://127.0.0.1:8529";

    @Builder.Default
    private String database = "_system";

    // Credentials
    @Builder.Default
    private String username = "root";

    @Builder.Default
    @ToString.Exclude
    private String password = "";

    // Transport timeouts
    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private Duration readTimeout = Duration.ofSeconds(60);

    // Transactions; zero leaves the lock timeout to the server
    @Builder.Default
    private Duration transactionLockTimeout = Duration.ZERO;

    /**
     * Creates a configuration pointing at a local server with the default credentials.
     */
    public static ClientConfig defaults() {
        return ClientConfig.builder().build();
    }

    /**
     * Validates the configuration. Missing connection coordinates are rejected; odd
     * timeout values are only logged.
     */
    public void validate() {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Server host must not be blank");
        }
        if (!host.startsWith("http://") && !host.startsWith("https://")) {
            throw new IllegalArgumentException("Server host must be an http or https URL: " + host);
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Database name must not be blank");
        }

        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            log.warn("Connect timeout ({}) should be positive, requests may hang on unreachable hosts",
                    connectTimeout);
        }

        if (readTimeout == null || readTimeout.isNegative()) {
            log.warn("Read timeout ({}) should not be negative", readTimeout);
        } else if (readTimeout.compareTo(connectTimeout == null ? Duration.ZERO : connectTimeout) < 0) {
            log.warn("Read timeout ({}) is shorter than connect timeout ({})", readTimeout, connectTimeout);
        }

        if (transactionLockTimeout != null && transactionLockTimeout.isNegative()) {
            log.warn("Transaction lock timeout ({}) should not be negative", transactionLockTimeout);
        }

        if (username == null || username.isBlank()) {
            log.warn("No username configured, requests will be sent without authentication");
        }
    }

    /**
     * Gets a one-line summary of the configuration without credentials.
     */
    public String getConfigurationSummary() {
        return String.format("host=%s, database=%s, user=%s, connectTimeout=%s, readTimeout=%s",
                host, database, username, connectTimeout, readTimeout);
    }
}
