package org.carball.aql.cli;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.carball.aql.model.cache.CacheMode;
import org.carball.aql.model.cache.CacheProperties;
import org.carball.aql.model.query.ExplainOptions;
import org.carball.aql.model.query.QueryOptions;
import org.carball.aql.model.query.TrackingProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AqlCLITest {

    private MockWebServer server;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseCommandArgumentsOptionsAndFlags() {
        // Given
        String[] args = {"execute", "FOR u IN users FILTER u.age > @age RETURN u",
                "--bind", "age=21", "--bind", "name=ann", "--count", "--batch-size", "10"};

        // When
        AqlCLI.CliCommand command = AqlCLI.parseArgs(args);

        // Then
        assertThat(command.name()).isEqualTo("execute");
        assertThat(command.arguments()).containsExactly("FOR u IN users FILTER u.age > @age RETURN u");
        assertThat(command.optionValues("--bind")).containsExactly("age=21", "name=ann");
        assertThat(command.option("--batch-size")).isEqualTo("10");
        assertThat(command.flag("--count")).isTrue();
        assertThat(command.flag("--profile")).isFalse();
    }

    @Test
    void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> AqlCLI.parseArgs(new String[]{"queries", "--colour", "red"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --colour");
    }

    @Test
    void shouldRejectOptionWithoutValue() {
        assertThatThrownBy(() -> AqlCLI.parseArgs(new String[]{"execute", "RETURN 1", "--ttl"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Value for --ttl not specified");
    }

    @Test
    void shouldBuildQueryOptions() {
        // Given
        AqlCLI.CliCommand command = AqlCLI.parseArgs(new String[]{"execute", "RETURN @x",
                "--bind", "x={\"a\": [1, 2]}", "--bind", "label=plain text",
                "--ttl", "30", "--full-count", "--rules", "-all, +use-indexes", "--write", "logs"});

        // When
        QueryOptions options = AqlCLI.buildQueryOptions(command);

        // Then
        assertThat(options.getCount()).isFalse();
        assertThat(options.getTtl()).isEqualTo(30);
        assertThat(options.getFullCount()).isTrue();
        assertThat(options.getProfile()).isNull();
        assertThat(options.getOptimizerRules()).containsExactly("-all", "+use-indexes");
        assertThat(options.getWriteCollections()).containsExactly("logs");
        assertThat(options.getReadCollections()).isNull();
        assertThat(options.getBindVars()).containsEntry("label", "plain text");
        assertThat(options.getBindVars().get("x")).isInstanceOf(java.util.Map.class);
    }

    @Test
    void shouldRejectNonNumericOptionValues() {
        // Given
        AqlCLI.CliCommand command = AqlCLI.parseArgs(new String[]{"execute", "RETURN 1", "--batch-size", "lots"});

        // When/Then
        assertThatThrownBy(() -> AqlCLI.buildQueryOptions(command))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid numeric value for --batch-size: lots");
    }

    @Test
    void shouldBuildExplainOptions() {
        // Given
        AqlCLI.CliCommand command = AqlCLI.parseArgs(new String[]{"explain", "RETURN 1", "--all-plans", "--max-plans", "3"});

        // When
        ExplainOptions options = AqlCLI.buildExplainOptions(command);

        // Then
        assertThat(options.isAllPlans()).isTrue();
        assertThat(options.getMaxPlans()).isEqualTo(3);
        assertThat(options.getOptimizerRules()).isNull();
    }

    @Test
    void shouldBuildPartialUpdates() {
        // Given
        AqlCLI.CliCommand tracking = AqlCLI.parseArgs(new String[]{"set-tracking", "--max-slow-queries", "64"});
        AqlCLI.CliCommand cache = AqlCLI.parseArgs(new String[]{"cache-configure", "--mode", "DEMAND"});

        // When
        TrackingProperties trackingUpdate = AqlCLI.buildTrackingUpdate(tracking);
        CacheProperties cacheUpdate = AqlCLI.buildCacheUpdate(cache);

        // Then
        assertThat(trackingUpdate.getMaxSlowQueries()).isEqualTo(64);
        assertThat(trackingUpdate.getEnabled()).isNull();
        assertThat(trackingUpdate.getSlowQueryThreshold()).isNull();
        assertThat(cacheUpdate.getMode()).isEqualTo(CacheMode.DEMAND);
        assertThat(cacheUpdate.getLimit()).isNull();
    }

    @Test
    void shouldPrintUsageWithoutArguments() {
        // When
        int exitCode = AqlCLI.run(new String[0], print(out), print(err));

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(text(out)).contains("Usage:").contains("Connection Configuration Options:");
    }

    @Test
    void shouldPrintUsageOnHelp() {
        // When
        int exitCode = AqlCLI.run(new String[]{"--help"}, print(out), print(err));

        // Then
        assertThat(exitCode).isZero();
        assertThat(text(out)).contains("cache-configure");
    }

    @Test
    void shouldPrintRunningQueries() throws Exception {
        // Given
        server.enqueue(json(200, """
                [{"id": "12", "database": "_system", "user": "root", "query": "FOR d IN docs RETURN d",
                  "bindVars": {}, "started": "2024-01-01T10:00:00Z", "runTime": 1.5, "state": "executing", "stream": false}]
                """));

        // When
        int exitCode = AqlCLI.run(new String[]{"queries", "--host", host()}, print(out), print(err));

        // Then
        assertThat(exitCode).isZero();
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/_db/_system/_api/query/current");
        assertThat(text(out)).contains("\"id\" : \"12\"").contains("\"state\" : \"executing\"");
    }

    @Test
    void shouldPrintFalseForMissingFunctionWhenIgnored() throws Exception {
        // Given
        server.enqueue(json(404, """
                {"error": true, "code": 404, "errorNum": 1582, "errorMessage": "user function 'geo::distance' not found"}
                """));

        // When
        int exitCode = AqlCLI.run(new String[]{"delete-function", "geo::distance", "--ignore-missing",
                "--host", host(), "--database", "maps"}, print(out), print(err));

        // Then
        assertThat(exitCode).isZero();
        assertThat(text(out).trim()).isEqualTo("false");
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/_db/maps/_api/aqlfunction/geo::distance?group=false");
    }

    @Test
    void shouldReportServerErrors() {
        // Given
        server.enqueue(json(400, """
                {"error": true, "code": 400, "errorNum": 1501, "errorMessage": "syntax error, unexpected end of query string"}
                """));

        // When
        int exitCode = AqlCLI.run(new String[]{"validate", "FOR", "--host", host()}, print(out), print(err));

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(text(err)).contains("Server error: [HTTP 400][ERR 1501] syntax error");
    }

    @Test
    void shouldReportUnknownCommand() {
        // When
        int exitCode = AqlCLI.run(new String[]{"drop-database", "--host", host()}, print(out), print(err));

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(text(err)).contains("Unknown command: drop-database");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldRunExecuteAsTransactionWhenCollectionsGiven() throws Exception {
        // Given
        server.enqueue(json(200, "{\"error\": false, \"code\": 200, \"result\": [7]}"));

        // When
        int exitCode = AqlCLI.run(new String[]{"execute", "FOR l IN logs RETURN 7", "--read", "logs",
                "--host", host()}, print(out), print(err));

        // Then
        assertThat(exitCode).isZero();
        assertThat(server.takeRequest().getPath()).isEqualTo("/_db/_system/_api/transaction");
        assertThat(text(out)).contains("7");
    }

    private String host() {
        return "http://" + server.getHostName() + ":" + server.getPort();
    }

    private static PrintStream print(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private static String text(ByteArrayOutputStream buffer) {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
