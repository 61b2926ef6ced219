package org.carball.aql.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.Credentials;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.carball.aql.config.ClientConfig;
import org.carball.aql.exception.AqlClientException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    private MockWebServer server;
    private Connection connection;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        connection = new Connection(ClientConfig.builder()
                .host("http://" + server.getHostName() + ":" + server.getPort())
                .database("shop")
                .username("app")
                .password("secret")
                .build());
    }

    @AfterEach
    void tearDown() throws IOException {
        connection.close();
        server.shutdown();
    }

    @Test
    void shouldResolveEndpointAgainstDatabase() throws Exception {
        // Given
        server.enqueue(json(200, "{\"result\": []}"));

        // When
        connection.send(Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/aqlfunction/geo")
                .param("group", "true")
                .build());

        // Then
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("DELETE");
        assertThat(recorded.getPath()).isEqualTo("/_db/shop/_api/aqlfunction/geo?group=true");
        assertThat(recorded.getHeader("Authorization")).isEqualTo(Credentials.basic("app", "secret"));
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void shouldSendJsonBody() throws Exception {
        // Given
        server.enqueue(json(201, "{\"id\": \"1\", \"result\": [1], \"hasMore\": false}"));
        ObjectNode data = connection.getObjectMapper().createObjectNode();
        data.put("query", "RETURN 1");
        data.put("count", false);

        // When
        Response response = connection.send(Request.builder()
                .method(HttpMethod.POST)
                .endpoint("/_api/cursor")
                .data(data)
                .build());

        // Then
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"query\":\"RETURN 1\",\"count\":false}");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getStatusCode()).isEqualTo(201);
        assertThat(response.getBody().get("result").get(0).asInt()).isEqualTo(1);
        assertThat(response.getErrorCode()).isNull();
        assertThat(response.getMethod()).isEqualTo(HttpMethod.POST);
    }

    @Test
    void shouldExtractServerErrorNumber() {
        // Given
        server.enqueue(json(404, """
            {"error": true, "code": 404, "errorNum": 1582, "errorMessage": "user function 'x::y()' not found"}
            """));

        // When
        Response response = connection.send(Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/aqlfunction/x::y")
                .param("group", "false")
                .build());

        // Then
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorCode()).isEqualTo(1582);
        assertThat(response.getKnownErrorCode()).isEqualTo(ErrorCode.QUERY_FUNCTION_NOT_FOUND);
        assertThat(response.getErrorMessage()).isEqualTo("user function 'x::y()' not found");
    }

    @Test
    void shouldKeepNonJsonBodyAsText() {
        // Given
        server.enqueue(new MockResponse().setResponseCode(502).setBody("<html>Bad Gateway</html>"));

        // When
        Response response = connection.send(Request.builder()
                .method(HttpMethod.GET)
                .endpoint("/_api/query/current")
                .build());

        // Then
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getBody().asText()).isEqualTo("<html>Bad Gateway</html>");
        assertThat(response.getErrorCode()).isNull();
    }

    @Test
    void shouldTreatEmptyBodyAsNull() {
        // Given
        server.enqueue(new MockResponse().setResponseCode(204));

        // When
        Response response = connection.send(Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/query-cache")
                .build());

        // Then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getBody().isNull()).isTrue();
    }

    @Test
    void shouldWrapTransportFailures() throws IOException {
        // Given
        server.shutdown();

        // When/Then
        assertThatThrownBy(() -> connection.send(Request.builder()
                .method(HttpMethod.GET)
                .endpoint("/_api/query/properties")
                .build()))
                .isInstanceOf(AqlClientException.class)
                .hasMessageContaining("GET")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldSkipAuthorizationWithoutUsername() throws Exception {
        // Given
        Connection anonymous = new Connection(ClientConfig.builder()
                .host("http://" + server.getHostName() + ":" + server.getPort())
                .username("")
                .build());
        server.enqueue(json(200, "{}"));

        // When
        anonymous.send(Request.builder().method(HttpMethod.GET).endpoint("/_api/query/properties").build());

        // Then
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getHeader("Authorization")).isNull();
        assertThat(recorded.getPath()).isEqualTo("/_db/_system/_api/query/properties");
        anonymous.close();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
