package org.carball.aql.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.RequestBody;
import okhttp3.ResponseBody;
import org.carball.aql.config.ClientConfig;
import org.carball.aql.exception.AqlClientException;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * HTTP connection to a single database. Requests are resolved against
 * {@code <host>/_db/<database>} and exchanged as JSON.
 */
@Slf4j
public class Connection implements Closeable {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String authorization;

    @Getter
    private final String databaseName;

    @Getter
    private final ObjectMapper objectMapper;

    public Connection(ClientConfig config) {
        this(config, new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeout())
                .readTimeout(config.getReadTimeout())
                .build());
    }

    public Connection(ClientConfig config, OkHttpClient httpClient) {
        HttpUrl host = HttpUrl.parse(config.getHost());
        if (host == null) {
            throw new IllegalArgumentException("Invalid server host: " + config.getHost());
        }
        this.httpClient = httpClient;
        this.databaseName = config.getDatabase();
        this.baseUrl = host.newBuilder()
                .addPathSegment("_db")
                .addPathSegment(config.getDatabase())
                .build();
        this.authorization = config.getUsername() == null || config.getUsername().isBlank()
                ? null
                : Credentials.basic(config.getUsername(), config.getPassword() == null ? "" : config.getPassword());

        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Sends the request and returns the server's answer, whatever its status. Only
     * failures to reach the server or to read its answer are thrown.
     */
    public Response send(Request request) {
        HttpUrl url = resolve(request);
        okhttp3.Request.Builder builder = new okhttp3.Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .method(request.getMethod().name(), encodeBody(request));
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }

        log.debug("Sending {} {}", request.getMethod(), url);

        try (okhttp3.Response httpResponse = httpClient.newCall(builder.build()).execute()) {
            ResponseBody responseBody = httpResponse.body();
            String raw = responseBody == null ? "" : responseBody.string();
            JsonNode body = parseBody(raw);

            Response.ResponseBuilder response = Response.builder()
                    .method(request.getMethod())
                    .url(url.toString())
                    .statusCode(httpResponse.code())
                    .statusText(httpResponse.message())
                    .body(body);
            if (body.isObject() && body.hasNonNull("errorNum")) {
                response.errorCode(body.get("errorNum").asInt());
                response.errorMessage(body.path("errorMessage").asText(null));
            }

            log.debug("Received HTTP {} from {} ({} characters)", httpResponse.code(), url, raw.length());
            return response.build();
        } catch (IOException e) {
            throw new AqlClientException("Request " + request.getMethod() + " " + url + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a value with this connection's mapper.
     */
    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AqlClientException("Unable to serialize value to JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        log.debug("Closed connection to database {}", databaseName);
    }

    HttpUrl resolve(Request request) {
        HttpUrl.Builder url = baseUrl.newBuilder();
        String endpoint = request.getEndpoint();
        if (endpoint.startsWith("/")) {
            endpoint = endpoint.substring(1);
        }
        url.addPathSegments(endpoint);
        for (Map.Entry<String, String> param : request.getParams().entrySet()) {
            url.addQueryParameter(param.getKey(), param.getValue());
        }
        return url.build();
    }

    private RequestBody encodeBody(Request request) {
        HttpMethod method = request.getMethod();
        if (request.getData() == null) {
            // OkHttp insists on a body for these methods
            if (method == HttpMethod.POST || method == HttpMethod.PUT) {
                return RequestBody.create("", JSON);
            }
            return null;
        }
        String json = toJson(request.getData());
        log.trace("Request body: {}", json);
        return RequestBody.create(json, JSON);
    }

    private JsonNode parseBody(String raw) {
        if (raw.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON: {}", e.getMessage());
            return TextNode.valueOf(raw);
        }
    }
}
