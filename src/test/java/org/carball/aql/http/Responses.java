package org.carball.aql.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Canned server responses for exercising response handlers.
 */
public final class Responses {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Responses() {
    }

    public static Response ok(String json) {
        return Response.builder()
                .method(HttpMethod.GET)
                .url("http://localhost:8529/_db/_system")
                .statusCode(200)
                .statusText("OK")
                .body(parse(json))
                .build();
    }

    public static Response created(String json) {
        return ok(json).toBuilder().statusCode(201).statusText("Created").build();
    }

    public static Response error(int status, int errorNum, String message) {
        String json = String.format("{\"error\":true,\"code\":%d,\"errorNum\":%d,\"errorMessage\":\"%s\"}",
                status, errorNum, message);
        return Response.builder()
                .method(HttpMethod.GET)
                .url("http://localhost:8529/_db/_system")
                .statusCode(status)
                .statusText("Error")
                .body(parse(json))
                .errorCode(errorNum)
                .errorMessage(message)
                .build();
    }

    public static JsonNode parse(String json) {
        if (json == null) {
            return NullNode.getInstance();
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test JSON: " + json, e);
        }
    }
}
