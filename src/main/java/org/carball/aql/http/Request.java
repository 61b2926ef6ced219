package org.carball.aql.http;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Describes a single call against the server: HTTP method, endpoint relative to the
 * database, query parameters and JSON body.
 * <p>
 * Two fields only matter in transaction mode: {@code command} is the server-side script
 * run in place of the HTTP call, and {@code read}/{@code write} are the collections the
 * script declares. Neither is ever sent as part of the HTTP body.
 */
@Value
@Builder
public class Request {

    HttpMethod method;

    String endpoint;

    @Singular
    Map<String, String> params;

    JsonNode data;

    String command;

    List<String> read;

    List<String> write;

    public boolean hasCommand() {
        return command != null && !command.isBlank();
    }
}
