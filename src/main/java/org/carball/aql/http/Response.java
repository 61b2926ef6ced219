package org.carball.aql.http;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Server response normalized for the response handlers: status, parsed JSON body and,
 * when the server reported one, its error number and message.
 */
@Value
@Builder(toBuilder = true)
public class Response {

    HttpMethod method;

    String url;

    int statusCode;

    String statusText;

    JsonNode body;

    Integer errorCode;

    String errorMessage;

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Looks up the server error number among the codes this client knows about.
     */
    public ErrorCode getKnownErrorCode() {
        return ErrorCode.fromCode(errorCode);
    }
}
