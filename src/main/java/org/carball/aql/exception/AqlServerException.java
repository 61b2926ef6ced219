package org.carball.aql.exception;

import lombok.Getter;
import org.carball.aql.http.ErrorCode;
import org.carball.aql.http.HttpMethod;
import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Base class for failures reported by the server. Keeps the failing response together
 * with the request that produced it so callers can diagnose what was sent.
 */
@Getter
public abstract class AqlServerException extends RuntimeException {

    private final transient Response response;
    private final transient Request request;
    private final int httpStatus;
    private final Integer errorCode;
    private final String errorMessage;

    protected AqlServerException(Response response, Request request) {
        super(formatMessage(response));
        this.response = response;
        this.request = request;
        this.httpStatus = response.getStatusCode();
        this.errorCode = response.getErrorCode();
        this.errorMessage = describe(response);
    }

    public ErrorCode getKnownErrorCode() {
        return ErrorCode.fromCode(errorCode);
    }

    public HttpMethod getHttpMethod() {
        return response.getMethod();
    }

    public String getUrl() {
        return response.getUrl();
    }

    private static String formatMessage(Response response) {
        StringBuilder message = new StringBuilder();
        message.append("[HTTP ").append(response.getStatusCode()).append(']');
        if (response.getErrorCode() != null) {
            message.append("[ERR ").append(response.getErrorCode()).append(']');
        }
        message.append(' ').append(describe(response));
        return message.toString();
    }

    private static String describe(Response response) {
        if (response.getErrorMessage() != null && !response.getErrorMessage().isBlank()) {
            return response.getErrorMessage();
        }
        ErrorCode known = response.getKnownErrorCode();
        if (known != ErrorCode.UNKNOWN) {
            return known.getDescription();
        }
        if (response.getStatusText() != null && !response.getStatusText().isBlank()) {
            return response.getStatusText();
        }
        return "request failed";
    }
}
