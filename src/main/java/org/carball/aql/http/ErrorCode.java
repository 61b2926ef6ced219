package org.carball.aql.http;

import lombok.Getter;

/**
 * Server error numbers the client reacts to, or describes when the server sends no message.
 */
@Getter
public enum ErrorCode {

    COLLECTION_NOT_FOUND(1203, "collection or view not found"),
    QUERY_KILLED(1500, "query killed"),
    QUERY_PARSE(1501, "query parse error"),
    QUERY_EMPTY(1502, "query is empty"),
    QUERY_BIND_PARAMETER_MISSING(1551, "no value specified for declared bind parameter"),
    QUERY_FUNCTION_INVALID_NAME(1580, "invalid user function name"),
    QUERY_FUNCTION_INVALID_CODE(1581, "invalid user function code"),
    QUERY_FUNCTION_NOT_FOUND(1582, "user function not found"),
    QUERY_NOT_FOUND(1591, "query ID not found"),
    CURSOR_NOT_FOUND(1600, "cursor not found"),
    TRANSACTION_INTERNAL(1650, "internal transaction error"),
    UNKNOWN(-1, "unknown error");

    private final int code;
    private final String description;

    ErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public static ErrorCode fromCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN;
    }
}
