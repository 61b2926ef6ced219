package org.carball.aql.http;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE
}
