package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to list running or slow queries.
 */
public class QueryListException extends AqlServerException {

    public QueryListException(Response response, Request request) {
        super(response, request);
    }
}
