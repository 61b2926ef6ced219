package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to clear the list of slow queries.
 */
public class QueryClearException extends AqlServerException {

    public QueryClearException(Response response, Request request) {
        super(response, request);
    }
}
