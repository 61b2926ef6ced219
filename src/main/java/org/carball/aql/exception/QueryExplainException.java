package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to explain a query.
 */
public class QueryExplainException extends AqlServerException {

    public QueryExplainException(Response response, Request request) {
        super(response, request);
    }
}
