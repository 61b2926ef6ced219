package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to execute a query or to create its cursor.
 */
public class QueryExecuteException extends AqlServerException {

    public QueryExecuteException(Response response, Request request) {
        super(response, request);
    }
}
