package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to parse and validate a query.
 */
public class QueryValidateException extends AqlServerException {

    public QueryValidateException(Response response, Request request) {
        super(response, request);
    }
}
