package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to update the query tracking properties.
 */
public class QueryTrackingSetException extends AqlServerException {

    public QueryTrackingSetException(Response response, Request request) {
        super(response, request);
    }
}
