package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to read the query tracking properties.
 */
public class QueryTrackingGetException extends AqlServerException {

    public QueryTrackingGetException(Response response, Request request) {
        super(response, request);
    }
}
