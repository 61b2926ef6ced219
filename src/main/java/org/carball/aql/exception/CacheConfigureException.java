package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to change the query results cache properties.
 */
public class CacheConfigureException extends AqlServerException {

    public CacheConfigureException(Response response, Request request) {
        super(response, request);
    }
}
