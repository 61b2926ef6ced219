package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to read the query results cache properties.
 */
public class CachePropertiesException extends AqlServerException {

    public CachePropertiesException(Response response, Request request) {
        super(response, request);
    }
}
