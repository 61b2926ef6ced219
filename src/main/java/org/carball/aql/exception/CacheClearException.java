package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to clear the query results cache.
 */
public class CacheClearException extends AqlServerException {

    public CacheClearException(Response response, Request request) {
        super(response, request);
    }
}
