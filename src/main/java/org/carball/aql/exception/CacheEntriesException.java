package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to list the query results cache entries.
 */
public class CacheEntriesException extends AqlServerException {

    public CacheEntriesException(Response response, Request request) {
        super(response, request);
    }
}
