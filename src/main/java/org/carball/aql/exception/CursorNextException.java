package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to fetch the next batch of a cursor.
 */
public class CursorNextException extends AqlServerException {

    public CursorNextException(Response response, Request request) {
        super(response, request);
    }
}
