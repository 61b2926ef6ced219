package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to delete a cursor on the server.
 */
public class CursorCloseException extends AqlServerException {

    public CursorCloseException(Response response, Request request) {
        super(response, request);
    }
}
