package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to list the user-defined functions.
 */
public class FunctionListException extends AqlServerException {

    public FunctionListException(Response response, Request request) {
        super(response, request);
    }
}
