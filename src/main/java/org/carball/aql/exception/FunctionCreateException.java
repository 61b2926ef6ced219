package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to create or replace a user-defined function.
 */
public class FunctionCreateException extends AqlServerException {

    public FunctionCreateException(Response response, Request request) {
        super(response, request);
    }
}
