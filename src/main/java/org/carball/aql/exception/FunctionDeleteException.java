package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to delete a user-defined function or function group.
 */
public class FunctionDeleteException extends AqlServerException {

    public FunctionDeleteException(Response response, Request request) {
        super(response, request);
    }
}
