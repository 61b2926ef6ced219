package org.carball.aql.exception;

import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

/**
 * Failed to send a kill signal to a running query.
 */
public class QueryKillException extends AqlServerException {

    public QueryKillException(Response response, Request request) {
        super(response, request);
    }
}
