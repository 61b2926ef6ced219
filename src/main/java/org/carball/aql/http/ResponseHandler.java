package org.carball.aql.http;

/**
 * Turns a raw {@link Response} into the caller's result, or throws the operation's
 * exception when the response signals a failure.
 */
@FunctionalInterface
public interface ResponseHandler<T> {

    T handle(Response response);
}
