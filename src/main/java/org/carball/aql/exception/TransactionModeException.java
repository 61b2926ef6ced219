package org.carball.aql.exception;

/**
 * Raised when a request that has no server-side script equivalent is issued inside a
 * transaction.
 */
public class TransactionModeException extends AqlClientException {

    public TransactionModeException(String message) {
        super(message);
    }
}
