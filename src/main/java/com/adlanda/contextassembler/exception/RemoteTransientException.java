package com.adlanda.contextassembler.exception;

/**
 * The remote service signalled rate limiting. Safe to retry after a delay.
 */
public class RemoteTransientException extends RemoteCallException {

    public RemoteTransientException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
