package com.adlanda.contextassembler.exception;

/**
 * Auth, request-structure or otherwise unrecoverable remote failure. Never retried.
 */
public class RemoteFatalException extends RemoteCallException {

    public RemoteFatalException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    public RemoteFatalException(String message) {
        super(message, null, null);
    }
}
