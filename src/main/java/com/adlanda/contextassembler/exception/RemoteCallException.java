package com.adlanda.contextassembler.exception;

/**
 * A call to a remote model service failed.
 */
public abstract class RemoteCallException extends AssemblerException {

    private final Integer statusCode;

    protected RemoteCallException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status reported by the service, or null when none was available.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
