package com.adlanda.contextassembler.exception;

/**
 * Base class for all errors raised by the context assembly pipeline.
 */
public abstract class AssemblerException extends RuntimeException {

    protected AssemblerException(String message) {
        super(message);
    }

    protected AssemblerException(String message, Throwable cause) {
        super(message, cause);
    }
}
