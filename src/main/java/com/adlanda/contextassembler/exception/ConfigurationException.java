package com.adlanda.contextassembler.exception;

/**
 * An invalid or missing configuration option. Always fatal.
 */
public class ConfigurationException extends AssemblerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
