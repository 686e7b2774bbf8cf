package com.microsoft.finops.exception;

/**
 * Invalid configuration rejected when it is saved, so it never reaches evaluation.
 */
public class ConfigurationException extends FinOpsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
