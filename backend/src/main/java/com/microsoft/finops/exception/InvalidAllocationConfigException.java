package com.microsoft.finops.exception;

public class InvalidAllocationConfigException extends ConfigurationException {

    public InvalidAllocationConfigException(String message) {
        super(message);
    }
}
