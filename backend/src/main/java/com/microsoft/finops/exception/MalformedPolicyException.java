package com.microsoft.finops.exception;

public class MalformedPolicyException extends ConfigurationException {

    public MalformedPolicyException(String message) {
        super(message);
    }

    public MalformedPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
