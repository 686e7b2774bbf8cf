package com.microsoft.finops.exception;

public class InvalidScopeExpressionException extends ConfigurationException {

    public InvalidScopeExpressionException(String message) {
        super(message);
    }

    public InvalidScopeExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
