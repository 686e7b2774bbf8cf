package com.microsoft.finops.exception;

public class NotFoundException extends FinOpsException {

    public NotFoundException(String entity, Object id) {
        super(entity + " not found: " + id);
    }
}
