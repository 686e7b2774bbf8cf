package com.microsoft.finops.exception;

import com.microsoft.finops.domain.model.CloudProvider;

public class SourceUnavailableException extends SourceException {

    public SourceUnavailableException(CloudProvider cloud, String message) {
        super(cloud, message);
    }

    public SourceUnavailableException(CloudProvider cloud, String message, Throwable cause) {
        super(cloud, message, cause);
    }
}
