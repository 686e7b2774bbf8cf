package com.microsoft.finops.exception;

import com.microsoft.finops.domain.model.CloudProvider;

/**
 * Credentials for the billing source were rejected or have expired.
 */
public class SourceAuthenticationException extends SourceException {

    public SourceAuthenticationException(CloudProvider cloud, String message) {
        super(cloud, message);
    }

    public SourceAuthenticationException(CloudProvider cloud, String message, Throwable cause) {
        super(cloud, message, cause);
    }
}
