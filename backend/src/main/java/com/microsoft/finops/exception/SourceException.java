package com.microsoft.finops.exception;

import com.microsoft.finops.domain.model.CloudProvider;

/**
 * An ingestion adapter could not deliver billing data. Always retryable; data
 * committed by earlier batches stays authoritative.
 */
public class SourceException extends FinOpsException {

    private final CloudProvider cloud;

    public SourceException(CloudProvider cloud, String message) {
        super(message);
        this.cloud = cloud;
    }

    public SourceException(CloudProvider cloud, String message, Throwable cause) {
        super(message, cause);
        this.cloud = cloud;
    }

    public CloudProvider getCloud() {
        return cloud;
    }
}
