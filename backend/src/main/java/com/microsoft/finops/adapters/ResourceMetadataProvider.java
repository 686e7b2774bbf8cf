package com.microsoft.finops.adapters;

import com.microsoft.finops.domain.model.CloudProvider;

import java.util.Optional;

/**
 * Lookup of resource inventory metadata. Empty when the resource is unknown.
 * Resource ids are only unique within a cloud.
 */
public interface ResourceMetadataProvider {

    Optional<ResourceMetadata> lookup(CloudProvider cloud, String resourceId);
}
