package com.microsoft.finops.normalization;

import com.microsoft.finops.domain.model.CloudProvider;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes cloud provider regions to a canonical format.
 *
 * Each cloud provider uses different naming conventions for regions:
 * - Azure: "East US", "West Europe"
 * - AWS: "us-east-1", "eu-west-1"
 * - GCP: "us-east1", "europe-west1"
 *
 * Canonical names follow the AWS style ({area}-{direction}-{number}) so that
 * region scopes and governance region allow-lists read the same for every cloud.
 * Unknown regions pass through lower-cased; OTHER is never mapped.
 */
@Component
public class RegionNormalizer {

    private static final Map<String, String> AZURE_TO_CANONICAL = Map.ofEntries(
            Map.entry("eastus", "us-east-1"),
            Map.entry("eastus2", "us-east-2"),
            Map.entry("westus", "us-west-1"),
            Map.entry("westus2", "us-west-2"),
            Map.entry("centralus", "us-central-1"),
            Map.entry("westeurope", "eu-west-1"),
            Map.entry("northeurope", "eu-north-1"),
            Map.entry("uksouth", "eu-west-2"),
            Map.entry("francecentral", "eu-west-3"),
            Map.entry("germanywestcentral", "eu-central-1"),
            Map.entry("southeastasia", "ap-southeast-1"),
            Map.entry("australiaeast", "ap-southeast-2"),
            Map.entry("japaneast", "ap-northeast-1"),
            Map.entry("koreacentral", "ap-northeast-2"),
            Map.entry("centralindia", "ap-south-1"),
            Map.entry("brazilsouth", "sa-east-1"),
            Map.entry("canadacentral", "ca-central-1")
    );

    private static final Map<String, String> GCP_TO_CANONICAL = Map.ofEntries(
            Map.entry("us-east1", "us-east-1"),
            Map.entry("us-east4", "us-east-2"),
            Map.entry("us-west1", "us-west-2"),
            Map.entry("us-west2", "us-west-1"),
            Map.entry("us-central1", "us-central-1"),
            Map.entry("europe-west1", "eu-west-1"),
            Map.entry("europe-west2", "eu-west-2"),
            Map.entry("europe-west3", "eu-central-1"),
            Map.entry("europe-north1", "eu-north-1"),
            Map.entry("asia-southeast1", "ap-southeast-1"),
            Map.entry("australia-southeast1", "ap-southeast-2"),
            Map.entry("asia-northeast1", "ap-northeast-1"),
            Map.entry("asia-northeast3", "ap-northeast-2"),
            Map.entry("asia-south1", "ap-south-1"),
            Map.entry("southamerica-east1", "sa-east-1"),
            Map.entry("northamerica-northeast1", "ca-central-1")
    );

    /**
     * Convert provider-specific region to canonical format, null when absent.
     */
    public String toCanonicalRegion(CloudProvider provider, String providerRegion) {
        if (providerRegion == null || providerRegion.isBlank()) {
            return null;
        }

        String lower = providerRegion.trim().toLowerCase(Locale.ROOT);

        return switch (provider) {
            case AZURE -> AZURE_TO_CANONICAL.getOrDefault(lower.replace(" ", "").replace("-", ""), lower);
            case GCP -> GCP_TO_CANONICAL.getOrDefault(lower, lower);
            case AWS, OTHER -> lower;
        };
    }
}
