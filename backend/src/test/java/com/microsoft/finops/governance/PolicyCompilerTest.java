package com.microsoft.finops.governance;

import com.microsoft.finops.adapters.ResourceMetadata;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.domain.model.PolicyType;
import com.microsoft.finops.domain.model.Severity;
import com.microsoft.finops.exception.MalformedPolicyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyCompilerTest {

    private final PolicyCompiler compiler = new PolicyCompiler();

    private static Policy policy(PolicyType type, Map<String, String> parameters) {
        return Policy.builder()
                .name("test-policy")
                .type(type)
                .severity(Severity.MEDIUM)
                .parameters(new HashMap<>(parameters))
                .build();
    }

    private static ResourceFacts facts(String region, Map<String, String> tags, long spend,
                                       ResourceMetadata metadata) {
        return new ResourceFacts("resource:AWS:i-1", CloudProvider.AWS, "A1", "i-1",
                new TreeSet<>(List.of("EC2")),
                region == null ? new TreeSet<>() : new TreeSet<>(List.of(region)),
                new TreeMap<>(tags), spend, Optional.ofNullable(metadata));
    }

    @Nested
    @DisplayName("Malformed Policy Tests")
    class MalformedPolicyTests {

        @Test
        @DisplayName("Should reject a policy missing a required parameter")
        void shouldRejectMissingParameter() {
            assertThatThrownBy(() -> compiler.compile(policy(PolicyType.RESOURCE_ATTRIBUTE_MATCH,
                    Map.of("attribute", "gpu_present", "operator", "EQUALS"))))
                    .isInstanceOf(MalformedPolicyException.class)
                    .hasMessageContaining("'value'");
        }

        @Test
        @DisplayName("Should reject an unknown operator")
        void shouldRejectUnknownOperator() {
            assertThatThrownBy(() -> compiler.compile(policy(PolicyType.RESOURCE_ATTRIBUTE_MATCH,
                    Map.of("attribute", "instance_type", "operator", "STARTS_WITH", "value", "p3"))))
                    .isInstanceOf(MalformedPolicyException.class)
                    .hasMessageContaining("STARTS_WITH");
        }

        @Test
        @DisplayName("Should reject an invalid regular expression")
        void shouldRejectInvalidPattern() {
            assertThatThrownBy(() -> compiler.compile(policy(PolicyType.RESOURCE_ATTRIBUTE_MATCH,
                    Map.of("attribute", "instance_type", "operator", "MATCHES", "value", "p3.(["))))
                    .isInstanceOf(MalformedPolicyException.class);
        }

        @Test
        @DisplayName("Should wrap an invalid scope")
        void shouldRejectInvalidScope() {
            Policy policy = policy(PolicyType.SPEND_THRESHOLD, Map.of("maxAmountMinorUnits", "1000"));
            policy.setScope("owner=bob");

            assertThatThrownBy(() -> compiler.compile(policy))
                    .isInstanceOf(MalformedPolicyException.class)
                    .hasMessageContaining("invalid scope");
        }

        @ParameterizedTest
        @ValueSource(strings = {"lots", "-1", "12.5"})
        @DisplayName("Should reject thresholds that are not non-negative integers")
        void shouldRejectBadThreshold(String max) {
            assertThatThrownBy(() -> compiler.compile(policy(PolicyType.SPEND_THRESHOLD,
                    Map.of("maxAmountMinorUnits", max))))
                    .isInstanceOf(MalformedPolicyException.class);
        }

        @Test
        @DisplayName("Should reject a whenTag without a value")
        void shouldRejectMalformedWhenTag() {
            assertThatThrownBy(() -> compiler.compile(policy(PolicyType.ALLOWED_REGIONS,
                    Map.of("regions", "us-east-1", "whenTag", "environment="))))
                    .isInstanceOf(MalformedPolicyException.class);
        }

        @Test
        @DisplayName("Should reject a tag policy with only separators")
        void shouldRejectEmptyTagList() {
            assertThatThrownBy(() -> compiler.compile(policy(PolicyType.TAG_PRESENCE,
                    Map.of("requiredTags", " , ,"))))
                    .isInstanceOf(MalformedPolicyException.class);
        }
    }

    @Nested
    @DisplayName("Predicate Tests")
    class PredicateTests {

        @Test
        @DisplayName("Should flag GPU instances through resource metadata")
        void shouldMatchGpuAttribute() {
            // Given
            CompiledPolicy compiled = compiler.compile(policy(PolicyType.RESOURCE_ATTRIBUTE_MATCH,
                    Map.of("attribute", "gpu_present", "operator", "EQUALS", "value", "true")));

            // When / Then
            assertThat(compiled.predicate().violation(facts("us-east-1", Map.of(), 100,
                    new ResourceMetadata("i-1", "p3.2xlarge", true, Map.of()))))
                    .contains("gpu_present is true");
            assertThat(compiled.predicate().violation(facts("us-east-1", Map.of(), 100,
                    new ResourceMetadata("i-1", "m5.large", false, Map.of()))))
                    .isEmpty();
            assertThat(compiled.predicate().violation(facts("us-east-1", Map.of(), 100, null)))
                    .isEmpty();
        }

        @Test
        @DisplayName("Should fall back to record fields for non-metadata attributes")
        void shouldMatchRecordAttribute() {
            CompiledPolicy compiled = compiler.compile(policy(PolicyType.RESOURCE_ATTRIBUTE_MATCH,
                    Map.of("attribute", "tag:team", "operator", "MATCHES", "value", "data.*")));

            assertThat(compiled.predicate().violation(facts(null, Map.of("team", "datascience"), 0, null)))
                    .isPresent();
        }

        @Test
        @DisplayName("Should only flag spend strictly above the threshold")
        void shouldFlagSpendAboveThreshold() {
            CompiledPolicy compiled = compiler.compile(policy(PolicyType.SPEND_THRESHOLD,
                    Map.of("maxAmountMinorUnits", "50000")));

            assertThat(compiled.predicate().violation(facts(null, Map.of(), 50_000, null))).isEmpty();
            assertThat(compiled.predicate().violation(facts(null, Map.of(), 50_001, null)))
                    .contains("spend 50001 exceeds 50000");
        }

        @Test
        @DisplayName("Should list every missing tag")
        void shouldListMissingTags() {
            CompiledPolicy compiled = compiler.compile(policy(PolicyType.TAG_PRESENCE,
                    Map.of("requiredTags", "team, Environment,cost_center")));

            assertThat(compiled.predicate().violation(facts(null, Map.of("team", "web"), 0, null)))
                    .contains("missing tags [environment, cost_center]");
        }

        @Test
        @DisplayName("Should check regions only for resources carrying the whenTag")
        void shouldRestrictRegionsWhenTagged() {
            CompiledPolicy compiled = compiler.compile(policy(PolicyType.ALLOWED_REGIONS,
                    Map.of("regions", "us-east-1,us-west-2", "whenTag", "environment=prod")));

            assertThat(compiled.predicate().violation(facts("eu-west-1", Map.of("environment", "prod"), 0, null)))
                    .contains("runs in unapproved regions [eu-west-1]");
            assertThat(compiled.predicate().violation(facts("eu-west-1", Map.of("environment", "dev"), 0, null)))
                    .isEmpty();
            assertThat(compiled.predicate().violation(facts("us-west-2", Map.of("environment", "prod"), 0, null)))
                    .isEmpty();
        }
    }
}
