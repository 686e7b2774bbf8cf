package com.microsoft.finops.config;

import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.domain.model.PolicyStatus;
import com.microsoft.finops.domain.model.PolicyType;
import com.microsoft.finops.domain.model.Severity;
import com.microsoft.finops.domain.repository.PolicyRepository;
import com.microsoft.finops.governance.PolicyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads the default governance policies on startup.
 *
 * Only seeds data if the policy table is empty.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class PolicySeedLoader implements CommandLineRunner {

    private final PolicyRepository policyRepository;
    private final PolicyService policyService;
    private final FinOpsProperties properties;

    @Override
    @Transactional
    public void run(String... args) {
        if (!properties.getGovernance().isSeedDefaultPolicies()) {
            return;
        }
        if (policyRepository.count() > 0) {
            log.info("Policies already exist, skipping seed");
            return;
        }

        log.info("Seeding default governance policies...");

        policyService.save(policy(
                "No GPU instances",
                "GPU-backed instances are not allowed without an approved exception",
                PolicyType.RESOURCE_ATTRIBUTE_MATCH,
                Severity.HIGH,
                Map.of("attribute", "gpu_present",
                       "operator", "EQUALS",
                       "value", "true"),
                "Stop the instance or request an exception"));

        policyService.save(policy(
                "All resources must have cost allocation tags",
                "Spend must carry team, environment and cost center tags for chargeback",
                PolicyType.TAG_PRESENCE,
                Severity.MEDIUM,
                Map.of("requiredTags", "team,environment,cost_center"),
                "Add the missing tags to the resource"));

        policyService.save(policy(
                "Production resources restricted to approved regions",
                "Production workloads may only run in the approved US regions",
                PolicyType.ALLOWED_REGIONS,
                Severity.HIGH,
                Map.of("regions", "us-east-1,us-east-2,us-west-2",
                       "whenTag", "environment=prod"),
                "Migrate the resource to an approved region"));

        log.info("Seeded {} policies", policyRepository.count());
    }

    private static Policy policy(String name, String description, PolicyType type, Severity severity,
                                 Map<String, String> parameters, String actionHint) {
        return Policy.builder()
                .name(name)
                .description(description)
                .type(type)
                .severity(severity)
                .status(PolicyStatus.ACTIVE)
                .scope("")
                .parameters(new HashMap<>(parameters))
                .actionHint(actionHint)
                .build();
    }
}
