package com.microsoft.finops.governance;

import com.microsoft.finops.adapters.ResourceMetadata;
import com.microsoft.finops.adapters.ResourceMetadataProvider;
import com.microsoft.finops.config.FinOpsProperties;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.domain.model.PolicyStatus;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.domain.model.Violation;
import com.microsoft.finops.domain.model.ViolationStatus;
import com.microsoft.finops.domain.repository.PolicyRepository;
import com.microsoft.finops.domain.repository.ViolationRepository;
import com.microsoft.finops.exception.ConfigurationException;
import com.microsoft.finops.scope.CostFilter;
import com.microsoft.finops.store.CostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Evaluates active policies against cost records joined with resource metadata.
 *
 * EVALUATION CYCLE:
 * 1. Window = the configured number of days up to the end of today (UTC)
 * 2. For every active policy, build one subject per resource (or per account for
 *    spend without a resource id) from the in-scope records
 * 3. A violating (policy, subject) pair creates an OPEN violation unless any
 *    violation for the pair already overlaps the window
 *
 * Each violation is saved on its own, so a cycle that dies halfway can simply be
 * re-run. The unique key (policy, subject, window start) catches a concurrent
 * cycle inserting the same pair. The engine never closes or edits violations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GovernanceRuleEngine {

    private final PolicyRepository policyRepository;
    private final ViolationRepository violationRepository;
    private final PolicyCompiler policyCompiler;
    private final CostStore costStore;
    private final ResourceMetadataProvider metadataProvider;
    private final FinOpsProperties properties;
    private final Clock clock;

    public EvaluationReport evaluate() {
        LocalDate today = LocalDate.now(clock);
        TimeWindow window = TimeWindow.ofDays(
                today.plusDays(1).minusDays(properties.getGovernance().getWindowDays()), today.plusDays(1));
        return evaluate(window);
    }

    public EvaluationReport evaluate(TimeWindow window) {
        Instant detectedAt = clock.instant();
        List<Policy> policies = policyRepository.findByStatusOrderByIdAsc(PolicyStatus.ACTIVE);
        List<CostRecord> records = costStore.snapshot(CostFilter.all(), window);
        Map<String, Optional<ResourceMetadata>> metadataCache = new HashMap<>();

        int subjects = 0;
        int created = 0;
        int duplicates = 0;
        int evaluated = 0;

        for (Policy policy : policies) {
            CompiledPolicy compiled;
            try {
                compiled = policyCompiler.compile(policy);
            } catch (ConfigurationException e) {
                log.error("Stored policy '{}' ({}) no longer compiles, skipping it", policy.getName(), policy.getId(), e);
                continue;
            }
            evaluated++;

            List<ResourceFacts> policySubjects = subjects(compiled.scope(), records, metadataCache);
            subjects += policySubjects.size();

            for (ResourceFacts facts : policySubjects) {
                Optional<String> reason = compiled.predicate().violation(facts);
                if (reason.isEmpty()) {
                    continue;
                }
                if (violationRepository.existsInWindow(policy.getId(), facts.subjectKey(), window.start(), window.end())) {
                    duplicates++;
                    continue;
                }
                try {
                    violationRepository.save(toViolation(policy, facts, reason.get(), window, detectedAt));
                    created++;
                    log.info("Policy '{}' violated by {}: {}", policy.getName(), facts.subjectKey(), reason.get());
                } catch (DataIntegrityViolationException e) {
                    log.debug("Violation of '{}' by {} was recorded concurrently", policy.getName(), facts.subjectKey());
                    duplicates++;
                }
            }
        }

        log.info("Governance cycle over {}: {} polic(ies), {} subject(s), {} new violation(s), {} already known",
                window, evaluated, subjects, created, duplicates);
        return new EvaluationReport(window, evaluated, subjects, created, duplicates);
    }

    private List<ResourceFacts> subjects(CostFilter scope, List<CostRecord> records,
                                         Map<String, Optional<ResourceMetadata>> metadataCache) {
        SortedMap<String, List<CostRecord>> bySubject = new TreeMap<>();
        for (CostRecord record : records) {
            if (scope.matches(record)) {
                bySubject.computeIfAbsent(subjectKey(record), k -> new ArrayList<>()).add(record);
            }
        }

        List<ResourceFacts> subjects = new ArrayList<>(bySubject.size());
        bySubject.forEach((key, subjectRecords) -> {
            CostRecord first = subjectRecords.get(0);
            TreeSet<String> services = new TreeSet<>();
            TreeSet<String> regions = new TreeSet<>();
            TreeMap<String, String> tags = new TreeMap<>();
            long spend = 0;
            for (CostRecord record : subjectRecords) {
                services.add(record.getService());
                if (record.getRegion() != null) {
                    regions.add(record.getRegion());
                }
                tags.putAll(record.getTags());
                spend = Math.addExact(spend, record.getAmountMinorUnits());
            }
            Optional<ResourceMetadata> metadata = first.getResourceId() == null
                    ? Optional.empty()
                    : metadataCache.computeIfAbsent(key,
                            k -> metadataProvider.lookup(first.getCloud(), first.getResourceId()));
            subjects.add(new ResourceFacts(key, first.getCloud(), first.getAccountId(), first.getResourceId(),
                    services, regions, tags, spend, metadata));
        });
        return subjects;
    }

    static String subjectKey(CostRecord record) {
        if (record.getResourceId() != null) {
            return "resource:" + record.getCloud() + ":" + record.getResourceId();
        }
        return "account:" + record.getCloud() + ":" + record.getAccountId();
    }

    private static Violation toViolation(Policy policy, ResourceFacts facts, String reason,
                                         TimeWindow window, Instant detectedAt) {
        return Violation.builder()
                .policyId(policy.getId())
                .policyName(policy.getName())
                .severity(policy.getSeverity())
                .subjectKey(facts.subjectKey())
                .resourceId(facts.resourceId())
                .accountId(facts.accountId())
                .cloud(facts.cloud())
                .region(facts.primaryRegion())
                .detectedAt(detectedAt)
                .windowStart(window.start())
                .windowEnd(window.end())
                .status(ViolationStatus.OPEN)
                .detail(reason.length() > 1024 ? reason.substring(0, 1024) : reason)
                .build();
    }
}
