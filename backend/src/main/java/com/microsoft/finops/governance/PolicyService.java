package com.microsoft.finops.governance;

import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.domain.model.PolicyStatus;
import com.microsoft.finops.domain.model.PolicyType;
import com.microsoft.finops.domain.model.Severity;
import com.microsoft.finops.domain.repository.PolicyRepository;
import com.microsoft.finops.exception.MalformedPolicyException;
import com.microsoft.finops.exception.NotFoundException;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Policy configuration. Every policy is compiled before it is stored.
 *
 * Disabling a policy stops it from being evaluated; violations it already
 * produced are left untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyService {

    private final PolicyRepository policyRepository;
    private final PolicyCompiler policyCompiler;

    @Transactional
    public Policy create(PolicyRequest request) {
        Policy policy = Policy.builder()
                .name(request.name().trim())
                .description(request.description())
                .type(request.type())
                .severity(request.severity())
                .status(PolicyStatus.ACTIVE)
                .scope(request.scope() == null ? "" : request.scope().trim())
                .parameters(request.parameters() == null ? new HashMap<>() : new HashMap<>(request.parameters()))
                .actionHint(request.actionHint())
                .build();
        return save(policy);
    }

    /**
     * Compile and store. Used by the REST surface and the default policy seed.
     */
    @Transactional
    public Policy save(Policy policy) {
        if (policyRepository.existsByName(policy.getName())) {
            throw new MalformedPolicyException("A policy named '" + policy.getName() + "' already exists");
        }
        policyCompiler.compile(policy);
        Policy saved = policyRepository.save(policy);
        log.info("Created {} policy '{}' ({}) with severity {}", saved.getType(), saved.getName(),
                saved.getId(), saved.getSeverity());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Policy> list() {
        return policyRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Policy get(Long id) {
        return policyRepository.findById(id).orElseThrow(() -> new NotFoundException("Policy", id));
    }

    @Transactional
    public Policy disable(Long id) {
        return setStatus(id, PolicyStatus.DISABLED);
    }

    @Transactional
    public Policy enable(Long id) {
        Policy policy = get(id);
        policyCompiler.compile(policy);
        return setStatus(id, PolicyStatus.ACTIVE);
    }

    private Policy setStatus(Long id, PolicyStatus status) {
        Policy policy = get(id);
        policy.setStatus(status);
        log.info("Policy '{}' ({}) is now {}", policy.getName(), id, status);
        return policyRepository.save(policy);
    }

    public record PolicyRequest(
            @NotBlank String name,
            String description,
            @NotNull PolicyType type,
            @NotNull Severity severity,
            String scope,
            Map<String, String> parameters,
            String actionHint
    ) {
    }
}
