package com.microsoft.finops.governance;

import com.microsoft.finops.domain.model.Severity;
import com.microsoft.finops.domain.model.Violation;
import com.microsoft.finops.domain.model.ViolationStatus;
import com.microsoft.finops.domain.repository.ViolationRepository;
import com.microsoft.finops.exception.NotFoundException;
import com.microsoft.finops.security.UserContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Violation listing and the approval workflow.
 *
 * Only an OPEN violation can be approved or rejected; the decision is final.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViolationService {

    private final ViolationRepository violationRepository;
    private final Clock clock;

    /**
     * Violations newest first; null filters match everything.
     */
    @Transactional(readOnly = true)
    public List<Violation> list(Long policyId, ViolationStatus status, Severity severity, String accountId) {
        return violationRepository.search(policyId, status, severity, accountId);
    }

    @Transactional(readOnly = true)
    public Violation get(Long id) {
        return violationRepository.findById(id).orElseThrow(() -> new NotFoundException("Violation", id));
    }

    @Transactional
    public Violation approve(Long id, String note) {
        return transition(id, ViolationStatus.APPROVED, note);
    }

    @Transactional
    public Violation reject(Long id, String note) {
        return transition(id, ViolationStatus.REJECTED, note);
    }

    private Violation transition(Long id, ViolationStatus target, String note) {
        Violation violation = get(id);
        if (violation.getStatus() != ViolationStatus.OPEN) {
            throw new IllegalStateException("Violation " + id + " is already " + violation.getStatus());
        }
        String actor = UserContext.getCurrentUserOrSystem();
        violation.setStatus(target);
        violation.setActionedBy(actor);
        violation.setActionedAt(clock.instant());
        violation.setNote(note);
        log.info("Violation {} of policy '{}' {} by {}", id, violation.getPolicyName(), target, actor);
        return violationRepository.save(violation);
    }
}
