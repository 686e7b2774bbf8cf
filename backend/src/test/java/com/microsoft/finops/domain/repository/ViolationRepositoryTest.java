package com.microsoft.finops.domain.repository;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.Severity;
import com.microsoft.finops.domain.model.Violation;
import com.microsoft.finops.domain.model.ViolationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Repository queries the governance engine and the violation API rely on.
 */
@DataJpaTest
class ViolationRepositoryTest {

    private static final Instant FEB_15 = Instant.parse("2024-02-15T00:00:00Z");
    private static final Instant MAR_16 = Instant.parse("2024-03-16T00:00:00Z");

    @Autowired
    private ViolationRepository violationRepository;

    private static Violation violation(long policyId, String subjectKey, Severity severity, ViolationStatus status,
                                       String accountId, Instant detectedAt) {
        return Violation.builder()
                .policyId(policyId)
                .policyName("policy-" + policyId)
                .severity(severity)
                .subjectKey(subjectKey)
                .accountId(accountId)
                .cloud(CloudProvider.AWS)
                .detectedAt(detectedAt)
                .windowStart(FEB_15)
                .windowEnd(MAR_16)
                .status(status)
                .detail("detail")
                .build();
    }

    @Nested
    @DisplayName("Window Overlap Tests")
    class WindowOverlapTests {

        @BeforeEach
        void setUp() {
            violationRepository.saveAndFlush(violation(1L, "resource:AWS:i-gpu", Severity.HIGH,
                    ViolationStatus.REJECTED, "A1", MAR_16));
        }

        @Test
        @DisplayName("Should find a violation of any status in an overlapping window")
        void shouldMatchOverlappingWindow() {
            assertThat(violationRepository.existsInWindow(1L, "resource:AWS:i-gpu",
                    Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-31T00:00:00Z"))).isTrue();
        }

        @Test
        @DisplayName("Should treat windows as half-open")
        void shouldNotMatchAdjacentWindow() {
            assertThat(violationRepository.existsInWindow(1L, "resource:AWS:i-gpu",
                    MAR_16, Instant.parse("2024-04-15T00:00:00Z"))).isFalse();
            assertThat(violationRepository.existsInWindow(1L, "resource:AWS:i-gpu",
                    Instant.parse("2024-01-15T00:00:00Z"), FEB_15)).isFalse();
        }

        @Test
        @DisplayName("Should not match another policy or subject")
        void shouldMatchOnlyTheSamePair() {
            assertThat(violationRepository.existsInWindow(2L, "resource:AWS:i-gpu", FEB_15, MAR_16)).isFalse();
            assertThat(violationRepository.existsInWindow(1L, "resource:GCP:i-gpu", FEB_15, MAR_16)).isFalse();
        }

        @Test
        @DisplayName("Should reject a second row for the same policy, subject and window start")
        void shouldEnforceUniquePair() {
            Violation duplicate = violation(1L, "resource:AWS:i-gpu", Severity.HIGH,
                    ViolationStatus.OPEN, "A1", MAR_16);

            assertThatThrownBy(() -> violationRepository.saveAndFlush(duplicate))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }
    }

    @Nested
    @DisplayName("Search Tests")
    class SearchTests {

        private Violation gpu;
        private Violation untagged;
        private Violation spend;

        @BeforeEach
        void setUp() {
            gpu = violationRepository.save(violation(1L, "resource:AWS:i-gpu", Severity.HIGH,
                    ViolationStatus.OPEN, "A1", Instant.parse("2024-03-10T00:00:00Z")));
            untagged = violationRepository.save(violation(2L, "account:AWS:A2", Severity.LOW,
                    ViolationStatus.OPEN, "A2", Instant.parse("2024-03-11T00:00:00Z")));
            spend = violationRepository.save(violation(3L, "resource:AWS:db-1", Severity.HIGH,
                    ViolationStatus.APPROVED, "A1", Instant.parse("2024-03-12T00:00:00Z")));
            violationRepository.flush();
        }

        @Test
        @DisplayName("Should return every violation, newest first, without filters")
        void shouldReturnAllWithoutFilters() {
            assertThat(violationRepository.search(null, null, null, null))
                    .containsExactly(spend, untagged, gpu);
        }

        @Test
        @DisplayName("Should narrow results by the given filters")
        void shouldApplyFilters() {
            assertThat(violationRepository.search(null, ViolationStatus.OPEN, null, null))
                    .containsExactly(untagged, gpu);
            assertThat(violationRepository.search(null, null, Severity.HIGH, "A1"))
                    .containsExactly(spend, gpu);
            assertThat(violationRepository.search(2L, null, null, null))
                    .containsExactly(untagged);
        }
    }
}
