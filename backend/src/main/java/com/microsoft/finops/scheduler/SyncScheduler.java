package com.microsoft.finops.scheduler;

import com.microsoft.finops.config.FinOpsProperties;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.governance.EvaluationReport;
import com.microsoft.finops.governance.GovernanceRuleEngine;
import com.microsoft.finops.ingestion.CostIngestionService;
import com.microsoft.finops.ingestion.SyncReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Daily billing sync followed by a governance cycle.
 *
 * Re-fetches the trailing lookback days every run: providers keep revising
 * recent lines, and a re-fetched window replaces its earlier batch.
 */
@Component
@ConditionalOnProperty(name = "finops.sync.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SyncScheduler {

    private final CostIngestionService ingestionService;
    private final GovernanceRuleEngine governanceRuleEngine;
    private final FinOpsProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${finops.sync.cron:0 0 3 * * *}", zone = "UTC")
    public void runDailySync() {
        LocalDate today = LocalDate.now(clock);
        int lookback = Math.max(1, properties.getSync().getLookbackDays());
        TimeWindow window = TimeWindow.ofDays(today.minusDays(lookback), today);

        log.info("Starting scheduled sync for {}", window);
        SyncReport report = ingestionService.sync(window);
        if (!report.allSucceeded()) {
            log.warn("Scheduled sync for {} had failures: {}", window, report.results());
        }

        try {
            EvaluationReport evaluation = governanceRuleEngine.evaluate();
            log.info("Scheduled governance cycle created {} violation(s)", evaluation.violationsCreated());
        } catch (RuntimeException e) {
            log.error("Scheduled governance cycle failed", e);
        }
    }
}
