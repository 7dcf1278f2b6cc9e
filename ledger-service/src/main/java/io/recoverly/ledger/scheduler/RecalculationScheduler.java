package io.recoverly.ledger.scheduler;

import io.recoverly.ledger.config.LedgerProperties;
import io.recoverly.ledger.service.AsyncRecalculationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Periodic payment score recalculation and job store housekeeping.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecalculationScheduler {

    private static final int JOB_RETENTION_MINUTES = 24 * 60;

    private final AsyncRecalculationService asyncRecalculationService;
    private final LedgerProperties ledgerProperties;
    private final Clock clock;

    @Scheduled(cron = "${ledger.recalculation.cron:0 30 2 * * *}")
    public void recalculateScores() {
        if (!ledgerProperties.getRecalculation().isScheduleEnabled()) {
            log.debug("Scheduled recalculation disabled");
            return;
        }
        String jobId = asyncRecalculationService.triggerRecalculation("scheduler", LocalDate.now(clock), null);
        log.info("Scheduled payment score recalculation queued: {}", jobId);
    }

    @Scheduled(cron = "0 0 * * * *")
    public void cleanupJobs() {
        asyncRecalculationService.cleanupOldJobs(JOB_RETENTION_MINUTES);
    }
}
