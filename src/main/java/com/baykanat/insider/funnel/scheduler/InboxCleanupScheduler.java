package com.baykanat.insider.funnel.scheduler;

import com.baykanat.insider.funnel.config.AppProperties;
import com.baykanat.insider.funnel.infrastructure.persistence.InboxJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/** Inbox'ta retention süresi boyunca sessiz kalan oturumların idempotency key'lerini bırakır. */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboxCleanupScheduler {

    private final InboxJdbcRepository inboxRepository;
    private final AppProperties appProperties;

    /** fixedDelay: uzun süren bir temizlik bir sonrakiyle üst üste binmez. */
    @Scheduled(
            fixedDelayString = "${app.scheduler.inbox-cleanup-rate:3600000}",
            initialDelayString = "${app.scheduler.inbox-cleanup-initial-delay:60000}"
    )
    public void releaseIdleSessions() {
        int retentionDays = appProperties.getScheduler().getInboxRetentionDays();
        List<String> releasedKeys;
        try {
            releasedKeys = inboxRepository.deleteIdleSessions(retentionDays);
        } catch (DataAccessException e) {
            log.error("Inbox cleanup failed, retrying on next run: {}", e.getMessage(), e);
            return;
        }

        if (releasedKeys.isEmpty()) {
            log.debug("Inbox cleanup: no session idle for {} days", retentionDays);
            return;
        }
        long sessions = releasedKeys.stream().distinct().count();
        log.info("Inbox cleanup: released {} keys of {} sessions idle for {} days",
                releasedKeys.size(), sessions, retentionDays);
    }
}
