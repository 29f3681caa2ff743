package com.baykanat.insider.funnel.scheduler;

import com.baykanat.insider.funnel.config.AppProperties;
import com.baykanat.insider.funnel.infrastructure.persistence.InboxJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboxCleanupSchedulerTest {

    @Mock
    private InboxJdbcRepository inboxRepository;

    private AppProperties appProperties;
    private InboxCleanupScheduler scheduler;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        scheduler = new InboxCleanupScheduler(inboxRepository, appProperties);
    }

    @Test
    @DisplayName("Cleanup uses the configured retention in days")
    void usesConfiguredRetention() {
        appProperties.getScheduler().setInboxRetentionDays(3);
        when(inboxRepository.deleteIdleSessions(3)).thenReturn(List.of("s1", "s1", "s2"));

        scheduler.releaseIdleSessions();

        verify(inboxRepository).deleteIdleSessions(3);
    }

    @Test
    @DisplayName("A database failure is logged and does not escape the scheduled run")
    void databaseFailureDoesNotPropagate() {
        when(inboxRepository.deleteIdleSessions(7)).thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatCode(() -> scheduler.releaseIdleSessions()).doesNotThrowAnyException();
    }
}
