package com.baykanat.insider.funnel.integration;

import com.baykanat.insider.funnel.api.dto.DrilldownResult;
import com.baykanat.insider.funnel.api.dto.DrilldownRow;
import com.baykanat.insider.funnel.api.dto.FilterOptionsResponse;
import com.baykanat.insider.funnel.api.dto.FunnelResponse;
import com.baykanat.insider.funnel.api.dto.SessionEventResponse;
import com.baykanat.insider.funnel.api.dto.SessionLogResponse;
import com.baykanat.insider.funnel.api.dto.SessionSummary;
import com.baykanat.insider.funnel.api.dto.StatsResponse;
import com.baykanat.insider.funnel.api.dto.StepBreakdown;
import com.baykanat.insider.funnel.api.dto.StepData;
import com.baykanat.insider.funnel.api.dto.StepOption;
import com.baykanat.insider.funnel.api.dto.TrackingEventRequest;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import com.baykanat.insider.funnel.domain.service.BreakdownService;
import com.baykanat.insider.funnel.domain.service.DrilldownService;
import com.baykanat.insider.funnel.domain.service.EventIngestionService;
import com.baykanat.insider.funnel.domain.service.FunnelService;
import com.baykanat.insider.funnel.domain.service.SessionLogService;
import com.baykanat.insider.funnel.scheduler.InboxCleanupScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests against a real PostgreSQL (Testcontainers): events go through the ingestion
 * service and are read back through drilldown, funnel and session log queries.
 *
 * <p>Kafka is embedded only so that the application context starts; events are handed to the
 * ingestion service directly.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@EmbeddedKafka(partitions = 1, topics = {"tracking-events", "tracking-events.DLT"})
@ActiveProfiles("test")
class FunnelAnalyticsIntegrationTest {

    private static final Instant BASE = Instant.parse("2025-02-10T12:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("funnel_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private EventIngestionService eventIngestionService;

    @Autowired
    private DrilldownService drilldownService;

    @Autowired
    private FunnelService funnelService;

    @Autowired
    private SessionLogService sessionLogService;

    @Autowired
    private BreakdownService breakdownService;

    @Autowired
    private InboxCleanupScheduler inboxCleanupScheduler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.execute("TRUNCATE tracking_events, inbox");
    }

    @Test
    @DisplayName("Inbox cleanup releases only sessions idle for the whole retention period")
    void inboxCleanupKeepsActiveSessions() {
        List<TrackingEventRequest> idle = session("s-idle", "a.com", "mobile", "facebook", 1, 0);
        List<TrackingEventRequest> active = session("s-active", "a.com", "mobile", "facebook", 2, 5);
        eventIngestionService.processBatch(idle);
        eventIngestionService.processBatch(active);
        jdbcTemplate.update("UPDATE inbox SET received_at = NOW() - INTERVAL '10 days' WHERE session_id = 's-idle'");
        jdbcTemplate.update("""
                UPDATE inbox SET received_at = NOW() - INTERVAL '10 days'
                WHERE session_id = 's-active'
                  AND idempotency_key = (SELECT MIN(idempotency_key) FROM inbox WHERE session_id = 's-active')
                """);

        inboxCleanupScheduler.releaseIdleSessions();

        List<String> remaining = jdbcTemplate.queryForList("SELECT DISTINCT session_id FROM inbox", String.class);
        assertThat(remaining).containsExactly("s-active");
        assertThat(eventIngestionService.processBatch(active)).isZero();
    }

    @Test
    @DisplayName("Should persist events once and skip redeliveries")
    void shouldDeduplicateRedeliveredEvents() {
        List<TrackingEventRequest> session = session("s-dedup", "a.com", "mobile", "facebook", 2, 0);

        int first = eventIngestionService.processBatch(session);
        int second = eventIngestionService.processBatch(session);

        assertThat(first).isEqualTo(session.size());
        assertThat(second).isZero();
        Integer stored = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM tracking_events WHERE session_id = 's-dedup'", Integer.class);
        assertThat(stored).isEqualTo(session.size());
    }

    @Test
    @DisplayName("Drilldown leaves never count more sessions than their parent row")
    void drilldownLeavesAreBoundedByParent() {
        seedCohort();
        AnalyticsFilters filters = new AnalyticsFilters();

        DrilldownResult domains = drilldownService.drilldown(filters, GroupingDimension.DOMAIN, Map.of());
        DrilldownRow aCom = rowOf(domains, "a.com");

        DrilldownResult devices = drilldownService.drilldown(filters, GroupingDimension.DEVICE_TYPE,
                Map.of(GroupingDimension.DOMAIN, "a.com"));
        for (DrilldownRow device : devices.getRows()) {
            assertThat(device.getUniqueViews()).isLessThanOrEqualTo(aCom.getUniqueViews());

            DrilldownResult sources = drilldownService.drilldown(filters, GroupingDimension.UTM_SOURCE,
                    Map.of(GroupingDimension.DOMAIN, "a.com", GroupingDimension.DEVICE_TYPE, device.getGroupValue()));
            long leafSum = sources.getRows().stream().mapToLong(DrilldownRow::getUniqueViews).sum();
            assertThat(leafSum).isLessThanOrEqualTo(device.getUniqueViews());
        }
    }

    @Test
    @DisplayName("Totals row equals the sum of group rows for additive counts")
    void totalsEqualSumOfRows() {
        seedCohort();

        DrilldownResult result = drilldownService.drilldown(new AnalyticsFilters(), GroupingDimension.DOMAIN, Map.of());

        DrilldownRow totals = result.getTotals();
        assertThat(totals.getGroupValue()).isEqualTo("Totals");
        assertThat(totals.getUniqueViews())
                .isEqualTo(result.getRows().stream().mapToLong(DrilldownRow::getUniqueViews).sum());
        assertThat(totals.getFormCompletions())
                .isEqualTo(result.getRows().stream().mapToLong(DrilldownRow::getFormCompletions).sum());
        assertThat(result.getRows()).allSatisfy(row ->
                assertThat(row.getSteps()).extracting(StepData::getStepKey)
                        .containsExactlyElementsOf(totals.getSteps().stream().map(StepData::getStepKey).toList()));
    }

    @Test
    @DisplayName("Missing attribute is reported as the sentinel value and can be drilled into")
    void missingAttributeUsesSentinel() {
        seedCohort();

        DrilldownResult sources = drilldownService.drilldown(new AnalyticsFilters(), GroupingDimension.UTM_SOURCE, Map.of());
        DrilldownRow none = rowOf(sources, "(none)");
        assertThat(none.getUniqueViews()).isEqualTo(1);

        DrilldownResult underNone = drilldownService.drilldown(new AnalyticsFilters(), GroupingDimension.DOMAIN,
                Map.of(GroupingDimension.UTM_SOURCE, "(none)"));
        assertThat(underNone.getRows()).extracting(DrilldownRow::getGroupValue).containsExactly("b.com");
    }

    @Test
    @DisplayName("Blank stored values fall into the sentinel row and its expansion covers exactly that row")
    void blankStoredValuesMergeWithSentinel() {
        seedCohort();
        jdbcTemplate.update("UPDATE tracking_events SET utm_source = '' WHERE session_id = 's-4'");

        DrilldownResult sources = drilldownService.drilldown(new AnalyticsFilters(), GroupingDimension.UTM_SOURCE, Map.of());
        assertThat(sources.getRows()).extracting(DrilldownRow::getGroupValue)
                .containsExactlyInAnyOrder("facebook", "google", "(none)");
        DrilldownRow none = rowOf(sources, "(none)");
        assertThat(none.getUniqueViews()).isEqualTo(2);

        DrilldownResult underNone = drilldownService.drilldown(new AnalyticsFilters(), GroupingDimension.DOMAIN,
                Map.of(GroupingDimension.UTM_SOURCE, "(none)"));
        long leafSum = underNone.getRows().stream().mapToLong(DrilldownRow::getUniqueViews).sum();
        assertThat(leafSum).isEqualTo(none.getUniqueViews());
    }

    @Test
    @DisplayName("Funnel reports lands, completions and per-step conversion for the cohort")
    void funnelForWholeCohort() {
        seedCohort();

        FunnelResponse funnel = funnelService.getFunnel(new AnalyticsFilters());

        assertThat(funnel.getUniqueViews()).isEqualTo(5);
        assertThat(funnel.getPageLands()).isEqualTo(5);
        assertThat(funnel.getFormCompletions()).isEqualTo(2);
        StepData firstStep = funnel.getSteps().get(0);
        assertThat(firstStep.getStepKey()).isEqualTo("1:Step 1");
        assertThat(firstStep.getCompletions()).isEqualTo(5);
        assertThat(firstStep.getConversionFromInitial()).isEqualTo(100.0);
        assertThat(funnel.getSteps()).allSatisfy(step ->
                assertThat(step.getConversionFromPrev()).isBetween(0.0, 100.0));
    }

    @Test
    @DisplayName("Stats and bounce count land-only sessions as bounced")
    void statsAndBounce() {
        seedCohort();
        eventIngestionService.processBatch(session("s-6", "b.com", "mobile", "google", 0, 50));

        StatsResponse stats = breakdownService.getStats(new AnalyticsFilters());

        assertThat(stats.getTotalSessions()).isEqualTo(6);
        assertThat(stats.getTotalEvents()).isEqualTo(18);
        assertThat(stats.getOverallConversion()).isEqualTo(33.3);
        assertThat(stats.getAvgStepsCompleted()).isEqualTo(2.0);
        assertThat(stats.getBounceRate()).isEqualTo(16.7);
        assertThat(breakdownService.getBounceRate(new AnalyticsFilters()).getBouncedVisitors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Step breakdown distributes answers per step")
    void stepBreakdown() {
        seedCohort();
        jdbcTemplate.update("UPDATE tracking_events SET selected_value = "
                + "CASE WHEN domain = 'a.com' THEN 'Florida' ELSE 'Texas' END WHERE step_number = 1");

        List<StepBreakdown> steps = breakdownService.getStepBreakdown(new AnalyticsFilters());

        assertThat(steps).hasSize(1);
        assertThat(steps.get(0).getStepKey()).isEqualTo("1:Step 1");
        assertThat(steps.get(0).getOptions()).extracting(StepOption::getValue).containsExactly("Florida", "Texas");
        assertThat(steps.get(0).getOptions()).extracting(StepOption::getPercentage).containsExactly(60.0, 40.0);
    }

    @Test
    @DisplayName("Session pages are disjoint and stable across repeated calls")
    void sessionPaginationIsStable() {
        seedCohort();
        AnalyticsFilters filters = new AnalyticsFilters();

        Set<String> seen = new HashSet<>();
        List<String> firstPass = new ArrayList<>();
        for (int page = 1; page <= 3; page++) {
            SessionLogResponse response = sessionLogService.getSessions(filters, null, page, 2);
            assertThat(response.getTotal()).isEqualTo(5);
            assertThat(response.getTotalPages()).isEqualTo(3);
            for (SessionSummary session : response.getSessions()) {
                assertThat(seen.add(session.getSessionId())).isTrue();
                firstPass.add(session.getSessionId());
            }
        }
        assertThat(seen).hasSize(5);

        List<String> secondPass = new ArrayList<>();
        for (int page = 1; page <= 3; page++) {
            sessionLogService.getSessions(filters, null, page, 2).getSessions()
                    .forEach(session -> secondPass.add(session.getSessionId()));
        }
        assertThat(secondPass).isEqualTo(firstPass);

        assertThat(sessionLogService.getSessions(filters, null, 4, 2).getSessions()).isEmpty();
    }

    @Test
    @DisplayName("Reconstructed session carries all events in order and keeps PII only from the form")
    void sessionReconstruction() {
        seedCohort();

        SessionLogResponse response = sessionLogService.getSessions(new AnalyticsFilters(), "s-1", 1, null);

        assertThat(response.getSessions()).hasSize(1);
        SessionSummary summary = response.getSessions().get(0);
        assertThat(summary.getSessionId()).isEqualTo("s-1");
        assertThat(summary.getEventCount()).isEqualTo(summary.getEvents().size());
        assertThat(summary.getMaxEventType()).isEqualTo("form_complete");
        assertThat(summary.getEmail()).isEqualTo("s-1@example.com");
        assertThat(summary.getEvents().get(0).getEventType()).isEqualTo("page_land");
        assertThat(summary.getEvents()).extracting(SessionEventResponse::getEventTimestamp).isSorted();
    }

    @Test
    @DisplayName("Filter options list distinct non-empty values per dimension")
    void filterOptions() {
        seedCohort();

        FilterOptionsResponse options = funnelService.getFilterOptions();

        assertThat(options.getDomains()).containsExactly("a.com", "b.com");
        assertThat(options.getDeviceTypes()).containsExactly("desktop", "mobile");
        assertThat(options.getUtmSources()).containsExactly("facebook", "google");
    }

    /** Five sessions: two form completions on a.com, one b.com session without utm source. */
    private void seedCohort() {
        List<TrackingEventRequest> events = new ArrayList<>();
        events.addAll(session("s-1", "a.com", "mobile", "facebook", 3, 0));
        events.addAll(session("s-2", "a.com", "mobile", "google", 3, 10));
        events.addAll(session("s-3", "a.com", "desktop", "facebook", 2, 20));
        events.addAll(session("s-4", "b.com", "desktop", "google", 1, 30));
        events.addAll(session("s-5", "b.com", "mobile", null, 1, 40));
        eventIngestionService.processBatch(events);
    }

    /** page_land, steps 1..lastStep; sessions reaching step 3 finish with form_complete. */
    private static List<TrackingEventRequest> session(String sessionId, String domain, String device,
                                                      String utmSource, int lastStep, int minuteOffset) {
        List<TrackingEventRequest> events = new ArrayList<>();
        Instant start = BASE.plusSeconds(minuteOffset * 60L);
        events.add(event(sessionId, "page_land", domain, device, utmSource, 0, "Landing", start));
        for (int step = 1; step <= lastStep; step++) {
            events.add(event(sessionId, "step_complete", domain, device, utmSource, step, "Step " + step,
                    start.plusSeconds(step * 5L)));
        }
        if (lastStep >= 3) {
            TrackingEventRequest form = event(sessionId, "form_complete", domain, device, utmSource, 4, "Form",
                    start.plusSeconds(30));
            form.setEmail(sessionId + "@example.com");
            form.setFirstName("Jane");
            events.add(form);
        }
        return events;
    }

    private static TrackingEventRequest event(String sessionId, String eventType, String domain, String device,
                                              String utmSource, int step, String stepName, Instant timestamp) {
        return TrackingEventRequest.builder()
                .sessionId(sessionId)
                .eventType(eventType)
                .page("seniors")
                .pageType("lead")
                .domain(domain)
                .deviceType(device)
                .utmSource(utmSource)
                .stepNumber(step)
                .stepName(stepName)
                .timestamp(timestamp)
                .build();
    }

    private static DrilldownRow rowOf(DrilldownResult result, String groupValue) {
        return result.getRows().stream()
                .filter(row -> groupValue.equals(row.getGroupValue()))
                .findFirst()
                .orElseThrow();
    }
}
