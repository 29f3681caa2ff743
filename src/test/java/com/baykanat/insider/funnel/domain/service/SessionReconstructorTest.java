package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.SessionEventResponse;
import com.baykanat.insider.funnel.api.dto.SessionSummary;
import com.baykanat.insider.funnel.domain.mapper.TrackingEventMapper;
import com.baykanat.insider.funnel.domain.model.TrackingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SessionReconstructor.
 *
 * <p>Sessions are derived from raw events only; these tests pin the summary rules:
 * furthest step, terminal event type, first-event dimensions and form_complete PII.
 */
class SessionReconstructorTest {

    private static final Instant T0 = Instant.parse("2025-02-10T12:00:00Z");

    private SessionReconstructor reconstructor;
    private long nextId;

    @BeforeEach
    void setUp() {
        reconstructor = new SessionReconstructor(Mappers.getMapper(TrackingEventMapper.class));
        nextId = 1;
    }

    @Test
    @DisplayName("Repeated and skipped steps: max step is the furthest reached, all events counted")
    void furthestStepWithRepeatsAndGaps() {
        List<TrackingEvent> events = List.of(
                event("s1", "page_land", 0, "Landing", 0),
                event("s1", "step_complete", 1, "Zip", 10),
                event("s1", "step_complete", 1, "Zip", 20),
                event("s1", "step_complete", 3, "Income", 30));

        SessionSummary summary = reconstructor.summarize("s1", events);

        assertThat(summary.getMaxStep()).isEqualTo(3);
        assertThat(summary.getMaxStepName()).isEqualTo("Income");
        assertThat(summary.getMaxEventType()).isEqualTo("step_complete");
        assertThat(summary.getEventCount()).isEqualTo(4);
        assertThat(summary.getFirstEventAt()).isEqualTo(T0);
        assertThat(summary.getLastEventAt()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    @DisplayName("Events arriving out of order are sorted by timestamp")
    void sortsEventsChronologically() {
        List<TrackingEvent> events = List.of(
                event("s1", "step_complete", 2, "State", 20),
                event("s1", "page_land", 0, "Landing", 0),
                event("s1", "step_complete", 1, "Zip", 10));

        SessionSummary summary = reconstructor.summarize("s1", events);

        assertThat(summary.getEvents()).extracting(SessionEventResponse::getStepNumber).containsExactly(0, 1, 2);
        assertThat(summary.getFirstEventAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("form_complete wins the event type and supplies PII and ad attribution")
    void formCompleteSuppliesPii() {
        TrackingEvent land = event("s1", "page_land", 0, "Landing", 0);
        land.setExternalId("ext-first");
        land.setFbclid("fb-first");
        land.setAdId("ad-first");
        TrackingEvent form = event("s1", "form_complete", 5, "Contact", 50);
        form.setFirstName("Jane");
        form.setLastName("Doe");
        form.setEmail("jane@example.com");
        form.setPhone("5551234567");
        form.setExternalId("ext-form");
        TrackingEvent later = event("s1", "step_complete", 6, "ThankYou", 60);

        SessionSummary summary = reconstructor.summarize("s1", List.of(land, form, later));

        assertThat(summary.getMaxEventType()).isEqualTo("form_complete");
        assertThat(summary.getMaxStep()).isEqualTo(6);
        assertThat(summary.getFirstName()).isEqualTo("Jane");
        assertThat(summary.getEmail()).isEqualTo("jane@example.com");
        assertThat(summary.getExternalId()).isEqualTo("ext-form");
        // form event has no fbclid/adId, first event's are kept
        assertThat(summary.getFbclid()).isEqualTo("fb-first");
        assertThat(summary.getAdId()).isEqualTo("ad-first");
    }

    @Test
    @DisplayName("Without form_complete PII is null and dimensions come from the first event")
    void dimensionsFromFirstEvent() {
        TrackingEvent first = event("s1", "page_land", 0, "Landing", 0);
        first.setUtmSource("facebook");
        first.setDeviceType("mobile");
        TrackingEvent second = event("s1", "step_complete", 1, "Zip", 10);
        second.setUtmSource("google");
        second.setDeviceType("desktop");

        SessionSummary summary = reconstructor.summarize("s1", List.of(first, second));

        assertThat(summary.getUtmSource()).isEqualTo("facebook");
        assertThat(summary.getDeviceType()).isEqualTo("mobile");
        assertThat(summary.getFirstName()).isNull();
        assertThat(summary.getEmail()).isNull();
    }

    @Test
    @DisplayName("Legacy events without event_type are treated as step_complete")
    void legacyEventTypeIsStepComplete() {
        SessionSummary summary = reconstructor.summarize("s1", List.of(event("s1", null, 2, "State", 0)));

        assertThat(summary.getMaxEventType()).isEqualTo("step_complete");
        assertThat(summary.getEvents().get(0).getEventType()).isEqualTo("step_complete");
    }

    @Test
    @DisplayName("On a step number tie the latest event names the furthest step")
    void tieOnStepNumberUsesLatestEvent() {
        SessionSummary summary = reconstructor.summarize("s1", List.of(
                event("s1", "step_complete", 2, "State", 10),
                event("s1", "step_complete", 2, "Age", 20)));

        assertThat(summary.getMaxStepName()).isEqualTo("Age");
    }

    @Test
    @DisplayName("Sessions keep the requested order and ids without events are skipped")
    void reconstructKeepsPageOrder() {
        List<TrackingEvent> events = List.of(
                event("a", "page_land", 0, "Landing", 0),
                event("b", "page_land", 0, "Landing", 5),
                event("b", "step_complete", 1, "Zip", 6));

        List<SessionSummary> sessions = reconstructor.reconstruct(List.of("b", "missing", "a"), events);

        assertThat(sessions).extracting(SessionSummary::getSessionId).containsExactly("b", "a");
        assertThat(sessions.get(0).getEventCount()).isEqualTo(2);
    }

    private TrackingEvent event(String sessionId, String type, int step, String name, long offsetSeconds) {
        return TrackingEvent.builder()
                .id(nextId++)
                .sessionId(sessionId)
                .eventType(type)
                .stepNumber(step)
                .stepName(name)
                .page("seniors")
                .pageType("lead")
                .domain("blueskylife.net")
                .eventTimestamp(T0.plusSeconds(offsetSeconds))
                .build();
    }
}
