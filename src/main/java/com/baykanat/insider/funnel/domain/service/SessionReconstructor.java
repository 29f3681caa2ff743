package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.SessionSummary;
import com.baykanat.insider.funnel.domain.mapper.TrackingEventMapper;
import com.baykanat.insider.funnel.domain.model.EventType;
import com.baykanat.insider.funnel.domain.model.TrackingEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Düz event listesini oturumlara ayırır ve her oturumun özetini çıkarır. Oturum hiçbir yerde
 * saklanmaz; her istekte ham event'lerden yeniden kurulur.
 */
@Component
@RequiredArgsConstructor
public class SessionReconstructor {

    private static final Comparator<TrackingEvent> CHRONOLOGICAL = Comparator
            .comparing(TrackingEvent::getEventTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(TrackingEvent::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final TrackingEventMapper trackingEventMapper;

    /** Oturumlar sessionIds sırasıyla döner; event'i olmayan id atlanır. */
    public List<SessionSummary> reconstruct(List<String> sessionIds, List<TrackingEvent> events) {
        Map<String, List<TrackingEvent>> bySession = new LinkedHashMap<>();
        for (String sessionId : sessionIds) {
            bySession.put(sessionId, new ArrayList<>());
        }
        for (TrackingEvent event : events) {
            List<TrackingEvent> sessionEvents = bySession.get(event.getSessionId());
            if (sessionEvents != null) {
                sessionEvents.add(event);
            }
        }

        List<SessionSummary> sessions = new ArrayList<>(bySession.size());
        for (Map.Entry<String, List<TrackingEvent>> entry : bySession.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                sessions.add(summarize(entry.getKey(), entry.getValue()));
            }
        }
        return sessions;
    }

    /** Tek oturumun özeti; events boş olmamalı. */
    public SessionSummary summarize(String sessionId, List<TrackingEvent> events) {
        List<TrackingEvent> ordered = new ArrayList<>(events);
        ordered.sort(CHRONOLOGICAL);

        TrackingEvent first = ordered.get(0);
        TrackingEvent last = ordered.get(ordered.size() - 1);

        // En yüksek adım; eşitlikte en son gelen
        TrackingEvent furthest = first;
        TrackingEvent terminalForm = null;
        for (TrackingEvent event : ordered) {
            if (event.getStepNumber() >= furthest.getStepNumber()) {
                furthest = event;
            }
            if (event.resolveEventType() == EventType.FORM_COMPLETE) {
                terminalForm = event;
            }
        }

        String maxEventType = terminalForm != null
                ? EventType.FORM_COMPLETE.getValue()
                : furthest.resolveEventType().getValue();

        SessionSummary.SessionSummaryBuilder summary = SessionSummary.builder()
                .sessionId(sessionId)
                .events(trackingEventMapper.toSessionEvents(ordered))
                .maxStep(furthest.getStepNumber())
                .maxStepName(furthest.getStepName())
                .maxEventType(maxEventType)
                .eventCount(ordered.size())
                .firstEventAt(first.getEventTimestamp())
                .lastEventAt(last.getEventTimestamp())
                .page(first.getPage())
                .pageType(first.getPageType())
                .domain(first.getDomain())
                .funnelId(first.getFunnelId())
                .deviceType(first.getDeviceType())
                .os(first.getOs())
                .browser(first.getBrowser())
                .geoState(first.getGeoState())
                .utmSource(first.getUtmSource())
                .utmCampaign(first.getUtmCampaign())
                .utmMedium(first.getUtmMedium())
                .referrer(first.getReferrer())
                .externalId(first.getExternalId())
                .fbclid(first.getFbclid())
                .adId(first.getAdId());

        if (terminalForm != null) {
            summary.firstName(terminalForm.getFirstName())
                    .lastName(terminalForm.getLastName())
                    .email(terminalForm.getEmail())
                    .phone(terminalForm.getPhone())
                    .externalId(preferTerminal(terminalForm.getExternalId(), first.getExternalId()))
                    .fbclid(preferTerminal(terminalForm.getFbclid(), first.getFbclid()))
                    .adId(preferTerminal(terminalForm.getAdId(), first.getAdId()));
        }
        return summary.build();
    }

    private String preferTerminal(String terminalValue, String firstValue) {
        return terminalValue != null ? terminalValue : firstValue;
    }
}
