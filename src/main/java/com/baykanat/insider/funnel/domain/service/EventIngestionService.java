package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.TrackingEventRequest;
import com.baykanat.insider.funnel.domain.mapper.TrackingEventMapper;
import com.baykanat.insider.funnel.domain.model.TrackingEvent;
import com.baykanat.insider.funnel.infrastructure.persistence.InboxJdbcRepository;
import com.baykanat.insider.funnel.infrastructure.persistence.TrackingEventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Kafka consumer tarafı: inbox ile dedup, ardından tracking_events'e batch insert. Tek transaction. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIngestionService {

    private static final Comparator<TrackingEvent> SESSION_TIMELINE = Comparator
            .comparing(TrackingEvent::getSessionId)
            .thenComparing(TrackingEvent::getEventTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final TrackingEventJdbcRepository trackingEventRepository;
    private final InboxJdbcRepository inboxRepository;
    private final IdempotencyService idempotencyService;
    private final TrackingEventMapper trackingEventMapper;

    /** Inbox'ta olmayan event'leri inbox + tracking_events'e yazar; eklenen sayıyı döner. */
    @Transactional
    public int processBatch(List<TrackingEventRequest> events) {
        if (events.isEmpty()) {
            return 0;
        }

        // Aynı batch içindeki tekrarlar da key üzerinden tekilleşir
        Map<String, TrackingEventRequest> keyToEvent = new LinkedHashMap<>();
        for (TrackingEventRequest event : events) {
            keyToEvent.putIfAbsent(idempotencyService.generateKey(event), event);
        }

        Set<String> existingKeys = inboxRepository.findExistingKeys(keyToEvent.keySet());
        if (!existingKeys.isEmpty()) {
            log.debug("Deduplicating {} out of {} events", existingKeys.size(), events.size());
        }

        Map<String, TrackingEventRequest> newEvents = keyToEvent.entrySet().stream()
                .filter(entry -> !existingKeys.contains(entry.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        if (newEvents.isEmpty()) {
            log.debug("All {} events were duplicates, skipping batch", events.size());
            return 0;
        }

        Map<String, String> keyToSession = new LinkedHashMap<>();
        newEvents.forEach((key, event) -> keyToSession.put(key, event.getSessionId()));
        inboxRepository.batchInsert(keyToSession);

        // Oturum içinde zaman sırasıyla yazılır; aynı timestamp'li event'lerde id sırası geliş sırasıdır
        List<TrackingEvent> trackingEvents = newEvents.entrySet().stream()
                .map(entry -> trackingEventMapper.toTrackingEvent(entry.getValue(), entry.getKey()))
                .sorted(SESSION_TIMELINE)
                .toList();
        trackingEventRepository.batchInsert(trackingEvents);

        long sessions = keyToSession.values().stream().distinct().count();
        log.info("Processed batch: {} new events across {} sessions inserted, {} duplicates skipped",
                newEvents.size(), sessions, events.size() - newEvents.size());
        return newEvents.size();
    }
}
