package com.baykanat.insider.funnel.api.controller;

import com.baykanat.insider.funnel.api.dto.BulkTrackingEventRequest;
import com.baykanat.insider.funnel.api.dto.EventResponse;
import com.baykanat.insider.funnel.api.dto.TrackingEventRequest;
import com.baykanat.insider.funnel.infrastructure.kafka.TrackingEventKafkaProducer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/** POST /events ve POST /events/bulk. Event Kafka'ya gönderilir, 202 döner; DB yazımı consumer'da. */
@Slf4j
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
@Tag(name = "Event Ingestion", description = "Funnel tracking event ingestion")
public class TrackingEventController {

    private final TrackingEventKafkaProducer kafkaProducer;

    @PostMapping
    @Operation(summary = "Ingest a single tracking event", description = "Accepts and queues a single event for async processing")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Event accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable (Kafka down)")
    })
    public ResponseEntity<EventResponse> ingestEvent(@Valid @RequestBody TrackingEventRequest event) throws Exception {
        log.debug("Received event: session_id={}, event_type={}, step={}",
                event.getSessionId(), event.getEventType(), event.getStepNumber());

        kafkaProducer.send(stampReceiveTime(event, Instant.now()));

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(EventResponse.builder()
                        .status("queued")
                        .acceptedCount(1)
                        .sessionCount(1)
                        .message("Tracking event queued for storage")
                        .build());
    }

    /** En fazla 1000 event; hepsi doğrulanıp Kafka'ya paralel gönderilir. */
    @PostMapping("/bulk")
    @Operation(summary = "Bulk ingest tracking events", description = "Accepts up to 1000 events for async processing")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Events accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload(s)"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable")
    })
    public ResponseEntity<EventResponse> ingestBulkEvents(@Valid @RequestBody BulkTrackingEventRequest bulkRequest) throws Exception {
        log.debug("Received bulk request: {} events across {} sessions",
                bulkRequest.getEvents().size(), bulkRequest.sessionCount());

        Instant receivedAt = Instant.now();
        List<TrackingEventRequest> events = bulkRequest.getEvents().stream()
                .map(event -> stampReceiveTime(event, receivedAt))
                .toList();
        kafkaProducer.sendBatch(events);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(EventResponse.builder()
                        .status("queued")
                        .acceptedCount(events.size())
                        .sessionCount(bulkRequest.sessionCount())
                        .message("Tracking events queued for storage")
                        .build());
    }

    /** Timestamp'siz event alındığı an ile damgalanır; idempotency key de bu değeri kullanır. */
    private TrackingEventRequest stampReceiveTime(TrackingEventRequest event, Instant receivedAt) {
        if (event.getTimestamp() == null) {
            event.setTimestamp(receivedAt);
        }
        return event;
    }
}
