package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.TrackingEventRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Tracking event için SHA-256 idempotency key. event_id varsa yalnızca ondan, yoksa
 * session_id + event_type + step_number + step_name + timestamp'ten üretilir.
 */
@Slf4j
@Service
public class IdempotencyService {

    private static final String SEPARATOR = "|";

    /** 64 karakterlik hex key. */
    public String generateKey(TrackingEventRequest event) {
        String raw;
        if (event.getEventId() != null && !event.getEventId().isBlank()) {
            raw = "id" + SEPARATOR + event.getEventId();
        } else {
            raw = event.getSessionId() + SEPARATOR
                    + (event.getEventType() != null ? event.getEventType() : "") + SEPARATOR
                    + event.getStepNumber() + SEPARATOR
                    + event.getStepName() + SEPARATOR
                    + event.getTimestamp();
        }
        return sha256(raw);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
