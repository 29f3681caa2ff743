package com.baykanat.insider.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/** Bir ya da birden çok oturumun event'leri; sıra korunmaz, consumer oturum zaman çizelgesine göre yazar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Tracking events from one or more sessions, e.g. a client-side buffer flush")
public class BulkTrackingEventRequest {

    @NotEmpty(message = "events must not be empty")
    @Size(max = 1000, message = "at most 1000 tracking events per request")
    @Valid
    private List<@NotNull(message = "events must not contain null entries") TrackingEventRequest> events;

    /** Farklı session_id sayısı; doğrulamadan sonra çağrılır. */
    @JsonIgnore
    public int sessionCount() {
        return (int) events.stream()
                .map(TrackingEventRequest::getSessionId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }
}
