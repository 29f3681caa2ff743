package com.baykanat.insider.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 202 yanıtı: kuyruğa alınan event ve oturum sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Acknowledgement for queued tracking events")
public class EventResponse {

    @Schema(example = "queued")
    private String status;

    @Schema(description = "Tracking events handed to Kafka", example = "12")
    private int acceptedCount;

    @Schema(description = "Distinct session_id values among the queued events", example = "3")
    private int sessionCount;

    @Schema(description = "Events are written by the consumer; analytics reflect them once stored",
            example = "Tracking events queued for storage")
    private String message;
}
