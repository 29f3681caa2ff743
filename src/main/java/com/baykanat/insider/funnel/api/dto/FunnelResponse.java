package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Filtrelenmiş tüm oturumların tek kohort olarak funnel'ı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel for the whole filtered population")
public class FunnelResponse {

    @Schema(description = "Distinct sessions", example = "1920")
    private long uniqueViews;

    @Schema(description = "Total events", example = "10850")
    private long grossViews;

    @Schema(description = "Distinct sessions with a page_land event", example = "1900")
    private long pageLands;

    @Schema(description = "Distinct sessions with a form_complete event", example = "240")
    private long formCompletions;

    @Schema(description = "Per-step funnel data")
    private List<StepData> steps;
}
