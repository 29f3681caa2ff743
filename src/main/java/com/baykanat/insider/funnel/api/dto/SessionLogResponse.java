package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** GET /analytics/sessions yanıtı: sayfadaki oturumlar + sayfalama bilgisi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paginated session log")
public class SessionLogResponse {

    @Schema(description = "Sessions ordered by most recent activity")
    private List<SessionSummary> sessions;

    @Schema(description = "Distinct sessions matching the filters", example = "1920")
    private long total;

    @Schema(example = "1")
    private int page;

    @Schema(example = "25")
    private int limit;

    @Schema(example = "77")
    private long totalPages;
}
