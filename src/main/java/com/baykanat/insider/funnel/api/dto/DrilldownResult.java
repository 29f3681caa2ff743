package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** GET /analytics/drilldown yanıtı: sıralı satırlar, Totals satırı ve kullanılan boyut. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel drilldown grouped by one dimension")
public class DrilldownResult {

    public static final String TOTALS_LABEL = "Totals";

    @Schema(description = "Rows ordered by uniqueViews desc (ordinal dimensions: by group key)")
    private List<DrilldownRow> rows;

    @Schema(description = "Reconciled totals row")
    private DrilldownRow totals;

    @Schema(description = "Dimension used for grouping", example = "domain")
    private String groupBy;
}
