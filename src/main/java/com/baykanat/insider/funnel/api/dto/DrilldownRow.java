package com.baykanat.insider.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Drilldown'da bir boyut değerinin funnel satırı; toplam satırı da aynı şekli kullanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel row for one dimension value")
public class DrilldownRow {

    @Schema(description = "Dimension value, (unknown)/(none) when the attribute is missing", example = "blueskylife.net")
    private String groupValue;

    @Schema(description = "Distinct sessions with any event in the group", example = "120")
    private long uniqueViews;

    @Schema(description = "Total events in the group", example = "450")
    private long grossViews;

    @Schema(description = "Distinct sessions with a page_land event", example = "120")
    private long pageLands;

    @Schema(description = "Distinct sessions with a form_complete event", example = "18")
    private long formCompletions;

    @Schema(description = "Per-step funnel data ordered by step number, then name")
    private List<StepData> steps;

    /** Land base: page land varsa o, yoksa benzersiz görüntüleme. */
    @JsonIgnore
    public long landBase() {
        return pageLands > 0 ? pageLands : uniqueViews;
    }
}
