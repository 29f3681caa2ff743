package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Bir adımın cevap dağılımı; seçenekler oturum sayısına göre azalan. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Answer distribution of one step")
public class StepBreakdown {

    @Schema(example = "2")
    private int stepNumber;

    @Schema(example = "State")
    private String stepName;

    @Schema(example = "2:State")
    private String stepKey;

    @Schema(description = "Sum of option counts", example = "120")
    private long totalResponses;

    private List<StepOption> options;
}
