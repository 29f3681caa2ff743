package com.baykanat.insider.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bir kohortta tek adımın ham sayıları. sessionsWithPrev: bu adıma ve bir önceki adım
 * numarasına birlikte ulaşan oturum sayısı (oturum seviyesinde join).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepTally {

    /** Drilldown'da grubun ham değeri; tek kohort sorgularında null. */
    private String groupValue;
    private StepKey stepKey;
    private long completions;
    private long sessionsWithPrev;

    public static StepTally empty(StepKey stepKey) {
        return StepTally.builder().stepKey(stepKey).build();
    }
}
