package com.baykanat.insider.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Filtrelenmiş kohortun oturum bazlı özeti; stats ve bounce hesapları bunun üzerinden. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionOverview {

    private long totalSessions;
    private long totalEvents;
    /** form_complete event'i olan oturumlar. */
    private long completedSessions;
    /** Hiç step_complete (veya tipsiz) event'i olmayan oturumlar. */
    private long bouncedSessions;
    /** Adım event'i olan oturumların en yüksek adım numarası ortalaması. */
    private double avgMaxStep;
}
