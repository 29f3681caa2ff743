package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.DrilldownResult;
import com.baykanat.insider.funnel.api.dto.DrilldownRow;
import com.baykanat.insider.funnel.api.dto.StepData;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.model.StepTally;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Drilldown satırlarından Totals satırını kurar. Sayılar düz toplamdır; adım oranlarının paydası
 * o adımı tamamlayan satırların land base toplamıdır. Böylece 6 adımlı bir funnel 7-9. adımların
 * paydasını büyütmez.
 */
@Component
@RequiredArgsConstructor
public class TotalsReconciler {

    private final FunnelStepAggregator aggregator;

    public DrilldownRow reconcile(List<DrilldownRow> rows) {
        long uniqueViews = 0;
        long grossViews = 0;
        long pageLands = 0;
        long formCompletions = 0;

        Map<StepKey, StepTally> summed = new TreeMap<>();
        Map<StepKey, Long> stepBases = new HashMap<>();

        for (DrilldownRow row : rows) {
            uniqueViews += row.getUniqueViews();
            grossViews += row.getGrossViews();
            pageLands += row.getPageLands();
            formCompletions += row.getFormCompletions();

            List<StepData> steps = row.getSteps() == null ? List.of() : row.getSteps();
            for (StepData step : steps) {
                StepKey key = step.toStepKey();
                StepTally tally = summed.computeIfAbsent(key, StepTally::empty);
                tally.setCompletions(tally.getCompletions() + step.getCompletions());
                tally.setSessionsWithPrev(tally.getSessionsWithPrev() + step.getSessionsWithPrev());
                if (step.getCompletions() > 0) {
                    stepBases.merge(key, row.landBase(), Long::sum);
                }
            }
        }

        DrilldownRow totals = DrilldownRow.builder()
                .groupValue(DrilldownResult.TOTALS_LABEL)
                .uniqueViews(uniqueViews)
                .grossViews(grossViews)
                .pageLands(pageLands)
                .formCompletions(formCompletions)
                .build();

        long flatBase = totals.landBase();
        totals.setSteps(aggregator.computeSteps(
                new ArrayList<>(summed.values()),
                key -> {
                    Long base = stepBases.get(key);
                    return base != null && base > 0 ? base : flatBase;
                }));
        return totals;
    }
}
