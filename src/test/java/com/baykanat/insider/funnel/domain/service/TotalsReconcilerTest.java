package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.DrilldownRow;
import com.baykanat.insider.funnel.api.dto.StepData;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.model.StepTally;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for TotalsReconciler.
 *
 * <p>Verifies that the totals row sums counts and uses, per step, only the land bases of the
 * rows that actually reached that step.
 */
class TotalsReconcilerTest {

    private final TotalsReconciler reconciler = new TotalsReconciler(new FunnelStepAggregator());

    @Test
    @DisplayName("Totals counts and per-step completions are straight sums of the rows")
    void sumsCountsAndCompletions() {
        DrilldownRow a = row("a.com", 120, 100, steps(new long[]{90, 70}, new long[]{0, 65}));
        DrilldownRow b = row("b.com", 80, 60, steps(new long[]{40, 20}, new long[]{0, 18}));

        DrilldownRow totals = reconciler.reconcile(List.of(a, b));

        assertThat(totals.getGroupValue()).isEqualTo("Totals");
        assertThat(totals.getUniqueViews()).isEqualTo(200);
        assertThat(totals.getPageLands()).isEqualTo(160);
        assertThat(totals.getGrossViews()).isEqualTo(600);
        assertThat(totals.getSteps()).extracting(StepData::getCompletions).containsExactly(130L, 90L);
        assertThat(totals.getSteps()).extracting(StepData::getSessionsWithPrev).containsExactly(0L, 83L);
    }

    @Test
    @DisplayName("Steps 7-9 of a 9-step funnel are based only on the group that has them")
    void heterogeneousFunnelsUsePerStepBase() {
        long[] nineStep = {90, 85, 80, 75, 70, 60, 40, 30, 20};
        long[] sixStep = {270, 240, 210, 180, 150, 120, 0, 0, 0};
        DrilldownRow longFunnel = row("long", 100, 100, steps(nineStep, prevOf(nineStep)));
        DrilldownRow shortFunnel = row("short", 300, 300, steps(sixStep, prevOf(sixStep)));

        DrilldownRow totals = reconciler.reconcile(List.of(longFunnel, shortFunnel));

        StepData step1 = totals.getSteps().get(0);
        StepData step7 = totals.getSteps().get(6);
        StepData step9 = totals.getSteps().get(8);
        // step 1: 360 / (100 + 300)
        assertThat(step1.getConversionFromInitial()).isEqualTo(90.0);
        // step 7: 40 / 100, not 40 / 400
        assertThat(step7.getConversionFromInitial()).isEqualTo(40.0);
        assertThat(step9.getConversionFromInitial()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("A row without page lands contributes its unique views to the step base")
    void rowWithoutPageLandsContributesUniqueViews() {
        DrilldownRow landed = row("landed", 100, 100, steps(new long[]{50}, new long[]{0}));
        DrilldownRow legacy = row("legacy", 50, 0, steps(new long[]{25}, new long[]{0}));

        DrilldownRow totals = reconciler.reconcile(List.of(landed, legacy));

        assertThat(totals.getSteps().get(0).getConversionFromInitial()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Reconciling a single row reproduces that row's rates")
    void singleRowMatchesItself() {
        FunnelStepAggregator aggregator = new FunnelStepAggregator();
        DrilldownRow only = row("only", 100, 80, null);
        only.setSteps(aggregator.computeSteps(List.of(
                StepTally.builder()
                        .stepKey(StepKey.of(1, "Zip")).completions(60).build(),
                StepTally.builder()
                        .stepKey(StepKey.of(2, "State")).completions(30).sessionsWithPrev(27).build()),
                key -> only.landBase()));

        DrilldownRow totals = reconciler.reconcile(List.of(only));

        assertThat(totals.getSteps()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(only.getSteps());
    }

    @Test
    @DisplayName("No rows produce an empty totals row")
    void emptyRows() {
        DrilldownRow totals = reconciler.reconcile(List.of());

        assertThat(totals.getUniqueViews()).isZero();
        assertThat(totals.getSteps()).isEmpty();
    }

    private static DrilldownRow row(String value, long uniqueViews, long pageLands, List<StepData> steps) {
        return DrilldownRow.builder()
                .groupValue(value)
                .uniqueViews(uniqueViews)
                .grossViews(uniqueViews * 3)
                .pageLands(pageLands)
                .steps(steps)
                .build();
    }

    private static List<StepData> steps(long[] completions, long[] sessionsWithPrev) {
        List<StepData> steps = new ArrayList<>();
        for (int i = 0; i < completions.length; i++) {
            StepKey key = StepKey.of(i + 1, "Step" + (i + 1));
            steps.add(StepData.builder()
                    .stepNumber(key.getStepNumber())
                    .stepName(key.getStepName())
                    .stepKey(key.asKey())
                    .completions(completions[i])
                    .sessionsWithPrev(sessionsWithPrev[i])
                    .build());
        }
        return steps;
    }

    private static long[] prevOf(long[] completions) {
        long[] prev = new long[completions.length];
        for (int i = 1; i < completions.length; i++) {
            prev[i] = completions[i];
        }
        return prev;
    }
}
