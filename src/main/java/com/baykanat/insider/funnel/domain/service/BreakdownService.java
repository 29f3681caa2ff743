package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.BounceResponse;
import com.baykanat.insider.funnel.api.dto.CampaignRow;
import com.baykanat.insider.funnel.api.dto.HeatmapCell;
import com.baykanat.insider.funnel.api.dto.ReferrerRow;
import com.baykanat.insider.funnel.api.dto.StatsResponse;
import com.baykanat.insider.funnel.api.dto.StepBreakdown;
import com.baykanat.insider.funnel.api.dto.StepOption;
import com.baykanat.insider.funnel.config.AppProperties;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.OptionCount;
import com.baykanat.insider.funnel.domain.model.SessionOverview;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.query.EventPredicate;
import com.baykanat.insider.funnel.domain.query.FilterPredicateBuilder;
import com.baykanat.insider.funnel.infrastructure.persistence.BreakdownJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dashboard kırılımları: adım cevap dağılımı, özet istatistikler, bounce, kampanya, referrer ve
 * ısı haritası. Hepsi funnel ile aynı AnalyticsFilters → EventPredicate yolunu kullanır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BreakdownService {

    private final BreakdownJdbcRepository breakdownRepository;
    private final FilterPredicateBuilder predicateBuilder;
    private final AppProperties appProperties;

    /** Adım anahtarı sırasıyla; her adımın seçenekleri oturum sayısına göre azalan. */
    public List<StepBreakdown> getStepBreakdown(AnalyticsFilters filters) {
        EventPredicate predicate = predicateBuilder.build(filters);
        log.debug("Step breakdown: predicate={}", predicate);

        Map<StepKey, List<OptionCount>> byStep = new LinkedHashMap<>();
        for (OptionCount option : breakdownRepository.queryOptionCounts(predicate)) {
            byStep.computeIfAbsent(option.getStepKey(), key -> new ArrayList<>()).add(option);
        }

        List<StepBreakdown> steps = new ArrayList<>(byStep.size());
        for (Map.Entry<StepKey, List<OptionCount>> entry : byStep.entrySet()) {
            long total = entry.getValue().stream().mapToLong(OptionCount::getSessions).sum();
            List<StepOption> options = entry.getValue().stream()
                    .map(option -> StepOption.builder()
                            .value(option.getValue())
                            .count(option.getSessions())
                            .percentage(FunnelStepAggregator.percentage(option.getSessions(), total))
                            .build())
                    .toList();

            StepKey key = entry.getKey();
            steps.add(StepBreakdown.builder()
                    .stepNumber(key.getStepNumber())
                    .stepName(key.getStepName())
                    .stepKey(key.asKey())
                    .totalResponses(total)
                    .options(options)
                    .build());
        }
        return steps;
    }

    public StatsResponse getStats(AnalyticsFilters filters) {
        SessionOverview overview = breakdownRepository.querySessionOverview(predicateBuilder.build(filters));
        return StatsResponse.builder()
                .totalSessions(overview.getTotalSessions())
                .totalEvents(overview.getTotalEvents())
                .overallConversion(FunnelStepAggregator.percentage(
                        overview.getCompletedSessions(), overview.getTotalSessions()))
                .avgStepsCompleted(Math.round(overview.getAvgMaxStep() * 10) / 10.0)
                .bounceRate(FunnelStepAggregator.percentage(
                        overview.getBouncedSessions(), overview.getTotalSessions()))
                .build();
    }

    /** Bounce: hiç adım tamamlamamış oturum (yalnızca page_land ya da form_complete). */
    public BounceResponse getBounceRate(AnalyticsFilters filters) {
        SessionOverview overview = breakdownRepository.querySessionOverview(predicateBuilder.build(filters));
        return BounceResponse.builder()
                .totalVisitors(overview.getTotalSessions())
                .bouncedVisitors(overview.getBouncedSessions())
                .bounceRate(FunnelStepAggregator.percentage(
                        overview.getBouncedSessions(), overview.getTotalSessions()))
                .build();
    }

    public List<CampaignRow> getCampaignComparison(AnalyticsFilters filters) {
        List<CampaignRow> rows = breakdownRepository.queryCampaigns(predicateBuilder.build(filters),
                appProperties.getAnalytics().getCampaignLimit());
        rows.forEach(row -> row.setConversionRate(
                FunnelStepAggregator.percentage(row.getCompletions(), row.getSessions())));
        return rows;
    }

    public List<ReferrerRow> getReferrerBreakdown(AnalyticsFilters filters) {
        List<ReferrerRow> rows = breakdownRepository.queryReferrers(predicateBuilder.build(filters),
                appProperties.getAnalytics().getReferrerLimit());
        rows.forEach(row -> row.setConversionRate(
                FunnelStepAggregator.percentage(row.getCompletions(), row.getSessions())));
        return rows;
    }

    public List<HeatmapCell> getTimeHeatmap(AnalyticsFilters filters) {
        List<HeatmapCell> cells = breakdownRepository.queryHeatmap(predicateBuilder.build(filters));
        cells.forEach(cell -> cell.setConversionRate(
                FunnelStepAggregator.percentage(cell.getConversions(), cell.getSessions())));
        return cells;
    }
}
