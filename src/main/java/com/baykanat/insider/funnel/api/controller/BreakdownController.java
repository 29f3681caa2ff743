package com.baykanat.insider.funnel.api.controller;

import com.baykanat.insider.funnel.api.dto.BounceResponse;
import com.baykanat.insider.funnel.api.dto.CampaignRow;
import com.baykanat.insider.funnel.api.dto.HeatmapCell;
import com.baykanat.insider.funnel.api.dto.ReferrerRow;
import com.baykanat.insider.funnel.api.dto.StatsResponse;
import com.baykanat.insider.funnel.api.dto.StepBreakdown;
import com.baykanat.insider.funnel.api.support.AnalyticsFilterParser;
import com.baykanat.insider.funnel.domain.service.BreakdownService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Dashboard kırılımları; hepsi drilldown ile aynı filtre parametrelerini kabul eder. */
@RestController
@RequestMapping("/analytics")
@RequiredArgsConstructor
@Tag(name = "Breakdowns", description = "Answer distribution, headline stats and traffic breakdowns")
public class BreakdownController {

    private final BreakdownService breakdownService;
    private final AnalyticsFilterParser filterParser;

    @GetMapping("/breakdown")
    @Operation(summary = "Answer distribution per step", description = "Distinct sessions per selected value of each step")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Breakdown computed"),
            @ApiResponse(responseCode = "400", description = "Malformed filter")
    })
    public ResponseEntity<List<StepBreakdown>> breakdown(
            @Parameter(hidden = true) @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(breakdownService.getStepBreakdown(filterParser.parseFilters(params)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Headline numbers: sessions, events, conversion, average steps, bounce rate")
    public ResponseEntity<StatsResponse> stats(
            @Parameter(hidden = true) @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(breakdownService.getStats(filterParser.parseFilters(params)));
    }

    @GetMapping("/bounce")
    @Operation(summary = "Sessions that never completed a step")
    public ResponseEntity<BounceResponse> bounce(
            @Parameter(hidden = true) @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(breakdownService.getBounceRate(filterParser.parseFilters(params)));
    }

    @GetMapping("/campaigns")
    @Operation(summary = "Sessions and completions per campaign, source and medium")
    public ResponseEntity<List<CampaignRow>> campaigns(
            @Parameter(hidden = true) @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(breakdownService.getCampaignComparison(filterParser.parseFilters(params)));
    }

    @GetMapping("/referrers")
    @Operation(summary = "Sessions and completions per referrer")
    public ResponseEntity<List<ReferrerRow>> referrers(
            @Parameter(hidden = true) @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(breakdownService.getReferrerBreakdown(filterParser.parseFilters(params)));
    }

    @GetMapping("/heatmap")
    @Operation(summary = "Sessions and conversions per UTC day of week and hour")
    public ResponseEntity<List<HeatmapCell>> heatmap(
            @Parameter(hidden = true) @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(breakdownService.getTimeHeatmap(filterParser.parseFilters(params)));
    }
}
