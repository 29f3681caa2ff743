package com.baykanat.insider.funnel.api.controller;

import com.baykanat.insider.funnel.api.dto.DrilldownResult;
import com.baykanat.insider.funnel.api.dto.FilterOptionsResponse;
import com.baykanat.insider.funnel.api.dto.FunnelResponse;
import com.baykanat.insider.funnel.api.support.AnalyticsFilterParser;
import com.baykanat.insider.funnel.config.AppProperties;
import com.baykanat.insider.funnel.domain.exception.InvalidQueryParameterException;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import com.baykanat.insider.funnel.domain.service.DrilldownService;
import com.baykanat.insider.funnel.domain.service.FunnelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** GET /analytics/drilldown, /analytics/funnel ve /analytics/filter-options. */
@Slf4j
@RestController
@RequestMapping("/analytics")
@RequiredArgsConstructor
@Validated
@Tag(name = "Funnel Analytics", description = "Funnel drilldown and overview endpoints")
public class AnalyticsController {

    private final DrilldownService drilldownService;
    private final FunnelService funnelService;
    private final AnalyticsFilterParser filterParser;
    private final AppProperties appProperties;

    /** "Satırı aç": aynı endpoint, parent.{boyut}=değer eklenmiş ve kullanılmamış bir groupBy ile. */
    @GetMapping("/drilldown")
    @Operation(summary = "Funnel drilldown by dimension",
            description = "Returns one funnel row per value of groupBy plus a reconciled totals row. "
                    + "Expand a row by repeating the call with parent.<dimension>=<rowValue>.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Drilldown computed"),
            @ApiResponse(responseCode = "400", description = "Unknown dimension, malformed filter or depth exceeded")
    })
    public ResponseEntity<DrilldownResult> drilldown(
            @Parameter(description = "Grouping dimension", example = "domain")
            @RequestParam(value = "groupBy", required = false) String groupBy,

            @Parameter(hidden = true)
            @RequestParam MultiValueMap<String, String> params
    ) {
        GroupingDimension dimension = filterParser.parseGroupBy(groupBy);
        Map<GroupingDimension, String> parents = filterParser.parseParentFilters(params);

        int maxDepth = appProperties.getAnalytics().getMaxDrilldownDepth();
        if (parents.size() + 1 > maxDepth) {
            throw new InvalidQueryParameterException("parent",
                    "Drilldown path supports at most " + maxDepth + " dimensions");
        }

        AnalyticsFilters filters = filterParser.parseFilters(params);
        log.debug("Drilldown request: groupBy={}, parents={}", dimension, parents);

        return ResponseEntity.ok(drilldownService.drilldown(filters, dimension, parents));
    }

    @GetMapping("/funnel")
    @Operation(summary = "Funnel for the whole filtered population")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Funnel computed"),
            @ApiResponse(responseCode = "400", description = "Malformed filter")
    })
    public ResponseEntity<FunnelResponse> funnel(
            @Parameter(hidden = true)
            @RequestParam MultiValueMap<String, String> params
    ) {
        return ResponseEntity.ok(funnelService.getFunnel(filterParser.parseFilters(params)));
    }

    @GetMapping("/filter-options")
    @Operation(summary = "Distinct values for the filter dropdowns")
    public ResponseEntity<FilterOptionsResponse> filterOptions() {
        return ResponseEntity.ok(funnelService.getFilterOptions());
    }
}
