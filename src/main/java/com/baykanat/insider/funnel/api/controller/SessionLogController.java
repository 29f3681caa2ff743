package com.baykanat.insider.funnel.api.controller;

import com.baykanat.insider.funnel.api.dto.SessionLogResponse;
import com.baykanat.insider.funnel.api.support.AnalyticsFilterParser;
import com.baykanat.insider.funnel.domain.service.SessionLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** GET /analytics/sessions: ham event'lerden yeniden kurulan oturumlar, sayfalı. */
@Slf4j
@RestController
@RequestMapping("/analytics")
@RequiredArgsConstructor
@Validated
@Tag(name = "Session Log", description = "Session reconstruction endpoint")
public class SessionLogController {

    private final SessionLogService sessionLogService;
    private final AnalyticsFilterParser filterParser;

    @GetMapping("/sessions")
    @Operation(summary = "Paginated session log",
            description = "Sessions ordered by latest activity; each carries all of its events")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sessions retrieved"),
            @ApiResponse(responseCode = "400", description = "Invalid page or malformed filter")
    })
    public ResponseEntity<SessionLogResponse> sessions(
            @Parameter(description = "1-based page number", example = "1")
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,

            @Parameter(description = "Page size, clamped to [1, 200]", example = "25")
            @RequestParam(value = "limit", required = false) Integer limit,

            @Parameter(description = "Case-insensitive substring search", example = "florida")
            @RequestParam(value = "search", required = false) String search,

            @Parameter(hidden = true)
            @RequestParam MultiValueMap<String, String> params
    ) {
        log.debug("Session log request: page={}, limit={}, search={}", page, limit, search);
        return ResponseEntity.ok(sessionLogService.getSessions(filterParser.parseFilters(params), search, page, limit));
    }
}
