package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Dashboard filtre seçenekleri: mevcut veriden distinct değerler. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Distinct filter values present in the event store")
public class FilterOptionsResponse {

    @Schema(example = "[\"seniors\", \"veterans\"]")
    private List<String> pages;

    @Schema(example = "[\"blueskylife.net\"]")
    private List<String> domains;

    @Schema(example = "[\"seniors-lead-v2\"]")
    private List<String> funnelIds;

    @Schema(example = "[\"mobile\", \"desktop\"]")
    private List<String> deviceTypes;

    @Schema(example = "[\"FL\", \"TX\"]")
    private List<String> geoStates;

    @Schema(example = "[\"fb\", \"google\"]")
    private List<String> utmSources;

    @Schema(example = "[\"spring-2025\"]")
    private List<String> utmCampaigns;

    @Schema(example = "[\"cpc\", \"paid\"]")
    private List<String> utmMediums;
}
