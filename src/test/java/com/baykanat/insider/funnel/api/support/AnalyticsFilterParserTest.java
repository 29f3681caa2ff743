package com.baykanat.insider.funnel.api.support;

import com.baykanat.insider.funnel.domain.exception.InvalidQueryParameterException;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for AnalyticsFilterParser.
 *
 * <p>Covers repeated and comma separated filters, the audience alias, date/time parsing and
 * the groupBy / parent dimension lookups.
 */
class AnalyticsFilterParserTest {

    private final AnalyticsFilterParser parser = new AnalyticsFilterParser();

    @Test
    @DisplayName("Repeated and comma separated values are merged, audience is an alias of page")
    void mergesMultiValuedFilters() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("domain", "a.com, b.com");
        params.add("domain", "c.com");
        params.add("page", "seniors");
        params.add("audience", "veterans");
        params.add("excludeBots", "TRUE");

        AnalyticsFilters filters = parser.parseFilters(params);

        assertThat(filters.getDomain()).containsExactly("a.com", "b.com", "c.com");
        assertThat(filters.getPage()).containsExactly("seniors", "veterans");
        assertThat(filters.isExcludeBots()).isTrue();
        assertThat(filters.getUtmSource()).isEmpty();
    }

    @Test
    @DisplayName("Dates are ISO, times are HH:MM")
    void parsesDateAndTime() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("startDate", "2025-02-10");
        params.add("endDate", "2025-02-11");
        params.add("startTime", "09:30");
        params.add("endTime", "17:45");

        AnalyticsFilters filters = parser.parseFilters(params);

        assertThat(filters.getStartDate()).isEqualTo(LocalDate.of(2025, 2, 10));
        assertThat(filters.getEndDate()).isEqualTo(LocalDate.of(2025, 2, 11));
        assertThat(filters.getStartTime()).isEqualTo(LocalTime.of(9, 30));
        assertThat(filters.getEndTime()).isEqualTo(LocalTime.of(17, 45));
    }

    @Test
    @DisplayName("Malformed date is rejected with the field name")
    void rejectsMalformedDate() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("startDate", "10/02/2025");

        assertThatThrownBy(() -> parser.parseFilters(params))
                .isInstanceOf(InvalidQueryParameterException.class)
                .extracting("field").isEqualTo("startDate");
    }

    @Test
    @DisplayName("Malformed time is rejected with the field name")
    void rejectsMalformedTime() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("endTime", "25:99");

        assertThatThrownBy(() -> parser.parseFilters(params))
                .isInstanceOf(InvalidQueryParameterException.class)
                .extracting("field").isEqualTo("endTime");
    }

    @Test
    @DisplayName("excludeBots accepts only true or false")
    void rejectsBadBoolean() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("excludeBots", "yes");

        assertThatThrownBy(() -> parser.parseFilters(params))
                .isInstanceOf(InvalidQueryParameterException.class)
                .extracting("field").isEqualTo("excludeBots");
    }

    @Test
    @DisplayName("groupBy defaults to domain and rejects unknown dimensions")
    void parsesGroupBy() {
        assertThat(parser.parseGroupBy(null)).isEqualTo(GroupingDimension.DOMAIN);
        assertThat(parser.parseGroupBy("hourOfDay")).isEqualTo(GroupingDimension.HOUR_OF_DAY);
        assertThatThrownBy(() -> parser.parseGroupBy("browserVersion"))
                .isInstanceOf(InvalidQueryParameterException.class)
                .hasMessageContaining("browserVersion");
    }

    @Test
    @DisplayName("parent.* parameters become the parent filter map, empty value kept as empty")
    void parsesParentFilters() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("parent.domain", "a.com");
        params.add("parent.utmSource", "");
        params.add("domain", "ignored-here.com");

        Map<GroupingDimension, String> parents = parser.parseParentFilters(params);

        assertThat(parents).containsExactly(
                entry(GroupingDimension.DOMAIN, "a.com"),
                entry(GroupingDimension.UTM_SOURCE, ""));
    }

    @Test
    @DisplayName("Unknown parent dimension is rejected")
    void rejectsUnknownParent() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("parent.color", "blue");

        assertThatThrownBy(() -> parser.parseParentFilters(params))
                .isInstanceOf(InvalidQueryParameterException.class)
                .extracting("field").isEqualTo("parent.color");
    }
}
