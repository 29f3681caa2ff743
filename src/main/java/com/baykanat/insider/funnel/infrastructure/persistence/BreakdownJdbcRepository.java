package com.baykanat.insider.funnel.infrastructure.persistence;

import com.baykanat.insider.funnel.api.dto.CampaignRow;
import com.baykanat.insider.funnel.api.dto.HeatmapCell;
import com.baykanat.insider.funnel.api.dto.ReferrerRow;
import com.baykanat.insider.funnel.domain.model.OptionCount;
import com.baykanat.insider.funnel.domain.model.SessionOverview;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.query.EventPredicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Funnel dışı dashboard sorguları: cevap dağılımı, oturum özeti, kampanya/referrer kırılımı ve
 * gün-saat ısı haritası. "Completion" form_complete event'i olan oturumdur.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class BreakdownJdbcRepository {

    /** step_complete ya da tipsiz legacy event. */
    private static final String STEP_COMPLETE = "(event_type IS NULL OR event_type = 'step_complete')";

    private static final String COMPLETED_SESSION =
            "COUNT(DISTINCT CASE WHEN event_type = 'form_complete' THEN session_id END)";

    private final JdbcTemplate jdbcTemplate;

    /** Adım ve seçilen değer başına oturum; boş cevaplar sayılmaz. */
    public List<OptionCount> queryOptionCounts(EventPredicate predicate) {
        String sql = String.format("""
                SELECT step_number, step_name, selected_value, COUNT(DISTINCT session_id) AS sessions
                FROM tracking_events
                WHERE %s
                  AND %s
                  AND selected_value IS NOT NULL AND selected_value <> ''
                GROUP BY step_number, step_name, selected_value
                ORDER BY step_number, step_name, sessions DESC, selected_value
                """, predicate.getSql(), STEP_COMPLETE);

        log.debug("Option counts query: predicate={}", predicate);
        return jdbcTemplate.query(Objects.requireNonNull(sql), (rs, rowNum) -> OptionCount.builder()
                .stepKey(StepKey.of(rs.getInt("step_number"), rs.getString("step_name")))
                .value(rs.getString("selected_value"))
                .sessions(rs.getLong("sessions"))
                .build(), predicate.toArgs());
    }

    /** Tek satır: oturum, event, tamamlanan, bounce sayıları ve ortalama en yüksek adım. */
    public SessionOverview querySessionOverview(EventPredicate predicate) {
        String sql = String.format("""
                WITH per_session AS (
                    SELECT session_id,
                           COUNT(*) AS events,
                           BOOL_OR(event_type = 'form_complete') AS completed,
                           BOOL_OR(%s) AS has_step,
                           MAX(CASE WHEN %s THEN step_number END) AS max_step
                    FROM tracking_events
                    WHERE %s
                    GROUP BY session_id
                )
                SELECT COUNT(*) AS total_sessions,
                       COALESCE(SUM(events), 0) AS total_events,
                       COUNT(*) FILTER (WHERE completed) AS completed_sessions,
                       COUNT(*) FILTER (WHERE NOT has_step) AS bounced_sessions,
                       COALESCE(AVG(max_step), 0) AS avg_max_step
                FROM per_session
                """, STEP_COMPLETE, STEP_COMPLETE, predicate.getSql());

        log.debug("Session overview query: predicate={}", predicate);
        return jdbcTemplate.queryForObject(Objects.requireNonNull(sql), (rs, rowNum) -> SessionOverview.builder()
                .totalSessions(rs.getLong("total_sessions"))
                .totalEvents(rs.getLong("total_events"))
                .completedSessions(rs.getLong("completed_sessions"))
                .bouncedSessions(rs.getLong("bounced_sessions"))
                .avgMaxStep(rs.getDouble("avg_max_step"))
                .build(), predicate.toArgs());
    }

    /** Kampanya/kaynak/medium üçlüsü başına; eksik değer (none). Oturuma göre azalan, en fazla limit. */
    public List<CampaignRow> queryCampaigns(EventPredicate predicate, int limit) {
        String sql = String.format("""
                SELECT COALESCE(NULLIF(utm_campaign, ''), '(none)') AS campaign,
                       COALESCE(NULLIF(utm_source, ''), '(none)') AS source,
                       COALESCE(NULLIF(utm_medium, ''), '(none)') AS medium,
                       COUNT(DISTINCT session_id) AS sessions,
                       %s AS completions
                FROM tracking_events
                WHERE %s
                GROUP BY 1, 2, 3
                ORDER BY sessions DESC, campaign, source, medium
                LIMIT ?
                """, COMPLETED_SESSION, predicate.getSql());

        return jdbcTemplate.query(Objects.requireNonNull(sql), (rs, rowNum) -> CampaignRow.builder()
                .campaign(rs.getString("campaign"))
                .source(rs.getString("source"))
                .medium(rs.getString("medium"))
                .sessions(rs.getLong("sessions"))
                .completions(rs.getLong("completions"))
                .build(), withLimit(predicate, limit));
    }

    /** Referrer başına; eksik referrer (direct). */
    public List<ReferrerRow> queryReferrers(EventPredicate predicate, int limit) {
        String sql = String.format("""
                SELECT COALESCE(NULLIF(referrer, ''), '(direct)') AS referrer,
                       COUNT(DISTINCT session_id) AS sessions,
                       %s AS completions
                FROM tracking_events
                WHERE %s
                GROUP BY 1
                ORDER BY sessions DESC, referrer
                LIMIT ?
                """, COMPLETED_SESSION, predicate.getSql());

        return jdbcTemplate.query(Objects.requireNonNull(sql), (rs, rowNum) -> ReferrerRow.builder()
                .referrer(rs.getString("referrer"))
                .sessions(rs.getLong("sessions"))
                .completions(rs.getLong("completions"))
                .build(), withLimit(predicate, limit));
    }

    /** UTC gün (0 = Pazar) ve saat başına; yalnızca event'i olan hücreler döner. */
    public List<HeatmapCell> queryHeatmap(EventPredicate predicate) {
        String sql = String.format("""
                WITH scoped AS (
                    SELECT CAST(EXTRACT(DOW FROM event_timestamp AT TIME ZONE 'UTC') AS INTEGER) AS day_of_week,
                           CAST(EXTRACT(HOUR FROM event_timestamp AT TIME ZONE 'UTC') AS INTEGER) AS hour,
                           session_id, event_type
                    FROM tracking_events
                    WHERE %s
                )
                SELECT day_of_week, hour,
                       COUNT(DISTINCT session_id) AS sessions,
                       %s AS conversions
                FROM scoped
                GROUP BY day_of_week, hour
                ORDER BY day_of_week, hour
                """, predicate.getSql(), COMPLETED_SESSION);

        return jdbcTemplate.query(Objects.requireNonNull(sql), (rs, rowNum) -> HeatmapCell.builder()
                .dayOfWeek(rs.getInt("day_of_week"))
                .hour(rs.getInt("hour"))
                .sessions(rs.getLong("sessions"))
                .conversions(rs.getLong("conversions"))
                .build(), predicate.toArgs());
    }

    private Object[] withLimit(EventPredicate predicate, int limit) {
        List<Object> params = new ArrayList<>(predicate.getParams());
        params.add(limit);
        return params.toArray();
    }
}
