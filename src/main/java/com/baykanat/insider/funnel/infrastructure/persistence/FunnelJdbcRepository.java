package com.baykanat.insider.funnel.infrastructure.persistence;

import com.baykanat.insider.funnel.domain.model.GroupCounts;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.model.StepTally;
import com.baykanat.insider.funnel.domain.query.EventPredicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * tracking_events üzerinde funnel sorguları. Boyut null ise tüm kohort tek grup olarak döner
 * (group_value = NULL). Gruplama bir CTE sütunu üzerinden yapılır, bu yüzden sabit ifade de geçerli.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FunnelJdbcRepository {

    /** Tek kohort sorgularında grup ifadesi. */
    private static final String NO_GROUP_EXPRESSION = "CAST(NULL AS TEXT)";

    private final JdbcTemplate jdbcTemplate;

    /** Grup başına benzersiz oturum, toplam event, page land ve form complete oturum sayıları. */
    public List<GroupCounts> queryGroupCounts(GroupingDimension dimension, EventPredicate predicate) {
        String sql = String.format("""
                WITH scoped AS (
                    SELECT %s AS group_value, session_id, event_type
                    FROM tracking_events
                    WHERE %s
                )
                SELECT group_value,
                       COUNT(DISTINCT session_id) AS unique_views,
                       COUNT(*) AS gross_views,
                       COUNT(DISTINCT CASE WHEN event_type = 'page_land' THEN session_id END) AS page_lands,
                       COUNT(DISTINCT CASE WHEN event_type = 'form_complete' THEN session_id END) AS form_completions
                FROM scoped
                GROUP BY group_value
                """, groupExpression(dimension), predicate.getSql());

        log.debug("Group counts query: groupBy={}, predicate={}", dimension, predicate);
        return jdbcTemplate.query(Objects.requireNonNull(sql), (rs, rowNum) -> GroupCounts.builder()
                .groupValue(rs.getString("group_value"))
                .uniqueViews(rs.getLong("unique_views"))
                .grossViews(rs.getLong("gross_views"))
                .pageLands(rs.getLong("page_lands"))
                .formCompletions(rs.getLong("form_completions"))
                .build(), predicate.toArgs());
    }

    /**
     * Grup ve (adım numarası, adım adı) başına tamamlayan oturum sayısı ve aynı grupta bir önceki
     * adım numarasına da sahip oturum sayısı. page_land adım taşımaz; null/legacy tip taşır.
     */
    public List<StepTally> queryStepCounts(GroupingDimension dimension, EventPredicate predicate) {
        String sql = String.format("""
                WITH step_events AS (
                    SELECT %s AS group_value, session_id, step_number, step_name
                    FROM tracking_events
                    WHERE (event_type IS NULL OR event_type <> 'page_land')
                      AND %s
                ),
                steps AS (
                    SELECT DISTINCT group_value, session_id, step_number, step_name FROM step_events
                ),
                prev AS (
                    SELECT DISTINCT group_value, session_id, step_number FROM step_events
                )
                SELECT s.group_value,
                       s.step_number,
                       s.step_name,
                       COUNT(DISTINCT s.session_id) AS completions,
                       COUNT(DISTINCT p.session_id) AS sessions_with_prev
                FROM steps s
                LEFT JOIN prev p
                       ON p.session_id = s.session_id
                      AND p.step_number = s.step_number - 1
                      AND p.group_value IS NOT DISTINCT FROM s.group_value
                GROUP BY s.group_value, s.step_number, s.step_name
                ORDER BY s.step_number, s.step_name
                """, groupExpression(dimension), predicate.getSql());

        log.debug("Step counts query: groupBy={}, predicate={}", dimension, predicate);
        return jdbcTemplate.query(Objects.requireNonNull(sql), (rs, rowNum) -> StepTally.builder()
                .groupValue(rs.getString("group_value"))
                .stepKey(StepKey.of(rs.getInt("step_number"), rs.getString("step_name")))
                .completions(rs.getLong("completions"))
                .sessionsWithPrev(rs.getLong("sessions_with_prev"))
                .build(), predicate.toArgs());
    }

    /** Düz sütun boyutunun null olmayan farklı değerleri, alfabetik, en fazla limit adet. */
    public List<String> findDistinctValues(GroupingDimension dimension, int limit) {
        if (!dimension.isPlainColumn()) {
            throw new IllegalArgumentException("Distinct values are only available for plain columns: " + dimension);
        }
        String column = dimension.getSqlExpression();
        String sql = String.format("""
                SELECT DISTINCT %s AS value
                FROM tracking_events
                WHERE %s IS NOT NULL AND %s <> ''
                ORDER BY value
                LIMIT ?
                """, column, column, column);

        List<Object> params = new ArrayList<>();
        params.add(limit);
        return jdbcTemplate.queryForList(Objects.requireNonNull(sql), String.class, params.toArray());
    }

    private String groupExpression(GroupingDimension dimension) {
        return dimension == null ? NO_GROUP_EXPRESSION : dimension.getGroupExpression();
    }
}
