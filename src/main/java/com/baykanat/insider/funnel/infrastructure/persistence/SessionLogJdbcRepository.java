package com.baykanat.insider.funnel.infrastructure.persistence;

import com.baykanat.insider.funnel.domain.query.EventPredicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Session log sayfalama sorguları: eşleşen oturum sayısı ve sayfadaki oturum id'leri. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SessionLogJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Predicate'e uyan en az bir event'i olan farklı oturum sayısı. */
    public long countSessions(EventPredicate predicate) {
        String sql = Objects.requireNonNull(
                "SELECT COUNT(DISTINCT session_id) FROM tracking_events WHERE " + predicate.getSql());
        Long count = jdbcTemplate.queryForObject(sql, Long.class, predicate.toArgs());
        return count != null ? count : 0L;
    }

    /** Son aktiviteye göre azalan, eşitlikte session_id artan; aynı veriyle sayfalar kararlıdır. */
    public List<String> findSessionIdsPage(EventPredicate predicate, int limit, long offset) {
        String sql = String.format("""
                SELECT session_id
                FROM tracking_events
                WHERE %s
                GROUP BY session_id
                ORDER BY MAX(event_timestamp) DESC, session_id ASC
                LIMIT ? OFFSET ?
                """, predicate.getSql());

        List<Object> params = new ArrayList<>(predicate.getParams());
        params.add(limit);
        params.add(offset);

        return jdbcTemplate.queryForList(Objects.requireNonNull(sql), String.class, params.toArray());
    }
}
