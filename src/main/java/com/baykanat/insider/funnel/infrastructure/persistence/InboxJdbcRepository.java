package com.baykanat.insider.funnel.infrastructure.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ingestion inbox'ı. Her key hangi oturuma ait olduğunu taşır; temizlik oturum bazında yapılır,
 * hâlâ event alan oturumun key'leri silinmez.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InboxJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Verilen key'lerden daha önce işlenmiş olanlar. */
    public Set<String> findExistingKeys(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Set.of();
        }

        String placeholders = String.join(",", keys.stream().map(k -> "?").toList());
        String sql = "SELECT idempotency_key FROM inbox WHERE idempotency_key IN (" + placeholders + ")";

        return new HashSet<>(jdbcTemplate.queryForList(sql, String.class, keys.toArray()));
    }

    /** key → session_id; yarışta ikinci yazım atlanır. */
    public void batchInsert(Map<String, String> keyToSession) {
        if (keyToSession.isEmpty()) {
            return;
        }

        String sql = "INSERT INTO inbox (idempotency_key, session_id) VALUES (?, ?) ON CONFLICT DO NOTHING";
        List<Object[]> batchArgs = keyToSession.entrySet().stream()
                .map(entry -> new Object[]{
                        Objects.requireNonNull(entry.getKey(), "key"),
                        Objects.requireNonNull(entry.getValue(), "sessionId")})
                .toList();
        jdbcTemplate.batchUpdate(sql, Objects.requireNonNull(batchArgs));
    }

    /**
     * Son retentionDays içinde hiç key'i olmayan oturumların key'lerini siler; silinen her key için
     * oturum id'si döner.
     * Aktif oturumda geç gelen tekrarlar böylece hâlâ yakalanır.
     */
    public List<String> deleteIdleSessions(int retentionDays) {
        String sql = """
                WITH idle AS (
                    SELECT session_id
                    FROM inbox
                    GROUP BY session_id
                    HAVING MAX(received_at) < NOW() - INTERVAL '1 day' * ?
                )
                DELETE FROM inbox i
                USING idle
                WHERE i.session_id = idle.session_id
                RETURNING i.session_id
                """;
        List<String> deleted = jdbcTemplate.queryForList(sql, String.class, retentionDays);
        log.debug("Inbox cleanup removed {} keys idle for {} days", deleted.size(), retentionDays);
        return deleted;
    }
}
