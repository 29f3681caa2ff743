package com.baykanat.insider.funnel.infrastructure.persistence;

import com.baykanat.insider.funnel.domain.model.TrackingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** tracking_events tablosu: JDBC batch insert (ON CONFLICT DO NOTHING) ve oturum bazlı okuma. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TrackingEventJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO tracking_events (event_id, session_id, event_type, page, page_type, domain, funnel_id,
                                         step_number, step_name, selected_value, time_on_step, event_timestamp,
                                         device_type, os, browser, geo_state, selected_state, country,
                                         utm_source, utm_campaign, utm_medium, utm_content, utm_term,
                                         referrer, user_agent, ip_address, is_bot,
                                         external_id, fbclid, ad_id, first_name, last_name, email, phone,
                                         idempotency_key)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (idempotency_key) DO NOTHING
            """;

    private static final String SELECT_COLUMNS = """
            SELECT id, event_id, session_id, event_type, page, page_type, domain, funnel_id,
                   step_number, step_name, selected_value, time_on_step, event_timestamp,
                   device_type, os, browser, geo_state, selected_state, country,
                   utm_source, utm_campaign, utm_medium, utm_content, utm_term,
                   referrer, user_agent, ip_address, is_bot,
                   external_id, fbclid, ad_id, first_name, last_name, email, phone,
                   idempotency_key, received_at
            FROM tracking_events
            """;

    private static final RowMapper<TrackingEvent> ROW_MAPPER = TrackingEventJdbcRepository::mapRow;

    /** Event listesini batch insert eder; aynı idempotency key'e sahip satır atlanır. */
    public int[][] batchInsert(List<TrackingEvent> events) {
        return jdbcTemplate.batchUpdate(INSERT_SQL, events, events.size(),
                (ps, event) -> {
                    int i = 1;
                    ps.setString(i++, event.getEventId());
                    ps.setString(i++, event.getSessionId());
                    ps.setString(i++, event.getEventType());
                    ps.setString(i++, event.getPage());
                    ps.setString(i++, event.getPageType());
                    ps.setString(i++, event.getDomain());
                    ps.setString(i++, event.getFunnelId());
                    ps.setInt(i++, event.getStepNumber());
                    ps.setString(i++, event.getStepName());
                    ps.setString(i++, event.getSelectedValue());
                    ps.setObject(i++, event.getTimeOnStep(), Types.INTEGER);
                    ps.setTimestamp(i++, Timestamp.from(Objects.requireNonNull(event.getEventTimestamp(), "eventTimestamp")));
                    ps.setString(i++, event.getDeviceType());
                    ps.setString(i++, event.getOs());
                    ps.setString(i++, event.getBrowser());
                    ps.setString(i++, event.getGeoState());
                    ps.setString(i++, event.getSelectedState());
                    ps.setString(i++, event.getCountry());
                    ps.setString(i++, event.getUtmSource());
                    ps.setString(i++, event.getUtmCampaign());
                    ps.setString(i++, event.getUtmMedium());
                    ps.setString(i++, event.getUtmContent());
                    ps.setString(i++, event.getUtmTerm());
                    ps.setString(i++, event.getReferrer());
                    ps.setString(i++, event.getUserAgent());
                    ps.setString(i++, event.getIpAddress());
                    ps.setObject(i++, event.getBot(), Types.BOOLEAN);
                    ps.setString(i++, event.getExternalId());
                    ps.setString(i++, event.getFbclid());
                    ps.setString(i++, event.getAdId());
                    ps.setString(i++, event.getFirstName());
                    ps.setString(i++, event.getLastName());
                    ps.setString(i++, event.getEmail());
                    ps.setString(i++, event.getPhone());
                    ps.setString(i, event.getIdempotencyKey());
                });
    }

    /** Verilen oturumların tüm event'leri (filtre uygulanmadan), zaman sırasıyla. */
    public List<TrackingEvent> findBySessionIds(Collection<String> sessionIds) {
        if (sessionIds.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(",", sessionIds.stream().map(id -> "?").toList());
        String sql = Objects.requireNonNull(SELECT_COLUMNS
                + " WHERE session_id IN (" + placeholders + ") ORDER BY event_timestamp ASC, id ASC");
        return jdbcTemplate.query(sql, ROW_MAPPER, sessionIds.toArray());
    }

    private static TrackingEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp eventTimestamp = rs.getTimestamp("event_timestamp");
        Timestamp receivedAt = rs.getTimestamp("received_at");
        return TrackingEvent.builder()
                .id(rs.getLong("id"))
                .eventId(rs.getString("event_id"))
                .sessionId(rs.getString("session_id"))
                .eventType(rs.getString("event_type"))
                .page(rs.getString("page"))
                .pageType(rs.getString("page_type"))
                .domain(rs.getString("domain"))
                .funnelId(rs.getString("funnel_id"))
                .stepNumber(rs.getInt("step_number"))
                .stepName(rs.getString("step_name"))
                .selectedValue(rs.getString("selected_value"))
                .timeOnStep(rs.getObject("time_on_step", Integer.class))
                .eventTimestamp(eventTimestamp != null ? eventTimestamp.toInstant() : null)
                .deviceType(rs.getString("device_type"))
                .os(rs.getString("os"))
                .browser(rs.getString("browser"))
                .geoState(rs.getString("geo_state"))
                .selectedState(rs.getString("selected_state"))
                .country(rs.getString("country"))
                .utmSource(rs.getString("utm_source"))
                .utmCampaign(rs.getString("utm_campaign"))
                .utmMedium(rs.getString("utm_medium"))
                .utmContent(rs.getString("utm_content"))
                .utmTerm(rs.getString("utm_term"))
                .referrer(rs.getString("referrer"))
                .userAgent(rs.getString("user_agent"))
                .ipAddress(rs.getString("ip_address"))
                .bot(rs.getObject("is_bot", Boolean.class))
                .externalId(rs.getString("external_id"))
                .fbclid(rs.getString("fbclid"))
                .adId(rs.getString("ad_id"))
                .firstName(rs.getString("first_name"))
                .lastName(rs.getString("last_name"))
                .email(rs.getString("email"))
                .phone(rs.getString("phone"))
                .idempotencyKey(rs.getString("idempotency_key"))
                .receivedAt(receivedAt != null ? receivedAt.toInstant() : null)
                .build();
    }
}
