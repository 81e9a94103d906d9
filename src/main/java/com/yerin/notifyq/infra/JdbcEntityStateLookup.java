package com.yerin.notifyq.infra;

import com.yerin.notifyq.domain.EntityFamily;
import com.yerin.notifyq.domain.EntityStateLookup;
import com.yerin.notifyq.domain.LifecycleState;
import com.yerin.notifyq.domain.TrackedEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 플랫폼 테이블을 읽기 전용으로 조회한다. 행이 없거나 id 형식이 맞지 않으면 empty.
 */
@Slf4j
public class JdbcEntityStateLookup implements EntityStateLookup {

    private static final String PROSPECT_SQL = """
            SELECT k.id, k.fund_id, k.status, k.email, k.first_name, k.last_name, k.kyc_link_token,
                   f.name AS fund_name
            FROM kyc_applications k
            LEFT JOIN funds f ON f.id = k.fund_id
            WHERE k.id = :id
            """;

    private static final String INVESTOR_SQL = """
            SELECT i.id, i.fund_id, i.status, i.email, i.first_name, i.last_name,
                   f.name AS fund_name
            FROM investors i
            LEFT JOIN funds f ON f.id = i.fund_id
            WHERE i.id = :id
            """;

    private static final String CAPITAL_CALL_ITEM_SQL = """
            SELECT ci.id, ci.status, ci.amount_due, ci.capital_call_id,
                   cc.fund_id, cc.call_number, cc.deadline,
                   i.email, i.first_name, i.last_name,
                   f.name AS fund_name
            FROM capital_call_items ci
            JOIN capital_calls cc ON cc.id = ci.capital_call_id
            JOIN investors i ON i.id = ci.investor_id
            LEFT JOIN funds f ON f.id = cc.fund_id
            WHERE ci.id = :id
            """;

    private static final String TEAM_INVITE_SQL = """
            SELECT t.id, t.fund_id, t.status, t.email, t.role, t.token, t.expires_at,
                   f.name AS fund_name
            FROM team_invites t
            LEFT JOIN funds f ON f.id = t.fund_id
            WHERE t.id = :id
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final EntityFamily family;
    private final String sql;
    private final AttributeReader attributeReader;

    JdbcEntityStateLookup(NamedParameterJdbcTemplate jdbc, EntityFamily family, String sql, AttributeReader attributeReader) {
        this.jdbc = jdbc;
        this.family = family;
        this.sql = sql;
        this.attributeReader = attributeReader;
    }

    public static JdbcEntityStateLookup prospects(NamedParameterJdbcTemplate jdbc) {
        return new JdbcEntityStateLookup(jdbc, EntityFamily.PROSPECT, PROSPECT_SQL, (rs, a) -> {
            a.put("recipientName", fullName(rs));
            a.put("kycToken", rs.getString("kyc_link_token"));
        });
    }

    public static JdbcEntityStateLookup investors(NamedParameterJdbcTemplate jdbc) {
        return new JdbcEntityStateLookup(jdbc, EntityFamily.INVESTOR, INVESTOR_SQL,
                (rs, a) -> a.put("recipientName", fullName(rs)));
    }

    public static JdbcEntityStateLookup capitalCallItems(NamedParameterJdbcTemplate jdbc) {
        return new JdbcEntityStateLookup(jdbc, EntityFamily.CAPITAL_CALL, CAPITAL_CALL_ITEM_SQL, (rs, a) -> {
            a.put("recipientName", fullName(rs));
            a.put("amountDue", rs.getString("amount_due"));
            a.put("capitalCallId", rs.getString("capital_call_id"));
            a.put("callNumber", rs.getString("call_number"));
            a.put("deadline", iso(rs.getTimestamp("deadline")));
        });
    }

    public static JdbcEntityStateLookup teamInvites(NamedParameterJdbcTemplate jdbc) {
        return new JdbcEntityStateLookup(jdbc, EntityFamily.TEAM_INVITE, TEAM_INVITE_SQL, (rs, a) -> {
            a.put("role", rs.getString("role"));
            a.put("token", rs.getString("token"));
            a.put("expiresAt", iso(rs.getTimestamp("expires_at")));
        });
    }

    @Override
    public EntityFamily family() {
        return family;
    }

    @Override
    public Optional<TrackedEntity> find(String entityId) {
        UUID id;
        try {
            id = UUID.fromString(entityId);
        } catch (IllegalArgumentException e) {
            log.debug("[Lookup.{}] not a uuid id={}", family.getValue(), entityId);
            return Optional.empty();
        }
        List<TrackedEntity> rows = jdbc.query(sql, new MapSqlParameterSource("id", id), rowMapper());
        return rows.stream().findFirst();
    }

    private RowMapper<TrackedEntity> rowMapper() {
        return (rs, rowNum) -> {
            Map<String, String> attributes = new HashMap<>();
            attributes.put("fundName", rs.getString("fund_name"));
            attributeReader.read(rs, attributes);
            attributes.values().removeIf(v -> v == null);

            String status = rs.getString("status");
            LifecycleState state = family.parseState(status).orElse(null);
            if (state == null) {
                log.debug("[Lookup.{}] unknown state id={}, status={}", family.getValue(), rs.getString("id"), status);
            }
            return new TrackedEntity(family, rs.getString("id"), rs.getString("fund_id"), state,
                    rs.getString("email"), attributes);
        };
    }

    private static String fullName(ResultSet rs) throws SQLException {
        String first = rs.getString("first_name");
        String last = rs.getString("last_name");
        if (first == null && last == null) return null;
        return ((first == null ? "" : first) + " " + (last == null ? "" : last)).trim();
    }

    private static String iso(Timestamp ts) {
        return ts == null ? null : ts.toInstant().toString();
    }

    @FunctionalInterface
    interface AttributeReader {
        void read(ResultSet rs, Map<String, String> attributes) throws SQLException;
    }
}
