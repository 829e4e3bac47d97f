package com.frontline.core.database.dao;

import com.frontline.core.database.DatabaseManager;
import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.EventPriority;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Append-only access to territorial_events. Rows are never updated.
 * Priority, control flag and cascade wave travel in the JSON payload column.
 */
public class TerritorialEventDAO {

    private final DatabaseManager db;

    public TerritorialEventDAO(DatabaseManager db) {
        this.db = db;
    }

    public void appendAll(List<TerritorialEvent> events) throws SQLException {
        if (events == null || events.isEmpty()) return;

        String sql = """
                INSERT IGNORE INTO territorial_events
                    (id, occurred_at_ms, territory_id, faction_id, actor_id, session_id, cause,
                     requested_delta, applied_delta, resulting_value, payload)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (TerritorialEvent e : events) {
                    ps.setLong(1, e.id());
                    ps.setLong(2, e.timestampMs());
                    ps.setInt(3, e.territoryId());
                    ps.setInt(4, e.factionId());
                    ps.setString(5, e.actorId());
                    ps.setString(6, e.sessionId());
                    ps.setString(7, e.cause().name());
                    ps.setDouble(8, e.requestedDelta());
                    ps.setDouble(9, e.appliedDelta());
                    ps.setDouble(10, e.resultingValue());
                    ps.setString(11, payloadOf(e).toString());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException ex) {
                conn.rollback();
                throw ex;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    public List<TerritorialEvent> loadAfter(long afterId, int limit) {
        String sql = """
                SELECT id, occurred_at_ms, territory_id, faction_id, actor_id, session_id, cause,
                       requested_delta, applied_delta, resulting_value, payload
                FROM territorial_events
                WHERE id > ?
                ORDER BY id ASC
                LIMIT ?
                """;

        List<TerritorialEvent> out = new ArrayList<>();
        try (Connection conn = db.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, afterId);
            ps.setInt(2, Math.max(1, limit));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        } catch (SQLException e) {
            if (!SqlCompat.isUnknownTable(e)) e.printStackTrace();
        }
        return out;
    }

    public long maxId() {
        try (Connection conn = db.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(id), 0) AS max_id FROM territorial_events");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) return rs.getLong("max_id");
        } catch (SQLException e) {
            if (!SqlCompat.isUnknownTable(e)) e.printStackTrace();
        }
        return 0L;
    }

    static JsonObject payloadOf(TerritorialEvent e) {
        JsonObject o = new JsonObject();
        o.addProperty("priority", e.priority().name());
        o.addProperty("control_changed", e.controlChanged());
        o.addProperty("cascade_wave", e.cascadeWave());
        return o;
    }

    private TerritorialEvent map(ResultSet rs) throws SQLException {
        EventPriority priority = EventPriority.NORMAL;
        boolean controlChanged = false;
        int wave = 0;

        String payload = rs.getString("payload");
        if (payload != null && !payload.isBlank()) {
            try {
                JsonObject o = JsonParser.parseString(payload).getAsJsonObject();
                if (o.has("priority")) priority = EventPriority.valueOf(o.get("priority").getAsString().toUpperCase(Locale.ROOT));
                if (o.has("control_changed")) controlChanged = o.get("control_changed").getAsBoolean();
                if (o.has("cascade_wave")) wave = o.get("cascade_wave").getAsInt();
            } catch (RuntimeException ex) {
                System.err.println("[DB] Bad event payload for id " + rs.getLong("id") + ": " + ex.getMessage());
            }
        }

        EventCause cause;
        try {
            cause = EventCause.valueOf(rs.getString("cause").trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException ex) {
            cause = EventCause.ADMIN;
        }

        return new TerritorialEvent(
                rs.getLong("id"),
                rs.getLong("occurred_at_ms"),
                rs.getInt("territory_id"),
                rs.getInt("faction_id"),
                rs.getString("actor_id"),
                rs.getString("session_id"),
                cause,
                rs.getDouble("requested_delta"),
                rs.getDouble("applied_delta"),
                rs.getDouble("resulting_value"),
                priority,
                controlChanged,
                wave
        );
    }
}
