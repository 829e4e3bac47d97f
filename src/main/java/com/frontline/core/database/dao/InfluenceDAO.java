package com.frontline.core.database.dao;

import com.frontline.core.database.DatabaseManager;
import com.frontline.core.domain.influence.InfluenceRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class InfluenceDAO {

    private final DatabaseManager db;

    public InfluenceDAO(DatabaseManager db) {
        this.db = db;
    }

    public List<InfluenceRecord> loadAll() {
        String sql = """
                SELECT territory_id, faction_id, influence_value, last_refreshed_ms, last_updated_ms
                FROM faction_influence
                ORDER BY territory_id ASC, faction_id ASC
                """;

        List<InfluenceRecord> out = new ArrayList<>();
        try (Connection conn = db.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                out.add(new InfluenceRecord(
                        rs.getInt("territory_id"),
                        rs.getInt("faction_id"),
                        SqlCompat.finiteOr(rs.getDouble("influence_value"), 0.0),
                        rs.getLong("last_refreshed_ms"),
                        rs.getLong("last_updated_ms")
                ));
            }
        } catch (SQLException e) {
            if (!SqlCompat.isUnknownTable(e)) e.printStackTrace();
        }
        return out;
    }

    /**
     * Upsert on the (territory_id, faction_id) unique key. Throws so the saver can retry.
     */
    public void upsertAll(Collection<InfluenceRecord> records) throws SQLException {
        if (records == null || records.isEmpty()) return;

        String sql = """
                INSERT INTO faction_influence (territory_id, faction_id, influence_value, last_refreshed_ms, last_updated_ms)
                VALUES (?, ?, ?, ?, ?)
                ON DUPLICATE KEY UPDATE
                    influence_value = VALUES(influence_value),
                    last_refreshed_ms = VALUES(last_refreshed_ms),
                    last_updated_ms = VALUES(last_updated_ms)
                """;

        try (Connection conn = db.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (InfluenceRecord r : records) {
                    ps.setInt(1, r.territoryId());
                    ps.setInt(2, r.factionId());
                    ps.setDouble(3, r.value());
                    ps.setLong(4, r.lastRefreshedMs());
                    ps.setLong(5, r.lastUpdatedMs());
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
}
