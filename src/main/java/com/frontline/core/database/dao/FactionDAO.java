package com.frontline.core.database.dao;

import com.frontline.core.database.DatabaseManager;
import com.frontline.core.domain.factions.BehaviorProfile;
import com.frontline.core.domain.factions.FactionDefinition;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class FactionDAO {

    private final DatabaseManager db;

    public FactionDAO(DatabaseManager db) {
        this.db = db;
    }

    public List<FactionDefinition> loadAllFactions() {
        String sql = """
                SELECT id, code, display_name,
                       aggression, risk_tolerance, expansion_priority, resource_focus, diplomatic_tendency,
                       influence_modifier
                FROM factions
                ORDER BY id ASC
                """;

        List<FactionDefinition> out = new ArrayList<>();
        try (Connection conn = db.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                BehaviorProfile profile = new BehaviorProfile(
                        unit(rs.getDouble("aggression")),
                        unit(rs.getDouble("risk_tolerance")),
                        unit(rs.getDouble("expansion_priority")),
                        unit(rs.getDouble("resource_focus")),
                        unit(rs.getDouble("diplomatic_tendency"))
                );
                out.add(new FactionDefinition(
                        rs.getInt("id"),
                        rs.getString("code"),
                        rs.getString("display_name"),
                        profile,
                        rs.getDouble("influence_modifier")
                ));
            }
        } catch (SQLException e) {
            // If the table does not exist yet, keep safe behavior (empty list).
            if (!SqlCompat.isUnknownTable(e)) e.printStackTrace();
        }
        return out;
    }

    public void replaceAll(Connection conn, Collection<FactionDefinition> factions) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM factions");
        }

        String sql = """
                INSERT INTO factions (id, code, display_name,
                                      aggression, risk_tolerance, expansion_priority, resource_focus, diplomatic_tendency,
                                      influence_modifier)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (FactionDefinition f : factions) {
                BehaviorProfile p = f.profile();
                ps.setInt(1, f.id());
                ps.setString(2, f.code());
                ps.setString(3, f.displayName());
                ps.setDouble(4, p.aggression());
                ps.setDouble(5, p.riskTolerance());
                ps.setDouble(6, p.expansionPriority());
                ps.setDouble(7, p.resourceFocus());
                ps.setDouble(8, p.diplomaticTendency());
                ps.setDouble(9, f.influenceModifier());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static double unit(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return 0.5;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
