package com.frontline.core.database.dao;

import com.frontline.core.database.DatabaseManager;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryLevel;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class TerritoryDAO {

    private final DatabaseManager db;

    public TerritoryDAO(DatabaseManager db) {
        this.db = db;
    }

    public List<Territory> loadAll() {
        List<Territory> out = new ArrayList<>();
        try (Connection conn = db.getConnection()) {
            Map<Integer, List<Integer>> links = loadLinks(conn);

            try (PreparedStatement ps = conn.prepareStatement(selectSql(true));
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs, links, true));
            } catch (SQLException e) {
                // compat: decay_rate was added later
                if (!SqlCompat.isUnknownColumn(e)) throw e;
                try (PreparedStatement ps = conn.prepareStatement(selectSql(false));
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs, links, false));
                }
            }
        } catch (SQLException e) {
            if (!SqlCompat.isUnknownTable(e)) e.printStackTrace();
        }
        return out;
    }

    private static String selectSql(boolean withDecay) {
        return """
                SELECT id, name, level, parent_id, strategic_value, resource_multiplier%s
                FROM territories
                ORDER BY id ASC
                """.formatted(withDecay ? ", decay_rate" : "");
    }

    private Map<Integer, List<Integer>> loadLinks(Connection conn) throws SQLException {
        Map<Integer, List<Integer>> out = new HashMap<>();
        String sql = """
                SELECT territory_id, linked_territory_id
                FROM territory_links
                ORDER BY territory_id ASC, linked_territory_id ASC
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.computeIfAbsent(rs.getInt("territory_id"), k -> new ArrayList<>())
                        .add(rs.getInt("linked_territory_id"));
            }
        } catch (SQLException e) {
            if (!SqlCompat.isUnknownTable(e)) throw e;
        }
        return out;
    }

    private Territory map(ResultSet rs, Map<Integer, List<Integer>> links, boolean withDecay) throws SQLException {
        int id = rs.getInt("id");
        int parent = rs.getInt("parent_id");
        Integer parentId = rs.wasNull() ? null : parent;

        double decay = withDecay ? rs.getDouble("decay_rate") : 1.0;
        if (withDecay && rs.wasNull()) decay = 1.0;

        return new Territory(
                id,
                rs.getString("name"),
                TerritoryLevel.parse(rs.getString("level"), null),
                parentId,
                links.getOrDefault(id, List.of()),
                rs.getInt("strategic_value"),
                SqlCompat.finiteOr(rs.getDouble("resource_multiplier"), 1.0),
                SqlCompat.finiteOr(decay, 1.0)
        );
    }

    /**
     * Replaces every territory and link inside the caller's transaction.
     * Stored influence goes with the territories through ON DELETE CASCADE; the caller
     * writes live influence back afterwards.
     */
    public void replaceAll(Connection conn, Collection<Territory> territories) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM territory_links");
            st.executeUpdate("DELETE FROM territories");
        }

        String insert = """
                INSERT INTO territories (id, name, level, parent_id, strategic_value, resource_multiplier, decay_rate)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        // parents before children for the parent_id foreign key
        List<Territory> ordered = new ArrayList<>(territories);
        ordered.sort(Comparator.comparingInt((Territory t) -> t.level().depth()).thenComparingInt(Territory::id));

        try (PreparedStatement ps = conn.prepareStatement(insert)) {
            for (Territory t : ordered) {
                ps.setInt(1, t.id());
                ps.setString(2, t.name());
                ps.setString(3, t.level().name());
                if (t.parentId() == null) ps.setNull(4, Types.INTEGER);
                else ps.setInt(4, t.parentId());
                ps.setInt(5, t.strategicValue());
                ps.setDouble(6, t.resourceMultiplier());
                ps.setDouble(7, t.decayRate());
                ps.addBatch();
            }
            ps.executeBatch();
        }

        String link = "INSERT INTO territory_links (territory_id, linked_territory_id) VALUES (?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(link)) {
            for (Territory t : territories) {
                for (Integer other : t.crossLinks()) {
                    ps.setInt(1, t.id());
                    ps.setInt(2, other);
                    ps.addBatch();
                }
            }
            ps.executeBatch();
        }
    }
}
