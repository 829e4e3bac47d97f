package com.frontline.core.infrastructure;

import com.frontline.core.database.DatabaseManager;
import com.frontline.core.database.dao.FactionDAO;
import com.frontline.core.database.dao.InfluenceDAO;
import com.frontline.core.database.dao.TerritorialEventDAO;
import com.frontline.core.database.dao.TerritoryDAO;
import com.frontline.core.domain.errors.PersistenceException;
import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.WorldDefinition;
import com.frontline.core.ports.ITerritoryRepository;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

public class MariaDBAdapter implements ITerritoryRepository {

    private final DatabaseManager dbManager;
    private final TerritoryDAO territoryDAO;
    private final FactionDAO factionDAO;
    private final InfluenceDAO influenceDAO;
    private final TerritorialEventDAO eventDAO;

    public MariaDBAdapter(DatabaseManager dbManager) {
        this(dbManager,
                new TerritoryDAO(dbManager),
                new FactionDAO(dbManager),
                new InfluenceDAO(dbManager),
                new TerritorialEventDAO(dbManager));
    }

    MariaDBAdapter(DatabaseManager dbManager,
                   TerritoryDAO territoryDAO,
                   FactionDAO factionDAO,
                   InfluenceDAO influenceDAO,
                   TerritorialEventDAO eventDAO) {
        this.dbManager = dbManager;
        this.territoryDAO = territoryDAO;
        this.factionDAO = factionDAO;
        this.influenceDAO = influenceDAO;
        this.eventDAO = eventDAO;
    }

    // --- WORLD ---

    @Override public List<Territory> loadTerritories() { return territoryDAO.loadAll(); }
    @Override public List<FactionDefinition> loadFactions() { return factionDAO.loadAllFactions(); }

    @Override
    public void replaceWorld(WorldDefinition world) {
        try (Connection conn = dbManager.getConnection()) {
            conn.setAutoCommit(false);
            try {
                territoryDAO.replaceAll(conn, world.territories());
                factionDAO.replaceAll(conn, world.factions());
                conn.commit();
                System.out.println("[DB] World replaced: territories=" + world.territories().size() +
                        " factions=" + world.factions().size());
            } catch (SQLException ex) {
                conn.rollback();
                throw ex;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new PersistenceException("World replace failed", e);
        }
    }

    // --- INFLUENCE ---

    @Override public List<InfluenceRecord> loadInfluence() { return influenceDAO.loadAll(); }

    @Override
    public void saveInfluence(Collection<InfluenceRecord> records) {
        try {
            influenceDAO.upsertAll(records);
        } catch (SQLException e) {
            throw new PersistenceException("Influence upsert failed (" + records.size() + " records)", e);
        }
    }

    // --- EVENTS ---

    @Override
    public void appendEvents(List<TerritorialEvent> events) {
        try {
            eventDAO.appendAll(events);
        } catch (SQLException e) {
            throw new PersistenceException("Event append failed (" + events.size() + " events)", e);
        }
    }

    @Override public List<TerritorialEvent> loadEvents(long afterId, int limit) { return eventDAO.loadAfter(afterId, limit); }
    @Override public long maxEventId() { return eventDAO.maxId(); }
}
