package com.frontline.core;

import com.frontline.core.database.DatabaseManager;
import com.frontline.core.domain.territory.WorldDefinition;
import com.frontline.core.infrastructure.CoreConfig;
import com.frontline.core.infrastructure.InMemoryTerritoryRepository;
import com.frontline.core.infrastructure.MariaDBAdapter;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.infrastructure.WorldDefinitionLoader;
import com.frontline.core.ports.ITerritoryRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.util.Random;

public class Main {

    private static final long HEALTH_EVERY_MS = 60_000L;

    public static void main(String[] args) throws InterruptedException {
        System.out.println("[BOOT] Frontline Core starting...");
        CoreConfig core = CoreConfig.load();
        TerritorialConfig config = TerritorialConfig.from(core);

        DatabaseManager dbManager = null;
        ITerritoryRepository repository;
        if (core.getBoolean("db.enabled", false)) {
            String url = core.getString("db.url", null);
            if (url == null) {
                System.err.println("[BOOT] db.enabled=true but db.url is missing. Aborting.");
                return;
            }
            dbManager = new DatabaseManager(url,
                    core.getString("db.user", ""),
                    core.getString("db.password", ""),
                    core.getInt("db.pool_size", 10));
            try {
                dbManager.applySchema();
            } catch (SQLException e) {
                System.err.println("[BOOT] Cannot prepare the database schema. Aborting.");
                e.printStackTrace();
                dbManager.close();
                return;
            }
            repository = new MariaDBAdapter(dbManager);
        } else {
            System.out.println("[BOOT] db.enabled=false: running with in-memory storage.");
            repository = new InMemoryTerritoryRepository();
        }

        String worldFile = core.getString("world.file", "classpath:world/default_world.json");
        WorldDefinition world = new WorldDefinitionLoader(config.defaultDecayRate()).load(worldFile);

        Random random = (config.cascadeSeed() != null) ? new Random(config.cascadeSeed()) : new Random();
        FrontlineCore frontline = new FrontlineCore(config, repository, Clock.systemUTC(), random);
        frontline.boot(world);
        frontline.start();

        DatabaseManager db = dbManager;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                System.out.println("[BOOT] ShutdownHook: flushing before exit...");
                frontline.close();
                System.out.println("[BOOT] ShutdownHook: flush done.");
            } catch (Throwable t) {
                t.printStackTrace();
            } finally {
                if (db != null) db.close();
            }
        }, "fl-shutdown-save"));

        System.out.println("[BOOT] Frontline Core running: territories=" + frontline.store().graph().size() +
                " factions=" + frontline.store().factions().size());

        while (true) {
            Thread.sleep(HEALTH_EVERY_MS);
            System.out.println("[HEALTH] " + frontline.telemetry().snapshot());
        }
    }
}
