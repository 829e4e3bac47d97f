package com.frontline.core;

import com.frontline.core.domain.ai.FactionStrategist;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.WorldDefinition;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.managers.AdminService;
import com.frontline.core.managers.CascadeEngine;
import com.frontline.core.managers.ControlResolver;
import com.frontline.core.managers.DominanceTracker;
import com.frontline.core.managers.EventReplayer;
import com.frontline.core.managers.InfluenceEngine;
import com.frontline.core.managers.TerritorialEventLog;
import com.frontline.core.managers.TerritorialIntrospection;
import com.frontline.core.managers.TerritoryStore;
import com.frontline.core.ports.ITerritoryRepository;
import com.frontline.core.synchronization.ActionQueue;
import com.frontline.core.synchronization.AsyncEventWriter;
import com.frontline.core.synchronization.DecayScheduler;
import com.frontline.core.synchronization.FactionDecisionLoop;
import com.frontline.core.synchronization.InfluenceSaverService;
import com.frontline.core.synchronization.SyncService;
import com.frontline.core.synchronization.TerritorialFeed;
import com.frontline.core.synchronization.wire.FeedCodec;

import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Composition root. Every component receives its collaborators here, by constructor.
 */
public final class FrontlineCore implements AutoCloseable {

    private static final int ACTION_WORKERS = 4;

    private final TerritorialConfig config;
    private final ITerritoryRepository repository;

    private final EngineTelemetry telemetry = new EngineTelemetry();
    private final TerritoryStore store;
    private final TerritorialEventLog eventLog;
    private final TerritorialFeed feed;
    private final DominanceTracker dominance;
    private final InfluenceEngine engine;
    private final ActionQueue actionQueue;
    private final SyncService syncService;
    private final DecayScheduler decayScheduler;
    private final FactionDecisionLoop decisionLoop;
    private final InfluenceSaverService saverService;
    private final AsyncEventWriter eventWriter;
    private final AdminService admin;
    private final TerritorialIntrospection introspection;

    public FrontlineCore(TerritorialConfig config, ITerritoryRepository repository, Clock clock, Random random) {
        this.config = config;
        this.repository = repository;

        this.store = new TerritoryStore(new ControlResolver(config.controlThreshold(), config.contestThreshold()), clock);
        this.eventLog = new TerritorialEventLog(clock, repository.maxEventId());
        this.feed = new TerritorialFeed(config, telemetry);
        this.dominance = new DominanceTracker(store, config, feed, clock);
        CascadeEngine cascade = new CascadeEngine(store, config, random, telemetry);
        this.engine = new InfluenceEngine(store, eventLog, cascade, dominance, feed, config, telemetry, clock);

        this.actionQueue = new ActionQueue(engine, telemetry, ACTION_WORKERS);
        this.syncService = new SyncService(store, actionQueue, feed, new FeedCodec(), config, clock);
        this.decayScheduler = new DecayScheduler(engine, config, telemetry, clock);
        this.decisionLoop = new FactionDecisionLoop(store, new FactionStrategist(), actionQueue, config, telemetry);
        this.saverService = new InfluenceSaverService(store, repository, telemetry);
        this.eventWriter = new AsyncEventWriter(eventLog, repository, saverService, config, telemetry);
        this.admin = new AdminService(store, engine, dominance, decayScheduler, repository);
        this.introspection = new TerritorialIntrospection(store, dominance, telemetry);
    }

    /**
     * Installs the world. A world already stored in the repository wins over the
     * world file; otherwise the file is installed and written to the repository, so
     * influence rows have territories and factions to reference.
     * Stored influence is restored when the repository has any; otherwise the stored
     * event log is replayed, otherwise the world starts empty.
     */
    public void boot(WorldDefinition worldFile) {
        WorldDefinition storedWorld = storedWorld();
        List<InfluenceRecord> stored = repository.loadInfluence();

        if (storedWorld != null) {
            admin.loadWorld(storedWorld, stored, false);
            System.out.println("[BOOT] World restored from storage: territories=" + storedWorld.territories().size());
        } else {
            admin.loadWorld(worldFile, stored, true);
            System.out.println("[BOOT] No stored world, installed the world file.");
        }

        if (stored.isEmpty() && repository.maxEventId() > 0) {
            int replayed = replayStoredEvents();
            dominance.rebaseline();
            System.out.println("[BOOT] Rebuilt influence from " + replayed + " stored events.");
        }
    }

    private WorldDefinition storedWorld() {
        List<Territory> territories = repository.loadTerritories();
        if (territories.isEmpty()) return null;
        return new WorldDefinition(territories, repository.loadFactions());
    }

    private int replayStoredEvents() {
        EventReplayer replayer = new EventReplayer(store);
        long after = 0L;
        int total = 0;
        while (true) {
            List<TerritorialEvent> page = repository.loadEvents(after, 1000);
            if (page.isEmpty()) break;
            total += replayer.replay(page);
            after = page.get(page.size() - 1).id();
        }
        return total;
    }

    public void start() {
        decayScheduler.start();
        decisionLoop.start();
        eventWriter.start();
    }

    @Override
    public void close() {
        decisionLoop.stop();
        decayScheduler.stop();
        actionQueue.close();
        eventWriter.close();
        feed.close();
    }

    public TerritorialConfig config() { return config; }
    public EngineTelemetry telemetry() { return telemetry; }
    public TerritoryStore store() { return store; }
    public TerritorialEventLog eventLog() { return eventLog; }
    public TerritorialFeed feed() { return feed; }
    public InfluenceEngine engine() { return engine; }
    public SyncService sync() { return syncService; }
    public AdminService admin() { return admin; }
    public TerritorialIntrospection introspection() { return introspection; }
    public FactionDecisionLoop decisionLoop() { return decisionLoop; }
    public AsyncEventWriter eventWriter() { return eventWriter; }
}
