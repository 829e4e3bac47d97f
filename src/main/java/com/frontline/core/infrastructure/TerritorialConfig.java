package com.frontline.core.infrastructure;

/**
 * Tunable simulation parameters. Probability and dominance constants live here
 * rather than in the engines because they are the first thing rebalancing touches.
 */
public record TerritorialConfig(
        double controlThreshold,
        double contestThreshold,

        long decayIntervalSeconds,
        long decayGraceSeconds,
        double defaultDecayRate,

        int cascadeMaxDepth,
        double cascadeDampening,
        double cascadeDistanceDecay,
        double cascadeReinforcementBonus,
        double cascadeMaxProbability,
        double cascadeDeltaScale,
        long cascadeBudgetMs,
        Long cascadeSeed,

        int dominanceHighValueThreshold,
        int dominanceHighValueCount,
        int strategicLossThreshold,

        long decisionIntervalSeconds,
        long decisionBudgetMs,
        double decisionBaseMagnitude,

        int feedQueueCapacity,
        int feedReplayBuffer,

        long persistenceIntervalSeconds,
        long eventRetentionMinutes
) {

    public static TerritorialConfig defaults() {
        return from(CoreConfig.empty());
    }

    public static TerritorialConfig from(CoreConfig c) {
        double control = clamp(c.getDouble("influence.control_threshold", 60.0), 0.0, 100.0);
        double contest = clamp(c.getDouble("influence.contest_threshold", 40.0), 0.0, control);

        return new TerritorialConfig(
                control,
                contest,

                Math.max(1L, c.getLong("decay.interval_seconds", 60L)),
                Math.max(0L, c.getLong("decay.grace_seconds", 120L)),
                Math.max(0.0, c.getDouble("decay.default_rate", 1.0)),

                Math.max(0, c.getInt("cascade.max_depth", 2)),
                clamp(c.getDouble("cascade.dampening", 0.6), 0.0, 1.0),
                clamp(c.getDouble("cascade.distance_decay", 0.5), 0.0, 1.0),
                Math.max(0.0, c.getDouble("cascade.reinforcement_bonus", 0.5)),
                clamp(c.getDouble("cascade.max_probability", 0.95), 0.0, 1.0),
                Math.max(0.0, c.getDouble("cascade.delta_scale", 1.0)),
                Math.max(1L, c.getLong("cascade.budget_ms", 25L)),
                c.getOptionalLong("cascade.seed"),

                c.getInt("dominance.high_value_threshold", 7),
                Math.max(1, c.getInt("dominance.high_value_count", 2)),
                c.getInt("strategic_loss.threshold", 5),

                Math.max(1L, c.getLong("decision.interval_seconds", 5L)),
                Math.max(1L, c.getLong("decision.budget_ms", 50L)),
                Math.max(0.0, c.getDouble("decision.base_magnitude", 10.0)),

                Math.max(1, c.getInt("feed.queue_capacity", 256)),
                Math.max(1, c.getInt("feed.replay_buffer", 512)),

                Math.max(1L, c.getLong("persistence.interval_seconds", 10L)),
                Math.max(1L, c.getLong("events.retention_minutes", 60L))
        );
    }

    public long decayGraceMs() {
        return decayGraceSeconds * 1000L;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
