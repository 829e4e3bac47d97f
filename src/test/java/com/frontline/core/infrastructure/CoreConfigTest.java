package com.frontline.core.infrastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static com.frontline.core.support.TestWorlds.config;
import static org.junit.jupiter.api.Assertions.*;

class CoreConfigTest {

    @Nested
    @DisplayName("Raw properties")
    class Raw {

        @Test
        @DisplayName("Malformed numbers fall back to the default")
        void badNumbersFallBack() {
            Properties p = new Properties();
            p.setProperty("a.int", "twelve");
            p.setProperty("a.double", "NaN");
            p.setProperty("a.seed", "x");
            CoreConfig c = CoreConfig.fromProperties(p);

            assertEquals(7, c.getInt("a.int", 7));
            assertEquals(1.5, c.getDouble("a.double", 1.5));
            assertNull(c.getOptionalLong("a.seed"));
            assertEquals("fallback", c.getString("missing", "fallback"));
        }

        @Test
        @DisplayName("A file next to the process wins over the classpath copy")
        void fileOverridesClasspath(@TempDir Path dir) throws IOException {
            Path file = dir.resolve(CoreConfig.FILE_NAME);
            Files.writeString(file, "cascade.max_depth=5\ndb.enabled=true\n");

            CoreConfig c = CoreConfig.load(file);

            assertEquals(5, c.getInt("cascade.max_depth", 2));
            assertTrue(c.getBoolean("db.enabled", false));
        }

        @Test
        @DisplayName("Without a file the classpath defaults are used")
        void classpathDefaults(@TempDir Path dir) {
            CoreConfig c = CoreConfig.load(dir.resolve("absent.properties"));

            assertFalse(c.getBoolean("db.enabled", true));
            assertEquals("classpath:world/default_world.json", c.getString("world.file", null));
        }
    }

    @Nested
    @DisplayName("Territorial parameters")
    class Territorial {

        @Test
        @DisplayName("Defaults match the documented tuning")
        void defaults() {
            TerritorialConfig c = TerritorialConfig.defaults();

            assertEquals(60.0, c.controlThreshold());
            assertEquals(40.0, c.contestThreshold());
            assertEquals(2, c.cascadeMaxDepth());
            assertEquals(0.95, c.cascadeMaxProbability());
            assertEquals(120_000L, c.decayGraceMs());
            assertNull(c.cascadeSeed());
        }

        @Test
        @DisplayName("The contest threshold never exceeds the control threshold")
        void contestClampedToControl() {
            TerritorialConfig c = config("influence.control_threshold", "50", "influence.contest_threshold", "70");

            assertEquals(50.0, c.contestThreshold());
        }

        @Test
        @DisplayName("Probabilities are clamped into [0,1] and the seed is read when present")
        void clampsAndSeed() {
            TerritorialConfig c = config("cascade.dampening", "3", "cascade.max_probability", "-1", "cascade.seed", "42");

            assertEquals(1.0, c.cascadeDampening());
            assertEquals(0.0, c.cascadeMaxProbability());
            assertEquals(42L, c.cascadeSeed());
        }
    }
}
