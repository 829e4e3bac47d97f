package com.frontline.core.infrastructure;

import com.frontline.core.domain.errors.GraphConsistencyException;
import com.frontline.core.domain.factions.BehaviorProfile;
import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryLevel;
import com.frontline.core.domain.territory.WorldDefinition;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads world authoring JSON (territories, cross-links, faction roster).
 *
 * Only shape is checked here; hierarchy and link invariants are enforced when the
 * graph is built. Missing decayRate takes the configured default.
 */
public class WorldDefinitionLoader {

    private final double defaultDecayRate;

    public WorldDefinitionLoader(double defaultDecayRate) {
        this.defaultDecayRate = Math.max(0.0, defaultDecayRate);
    }

    /**
     * @param location a file path, or "classpath:" followed by a resource name
     */
    public WorldDefinition load(String location) {
        if (location == null || location.isBlank()) {
            throw new GraphConsistencyException(List.of("World file location is empty"));
        }

        if (location.startsWith("classpath:")) {
            String resource = location.substring("classpath:".length());
            try (InputStream in = WorldDefinitionLoader.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) throw new GraphConsistencyException(List.of("World resource not found: " + resource));
                return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new GraphConsistencyException(List.of("Cannot read world resource " + resource + ": " + e.getMessage()));
            }
        }

        Path path = Path.of(location);
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(r);
        } catch (IOException e) {
            throw new GraphConsistencyException(List.of("Cannot read world file " + path + ": " + e.getMessage()));
        }
    }

    public WorldDefinition parse(String json) {
        return parse(new StringReader(json != null ? json : ""));
    }

    public WorldDefinition parse(Reader reader) {
        JsonObject root;
        try {
            JsonElement el = JsonParser.parseReader(reader);
            if (el == null || !el.isJsonObject()) {
                throw new GraphConsistencyException(List.of("World file must be a JSON object"));
            }
            root = el.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new GraphConsistencyException(List.of("Malformed world JSON: " + e.getMessage()));
        }

        List<String> problems = new ArrayList<>();
        List<Territory> territories = new ArrayList<>();
        List<FactionDefinition> factions = new ArrayList<>();

        for (JsonObject o : objects(root, "territories", problems)) {
            try {
                territories.add(readTerritory(o));
            } catch (RuntimeException e) {
                problems.add("bad territory entry " + o + ": " + e.getMessage());
            }
        }
        for (JsonObject o : objects(root, "factions", problems)) {
            try {
                factions.add(readFaction(o));
            } catch (RuntimeException e) {
                problems.add("bad faction entry " + o + ": " + e.getMessage());
            }
        }

        if (!problems.isEmpty()) throw new GraphConsistencyException(problems);
        return new WorldDefinition(territories, factions);
    }

    private Territory readTerritory(JsonObject o) {
        int id = o.get("id").getAsInt();
        String levelRaw = optString(o, "level");
        TerritoryLevel level = TerritoryLevel.parse(levelRaw, null);
        if (level == null) throw new IllegalArgumentException("unknown level '" + levelRaw + "'");

        Integer parentId = (o.has("parentId") && !o.get("parentId").isJsonNull()) ? o.get("parentId").getAsInt() : null;

        List<Integer> links = new ArrayList<>();
        if (o.has("crossLinks") && o.get("crossLinks").isJsonArray()) {
            for (JsonElement l : o.getAsJsonArray("crossLinks")) links.add(l.getAsInt());
        }

        return new Territory(
                id,
                optString(o, "name"),
                level,
                parentId,
                links,
                o.has("strategicValue") ? o.get("strategicValue").getAsInt() : 1,
                o.has("resourceMultiplier") ? o.get("resourceMultiplier").getAsDouble() : 1.0,
                o.has("decayRate") ? o.get("decayRate").getAsDouble() : defaultDecayRate
        );
    }

    private FactionDefinition readFaction(JsonObject o) {
        BehaviorProfile profile = BehaviorProfile.balanced();
        if (o.has("profile") && o.get("profile").isJsonObject()) {
            JsonObject p = o.getAsJsonObject("profile");
            BehaviorProfile b = BehaviorProfile.balanced();
            profile = new BehaviorProfile(
                    num(p, "aggression", b.aggression()),
                    num(p, "riskTolerance", b.riskTolerance()),
                    num(p, "expansionPriority", b.expansionPriority()),
                    num(p, "resourceFocus", b.resourceFocus()),
                    num(p, "diplomaticTendency", b.diplomaticTendency())
            );
        }

        return new FactionDefinition(
                o.get("id").getAsInt(),
                optString(o, "code"),
                optString(o, "name"),
                profile,
                o.has("influenceModifier") ? o.get("influenceModifier").getAsDouble() : 1.0
        );
    }

    private static List<JsonObject> objects(JsonObject root, String field, List<String> problems) {
        List<JsonObject> out = new ArrayList<>();
        JsonElement el = root.get(field);
        if (el == null || el.isJsonNull()) return out;
        if (!el.isJsonArray()) {
            problems.add("'" + field + "' must be an array");
            return out;
        }
        JsonArray arr = el.getAsJsonArray();
        for (JsonElement item : arr) {
            if (item.isJsonObject()) out.add(item.getAsJsonObject());
            else problems.add("'" + field + "' contains a non-object entry: " + item);
        }
        return out;
    }

    private static String optString(JsonObject o, String field) {
        return (o.has(field) && !o.get(field).isJsonNull()) ? o.get(field).getAsString() : null;
    }

    private static double num(JsonObject o, String field, double fallback) {
        return (o.has(field) && !o.get(field).isJsonNull()) ? o.get(field).getAsDouble() : fallback;
    }
}
