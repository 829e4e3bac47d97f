package com.frontline.core.synchronization.wire;

import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.feed.FeedEventKind;
import com.frontline.core.domain.influence.ActionKind;
import com.frontline.core.domain.influence.ActionRequest;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON wire form of feed events (outbound) and session actions (inbound).
 *
 * Inbound:  {"territoryId":7,"factionId":2,"actionKind":"Capture","magnitude":20,"actorId":"s-1","timestamp":0}
 * Outbound: {"kind":"ControlChanged","territoryId":7,...,"sequence":12}
 */
public final class FeedCodec {

    private final Gson gson = new GsonBuilder().serializeNulls().create();

    public String encode(FeedEvent e) {
        JsonObject o = new JsonObject();
        o.addProperty("kind", e.kind().wireName());
        o.addProperty("territoryId", e.territoryId());
        o.addProperty("territoryName", e.territoryName());
        addNullable(o, "previousControllerId", e.previousControllerId());
        addNullable(o, "newControllerId", e.newControllerId());
        o.addProperty("strategicValue", e.strategicValue());
        o.addProperty("contested", e.contested());

        JsonArray connected = new JsonArray();
        for (Integer id : e.connectedTerritoryIds()) connected.add(id);
        o.add("connectedTerritoryIds", connected);

        o.addProperty("sequence", e.sequence());
        o.addProperty("lowPriority", e.lowPriority());
        o.addProperty("timestamp", e.timestampMs());
        return gson.toJson(o);
    }

    public FeedEvent decodeEvent(String json) {
        JsonObject o = parseObject(json);
        FeedEventKind kind = FeedEventKind.fromWireName(requireString(o, "kind"));
        if (kind == null) throw new TerritorialValidationException("Unknown feed event kind: " + o.get("kind"));

        try {
            List<Integer> connected = new ArrayList<>();
            JsonElement arr = o.get("connectedTerritoryIds");
            if (arr != null && arr.isJsonArray()) {
                for (JsonElement el : arr.getAsJsonArray()) connected.add(el.getAsInt());
            }

            return new FeedEvent(
                    kind,
                    requireInt(o, "territoryId"),
                    optString(o, "territoryName"),
                    optInteger(o, "previousControllerId"),
                    optInteger(o, "newControllerId"),
                    o.has("strategicValue") ? o.get("strategicValue").getAsInt() : 0,
                    o.has("contested") && o.get("contested").getAsBoolean(),
                    connected,
                    o.has("sequence") ? o.get("sequence").getAsLong() : 0L,
                    o.has("lowPriority") && o.get("lowPriority").getAsBoolean(),
                    o.has("timestamp") ? o.get("timestamp").getAsLong() : 0L
            );
        } catch (RuntimeException ex) {
            throw new TerritorialValidationException("Malformed feed event: " + ex.getMessage(), ex);
        }
    }

    /**
     * @throws TerritorialValidationException for malformed JSON, missing fields or an unknown action kind
     */
    public ActionRequest decodeAction(String json) {
        JsonObject o = parseObject(json);

        int territoryId = requireInt(o, "territoryId");
        int factionId = requireInt(o, "factionId");

        String kindRaw = requireString(o, "actionKind");
        ActionKind kind = ActionKind.parse(kindRaw);
        if (kind == null) throw new TerritorialValidationException("Unknown action kind: " + kindRaw);

        double magnitude;
        try {
            JsonElement m = o.get("magnitude");
            if (m == null || m.isJsonNull()) throw new TerritorialValidationException("Missing field: magnitude");
            magnitude = m.getAsDouble();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
            throw new TerritorialValidationException("Field magnitude is not a number", ex);
        }

        String actorId = optString(o, "actorId");
        long timestamp = 0L;
        if (o.has("timestamp") && !o.get("timestamp").isJsonNull()) {
            try {
                timestamp = o.get("timestamp").getAsLong();
            } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
                throw new TerritorialValidationException("Field timestamp is not a number", ex);
            }
        }

        return new ActionRequest(territoryId, factionId, kind, magnitude, actorId, timestamp);
    }

    private static JsonObject parseObject(String json) {
        if (json == null || json.isBlank()) throw new TerritorialValidationException("Empty message");
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) throw new TerritorialValidationException("Message must be a JSON object");
            return root.getAsJsonObject();
        } catch (JsonParseException ex) {
            throw new TerritorialValidationException("Malformed JSON: " + ex.getMessage(), ex);
        }
    }

    private static int requireInt(JsonObject o, String field) {
        JsonElement el = o.get(field);
        if (el == null || el.isJsonNull()) throw new TerritorialValidationException("Missing field: " + field);
        try {
            double d = el.getAsDouble();
            if (d != Math.rint(d)) throw new TerritorialValidationException("Field " + field + " must be an integer");
            return el.getAsInt();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
            throw new TerritorialValidationException("Field " + field + " must be an integer", ex);
        }
    }

    private static String requireString(JsonObject o, String field) {
        String s = optString(o, field);
        if (s == null || s.isBlank()) throw new TerritorialValidationException("Missing field: " + field);
        return s;
    }

    private static String optString(JsonObject o, String field) {
        JsonElement el = o.get(field);
        if (el == null || el.isJsonNull()) return null;
        if (!el.isJsonPrimitive()) throw new TerritorialValidationException("Field " + field + " must be a string");
        return el.getAsString();
    }

    private static Integer optInteger(JsonObject o, String field) {
        JsonElement el = o.get(field);
        if (el == null || el.isJsonNull()) return null;
        return el.getAsInt();
    }

    private static void addNullable(JsonObject o, String field, Integer value) {
        if (value == null) o.add(field, JsonNull.INSTANCE);
        else o.addProperty(field, value);
    }
}
