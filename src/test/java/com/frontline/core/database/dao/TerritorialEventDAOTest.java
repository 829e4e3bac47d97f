package com.frontline.core.database.dao;

import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.EventPriority;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TerritorialEventDAOTest {

    @Test
    @DisplayName("The JSON payload carries priority, flip flag and cascade wave")
    void payload() {
        TerritorialEvent e = new TerritorialEvent(9L, 1_000L, 101, 2, "s-1", "s-1", EventCause.CASCADE,
                3.5, 3.5, 48.5, EventPriority.HIGH, true, 2);

        JsonObject payload = TerritorialEventDAO.payloadOf(e);

        assertEquals("HIGH", payload.get("priority").getAsString());
        assertTrue(payload.get("control_changed").getAsBoolean());
        assertEquals(2, payload.get("cascade_wave").getAsInt());
    }
}
