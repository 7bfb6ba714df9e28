/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.cerebrops.monitor.notifier;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SlackMessageTest {

    @Test
    public void testToJsonUsesWebhookFieldNames() {
        SlackMessage.Attachment attachment =
            new SlackMessage.Attachment("#ff0000", "title", "text", "footer", 1700000000L,
                                        List.of(new SlackMessage.Field("Anomaly Rate", "25.0%", true)));
        JsonObject json = JsonParser.parseString(new SlackMessage("user", ":brain:", null, attachment).toJson())
                                    .getAsJsonObject();
        assertEquals("user", json.get("username").getAsString());
        assertEquals(":brain:", json.get("icon_emoji").getAsString());
        assertFalse(json.has("channel"));
        JsonObject jsonAttachment = json.getAsJsonArray("attachments").get(0).getAsJsonObject();
        assertEquals("#ff0000", jsonAttachment.get("color").getAsString());
        assertEquals(1700000000L, jsonAttachment.get("ts").getAsLong());
        JsonObject jsonField = jsonAttachment.getAsJsonArray("fields").get(0).getAsJsonObject();
        assertEquals("Anomaly Rate", jsonField.get("title").getAsString());
        assertTrue(jsonField.get("short").getAsBoolean());
    }
}
