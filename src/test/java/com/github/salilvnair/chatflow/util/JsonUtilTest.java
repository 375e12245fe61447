package com.github.salilvnair.chatflow.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonUtilTest {

    @Test
    void parseOrNullReturnsNullNodeForInvalidJson() {
        assertEquals(NullNode.getInstance(), JsonUtil.parseOrNull("{bad json"));
        assertEquals(NullNode.getInstance(), JsonUtil.parseOrNull(" "));
    }

    @Test
    void parseOrNullReadsProviderError() {
        JsonNode node = JsonUtil.parseOrNull("{\"error\":{\"code\":131047,\"message\":\"Re-engagement message\"}}");

        assertEquals(131047, node.path("error").path("code").asInt());
    }

    @Test
    void toJsonKeepsInsertionOrderOfObjectNodes() {
        String json = JsonUtil.toJson(JsonUtil.object().put("to", "919800000001").put("type", "text"));

        assertEquals("{\"to\":\"919800000001\",\"type\":\"text\"}", json);
    }

    @Test
    void fromJsonFailsLoudly() {
        assertEquals(Map.of("a", 1), JsonUtil.fromJson("{\"a\":1}", Map.class));
        assertThrows(IllegalStateException.class, () -> JsonUtil.fromJson("[", Map.class));
    }
}
