package com.browsermux.browser.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolMessageTest {

    @Test
    void parse_readsEnvelopeFields() throws Exception {
        ProtocolMessage message = ProtocolMessage.parse(
                "{\"id\":7,\"method\":\"Page.navigate\",\"params\":{\"url\":\"about:blank\"},\"pageProxyId\":\"pp-1\"}");

        assertEquals(7, message.id());
        assertEquals("Page.navigate", message.method());
        assertEquals("about:blank", message.paramText("url"));
        assertEquals("pp-1", message.pageProxyId());
        assertNull(message.result());
        assertFalse(message.isError());
    }

    @Test
    void id_nonIntegralOrMissing_isNull() throws Exception {
        assertNull(ProtocolMessage.parse("{\"method\":\"x\"}").id());
        assertNull(ProtocolMessage.parse("{\"id\":\"7\"}").id());
        assertNull(ProtocolMessage.parse("{\"id\":1.5}").id());
        assertNull(ProtocolMessage.parse("{\"id\":99999999999}").id());
    }

    @Test
    void parse_rejectsNonObjects() {
        assertThrows(IllegalArgumentException.class, () -> ProtocolMessage.parse("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> ProtocolMessage.parse("42"));
        assertThrows(JsonProcessingException.class, () -> ProtocolMessage.parse("{\"id\":"));
    }

    @Test
    void withId_copiesAndKeepsUnknownFields() throws Exception {
        ProtocolMessage original = ProtocolMessage.parse("{\"id\":1,\"method\":\"m\",\"custom\":{\"a\":true}}");

        ProtocolMessage remapped = original.withId(42);

        assertEquals(42, remapped.id());
        assertEquals(1, original.id());
        assertTrue(remapped.toJsonNode().get("custom").get("a").asBoolean());
    }

    @Test
    void request_defaultsParamsToEmptyObject() {
        ProtocolMessage request = ProtocolMessage.request(BrowserProtocol.BROWSER_CLOSE_MESSAGE_ID,
                BrowserProtocol.CLOSE, null);

        assertEquals("{\"id\":-9999,\"method\":\"Playwright.close\",\"params\":{}}", request.toJson());
    }

    @Test
    void isError_ignoresNullError() throws Exception {
        assertFalse(ProtocolMessage.parse("{\"id\":1,\"error\":null}").isError());
        assertTrue(ProtocolMessage.parse("{\"id\":1,\"error\":{\"message\":\"nope\"}}").isError());
    }
}
