package com.browsermux.browser.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One protocol envelope: {@code {id?, method?, params?, result?, error?, pageProxyId?}}.
 *
 * <p>The envelope is backed by a Jackson tree so fields the relay does not
 * understand survive the round trip. Instances are not shared between
 * threads after they are handed to a transport or a session.
 */
public final class ProtocolMessage {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final ObjectNode node;

    private ProtocolMessage(ObjectNode node) {
        this.node = node;
    }

    public static ProtocolMessage of(ObjectNode node) {
        return new ProtocolMessage(Objects.requireNonNull(node, "node"));
    }

    /**
     * Parse a JSON text into a message.
     *
     * @throws JsonProcessingException  if the text is not valid JSON
     * @throws IllegalArgumentException if the JSON value is not an object
     */
    public static ProtocolMessage parse(String json) throws JsonProcessingException {
        JsonNode tree = mapper.readTree(json);
        if (tree == null || !tree.isObject()) {
            throw new IllegalArgumentException("Protocol message must be a JSON object");
        }
        return new ProtocolMessage((ObjectNode) tree);
    }

    /**
     * Build a request envelope. A null params value is sent as {@code {}}.
     */
    public static ProtocolMessage request(int id, String method, JsonNode params) {
        ObjectNode node = mapper.createObjectNode();
        node.put(BrowserProtocol.ID, id);
        node.put(BrowserProtocol.METHOD, method);
        node.set(BrowserProtocol.PARAMS, params != null ? params : mapper.createObjectNode());
        return new ProtocolMessage(node);
    }

    public static ObjectNode newObject() {
        return mapper.createObjectNode();
    }

    // ==================== Envelope accessors ====================

    /**
     * @return the id when present and representable as an int, otherwise null
     */
    public Integer id() {
        JsonNode id = node.get(BrowserProtocol.ID);
        if (id == null || !id.isIntegralNumber() || !id.canConvertToInt()) {
            return null;
        }
        return id.intValue();
    }

    public String method() {
        return text(node, BrowserProtocol.METHOD);
    }

    public JsonNode params() {
        return node.get(BrowserProtocol.PARAMS);
    }

    public JsonNode result() {
        return node.get(BrowserProtocol.RESULT);
    }

    public JsonNode error() {
        return node.get(BrowserProtocol.ERROR);
    }

    public boolean isError() {
        JsonNode error = error();
        return error != null && !error.isNull();
    }

    /** Top-level page proxy id, carried by page-scoped notifications. */
    public String pageProxyId() {
        return text(node, BrowserProtocol.PAGE_PROXY_ID);
    }

    /**
     * Read a string field from {@code params}, or null.
     */
    public String paramText(String field) {
        JsonNode params = params();
        return params != null ? text(params, field) : null;
    }

    /**
     * @return a copy of this message carrying the given id
     */
    public ProtocolMessage withId(int id) {
        ObjectNode copy = node.deepCopy();
        copy.put(BrowserProtocol.ID, id);
        return new ProtocolMessage(copy);
    }

    /**
     * Serialize to compact JSON.
     */
    public String toJson() {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // An in-memory tree always serializes.
            throw new IllegalStateException("Cannot serialize protocol message", e);
        }
    }

    public ObjectNode toJsonNode() {
        return node.deepCopy();
    }

    static String text(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProtocolMessage other)) return false;
        return node.equals(other.node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
