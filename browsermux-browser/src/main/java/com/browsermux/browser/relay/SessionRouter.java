package com.browsermux.browser.relay;

import com.browsermux.browser.transport.BrowserProtocol;
import com.browsermux.browser.transport.MessageTransport;
import com.browsermux.browser.transport.ProtocolMessage;
import com.browsermux.common.infra.ErrorUtils;
import com.browsermux.common.logging.SubsystemLogger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shares one browser transport between many external sessions.
 *
 * <p>Request ids from every session are remapped onto one flat id space.
 * Responses are routed back by id; notifications are routed by the browser
 * context or page proxy they concern. The router remembers which session
 * owns each context and page proxy, and deletes a session's contexts when
 * it goes away.
 *
 * <p>Not thread-safe. Every method must be called from the same event loop.
 */
public class SessionRouter {

    private static final SubsystemLogger log = SubsystemLogger.create("relay/router");

    static final String BROWSER_DISCONNECTED = "Browser disconnected";

    private final MessageTransport transport;
    private final SequenceIdMixer<PendingRequest> idMixer = new SequenceIdMixer<>();

    private final Set<Integer> pendingContextCreations = new HashSet<>();
    private final Map<Integer, String> pendingContextDeletions = new HashMap<>();
    private final Map<String, ExternalSession> browserContextOwners = new HashMap<>();
    private final Map<String, ExternalSession> pageProxyOwners = new HashMap<>();
    private final Set<ExternalSession> sessions = new LinkedHashSet<>();
    private boolean dead;

    public SessionRouter(MessageTransport transport) {
        this.transport = transport;
    }

    // ==================== Session lifecycle ====================

    /**
     * Admit a new session. A dead router closes it straight away.
     *
     * @return whether the session was admitted
     */
    public boolean onConnect(ExternalSession session) {
        if (dead) {
            session.close(BROWSER_DISCONNECTED);
            return false;
        }
        sessions.add(session);
        log.debug("session connected", Map.of("session", session.id(), "sessions", sessions.size()));
        return true;
    }

    /**
     * Forget a session and delete every browser context it owns. Safe to
     * call more than once.
     */
    public void onDisconnect(ExternalSession session) {
        if (!sessions.remove(session)) {
            return;
        }
        pageProxyOwners.values().removeIf(session::equals);

        int deletedContexts = 0;
        Iterator<Map.Entry<String, ExternalSession>> it = browserContextOwners.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ExternalSession> entry = it.next();
            if (entry.getValue().equals(session)) {
                sendContextDeletion(entry.getKey());
                it.remove();
                deletedContexts++;
            }
        }

        // In-flight creations stay registered so the created context can be deleted when it arrives.
        List<Integer> discarded = idMixer.discardIf(
                (id, pending) -> pending.session().equals(session) && !pendingContextCreations.contains(id));
        discarded.forEach(pendingContextDeletions::remove);

        log.debug("session disconnected", Map.of(
                "session", session.id(),
                "deletedContexts", deletedContexts,
                "discardedRequests", discarded.size()));
    }

    // ==================== Outbound ====================

    /**
     * Forward a request from a session to the browser under a mixed id.
     */
    public void onSessionMessage(ExternalSession session, ProtocolMessage message) {
        if (dead || !sessions.contains(session) || session.isClosing()) {
            log.debug("dropping message from inactive session", Map.of("session", session.id()));
            return;
        }
        Integer originalId = message.id();
        if (originalId == null) {
            log.warn("dropping session message without numeric id", Map.of(
                    "session", session.id(),
                    "method", String.valueOf(message.method())));
            return;
        }

        int mixedId = idMixer.generate(new PendingRequest(originalId, session));
        String method = message.method();
        if (BrowserProtocol.CREATE_CONTEXT.equals(method)) {
            pendingContextCreations.add(mixedId);
        } else if (BrowserProtocol.DELETE_CONTEXT.equals(method)) {
            String contextId = message.paramText(BrowserProtocol.BROWSER_CONTEXT_ID);
            if (contextId != null) {
                pendingContextDeletions.put(mixedId, contextId);
            }
        }
        transport.send(message.withId(mixedId));
    }

    // ==================== Inbound ====================

    /**
     * Route one message from the browser to the session it belongs to.
     */
    public void onTransportMessage(ProtocolMessage message) {
        if (dead) {
            return;
        }
        Integer id = message.id();
        if (id != null) {
            routeResponse(id, message);
            return;
        }

        String pageProxyId = message.pageProxyId();
        if (pageProxyId != null) {
            deliver(pageProxyOwners.get(pageProxyId), message);
            return;
        }

        String method = message.method();
        if (BrowserProtocol.PAGE_PROXY_CREATED.equals(method)) {
            routePageProxyCreated(message);
        } else if (BrowserProtocol.PAGE_PROXY_DESTROYED.equals(method)) {
            String destroyed = message.paramText(BrowserProtocol.PAGE_PROXY_ID);
            ExternalSession owner = destroyed != null ? pageProxyOwners.remove(destroyed) : null;
            deliver(owner, message);
        } else if (message.paramText(BrowserProtocol.PAGE_PROXY_ID) != null) {
            // provisional load failures and other page-scoped notifications
            deliver(pageProxyOwners.get(message.paramText(BrowserProtocol.PAGE_PROXY_ID)), message);
        } else {
            log.debug("dropping unattributed notification", Map.of("method", String.valueOf(method)));
        }
    }

    private void routeResponse(int mixedId, ProtocolMessage message) {
        if (mixedId == BrowserProtocol.BROWSER_CLOSE_MESSAGE_ID) {
            return;
        }
        Optional<PendingRequest> taken = idMixer.take(mixedId);
        if (taken.isEmpty()) {
            log.debug("dropping response with unknown id", Map.of("id", mixedId));
            return;
        }
        PendingRequest pending = taken.get();
        ExternalSession session = pending.session();
        boolean creation = pendingContextCreations.remove(mixedId);
        String deletedContextId = pendingContextDeletions.remove(mixedId);

        if (session.isClosing() || !sessions.contains(session)) {
            String createdContextId = creation ? resultText(message, BrowserProtocol.BROWSER_CONTEXT_ID) : null;
            if (createdContextId != null) {
                log.debug("deleting context created for a departed session", Map.of(
                        "session", session.id(), "browserContextId", createdContextId));
                sendContextDeletion(createdContextId);
            } else {
                log.debug("dropping response for departed session", Map.of("session", session.id()));
            }
            return;
        }

        if (creation) {
            String contextId = resultText(message, BrowserProtocol.BROWSER_CONTEXT_ID);
            if (contextId != null) {
                ExternalSession previous = browserContextOwners.put(contextId, session);
                if (previous != null && !previous.equals(session)) {
                    log.warn("browser context changed owner", Map.of(
                            "browserContextId", contextId, "from", previous.id(), "to", session.id()));
                }
            }
        }
        if (deletedContextId != null) {
            browserContextOwners.remove(deletedContextId);
        }

        session.send(message.withId(pending.originalId()));
    }

    private void routePageProxyCreated(ProtocolMessage message) {
        JsonNode params = message.params();
        JsonNode info = params != null ? params.get(BrowserProtocol.PAGE_PROXY_INFO) : null;
        String pageProxyId = info != null ? textOf(info.get(BrowserProtocol.PAGE_PROXY_ID)) : null;
        String contextId = info != null ? textOf(info.get(BrowserProtocol.BROWSER_CONTEXT_ID)) : null;
        if (pageProxyId == null || contextId == null) {
            log.debug("dropping malformed page proxy creation");
            return;
        }
        ExternalSession owner = browserContextOwners.get(contextId);
        if (owner == null || owner.isClosing()) {
            log.debug("dropping page proxy of unowned context", Map.of(
                    "pageProxyId", pageProxyId, "browserContextId", contextId));
            return;
        }
        ExternalSession previous = pageProxyOwners.put(pageProxyId, owner);
        if (previous != null && !previous.equals(owner)) {
            log.warn("page proxy changed owner", Map.of(
                    "pageProxyId", pageProxyId, "from", previous.id(), "to", owner.id()));
        }
        owner.send(message);
    }

    private void deliver(ExternalSession session, ProtocolMessage message) {
        if (session == null || session.isClosing()) {
            log.debug("dropping unattributed message", Map.of("method", String.valueOf(message.method())));
            return;
        }
        session.send(message);
    }

    // ==================== Transport lifecycle ====================

    /**
     * The browser connection is gone: close every session and stop routing.
     *
     * @param cause why the transport closed, or null for a normal close
     */
    public void onTransportClose(Throwable cause) {
        if (dead) {
            return;
        }
        dead = true;
        String reason = cause == null
                ? BROWSER_DISCONNECTED
                : BROWSER_DISCONNECTED + ": " + ErrorUtils.formatErrorMessage(cause);

        List<ExternalSession> toClose = new ArrayList<>(sessions);
        sessions.clear();
        pendingContextCreations.clear();
        pendingContextDeletions.clear();
        browserContextOwners.clear();
        pageProxyOwners.clear();
        idMixer.clear();

        log.info("browser transport closed, closing sessions", Map.of("sessions", toClose.size()));
        for (ExternalSession session : toClose) {
            session.close(reason);
        }
    }

    public boolean isDead() {
        return dead;
    }

    // ==================== Introspection ====================

    public Optional<ExternalSession> ownerOfContext(String browserContextId) {
        return Optional.ofNullable(browserContextOwners.get(browserContextId));
    }

    public Optional<ExternalSession> ownerOfPageProxy(String pageProxyId) {
        return Optional.ofNullable(pageProxyOwners.get(pageProxyId));
    }

    /**
     * Sizes of every routing table, for leak checks.
     */
    public PendingState pendingState() {
        return new PendingState(
                pendingContextCreations.size(),
                pendingContextDeletions.size(),
                browserContextOwners.size(),
                pageProxyOwners.size(),
                sessions.size(),
                idMixer.outstanding());
    }

    public record PendingState(
            int pendingContextCreations,
            int pendingContextDeletions,
            int browserContexts,
            int pageProxies,
            int sessions,
            int outstandingRequests) {

        public boolean isEmpty() {
            return pendingContextCreations == 0 && pendingContextDeletions == 0
                    && browserContexts == 0 && pageProxies == 0
                    && sessions == 0 && outstandingRequests == 0;
        }
    }

    // ==================== Helpers ====================

    private void sendContextDeletion(String browserContextId) {
        ObjectNode params = ProtocolMessage.newObject();
        params.put(BrowserProtocol.BROWSER_CONTEXT_ID, browserContextId);
        transport.send(ProtocolMessage.request(idMixer.nextSequenceNumber(), BrowserProtocol.DELETE_CONTEXT, params));
    }

    private static String resultText(ProtocolMessage message, String field) {
        JsonNode result = message.result();
        return result != null ? textOf(result.get(field)) : null;
    }

    private static String textOf(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
