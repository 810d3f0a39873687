package com.hashfleet.monitor.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hashfleet.monitor.registry.LiveRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for dashboards.
 * <p>
 * Sends: initial_data on connect ({instances, stats}), hashrate_update on
 * every accepted report ({instance, stats}).
 * <p>
 * Sessions are not thread-safe for sending, so each send holds the session's
 * monitor. A session that fails to receive is closed and forgotten.
 */
@Slf4j
@Component
public class WebSocketReportBroadcaster extends TextWebSocketHandler implements ReportBroadcaster {

    private final ObjectMapper objectMapper;
    private final LiveRegistry registry;

    private final Set<WebSocketSession> sessions = ConcurrentHashMap.newKeySet();

    public WebSocketReportBroadcaster(ObjectMapper objectMapper, LiveRegistry registry) {
        this.objectMapper = objectMapper;
        this.registry = registry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("Client connected: {} (total: {})", session.getId(), sessions.size());

        TextMessage initial = serialize("initial_data", Map.of(
                "instances", registry.snapshot(),
                "stats", registry.stats()
        ));
        if (initial != null) {
            send(session, initial);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("Client disconnected: {} ({}), remaining: {}", session.getId(), status, sessions.size());
    }

    @Override
    public void publish(ReportUpdate update) {
        if (sessions.isEmpty()) {
            return;
        }
        TextMessage message = serialize("hashrate_update", update);
        if (message == null) {
            return;
        }
        for (WebSocketSession session : sessions) {
            send(session, message);
        }
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private void send(WebSocketSession session, TextMessage message) {
        try {
            synchronized (session) {
                if (session.isOpen()) {
                    session.sendMessage(message);
                }
            }
        } catch (IOException | IllegalStateException e) {
            log.warn("Dropping client {} after failed send: {}", session.getId(), e.getMessage());
            sessions.remove(session);
            closeQuietly(session);
        }
    }

    private TextMessage serialize(String event, Object data) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(Map.of("event", event, "data", data)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} message", event, e);
            return null;
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            log.debug("Error closing client {}", session.getId(), e);
        }
    }
}
