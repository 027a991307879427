package com.flagship.budget_ledger.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open websocket sessions, grouped by the user they belong to.
 *
 * Sessions are wrapped so that sends from the Kafka listener thread and the
 * websocket container never interleave on one session.
 */
@Component
@Slf4j
public class RolloverConnectionManager {

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int BUFFER_SIZE_LIMIT_BYTES = 64 * 1024;

    private final Map<UUID, Set<WebSocketSession>> sessionsByUser = new ConcurrentHashMap<>();
    private final Map<String, UUID> userBySessionId = new ConcurrentHashMap<>();

    public void register(UUID userId, WebSocketSession session) {
        WebSocketSession decorated =
            new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT_BYTES);
        sessionsByUser.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(decorated);
        userBySessionId.put(session.getId(), userId);
        log.info("Websocket session {} registered for user {}", session.getId(), userId);
    }

    public void unregister(WebSocketSession session) {
        UUID userId = userBySessionId.remove(session.getId());
        if (userId == null) {
            return;
        }
        sessionsByUser.computeIfPresent(userId, (id, sessions) -> {
            sessions.removeIf(candidate -> candidate.getId().equals(session.getId()));
            return sessions.isEmpty() ? null : sessions;
        });
        log.info("Websocket session {} of user {} unregistered", session.getId(), userId);
    }

    /**
     * Sends the message to every open session of the user. A session whose
     * send fails is closed and dropped.
     *
     * @return the number of sessions the message reached
     */
    public int broadcast(UUID userId, String message) {
        Set<WebSocketSession> sessions = sessionsByUser.get(userId);
        if (sessions == null || sessions.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (WebSocketSession session : sessions) {
            try {
                session.sendMessage(new TextMessage(message));
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping websocket session {} of user {}: {}", session.getId(), userId, e.getMessage());
                unregister(session);
                closeQuietly(session);
            }
        }
        return delivered;
    }

    public int getSessionCount(UUID userId) {
        Set<WebSocketSession> sessions = sessionsByUser.get(userId);
        return sessions == null ? 0 : sessions.size();
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Closing websocket session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
