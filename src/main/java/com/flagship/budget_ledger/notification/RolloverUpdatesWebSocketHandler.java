package com.flagship.budget_ledger.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;
import java.util.UUID;

/**
 * Server side of {@code /api/rollover-updates?user_id=<uuid>}. Clients only
 * listen; anything they send is ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RolloverUpdatesWebSocketHandler extends TextWebSocketHandler {

    static final String USER_ID_PARAM = "user_id";

    private final RolloverConnectionManager connectionManager;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Optional<UUID> userId = userIdOf(session.getUri());
        if (userId.isEmpty()) {
            log.warn("Rejecting websocket session {}: missing or invalid {}", session.getId(), USER_ID_PARAM);
            session.close(CloseStatus.BAD_DATA.withReason("user_id query parameter is required"));
            return;
        }
        connectionManager.register(userId.get(), session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionManager.unregister(session);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on websocket session {}: {}", session.getId(), exception.getMessage());
        connectionManager.unregister(session);
    }

    static Optional<UUID> userIdOf(URI uri) {
        if (uri == null) {
            return Optional.empty();
        }
        String value = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(USER_ID_PARAM);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
