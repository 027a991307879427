package com.flagship.budget_ledger.config;

import com.flagship.budget_ledger.notification.RolloverUpdatesWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ROLLOVER_UPDATES_PATH = "/api/rollover-updates";

    private final RolloverUpdatesWebSocketHandler rolloverUpdatesHandler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(rolloverUpdatesHandler, ROLLOVER_UPDATES_PATH).setAllowedOriginPatterns("*");
    }
}
