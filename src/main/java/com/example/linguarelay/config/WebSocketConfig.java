package com.example.linguarelay.config;

import com.example.linguarelay.handler.RelayWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

/** Mounts the relay handler; clients connect to {@code app.websocket.path}. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

  private final RelayWebSocketHandler relayHandler;
  private final String relayPath;
  private final List<String> allowedOrigins;

  public WebSocketConfig(RelayWebSocketHandler relayHandler,
                         @Value("${app.websocket.path:/relay}") String relayPath,
                         @Value("${app.websocket.allowed-origins:http://localhost:3000}") String originsCsv,
                         @Value("${app.websocket.debug-open:false}") boolean anyOrigin) {
    this.relayHandler = relayHandler;
    this.relayPath = relayPath;
    this.allowedOrigins = anyOrigin ? List.of("*") : OriginPatterns.fromCsv(originsCsv);
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    log.info("WS relay mounted at {} origins={}", relayPath, allowedOrigins);
    registry.addHandler(relayHandler, relayPath)
            .setAllowedOriginPatterns(allowedOrigins.toArray(String[]::new));
  }
}
