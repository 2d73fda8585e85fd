package com.projectgroup5.arenasync.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.client.WebSocketClient;

import java.util.concurrent.CompletableFuture;

/**
 * 建立到会话服务器的连接，拿到账号后才算连接完成
 */
@Component
public class ServerConnector {

    private static final Logger logger = LoggerFactory.getLogger(ServerConnector.class);

    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;

    public ServerConnector(WebSocketClient webSocketClient, ObjectMapper objectMapper) {
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<WebSocketSessionServer> connect(String serverUrl) {
        WebSocketSessionServer server = new WebSocketSessionServer(objectMapper);
        logger.info("Connecting to session server {}", serverUrl);

        return webSocketClient.execute(server, serverUrl)
                .thenCompose(session -> server.accountAssigned())
                .thenApply(account -> server);
    }
}
