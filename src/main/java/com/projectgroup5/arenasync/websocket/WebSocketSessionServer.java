package com.projectgroup5.arenasync.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.projectgroup5.arenasync.service.CallOptions;
import com.projectgroup5.arenasync.service.SessionServer;
import com.projectgroup5.arenasync.service.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * 基于 WebSocket 的会话服务器实现
 *
 * 入站帧：
 *   {"type":"connected","account":"..."}
 *   {"type":"event","room":"...","name":"...","data":{...}}
 *   {"type":"state","room":"...","state":{...}}
 * 出站帧：
 *   {"type":"call","name":"...","args":[...]}
 */
public class WebSocketSessionServer extends TextWebSocketHandler implements SessionServer {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketSessionServer.class);

    private final ObjectMapper objectMapper;
    private final LongSupplier clock;

    // room:event -> handlers
    private final Map<String, List<Consumer<JsonNode>>> eventHandlers = new ConcurrentHashMap<>();
    // room -> handlers
    private final Map<String, List<Consumer<JsonNode>>> stateHandlers = new ConcurrentHashMap<>();
    // call name -> 上次真正发出的时间
    private final Map<String, Long> lastCallAt = new ConcurrentHashMap<>();

    private final CompletableFuture<String> accountAssigned = new CompletableFuture<>();

    private volatile WebSocketSession session;
    private volatile String account;

    public WebSocketSessionServer(ObjectMapper objectMapper) {
        this(objectMapper, System::currentTimeMillis);
    }

    public WebSocketSessionServer(ObjectMapper objectMapper, LongSupplier clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== 连接建立 / 关闭 ====================

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        this.session = session;
        logger.info("WebSocket connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        if (this.session == session) {
            this.session = null;
        }
        logger.info("WebSocket disconnected: {}, status: {}", session.getId(), status);
    }

    // ==================== 入站消息分发 ====================

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        try {
            JsonNode msg = objectMapper.readTree(message.getPayload());
            String type = msg.path("type").asText("");

            switch (type) {
                case "connected":
                    handleConnected(msg);
                    break;
                case "event":
                    dispatch(eventHandlers.get(eventKey(msg.path("room").asText(), msg.path("name").asText())),
                            msg.get("data"));
                    break;
                case "state":
                    dispatch(stateHandlers.get(msg.path("room").asText()), msg.get("state"));
                    break;
                default:
                    logger.warn("Unknown message type: {}", type);
            }
        } catch (Exception e) {
            logger.error("Error handling message from {}", session.getId(), e);
        }
    }

    private void handleConnected(JsonNode msg) {
        String assigned = msg.path("account").asText(null);
        if (assigned == null || assigned.isEmpty()) {
            logger.warn("Connected frame without account");
            return;
        }
        account = assigned;
        accountAssigned.complete(assigned);
        logger.info("Session account assigned: {}", assigned);
    }

    private void dispatch(List<Consumer<JsonNode>> handlers, JsonNode payload) {
        if (handlers == null) return;
        for (Consumer<JsonNode> handler : handlers) {
            try {
                handler.accept(payload);
            } catch (Exception e) {
                logger.error("Subscriber failed", e);
            }
        }
    }

    // ==================== SessionServer ====================

    @Override
    public String account() {
        return account;
    }

    /** 收到 connected 帧后完成 */
    public CompletableFuture<String> accountAssigned() {
        return accountAssigned;
    }

    @Override
    public Subscription subscribe(String roomId, String eventName, Consumer<JsonNode> handler) {
        List<Consumer<JsonNode>> handlers =
                eventHandlers.computeIfAbsent(eventKey(roomId, eventName), k -> new CopyOnWriteArrayList<>());
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    @Override
    public Subscription subscribeState(String roomId, Consumer<JsonNode> handler) {
        List<Consumer<JsonNode>> handlers = stateHandlers.computeIfAbsent(roomId, k -> new CopyOnWriteArrayList<>());
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    @Override
    public void call(String name, List<?> args, CallOptions options) {
        if (options.isThrottled()) {
            long now = clock.getAsLong();
            Long last = lastCallAt.get(name);
            if (last != null && now - last < options.getThrottleMs()) {
                logger.trace("Call {} throttled", name);
                return;
            }
            lastCallAt.put(name, now);
        }

        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            logger.warn("Call {} dropped, not connected", name);
            return;
        }

        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "call");
        frame.put("name", name);
        frame.set("args", objectMapper.valueToTree(args));
        sendMessage(current, frame);
    }

    private void sendMessage(WebSocketSession target, JsonNode frame) {
        try {
            String json = objectMapper.writeValueAsString(frame);
            // WebSocketSession 不允许并发发送
            synchronized (target) {
                target.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            // 不重试，丢了就丢了，下一次快照会纠正位置
            logger.error("Failed to send {} to server", frame.path("name").asText(), e);
        }
    }

    private static String eventKey(String roomId, String eventName) {
        return roomId + ":" + eventName;
    }
}
