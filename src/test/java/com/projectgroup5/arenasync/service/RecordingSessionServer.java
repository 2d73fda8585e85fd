package com.projectgroup5.arenasync.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 测试用会话服务器：记录所有出站调用，手动投递入站消息
 */
public class RecordingSessionServer implements SessionServer {

    public static final class Call {
        public final String name;
        public final List<?> args;
        public final CallOptions options;

        Call(String name, List<?> args, CallOptions options) {
            this.name = name;
            this.args = args;
            this.options = options;
        }

        @SuppressWarnings("unchecked")
        public <T> T arg(int index) {
            return (T) args.get(index);
        }
    }

    private final String account;
    private final List<Call> calls = new ArrayList<>();
    private final Map<String, List<Consumer<JsonNode>>> eventHandlers = new HashMap<>();
    private final Map<String, List<Consumer<JsonNode>>> stateHandlers = new HashMap<>();

    public RecordingSessionServer(String account) {
        this.account = account;
    }

    @Override
    public String account() {
        return account;
    }

    @Override
    public Subscription subscribe(String roomId, String eventName, Consumer<JsonNode> handler) {
        List<Consumer<JsonNode>> handlers = eventHandlers.computeIfAbsent(roomId + ":" + eventName, k -> new ArrayList<>());
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    @Override
    public Subscription subscribeState(String roomId, Consumer<JsonNode> handler) {
        List<Consumer<JsonNode>> handlers = stateHandlers.computeIfAbsent(roomId, k -> new ArrayList<>());
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    @Override
    public void call(String name, List<?> args, CallOptions options) {
        calls.add(new Call(name, args, options));
    }

    public void emitEvent(String roomId, String eventName, JsonNode payload) {
        new ArrayList<>(eventHandlers.getOrDefault(roomId + ":" + eventName, List.of())).forEach(h -> h.accept(payload));
    }

    public void emitState(String roomId, JsonNode state) {
        new ArrayList<>(stateHandlers.getOrDefault(roomId, List.of())).forEach(h -> h.accept(state));
    }

    public int subscriberCount(String roomId, String eventName) {
        return eventHandlers.getOrDefault(roomId + ":" + eventName, List.of()).size();
    }

    public int stateSubscriberCount(String roomId) {
        return stateHandlers.getOrDefault(roomId, List.of()).size();
    }

    public List<Call> calls() {
        return calls;
    }

    public List<Call> callsNamed(String name) {
        return calls.stream().filter(c -> c.name.equals(name)).collect(Collectors.toList());
    }

    public void clearCalls() {
        calls.clear();
    }
}
