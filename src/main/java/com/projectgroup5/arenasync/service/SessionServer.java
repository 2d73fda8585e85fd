package com.projectgroup5.arenasync.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Consumer;

/**
 * 游戏会话服务器的能力接口（房间 / 订阅 / 远程调用）
 * 引擎只依赖这个接口，具体传输见 websocket 包
 */
public interface SessionServer {

    /** 当前连接分配到的账号 id，连接完成前为 null */
    String account();

    /** 订阅房间事件，每条消息最多投递一次，回调异步执行 */
    Subscription subscribe(String roomId, String eventName, Consumer<JsonNode> handler);

    /** 订阅房间状态，每次状态变化都会收到完整的状态对象 */
    Subscription subscribeState(String roomId, Consumer<JsonNode> handler);

    /** 远程调用，fire-and-forget */
    void call(String name, List<?> args, CallOptions options);

    default void call(String name, List<?> args) {
        call(name, args, CallOptions.none());
    }
}
