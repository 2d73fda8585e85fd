package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.config.ArenaProperties;
import com.projectgroup5.arenasync.service.SessionServer;
import com.projectgroup5.arenasync.service.SessionSubscriptions;
import com.projectgroup5.arenasync.service.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话管理器 - 加入 / 离开房间时创建和销毁 ArenaSession
 */
@Component
public class ArenaSessionManager {
    private static final Logger logger = LoggerFactory.getLogger(ArenaSessionManager.class);

    // roomId -> ArenaSession
    private final Map<String, ArenaSession> activeSessions = new ConcurrentHashMap<>();
    // roomId -> 该会话在服务器上的订阅
    private final Map<String, Subscription> bindings = new ConcurrentHashMap<>();

    private final ArenaProperties props;
    private final SessionSubscriptions subscriptions;

    public ArenaSessionManager(ArenaProperties props, SessionSubscriptions subscriptions) {
        this.props = props;
        this.subscriptions = subscriptions;
    }

    public ArenaSession join(String roomId, String playerName, SessionServer server) {
        return join(roomId, playerName, server, new PhysicsEngine());
    }

    /**
     * 加入房间：新建会话并挂上服务器订阅
     */
    public ArenaSession join(String roomId, String playerName, SessionServer server, ArenaPhysics physics) {
        ArenaSession existing = activeSessions.get(roomId);
        if (existing != null) {
            logger.warn("Session already exists for roomId={}", roomId);
            return existing;
        }

        ArenaSession session = new ArenaSession(roomId, playerName, server, props, physics,
                System::currentTimeMillis, new Random());
        activeSessions.put(roomId, session);
        bindings.put(roomId, subscriptions.bind(session, server));

        logger.info("Joined room {} as {} ({})", roomId, session.getLocalId(), playerName);
        return session;
    }

    public Optional<ArenaSession> getSession(String roomId) {
        return Optional.ofNullable(activeSessions.get(roomId));
    }

    /**
     * 离开房间：先退订，再丢弃未执行的延迟动作
     * 连接可以复用，重新加入同一房间不会残留旧会话的回调
     */
    public void leave(String roomId) {
        Subscription binding = bindings.remove(roomId);
        if (binding != null) {
            binding.cancel();
        }
        ArenaSession session = activeSessions.remove(roomId);
        if (session != null) {
            session.close();
            logger.info("Left room {}", roomId);
        }
    }

    public Collection<ArenaSession> getActiveSessions() {
        return activeSessions.values();
    }
}
