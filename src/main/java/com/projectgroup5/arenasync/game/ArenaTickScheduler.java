package com.projectgroup5.arenasync.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 客户端帧循环：按固定间隔驱动所有活跃会话的 tick
 */
@Component
public class ArenaTickScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ArenaTickScheduler.class);

    private final ArenaSessionManager sessionManager;

    public ArenaTickScheduler(ArenaSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Scheduled(fixedRateString = "${arena.tick-interval-ms:16}")
    public void tick() {
        tickAt(System.currentTimeMillis());
    }

    void tickAt(long now) {
        for (ArenaSession session : sessionManager.getActiveSessions()) {
            try {
                session.tick(now);
            } catch (Exception e) {
                // 单个会话出错不影响其它会话
                logger.error("Error ticking session {}", session.getRoomId(), e);
            }
        }
    }
}
