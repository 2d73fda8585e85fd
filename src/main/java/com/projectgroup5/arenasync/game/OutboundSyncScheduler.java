package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.dto.PlayerPositionUpdate;
import com.projectgroup5.arenasync.service.CallOptions;
import com.projectgroup5.arenasync.service.SessionServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * 本地玩家状态上报，按模拟时间节流（与帧率无关）
 */
public class OutboundSyncScheduler {
    private static final Logger logger = LoggerFactory.getLogger(OutboundSyncScheduler.class);

    public static final String UPDATE_POSITION = "updatePlayerPosition";

    private final SessionServer server;
    private final Supplier<Participant> localParticipant;
    private final long intervalMs;

    private long lastPush = 0;

    public OutboundSyncScheduler(SessionServer server, Supplier<Participant> localParticipant, long intervalMs) {
        this.server = server;
        this.localParticipant = localParticipant;
        this.intervalMs = intervalMs;
    }

    /** 每帧都可以调用，内部自己节流 */
    public boolean maybePush(long now) {
        if (now - lastPush <= intervalMs) {
            return false;
        }
        return pushNow(now);
    }

    public boolean pushNow(long now) {
        Participant local = localParticipant.get();
        if (local == null) {
            return false;
        }
        PlayerPositionUpdate update = new PlayerPositionUpdate(
                local.x, local.y, local.angle, local.health, local.name);
        server.call(UPDATE_POSITION, List.of(update), CallOptions.throttle(intervalMs));
        lastPush = now;
        logger.trace("Pushed local state at {}", now);
        return true;
    }

    public long getLastPush() {
        return lastPush;
    }
}
