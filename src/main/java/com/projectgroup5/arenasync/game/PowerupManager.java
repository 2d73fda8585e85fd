package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.config.ArenaProperties;
import com.projectgroup5.arenasync.dto.PowerupDto;
import com.projectgroup5.arenasync.service.SessionServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 场上道具：跟随房间状态整体替换，本地玩家碰到即拾取
 */
public class PowerupManager {
    private static final Logger logger = LoggerFactory.getLogger(PowerupManager.class);

    public static final String COLLECT_POWERUP = "collectPowerup";

    private final ArenaProperties props;
    private final ArenaPhysics physics;
    private final SessionServer server;

    private final Map<String, PowerupEntity> powerups = new LinkedHashMap<>();

    public PowerupManager(ArenaProperties props, ArenaPhysics physics, SessionServer server) {
        this.props = props;
        this.physics = physics;
        this.server = server;
    }

    public boolean spawn(PowerupDto data) {
        if (!isComplete(data)) {
            logger.warn("Skipping malformed powerup {}", data == null ? null : data.getId());
            return false;
        }
        powerups.put(data.getId(), new PowerupEntity(data.getId(), data.getType(), data.getX(), data.getY()));
        return true;
    }

    /** 用服务器的列表替换全部道具 */
    public void sync(List<PowerupDto> data) {
        powerups.clear();
        if (data == null) return;
        for (PowerupDto entry : data) {
            if (isComplete(entry)) {
                powerups.put(entry.getId(), new PowerupEntity(entry.getId(), entry.getType(), entry.getX(), entry.getY()));
            }
        }
    }

    private static boolean isComplete(PowerupDto data) {
        return data != null && data.getId() != null && data.getType() != null
                && data.getX() != null && data.getY() != null;
    }

    /**
     * 检查本地玩家是否碰到道具
     * @return 本帧拾取的道具 id
     */
    public List<String> collect(Participant local, long now) {
        if (local == null || powerups.isEmpty()) return List.of();

        Bounds playerBounds = local.bounds(props.getParticipantWidth(), props.getParticipantHeight());
        List<String> collected = new ArrayList<>();
        for (PowerupEntity powerup : new ArrayList<>(powerups.values())) {
            if (!physics.overlaps(playerBounds, powerup.bounds(props.getPowerupSize()))) continue;

            apply(local, powerup, now);
            powerups.remove(powerup.id);
            collected.add(powerup.id);
            server.call(COLLECT_POWERUP, List.of(powerup.id));
        }
        return collected;
    }

    private void apply(Participant local, PowerupEntity powerup, long now) {
        switch (powerup.type) {
            case PowerupEntity.HEALTH:
                local.heal(props.getHealAmount(), props.getMaxHealth());
                break;
            case PowerupEntity.SPEED:
                local.speedBoostUntil = now + props.getSpeedBoostMs();
                break;
            default:
                logger.debug("Powerup type {} has no local effect", powerup.type);
        }
        logger.info("Collected powerup {} ({})", powerup.id, powerup.type);
    }

    public Optional<PowerupEntity> get(String id) {
        return Optional.ofNullable(powerups.get(id));
    }

    public int size() {
        return powerups.size();
    }

    public void clear() {
        powerups.clear();
    }
}
