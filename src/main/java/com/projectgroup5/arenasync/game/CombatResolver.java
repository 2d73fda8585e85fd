package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.config.ArenaProperties;
import com.projectgroup5.arenasync.dto.PlayerDiedRequest;
import com.projectgroup5.arenasync.dto.PlayerHitRequest;
import com.projectgroup5.arenasync.service.SessionServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * 命中结算：本地先扣血，再通知服务器
 * - 本地玩家被打：扣血，死亡则原地复活并上报 playerDied
 * - 远端玩家被打：扣血并写入覆盖层
 */
public class CombatResolver implements HitListener {
    private static final Logger logger = LoggerFactory.getLogger(CombatResolver.class);

    public static final String PLAYER_HIT = "playerHit";
    public static final String PLAYER_DIED = "playerDied";

    private final ArenaProperties props;
    private final ArenaPhysics physics;
    private final SessionServer server;
    private final ParticipantRegistry registry;
    private final HealthOverlay overlay;
    private final Supplier<Participant> localParticipant;
    private final Random random;

    public CombatResolver(ArenaProperties props,
                          ArenaPhysics physics,
                          SessionServer server,
                          ParticipantRegistry registry,
                          HealthOverlay overlay,
                          Supplier<Participant> localParticipant,
                          Random random) {
        this.props = props;
        this.physics = physics;
        this.server = server;
        this.registry = registry;
        this.overlay = overlay;
        this.localParticipant = localParticipant;
        this.random = random;
    }

    @Override
    public void onHit(String targetId, String attackerId, String sourceId) {
        int damage = props.getDamage();
        Participant local = localParticipant.get();

        if (local != null && targetId.equals(local.id)) {
            local.damage(damage);
            logger.debug("Local player hit by {} via {}, health={}", attackerId, sourceId, local.health);
            if (local.health <= 0) {
                handleLocalDeath(local, attackerId);
            }
        } else {
            Optional<Participant> target = registry.get(targetId);
            if (target.isPresent()) {
                Participant remote = target.get();
                remote.damage(damage);
                overlay.recordLocalDamage(targetId, remote.health);
                logger.debug("Player {} hit by {}, health={}", targetId, attackerId, remote.health);
            } else {
                logger.debug("Hit target {} no longer tracked, only notifying server", targetId);
            }
        }

        server.call(PLAYER_HIT, List.of(new PlayerHitRequest(targetId, attackerId, sourceId, damage)));
    }

    private void handleLocalDeath(Participant local, String killerId) {
        int margin = props.getSpawnMargin();
        local.x = randomBetween(margin, props.getWorldSize() - margin);
        local.y = randomBetween(margin, props.getWorldSize() - margin);
        local.setHealth(props.getMaxHealth());
        // 渲染层从 moveTo 取位置
        physics.moveTo(local.id, local.x, local.y);
        logger.info("Local player {} killed by {}, respawned at ({}, {})", local.id, killerId, local.x, local.y);

        server.call(PLAYER_DIED, List.of(new PlayerDiedRequest(local.id, killerId)));
    }

    private int randomBetween(int min, int max) {
        if (max <= min) return min;
        return min + random.nextInt(max - min + 1);
    }
}
