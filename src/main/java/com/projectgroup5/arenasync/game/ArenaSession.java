package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.config.ArenaProperties;
import com.projectgroup5.arenasync.dto.PlayerAttackRequest;
import com.projectgroup5.arenasync.dto.PowerupDto;
import com.projectgroup5.arenasync.dto.ProjectileFiredMessage;
import com.projectgroup5.arenasync.dto.RoomStateDto;
import com.projectgroup5.arenasync.dto.RosterEntryDto;
import com.projectgroup5.arenasync.service.SessionServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.LongSupplier;

/**
 * 一局游戏的客户端状态（每次加入房间新建一个）
 *
 * 帧循环和服务器回调都通过这里的 synchronized 方法进入，
 * 保证回调执行完之前不会和 tick 交错。
 */
public class ArenaSession {
    private static final Logger logger = LoggerFactory.getLogger(ArenaSession.class);

    public static final String PLAYER_ATTACK = "playerAttack";
    public static final String FIRE_PROJECTILE = "fireProjectile";

    private final String roomId;
    private final String localId;
    private final String playerName;
    private final ArenaProperties props;
    private final SessionServer server;
    private final ArenaPhysics physics;
    private final LongSupplier clock;
    private final Random random;

    private final ColorAllocator colorAllocator = new ColorAllocator();
    private final HealthOverlay overlay = new HealthOverlay();
    private final HitRegistry hitRegistry = new HitRegistry();
    private final DelayedActionQueue delayedActions = new DelayedActionQueue();
    private final ParticipantRegistry registry;
    private final WorldBootstrapGuard world;
    private final EphemeralEntityManager entities;
    private final CombatResolver combat;
    private final PowerupManager powerups;
    private final OutboundSyncScheduler sync;

    private Participant local;          // attachWorld 之后才有
    private boolean worldReady = false;
    private boolean attackCooldown = false;
    private boolean closed = false;
    private long projectileSeq = 0;

    public ArenaSession(String roomId,
                        String playerName,
                        SessionServer server,
                        ArenaProperties props,
                        ArenaPhysics physics,
                        LongSupplier clock,
                        Random random) {
        String account = server.account();
        if (account == null || account.isEmpty()) {
            throw new IllegalStateException("Session server has no account yet");
        }
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.localId = account;
        this.playerName = playerName;
        this.props = props;
        this.server = server;
        this.physics = physics;
        this.clock = clock;
        this.random = random;

        this.registry = new ParticipantRegistry(localId, props.getMaxHealth(),
                colorAllocator, overlay, physics, this::isGeometryBootstrapped);
        this.world = new WorldBootstrapGuard(physics, props.getWorldSize(), props.getBorderStep(),
                () -> worldReady, this::knownParticipantIds);
        this.combat = new CombatResolver(props, physics, server, registry, overlay, () -> local, random);
        this.entities = new EphemeralEntityManager(props, physics, hitRegistry, delayedActions,
                registry, world, () -> local, combat);
        this.powerups = new PowerupManager(props, physics, server);
        this.sync = new OutboundSyncScheduler(server, () -> local, props.getPositionPushIntervalMs());
    }

    // ==================== 生命周期 ====================

    /** 渲染 / 物理资源就绪，在随机位置生成本地玩家 */
    public synchronized Participant attachWorld(long now) {
        int margin = props.getSpawnMargin();
        int range = Math.max(0, props.getWorldSize() - 2 * margin);
        return attachWorld(margin + random.nextInt(range + 1), margin + random.nextInt(range + 1), now);
    }

    public synchronized Participant attachWorld(double x, double y, long now) {
        if (closed) {
            throw new IllegalStateException("Session " + roomId + " is closed");
        }
        if (local != null) {
            logger.warn("World already attached for room {}", roomId);
            return local;
        }
        local = new Participant(localId, playerName, x, y, props.getMaxHealth(), 0);
        physics.moveTo(localId, x, y);
        worldReady = true;
        logger.info("Local player {} spawned at ({}, {}) in room {}", localId, x, y, roomId);

        // 进场先发一次完整状态
        sync.pushNow(now);
        return local;
    }

    /** 离开房间：丢弃所有未执行的延迟动作 */
    public synchronized void close() {
        if (closed) return;
        closed = true;
        delayedActions.clear();
        entities.clear();
        powerups.clear();
        registry.clear();
        overlay.clearAll();
        hitRegistry.clear();
        colorAllocator.clear();
        logger.info("Session for room {} closed", roomId);
    }

    // ==================== 帧循环 ====================

    public synchronized void tick(long now) {
        if (closed) return;

        delayedActions.drain(now);
        entities.tick(now);
        powerups.collect(local, now);
        sync.maybePush(now);
    }

    // ==================== 本地输入 ====================

    public synchronized void updateLocalState(double x, double y, double angle, int facing) {
        if (local == null) {
            logger.warn("Local state update before world is attached, ignored");
            return;
        }
        local.x = x;
        local.y = y;
        local.angle = angle;
        local.facing = facing < 0 ? -1 : 1;
        physics.moveTo(localId, x, y);
    }

    /**
     * 近战攻击，冷却期间忽略
     */
    public synchronized Optional<AttackEvent> attack(long now) {
        if (closed || local == null) {
            logger.warn("Attack before world is attached, ignored");
            return Optional.empty();
        }
        if (attackCooldown) {
            return Optional.empty();
        }
        attackCooldown = true;

        AttackEvent attack = entities.spawnAttack(local.facing, now);
        server.call(PLAYER_ATTACK, List.of(new PlayerAttackRequest(
                attack.id, local.x, local.y, attack.direction, localId, playerName)));

        delayedActions.schedule(now + props.getAttackCooldownMs(), () -> attackCooldown = false);
        return Optional.of(attack);
    }

    /**
     * 本地开火：立即创建子弹，服务器回传的同一颗子弹会被忽略
     */
    public synchronized Optional<ProjectileEntity> fireProjectile(double targetX, double targetY, long now) {
        if (closed || local == null) {
            logger.warn("Fire before world is attached, ignored");
            return Optional.empty();
        }
        ProjectileFiredMessage message = new ProjectileFiredMessage(local.x, local.y, targetX, targetY,
                "projectile_" + localId + "_" + now + "_" + (projectileSeq++), localId);
        ProjectileEntity projectile = entities.spawnProjectile(message, now);
        server.call(FIRE_PROJECTILE, List.of(message));
        return Optional.of(projectile);
    }

    // ==================== 服务器回调 ====================

    public synchronized void onRosterSnapshot(List<RosterEntryDto> snapshot) {
        if (closed) return;
        registry.applyRosterSnapshot(snapshot);
    }

    public synchronized void onProjectileFired(ProjectileFiredMessage message) {
        if (closed || !worldReady) {
            logger.warn("Scene not active or physics not initialized when handling projectile");
            return;
        }
        if (message == null || !message.isComplete()) {
            logger.warn("Skipping malformed projectileFired message");
            return;
        }
        // 自己的子弹开火时已经创建过
        if (localId.equals(message.getOwnerId())) return;

        entities.spawnProjectile(message, clock.getAsLong());
    }

    public synchronized void onPowerupSpawned(PowerupDto powerup) {
        if (closed || !worldReady) {
            logger.warn("Scene not active or assets not loaded when handling powerup");
            return;
        }
        powerups.spawn(powerup);
    }

    /**
     * 房间状态：订阅推送和一次性的状态消息都走这里
     */
    public synchronized void onRoomState(RoomStateDto state) {
        if (closed || state == null) return;

        if (state.getPowerups() != null) {
            if (worldReady) {
                powerups.sync(state.getPowerups());
            } else {
                logger.warn("Powerup state before world is attached, ignored");
            }
        }
        if (state.getObstacles() != null && !world.isBootstrapped()) {
            world.tryBootstrap(state.getObstacles());
        }
    }

    // ==================== 查询 ====================

    private boolean isGeometryBootstrapped() {
        return world.isBootstrapped();
    }

    private Collection<String> knownParticipantIds() {
        List<String> ids = new ArrayList<>();
        if (local != null) {
            ids.add(localId);
        }
        ids.addAll(registry.ids());
        return ids;
    }

    public String getRoomId() { return roomId; }

    public String getLocalId() { return localId; }

    public synchronized Optional<Participant> getLocal() { return Optional.ofNullable(local); }

    public synchronized boolean isWorldReady() { return worldReady; }

    public synchronized boolean isAttackOnCooldown() { return attackCooldown; }

    public synchronized boolean isClosed() { return closed; }

    public ParticipantRegistry getRegistry() { return registry; }

    public HealthOverlay getOverlay() { return overlay; }

    public ColorAllocator getColorAllocator() { return colorAllocator; }

    public HitRegistry getHitRegistry() { return hitRegistry; }

    public DelayedActionQueue getDelayedActions() { return delayedActions; }

    public WorldBootstrapGuard getWorld() { return world; }

    public EphemeralEntityManager getEntities() { return entities; }

    public PowerupManager getPowerups() { return powerups; }

    public OutboundSyncScheduler getSync() { return sync; }
}
