package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.config.ArenaProperties;
import com.projectgroup5.arenasync.dto.ProjectileFiredMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * 临时实体管理：近战判定框 + 子弹
 *
 * 每帧 tick：
 * 1) 判定框 vs 远端玩家（经 HitRegistry 去重）
 * 2) 子弹移动，然后分别检查 地图块 / 本地玩家 / 存活时间
 */
public class EphemeralEntityManager {
    private static final Logger logger = LoggerFactory.getLogger(EphemeralEntityManager.class);

    public static final String MELEE_SOURCE = "melee_attack";

    private final ArenaProperties props;
    private final ArenaPhysics physics;
    private final HitRegistry hitRegistry;
    private final DelayedActionQueue delayedActions;
    private final ParticipantRegistry registry;
    private final WorldBootstrapGuard world;
    private final Supplier<Participant> localParticipant;
    private final HitListener hitListener;

    private final Map<String, ProjectileEntity> projectiles = new LinkedHashMap<>();
    private AttackEvent activeAttack;
    private long lastTick = -1;

    public EphemeralEntityManager(ArenaProperties props,
                                  ArenaPhysics physics,
                                  HitRegistry hitRegistry,
                                  DelayedActionQueue delayedActions,
                                  ParticipantRegistry registry,
                                  WorldBootstrapGuard world,
                                  Supplier<Participant> localParticipant,
                                  HitListener hitListener) {
        this.props = props;
        this.physics = physics;
        this.hitRegistry = hitRegistry;
        this.delayedActions = delayedActions;
        this.registry = registry;
        this.world = world;
        this.localParticipant = localParticipant;
        this.hitListener = hitListener;
    }

    /**
     * 在攻击者前方生成判定框，同一时间只有一个；
     * 到期只删除这一次攻击自己的判定框
     */
    public AttackEvent spawnAttack(int direction, long now) {
        Participant owner = localParticipant.get();
        if (owner == null) {
            throw new IllegalStateException("No local participant to attack with");
        }
        int sign = direction < 0 ? -1 : 1;

        if (activeAttack != null) {
            destroyAttack(activeAttack);
        }

        double hitboxX = owner.x + sign * (props.getParticipantWidth() / 2 + props.getHitboxWidth() / 2);
        Bounds hitbox = Bounds.centered(hitboxX, owner.y, props.getHitboxWidth(), props.getHitboxHeight());

        AttackEvent attack = new AttackEvent("attack_" + owner.id + "_" + now,
                owner.id, owner.x, owner.y, sign, hitbox, now);
        activeAttack = attack;
        hitRegistry.open(attack.id);

        delayedActions.schedule(now + props.getHitboxDurationMs(), () -> {
            if (activeAttack == attack) {
                destroyAttack(attack);
            }
        });
        return attack;
    }

    private void destroyAttack(AttackEvent attack) {
        hitRegistry.discard(attack.id);
        if (activeAttack == attack) {
            activeAttack = null;
        }
    }

    public ProjectileEntity spawnProjectile(ProjectileFiredMessage message, long now) {
        ProjectileEntity projectile = ProjectileEntity.aimed(
                message.getId(), message.getOwnerId(),
                message.getX(), message.getY(), message.getTargetX(), message.getTargetY(),
                props.getProjectileSpeed(), now);
        projectiles.put(projectile.id, projectile);
        logger.debug("Projectile {} spawned by {}", projectile.id, projectile.ownerId);
        return projectile;
    }

    public void tick(long now) {
        checkMeleeHits();
        updateProjectiles(now);
        lastTick = now;
    }

    private void checkMeleeHits() {
        AttackEvent attack = activeAttack;
        if (attack == null) return;

        for (Participant target : registry.all()) {
            // 上一次命中的回调可能已经结束了这次攻击
            if (activeAttack != attack) return;
            // 快照回调可能在两次检查之间删掉/重建了这个玩家
            Optional<Participant> current = registry.get(target.id);
            if (current.isEmpty()) continue;

            Bounds targetBounds = current.get().bounds(props.getParticipantWidth(), props.getParticipantHeight());
            if (physics.overlaps(attack.hitbox, targetBounds)
                    && hitRegistry.canHit(attack.id, target.id)) {
                logger.debug("Hitbox collision detected with player: {}", target.id);
                hitListener.onHit(target.id, attack.ownerId, MELEE_SOURCE);
            }
        }
    }

    private void updateProjectiles(long now) {
        long sinceLastTick = lastTick < 0 ? 0 : now - lastTick;
        Participant local = localParticipant.get();

        for (ProjectileEntity projectile : new ArrayList<>(projectiles.values())) {
            if (!projectiles.containsKey(projectile.id)) continue;

            // 两帧之间才生成的子弹只移动它自己存活的时间
            long elapsed = Math.max(0, Math.min(sinceLastTick, projectile.ageAt(now)));
            physics.integrate(projectile, elapsed / 1000.0);
            Bounds bounds = projectile.bounds(props.getProjectileSize());

            // 三项检查每帧各做一次
            boolean hitWorld = hitsGeometry(bounds);
            boolean hitLocal = local != null
                    && !local.id.equals(projectile.ownerId)
                    && physics.overlaps(bounds, local.bounds(props.getParticipantWidth(), props.getParticipantHeight()));
            boolean expired = projectile.ageAt(now) >= props.getProjectileTtlMs();

            if (hitWorld || hitLocal || expired) {
                projectiles.remove(projectile.id);
                logger.debug("Projectile {} removed (world={}, local={}, expired={})",
                        projectile.id, hitWorld, hitLocal, expired);
            }
            if (hitLocal) {
                hitListener.onHit(local.id, projectile.ownerId, projectile.id);
            }
        }
    }

    private boolean hitsGeometry(Bounds bounds) {
        double size = props.getObstacleSize();
        for (ObstacleEntity obstacle : world.geometry()) {
            if (physics.overlaps(bounds, obstacle.bounds(size))) {
                return true;
            }
        }
        return false;
    }

    public Optional<AttackEvent> activeAttack() {
        return Optional.ofNullable(activeAttack);
    }

    public Optional<ProjectileEntity> projectile(String id) {
        return Optional.ofNullable(projectiles.get(id));
    }

    public Collection<ProjectileEntity> projectiles() {
        return Collections.unmodifiableCollection(projectiles.values());
    }

    public int projectileCount() {
        return projectiles.size();
    }

    public void clear() {
        if (activeAttack != null) {
            destroyAttack(activeAttack);
        }
        projectiles.clear();
        lastTick = -1;
    }
}
