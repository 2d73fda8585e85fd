package com.projectgroup5.arenasync.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认物理实现 - 没有接渲染层时使用（无头客户端 / 测试）
 * 矩形重叠 + 匀速积分，记录玩家显示位置和碰撞注册
 */
public class PhysicsEngine implements ArenaPhysics {
    private static final Logger logger = LoggerFactory.getLogger(PhysicsEngine.class);

    private final Map<String, double[]> bodies = new ConcurrentHashMap<>();
    private final Set<String> worldColliders = ConcurrentHashMap.newKeySet();

    @Override
    public boolean overlaps(Bounds a, Bounds b) {
        return a.overlaps(b);
    }

    @Override
    public void integrate(ProjectileEntity projectile, double deltaSeconds) {
        projectile.x += projectile.velocityX * deltaSeconds;
        projectile.y += projectile.velocityY * deltaSeconds;
    }

    @Override
    public void moveTo(String participantId, double x, double y) {
        bodies.put(participantId, new double[]{x, y});
    }

    @Override
    public void addWorldCollider(String participantId) {
        if (worldColliders.add(participantId)) {
            logger.debug("World collider registered for {}", participantId);
        }
    }

    @Override
    public void removeWorldCollider(String participantId) {
        worldColliders.remove(participantId);
        bodies.remove(participantId);
    }

    public boolean hasWorldCollider(String participantId) {
        return worldColliders.contains(participantId);
    }

    public Optional<double[]> positionOf(String participantId) {
        return Optional.ofNullable(bodies.get(participantId));
    }
}
