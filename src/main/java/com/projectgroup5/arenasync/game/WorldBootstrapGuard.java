package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.dto.ObstacleDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 地图只生成一次
 *
 * 障碍物可能来自房间状态订阅，也可能来自房主推送的状态更新，谁先到用谁；
 * 生成后标记永久为 true，本局内不再重置，后到的数据直接忽略。
 */
public class WorldBootstrapGuard {
    private static final Logger logger = LoggerFactory.getLogger(WorldBootstrapGuard.class);

    private final ArenaPhysics physics;
    private final int worldSize;
    private final int borderStep;
    private final BooleanSupplier worldReady;
    private final Supplier<Collection<String>> knownParticipants;

    private List<ObstacleEntity> geometry = Collections.emptyList();
    private boolean bootstrapped = false;

    public WorldBootstrapGuard(ArenaPhysics physics,
                               int worldSize,
                               int borderStep,
                               BooleanSupplier worldReady,
                               Supplier<Collection<String>> knownParticipants) {
        if (borderStep <= 0) {
            throw new IllegalArgumentException("borderStep must be positive: " + borderStep);
        }
        this.physics = physics;
        this.worldSize = worldSize;
        this.borderStep = borderStep;
        this.worldReady = worldReady;
        this.knownParticipants = knownParticipants;
    }

    /**
     * @return 本次调用是否真正生成了地图
     */
    public boolean tryBootstrap(List<ObstacleDto> obstacles) {
        if (bootstrapped) {
            return false;
        }
        if (!worldReady.getAsBoolean()) {
            logger.warn("World not ready, ignoring obstacle data");
            return false;
        }

        // 先在新列表里建好，再整体替换
        List<ObstacleEntity> built = new ArrayList<>(createBorder());
        int fromServer = 0;
        if (obstacles != null) {
            for (ObstacleDto data : obstacles) {
                if (data == null || data.getX() == null || data.getY() == null) {
                    continue;
                }
                built.add(new ObstacleEntity(data.getX(), data.getY(), false));
                fromServer++;
            }
        }

        geometry = built;
        // 先置标记：下面注册碰撞时若有回调重入，也只会是空操作
        bootstrapped = true;

        for (String participantId : new ArrayList<>(knownParticipants.get())) {
            physics.addWorldCollider(participantId);
        }

        logger.info("Obstacles created: border={}, server={}", built.size() - fromServer, fromServer);
        return true;
    }

    /** 四条边按固定步长铺满，与服务器数据无关，所有客户端完全一致 */
    private List<ObstacleEntity> createBorder() {
        List<ObstacleEntity> border = new ArrayList<>();
        for (int i = 0; i < worldSize; i += borderStep) {
            border.add(new ObstacleEntity(i, 0, true));
            border.add(new ObstacleEntity(i, worldSize, true));
            border.add(new ObstacleEntity(0, i, true));
            border.add(new ObstacleEntity(worldSize, i, true));
        }
        return border;
    }

    public boolean isBootstrapped() {
        return bootstrapped;
    }

    public List<ObstacleEntity> geometry() {
        return Collections.unmodifiableList(geometry);
    }

    public int size() {
        return geometry.size();
    }
}
