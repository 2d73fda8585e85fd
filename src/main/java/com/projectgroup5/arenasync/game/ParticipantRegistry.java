package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.dto.RosterEntryDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BooleanSupplier;

/**
 * 远端玩家表 - 根据服务器快照做增删改
 * 本地玩家不在这里（localId 永远不会进入这张表）
 */
public class ParticipantRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ParticipantRegistry.class);

    private final String localId;
    private final int defaultHealth;
    private final ColorAllocator colorAllocator;
    private final HealthOverlay overlay;
    private final ArenaPhysics physics;
    private final BooleanSupplier geometryReady;

    // id -> 远端玩家，保持加入顺序
    private final Map<String, Participant> remotes = new LinkedHashMap<>();

    public ParticipantRegistry(String localId,
                               int defaultHealth,
                               ColorAllocator colorAllocator,
                               HealthOverlay overlay,
                               ArenaPhysics physics,
                               BooleanSupplier geometryReady) {
        this.localId = Objects.requireNonNull(localId, "localId");
        this.defaultHealth = defaultHealth;
        this.colorAllocator = colorAllocator;
        this.overlay = overlay;
        this.physics = physics;
        this.geometryReady = geometryReady;
    }

    /**
     * 应用一次服务器快照：
     * 1) 新 id 创建玩家并分配颜色
     * 2) 已知 id 直接覆盖位置，血量经过覆盖层
     * 3) 快照中没有的玩家删除，释放颜色和覆盖层记录
     */
    public void applyRosterSnapshot(List<RosterEntryDto> snapshot) {
        if (snapshot == null) return;

        Set<String> snapshotIds = new HashSet<>();

        for (RosterEntryDto entry : snapshot) {
            if (entry == null || entry.getAccount() == null) {
                logger.warn("Skipping roster entry without account");
                continue;
            }
            String id = entry.getAccount();
            snapshotIds.add(id);

            // 自己的状态本地维护
            if (id.equals(localId)) continue;

            if (entry.getX() == null || entry.getY() == null) {
                logger.warn("Skipping roster entry for {} without position", id);
                continue;
            }

            int snapshotHealth = entry.getHealth() != null ? entry.getHealth() : defaultHealth;
            Participant existing = remotes.get(id);
            if (existing != null) {
                existing.x = entry.getX();
                existing.y = entry.getY();
                physics.moveTo(id, existing.x, existing.y);
                existing.setHealth(overlay.resolve(id, snapshotHealth));
            } else {
                addRemote(entry, snapshotHealth);
            }
        }

        // 离开房间的玩家
        for (String id : new ArrayList<>(remotes.keySet())) {
            if (!snapshotIds.contains(id)) {
                removeRemote(id);
            }
        }
    }

    private void addRemote(RosterEntryDto entry, int snapshotHealth) {
        String id = entry.getAccount();
        int colorIndex = colorAllocator.allocate(id);
        String name = entry.getName() != null ? entry.getName() : "Unknown";

        Participant participant = new Participant(id, name, entry.getX(), entry.getY(),
                overlay.resolve(id, snapshotHealth), colorIndex);
        remotes.put(id, participant);
        physics.moveTo(id, participant.x, participant.y);

        if (geometryReady.getAsBoolean()) {
            physics.addWorldCollider(id);
        }
        logger.info("Participant {} ({}) joined, color={}", id, name, colorIndex);
    }

    private void removeRemote(String id) {
        Participant removed = remotes.remove(id);
        if (removed == null) return;

        colorAllocator.release(ColorAllocator.releaseIndexFor(id));
        overlay.clear(id);
        physics.removeWorldCollider(id);
        logger.info("Participant {} left", id);
    }

    public Optional<Participant> get(String id) {
        return Optional.ofNullable(remotes.get(id));
    }

    public boolean contains(String id) {
        return remotes.containsKey(id);
    }

    /** 当前远端玩家的拷贝，遍历期间表被修改也安全 */
    public List<Participant> all() {
        return new ArrayList<>(remotes.values());
    }

    public Set<String> ids() {
        return new LinkedHashSet<>(remotes.keySet());
    }

    public int size() {
        return remotes.size();
    }

    public void clear() {
        remotes.clear();
    }
}
