package com.projectgroup5.arenasync.game;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 本地伤害覆盖层
 *
 * 一旦本地对某个玩家造成过伤害，之后服务器快照里的血量都被本地值覆盖，
 * 直到该玩家离开房间。避免网络延迟导致血条回跳；
 * 代价是服务器侧的回血或第三方伤害不会再显示出来（已知分歧，保留）。
 */
public class HealthOverlay {

    private final Map<String, Integer> localHealth = new HashMap<>();

    public void recordLocalDamage(String participantId, int newHealth) {
        localHealth.put(participantId, newHealth);
    }

    public int resolve(String participantId, int snapshotHealth) {
        Integer local = localHealth.get(participantId);
        return local != null ? local : snapshotHealth;
    }

    public Optional<Integer> get(String participantId) {
        return Optional.ofNullable(localHealth.get(participantId));
    }

    public boolean contains(String participantId) {
        return localHealth.containsKey(participantId);
    }

    /** 只在玩家离开房间时调用 */
    public void clear(String participantId) {
        localHealth.remove(participantId);
    }

    public void clearAll() {
        localHealth.clear();
    }

    public int size() {
        return localHealth.size();
    }
}
