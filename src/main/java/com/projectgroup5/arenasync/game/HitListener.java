package com.projectgroup5.arenasync.game;

@FunctionalInterface
public interface HitListener {

    /**
     * @param sourceId 子弹 id，近战为 {@link EphemeralEntityManager#MELEE_SOURCE}
     */
    void onHit(String targetId, String attackerId, String sourceId);
}
