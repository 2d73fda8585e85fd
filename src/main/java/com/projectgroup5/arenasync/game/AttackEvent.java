package com.projectgroup5.arenasync.game;

/**
 * 一次近战攻击；命中集合由 HitRegistry 按 id 维护
 */
public class AttackEvent {
    public final String id;
    public final String ownerId;
    public final double originX, originY;
    public final int direction;
    public final Bounds hitbox;
    public final long createdAt;

    public AttackEvent(String id, String ownerId, double originX, double originY,
                       int direction, Bounds hitbox, long createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.originX = originX;
        this.originY = originY;
        this.direction = direction;
        this.hitbox = hitbox;
        this.createdAt = createdAt;
    }
}
