package com.projectgroup5.arenasync.game;

public class ProjectileEntity {
    public final String id;
    public final String ownerId;
    public final long createdAt;
    public double x, y;
    public final double velocityX, velocityY;

    public ProjectileEntity(String id, String ownerId, double x, double y,
                            double velocityX, double velocityY, long createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.x = x;
        this.y = y;
        this.velocityX = velocityX;
        this.velocityY = velocityY;
        this.createdAt = createdAt;
    }

    /**
     * 按发射点到目标点的角度算出速度（只在创建时计算一次）
     */
    public static ProjectileEntity aimed(String id, String ownerId,
                                         double x, double y, double targetX, double targetY,
                                         double speed, long createdAt) {
        double angle = Math.atan2(targetY - y, targetX - x);
        return new ProjectileEntity(id, ownerId, x, y,
                Math.cos(angle) * speed, Math.sin(angle) * speed, createdAt);
    }

    public long ageAt(long now) {
        return now - createdAt;
    }

    public Bounds bounds(double size) {
        return Bounds.centered(x, y, size, size);
    }
}
