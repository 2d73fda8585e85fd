package com.projectgroup5.arenasync.game;

/**
 * 房间里的一个玩家（本地玩家或远端玩家）
 */
public class Participant {
    public final String id;
    public final int colorIndex;     // 本地玩家固定为 0
    public String name;
    public double x, y;
    public double angle;
    public int facing = 1;           // -1 朝左 / 1 朝右
    public int health;
    public long speedBoostUntil = 0;

    public Participant(String id, String name, double x, double y, int health, int colorIndex) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("participant id must not be empty");
        }
        this.id = id;
        this.name = name;
        this.x = x;
        this.y = y;
        this.health = Math.max(0, health);
        this.colorIndex = colorIndex;
    }

    public void setHealth(int health) {
        this.health = Math.max(0, health);
    }

    public void damage(int amount) {
        setHealth(health - amount);
    }

    public void heal(int amount, int maxHealth) {
        setHealth(Math.min(maxHealth, health + amount));
    }

    public boolean isSpeedBoosted(long now) {
        return now < speedBoostUntil;
    }

    public Bounds bounds(double width, double height) {
        return Bounds.centered(x, y, width, height);
    }
}
