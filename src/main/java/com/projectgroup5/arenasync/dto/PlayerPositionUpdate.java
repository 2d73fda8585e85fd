package com.projectgroup5.arenasync.dto;

/**
 * updatePlayerPosition 的参数（本地玩家状态）
 */
public class PlayerPositionUpdate {
    private double x;
    private double y;
    private double angle;
    private int health;
    private String name;

    public PlayerPositionUpdate() {
    }

    public PlayerPositionUpdate(double x, double y, double angle, int health, String name) {
        this.x = x;
        this.y = y;
        this.angle = angle;
        this.health = health;
        this.name = name;
    }

    public double getX() { return x; }
    public void setX(double x) { this.x = x; }

    public double getY() { return y; }
    public void setY(double y) { this.y = y; }

    public double getAngle() { return angle; }
    public void setAngle(double angle) { this.angle = angle; }

    public int getHealth() { return health; }
    public void setHealth(int health) { this.health = health; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
