package com.projectgroup5.arenasync.game;

public class PowerupEntity {
    public static final String HEALTH = "health";
    public static final String SPEED = "speed";

    public final String id;
    public final String type;
    public final double x, y;

    public PowerupEntity(String id, String type, double x, double y) {
        this.id = id;
        this.type = type;
        this.x = x;
        this.y = y;
    }

    public Bounds bounds(double size) {
        return Bounds.centered(x, y, size, size);
    }
}
