package com.projectgroup5.arenasync.game;

/**
 * 静态地图块：边界或服务器下发的障碍物
 */
public class ObstacleEntity {
    public final double x, y;
    public final boolean border;

    public ObstacleEntity(double x, double y, boolean border) {
        this.x = x;
        this.y = y;
        this.border = border;
    }

    public Bounds bounds(double size) {
        return Bounds.centered(x, y, size, size);
    }
}
