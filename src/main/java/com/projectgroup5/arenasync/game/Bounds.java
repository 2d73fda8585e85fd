package com.projectgroup5.arenasync.game;

/**
 * 以中心点表示的轴对齐矩形
 */
public final class Bounds {
    public final double centerX;
    public final double centerY;
    public final double width;
    public final double height;

    private Bounds(double centerX, double centerY, double width, double height) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.width = width;
        this.height = height;
    }

    public static Bounds centered(double centerX, double centerY, double width, double height) {
        return new Bounds(centerX, centerY, width, height);
    }

    public double left() { return centerX - width / 2; }
    public double right() { return centerX + width / 2; }
    public double top() { return centerY - height / 2; }
    public double bottom() { return centerY + height / 2; }

    public boolean overlaps(Bounds other) {
        return left() < other.right() && right() > other.left()
                && top() < other.bottom() && bottom() > other.top();
    }

    @Override
    public String toString() {
        return "Bounds[" + centerX + "," + centerY + " " + width + "x" + height + "]";
    }
}
