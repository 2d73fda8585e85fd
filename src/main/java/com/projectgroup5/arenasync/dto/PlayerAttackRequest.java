package com.projectgroup5.arenasync.dto;

public class PlayerAttackRequest {
    private String id;
    private double x;
    private double y;
    private int direction;      // -1 左 / 1 右
    private String ownerId;
    private String ownerName;

    public PlayerAttackRequest() {
    }

    public PlayerAttackRequest(String id, double x, double y, int direction, String ownerId, String ownerName) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.direction = direction;
        this.ownerId = ownerId;
        this.ownerName = ownerName;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public double getX() { return x; }
    public void setX(double x) { this.x = x; }

    public double getY() { return y; }
    public void setY(double y) { this.y = y; }

    public int getDirection() { return direction; }
    public void setDirection(int direction) { this.direction = direction; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getOwnerName() { return ownerName; }
    public void setOwnerName(String ownerName) { this.ownerName = ownerName; }
}
