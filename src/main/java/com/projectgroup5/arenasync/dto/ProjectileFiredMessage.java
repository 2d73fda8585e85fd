package com.projectgroup5.arenasync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * projectileFired 事件；本地开火时也用同样的结构发给服务器
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectileFiredMessage {
    private Double x;
    private Double y;
    private Double targetX;
    private Double targetY;
    private String id;
    private String ownerId;

    public ProjectileFiredMessage() {
    }

    public ProjectileFiredMessage(Double x, Double y, Double targetX, Double targetY, String id, String ownerId) {
        this.x = x;
        this.y = y;
        this.targetX = targetX;
        this.targetY = targetY;
        this.id = id;
        this.ownerId = ownerId;
    }

    public boolean isComplete() {
        return x != null && y != null && targetX != null && targetY != null
                && id != null && ownerId != null;
    }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }

    public Double getTargetX() { return targetX; }
    public void setTargetX(Double targetX) { this.targetX = targetX; }

    public Double getTargetY() { return targetY; }
    public void setTargetY(Double targetY) { this.targetY = targetY; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
}
