package com.projectgroup5.arenasync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 房间状态里的道具，也用作 powerupSpawned 事件的消息体
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PowerupDto {
    private String id;
    private String type;
    private Double x;
    private Double y;

    public PowerupDto() {
    }

    public PowerupDto(String id, String type, Double x, Double y) {
        this.id = id;
        this.type = type;
        this.x = x;
        this.y = y;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }
}
