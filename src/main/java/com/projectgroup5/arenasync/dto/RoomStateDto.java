package com.projectgroup5.arenasync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomStateDto {
    private List<ObstacleDto> obstacles;   // 可能为空：服务器还没生成地图
    private List<PowerupDto> powerups;

    public RoomStateDto() {
    }

    public RoomStateDto(List<ObstacleDto> obstacles, List<PowerupDto> powerups) {
        this.obstacles = obstacles;
        this.powerups = powerups;
    }

    public List<ObstacleDto> getObstacles() { return obstacles; }
    public void setObstacles(List<ObstacleDto> obstacles) { this.obstacles = obstacles; }

    public List<PowerupDto> getPowerups() { return powerups; }
    public void setPowerups(List<PowerupDto> powerups) { this.powerups = powerups; }
}
