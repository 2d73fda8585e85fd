package com.projectgroup5.arenasync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 客户端引擎配置（application.yml 中 arena.*）
 * 默认值与原版场景常量保持一致
 */
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    // 连接
    private String serverUrl = "ws://localhost:8080/ws/arena";
    private String roomId = "lobby";
    private String playerName = "Knight";
    private boolean autoConnect = false;

    // 帧循环 / 同步
    private long tickIntervalMs = 16;
    private long positionPushIntervalMs = 50;

    // 近战
    private long attackCooldownMs = 500;
    private long hitboxDurationMs = 300;
    private double hitboxWidth = 80;
    private double hitboxHeight = 60;

    // 玩家碰撞体
    private double participantWidth = 32;
    private double participantHeight = 48;

    // 子弹
    private long projectileTtlMs = 2000;
    private double projectileSpeed = 500;
    private double projectileSize = 8;

    // 战斗
    private int damage = 10;
    private int maxHealth = 100;

    // 地图
    private int worldSize = 2000;
    private int borderStep = 50;
    private double obstacleSize = 32;
    private int spawnMargin = 100;

    // 道具
    private double powerupSize = 24;
    private int healAmount = 25;
    private long speedBoostMs = 5000;

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }

    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }

    public boolean isAutoConnect() { return autoConnect; }
    public void setAutoConnect(boolean autoConnect) { this.autoConnect = autoConnect; }

    public long getTickIntervalMs() { return tickIntervalMs; }
    public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }

    public long getPositionPushIntervalMs() { return positionPushIntervalMs; }
    public void setPositionPushIntervalMs(long positionPushIntervalMs) { this.positionPushIntervalMs = positionPushIntervalMs; }

    public long getAttackCooldownMs() { return attackCooldownMs; }
    public void setAttackCooldownMs(long attackCooldownMs) { this.attackCooldownMs = attackCooldownMs; }

    public long getHitboxDurationMs() { return hitboxDurationMs; }
    public void setHitboxDurationMs(long hitboxDurationMs) { this.hitboxDurationMs = hitboxDurationMs; }

    public double getHitboxWidth() { return hitboxWidth; }
    public void setHitboxWidth(double hitboxWidth) { this.hitboxWidth = hitboxWidth; }

    public double getHitboxHeight() { return hitboxHeight; }
    public void setHitboxHeight(double hitboxHeight) { this.hitboxHeight = hitboxHeight; }

    public double getParticipantWidth() { return participantWidth; }
    public void setParticipantWidth(double participantWidth) { this.participantWidth = participantWidth; }

    public double getParticipantHeight() { return participantHeight; }
    public void setParticipantHeight(double participantHeight) { this.participantHeight = participantHeight; }

    public long getProjectileTtlMs() { return projectileTtlMs; }
    public void setProjectileTtlMs(long projectileTtlMs) { this.projectileTtlMs = projectileTtlMs; }

    public double getProjectileSpeed() { return projectileSpeed; }
    public void setProjectileSpeed(double projectileSpeed) { this.projectileSpeed = projectileSpeed; }

    public double getProjectileSize() { return projectileSize; }
    public void setProjectileSize(double projectileSize) { this.projectileSize = projectileSize; }

    public int getDamage() { return damage; }
    public void setDamage(int damage) { this.damage = damage; }

    public int getMaxHealth() { return maxHealth; }
    public void setMaxHealth(int maxHealth) { this.maxHealth = maxHealth; }

    public int getWorldSize() { return worldSize; }
    public void setWorldSize(int worldSize) { this.worldSize = worldSize; }

    public int getBorderStep() { return borderStep; }
    public void setBorderStep(int borderStep) { this.borderStep = borderStep; }

    public double getObstacleSize() { return obstacleSize; }
    public void setObstacleSize(double obstacleSize) { this.obstacleSize = obstacleSize; }

    public int getSpawnMargin() { return spawnMargin; }
    public void setSpawnMargin(int spawnMargin) { this.spawnMargin = spawnMargin; }

    public double getPowerupSize() { return powerupSize; }
    public void setPowerupSize(double powerupSize) { this.powerupSize = powerupSize; }

    public int getHealAmount() { return healAmount; }
    public void setHealAmount(int healAmount) { this.healAmount = healAmount; }

    public long getSpeedBoostMs() { return speedBoostMs; }
    public void setSpeedBoostMs(long speedBoostMs) { this.speedBoostMs = speedBoostMs; }
}
