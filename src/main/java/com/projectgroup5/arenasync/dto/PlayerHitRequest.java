package com.projectgroup5.arenasync.dto;

public class PlayerHitRequest {
    private String targetId;
    private String attackerId;
    private String projectileId;   // 近战为 "melee_attack"
    private int damage;

    public PlayerHitRequest() {
    }

    public PlayerHitRequest(String targetId, String attackerId, String projectileId, int damage) {
        this.targetId = targetId;
        this.attackerId = attackerId;
        this.projectileId = projectileId;
        this.damage = damage;
    }

    public String getTargetId() { return targetId; }
    public void setTargetId(String targetId) { this.targetId = targetId; }

    public String getAttackerId() { return attackerId; }
    public void setAttackerId(String attackerId) { this.attackerId = attackerId; }

    public String getProjectileId() { return projectileId; }
    public void setProjectileId(String projectileId) { this.projectileId = projectileId; }

    public int getDamage() { return damage; }
    public void setDamage(int damage) { this.damage = damage; }
}
