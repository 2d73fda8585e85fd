package com.projectgroup5.arenasync.dto;

public class PlayerDiedRequest {
    private String playerId;
    private String killerId;

    public PlayerDiedRequest() {
    }

    public PlayerDiedRequest(String playerId, String killerId) {
        this.playerId = playerId;
        this.killerId = killerId;
    }

    public String getPlayerId() { return playerId; }
    public void setPlayerId(String playerId) { this.playerId = playerId; }

    public String getKillerId() { return killerId; }
    public void setKillerId(String killerId) { this.killerId = killerId; }
}
