package com.projectgroup5.arenasync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 服务器推送的玩家快照中的一项
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RosterEntryDto {
    private String account;
    private Double x;
    private Double y;
    private String name;
    private Integer health;

    public RosterEntryDto() {
    }

    public RosterEntryDto(String account, Double x, Double y, String name, Integer health) {
        this.account = account;
        this.x = x;
        this.y = y;
        this.name = name;
        this.health = health;
    }

    public String getAccount() { return account; }
    public void setAccount(String account) { this.account = account; }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Integer getHealth() { return health; }
    public void setHealth(Integer health) { this.health = health; }
}
