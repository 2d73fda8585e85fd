package com.projectgroup5.arenasync.game;

/**
 * 物理/渲染层提供的基础能力，引擎把它当黑盒使用
 */
public interface ArenaPhysics {

    /** A 与 B 是否重叠 */
    boolean overlaps(Bounds a, Bounds b);

    /** 按速度推进子弹位置 */
    void integrate(ProjectileEntity projectile, double deltaSeconds);

    /** 把玩家的显示体移动到 (x, y) */
    void moveTo(String participantId, double x, double y);

    /** 注册玩家与地图块之间的碰撞 */
    void addWorldCollider(String participantId);

    void removeWorldCollider(String participantId);
}
