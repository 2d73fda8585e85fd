package com.projectgroup5.arenasync.game;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 每次攻击的命中去重：同一次攻击对同一目标只结算一次
 */
public class HitRegistry {

    // attackId -> 已命中的目标
    private final Map<String, Set<String>> hitsByAttack = new HashMap<>();

    /** 新攻击开始，命中集合总是新建，不与之前的攻击共享 */
    public void open(String attackId) {
        hitsByAttack.put(attackId, new HashSet<>());
    }

    /**
     * 目标还没被这次攻击命中时返回 true 并记下；攻击已结束或未知时返回 false
     */
    public boolean canHit(String attackId, String targetId) {
        Set<String> hits = hitsByAttack.get(attackId);
        if (hits == null) {
            return false;
        }
        return hits.add(targetId);
    }

    public void discard(String attackId) {
        hitsByAttack.remove(attackId);
    }

    public boolean isOpen(String attackId) {
        return hitsByAttack.containsKey(attackId);
    }

    public Set<String> hitsOf(String attackId) {
        Set<String> hits = hitsByAttack.get(attackId);
        return hits == null ? Set.of() : Set.copyOf(hits);
    }

    public void clear() {
        hitsByAttack.clear();
    }
}
