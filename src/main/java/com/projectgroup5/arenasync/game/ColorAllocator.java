package com.projectgroup5.arenasync.game;

import java.util.HashSet;
import java.util.Set;

/**
 * 远端玩家颜色分配，取值 1..8（0 留给本地玩家）
 *
 * 已知问题（保留现有行为，等产品决定）：
 * - 8 个都被占用后按 id 哈希回退，可能和已分配的颜色重复
 * - 离开时用 hash % 8 + 1 反推要释放的颜色，而不是记录实际分配到的值；
 *   通过扫描分配的颜色可能释放错位置，哈希为负时释放的是不存在的值
 */
public class ColorAllocator {
    public static final int MIN_INDEX = 1;
    public static final int MAX_INDEX = 8;

    private final Set<Integer> usedIndices = new HashSet<>();

    public int allocate(String participantId) {
        for (int i = MIN_INDEX; i <= MAX_INDEX; i++) {
            if (!usedIndices.contains(i)) {
                usedIndices.add(i);
                return i;
            }
        }
        // 全部占用：按 id 计算一个固定值，不标记占用
        return Math.abs(hash(participantId) % MAX_INDEX) + 1;
    }

    public void release(int index) {
        usedIndices.remove(index);
    }

    /** 离开时要释放的颜色 */
    public static int releaseIndexFor(String participantId) {
        return hash(participantId) % MAX_INDEX + 1;
    }

    /** 31 多项式滚动哈希，32 位溢出 */
    public static int hash(String value) {
        int hash = 0;
        for (int i = 0; i < value.length(); i++) {
            hash = (hash << 5) - hash + value.charAt(i);
        }
        return hash;
    }

    public boolean isInUse(int index) {
        return usedIndices.contains(index);
    }

    public int inUseCount() {
        return usedIndices.size();
    }

    public void clear() {
        usedIndices.clear();
    }
}
