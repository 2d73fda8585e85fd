package com.projectgroup5.arenasync.game;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * 延迟动作队列：每帧 drain 一次，取代引擎定时器
 * 会话结束时 clear()，未到期的动作直接丢弃、不执行
 */
public class DelayedActionQueue {

    private static final class Entry {
        final long dueAt;
        final long seq;
        final Runnable action;

        Entry(long dueAt, long seq, Runnable action) {
            this.dueAt = dueAt;
            this.seq = seq;
            this.action = action;
        }
    }

    private final PriorityQueue<Entry> entries = new PriorityQueue<>(
            Comparator.comparingLong((Entry e) -> e.dueAt).thenComparingLong(e -> e.seq));
    private long nextSeq = 0;

    public void schedule(long dueAt, Runnable action) {
        entries.add(new Entry(dueAt, nextSeq++, action));
    }

    /**
     * 按到期顺序执行所有 dueAt <= now 的动作（包括执行过程中新排入且已到期的）
     * @return 执行的数量
     */
    public int drain(long now) {
        int ran = 0;
        while (!entries.isEmpty() && entries.peek().dueAt <= now) {
            entries.poll().action.run();
            ran++;
        }
        return ran;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
