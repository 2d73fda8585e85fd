package com.projectgroup5.arenasync.game;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DelayedActionQueueTest {

    @Test
    void runsOnlyDueActionsInDueOrder() {
        DelayedActionQueue queue = new DelayedActionQueue();
        List<String> ran = new ArrayList<>();
        queue.schedule(500, () -> ran.add("cooldown"));
        queue.schedule(300, () -> ran.add("hitbox"));
        queue.schedule(300, () -> ran.add("hitbox-2"));

        assertThat(queue.drain(299)).isZero();
        assertThat(queue.drain(300)).isEqualTo(2);
        assertThat(ran).containsExactly("hitbox", "hitbox-2");

        queue.drain(1000);
        assertThat(ran).containsExactly("hitbox", "hitbox-2", "cooldown");
        assertThat(queue.size()).isZero();
    }

    @Test
    void actionScheduledWhileDrainingRunsIfAlreadyDue() {
        DelayedActionQueue queue = new DelayedActionQueue();
        List<String> ran = new ArrayList<>();
        queue.schedule(100, () -> {
            ran.add("first");
            queue.schedule(150, () -> ran.add("chained"));
            queue.schedule(900, () -> ran.add("later"));
        });

        queue.drain(200);

        assertThat(ran).containsExactly("first", "chained");
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void clearDiscardsPendingActionsWithoutRunning() {
        DelayedActionQueue queue = new DelayedActionQueue();
        List<String> ran = new ArrayList<>();
        queue.schedule(100, () -> ran.add("never"));

        queue.clear();
        queue.drain(10_000);

        assertThat(ran).isEmpty();
    }
}
