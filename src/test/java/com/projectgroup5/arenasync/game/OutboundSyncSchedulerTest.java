package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.dto.PlayerPositionUpdate;
import com.projectgroup5.arenasync.service.RecordingSessionServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundSyncSchedulerTest {

    private RecordingSessionServer server;
    private Participant local;
    private OutboundSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        server = new RecordingSessionServer("me");
        local = new Participant("me", "Knight", 10, 20, 100, 0);
        local.angle = 45;
        scheduler = new OutboundSyncScheduler(server, () -> local, 50);
    }

    @Test
    void pushesAtMostOncePerIntervalOfSimulatedTime() {
        assertThat(scheduler.maybePush(1000)).isTrue();
        assertThat(scheduler.maybePush(1016)).isFalse();
        assertThat(scheduler.maybePush(1050)).isFalse();
        assertThat(scheduler.maybePush(1051)).isTrue();
        assertThat(scheduler.maybePush(1060)).isFalse();

        assertThat(server.callsNamed(OutboundSyncScheduler.UPDATE_POSITION)).hasSize(2);
    }

    @Test
    void pushCarriesLocalStateAndThrottleOption() {
        local.setHealth(80);
        scheduler.pushNow(500);

        RecordingSessionServer.Call call = server.callsNamed(OutboundSyncScheduler.UPDATE_POSITION).get(0);
        PlayerPositionUpdate update = call.arg(0);
        assertThat(update.getX()).isEqualTo(10);
        assertThat(update.getY()).isEqualTo(20);
        assertThat(update.getAngle()).isEqualTo(45);
        assertThat(update.getHealth()).isEqualTo(80);
        assertThat(update.getName()).isEqualTo("Knight");
        assertThat(call.options.getThrottleMs()).isEqualTo(50);
        assertThat(scheduler.getLastPush()).isEqualTo(500);
    }

    @Test
    void nothingPushedWithoutLocalParticipant() {
        local = null;

        assertThat(scheduler.maybePush(1000)).isFalse();
        assertThat(server.calls()).isEmpty();
    }
}
