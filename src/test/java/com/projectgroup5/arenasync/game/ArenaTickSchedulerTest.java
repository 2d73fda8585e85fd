package com.projectgroup5.arenasync.game;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.Mockito.*;

class ArenaTickSchedulerTest {

    @Test
    void failingSessionDoesNotStopOthers() {
        ArenaSessionManager manager = mock(ArenaSessionManager.class);
        ArenaSession broken = mock(ArenaSession.class);
        ArenaSession healthy = mock(ArenaSession.class);
        when(broken.getRoomId()).thenReturn("room-1");
        doThrow(new IllegalStateException("boom")).when(broken).tick(anyLong());
        when(manager.getActiveSessions()).thenReturn(List.of(broken, healthy));

        new ArenaTickScheduler(manager).tickAt(1234);

        verify(broken).tick(1234);
        verify(healthy).tick(1234);
    }
}
