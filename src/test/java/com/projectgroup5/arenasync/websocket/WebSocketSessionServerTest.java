package com.projectgroup5.arenasync.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.arenasync.dto.PlayerHitRequest;
import com.projectgroup5.arenasync.service.CallOptions;
import com.projectgroup5.arenasync.service.Subscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebSocketSessionServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private AtomicLong clock;
    private WebSocketSession socket;
    private WebSocketSessionServer server;

    @BeforeEach
    void setUp() throws Exception {
        clock = new AtomicLong(0);
        socket = mock(WebSocketSession.class);
        when(socket.isOpen()).thenReturn(true);
        when(socket.getId()).thenReturn("s1");
        server = new WebSocketSessionServer(mapper, clock::get);
        server.afterConnectionEstablished(socket);
    }

    private void receive(String json) throws Exception {
        server.handleMessage(socket, new TextMessage(json));
    }

    @Test
    void connectedFrameAssignsAccount() throws Exception {
        assertThat(server.account()).isNull();
        assertThat(server.accountAssigned()).isNotDone();

        receive("{\"type\":\"connected\",\"account\":\"acc-1\"}");

        assertThat(server.account()).isEqualTo("acc-1");
        assertThat(server.accountAssigned()).isCompletedWithValue("acc-1");
    }

    @Test
    void eventsAreDispatchedByRoomAndName() throws Exception {
        List<JsonNode> received = new ArrayList<>();
        server.subscribe("room-1", "roster", received::add);
        server.subscribe("room-2", "roster", node -> received.add(null));

        receive("{\"type\":\"event\",\"room\":\"room-1\",\"name\":\"roster\",\"data\":[{\"account\":\"p1\"}]}");
        receive("{\"type\":\"event\",\"room\":\"room-1\",\"name\":\"other\",\"data\":{}}");

        assertThat(received).hasSize(1);
        assertThat(received.get(0).get(0).get("account").asText()).isEqualTo("p1");
    }

    @Test
    void cancelledSubscriptionIsNotCalled() throws Exception {
        List<JsonNode> received = new ArrayList<>();
        Subscription events = server.subscribe("room-1", "roster", received::add);
        Subscription state = server.subscribeState("room-1", received::add);

        events.cancel();
        state.cancel();
        receive("{\"type\":\"event\",\"room\":\"room-1\",\"name\":\"roster\",\"data\":[]}");
        receive("{\"type\":\"state\",\"room\":\"room-1\",\"state\":{}}");

        assertThat(received).isEmpty();
    }

    @Test
    void stateFramesReachStateSubscribers() throws Exception {
        List<JsonNode> received = new ArrayList<>();
        server.subscribeState("room-1", received::add);

        receive("{\"type\":\"state\",\"room\":\"room-1\",\"state\":{\"obstacles\":[]}}");

        assertThat(received).hasSize(1);
        assertThat(received.get(0).has("obstacles")).isTrue();
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() throws Exception {
        List<JsonNode> received = new ArrayList<>();
        server.subscribe("room-1", "roster", node -> {
            throw new IllegalStateException("boom");
        });
        server.subscribe("room-1", "roster", received::add);

        receive("{\"type\":\"event\",\"room\":\"room-1\",\"name\":\"roster\",\"data\":[]}");
        receive("not json");

        assertThat(received).hasSize(1);
    }

    @Test
    void callSendsFrame() throws Exception {
        server.call("playerHit", List.of(new PlayerHitRequest("p1", "me", "melee_attack", 10)));

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket).sendMessage(captor.capture());
        JsonNode frame = mapper.readTree(captor.getValue().getPayload());
        assertThat(frame.get("type").asText()).isEqualTo("call");
        assertThat(frame.get("name").asText()).isEqualTo("playerHit");
        assertThat(frame.get("args").get(0).get("targetId").asText()).isEqualTo("p1");
        assertThat(frame.get("args").get(0).get("damage").asInt()).isEqualTo(10);
    }

    @Test
    void throttledCallsAreDroppedInsideInterval() throws Exception {
        server.call("updatePlayerPosition", List.of(), CallOptions.throttle(50));
        clock.set(30);
        server.call("updatePlayerPosition", List.of(), CallOptions.throttle(50));
        clock.set(60);
        server.call("updatePlayerPosition", List.of(), CallOptions.throttle(50));
        // 节流按名字区分
        server.call("collectPowerup", List.of("pw1"), CallOptions.throttle(50));

        verify(socket, times(3)).sendMessage(any(TextMessage.class));
    }

    @Test
    void callWithoutConnectionIsDropped() throws Exception {
        server.afterConnectionClosed(socket, CloseStatus.NORMAL);

        server.call("playerAttack", List.of());

        verify(socket, never()).sendMessage(any(TextMessage.class));
    }
}
