package com.projectgroup5.arenasync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.arenasync.dto.PowerupDto;
import com.projectgroup5.arenasync.dto.ProjectileFiredMessage;
import com.projectgroup5.arenasync.dto.RoomStateDto;
import com.projectgroup5.arenasync.dto.RosterEntryDto;
import com.projectgroup5.arenasync.game.ArenaSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 把服务器的房间事件 / 房间状态转换成 DTO，再交给 ArenaSession
 *
 * 每个回调在这里兜底：解析失败只跳过这条消息，异常不会抛回传输层
 */
@Service
public class SessionSubscriptions {
    private static final Logger logger = LoggerFactory.getLogger(SessionSubscriptions.class);

    public static final String PROJECTILE_FIRED = "projectileFired";
    public static final String POWERUP_SPAWNED = "powerupSpawned";
    public static final String ROSTER = "roster";
    public static final String ROOM_STATE = "roomState";

    private final ObjectMapper objectMapper;

    public SessionSubscriptions(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return 取消全部订阅的句柄，离开房间时调用
     */
    public Subscription bind(ArenaSession session, SessionServer server) {
        String roomId = session.getRoomId();
        List<Subscription> bound = new ArrayList<>();

        bound.add(server.subscribe(roomId, PROJECTILE_FIRED, guarded(PROJECTILE_FIRED, node ->
                convert(node, ProjectileFiredMessage.class).ifPresent(session::onProjectileFired))));

        bound.add(server.subscribe(roomId, POWERUP_SPAWNED, guarded(POWERUP_SPAWNED, node ->
                convert(node, PowerupDto.class).ifPresent(session::onPowerupSpawned))));

        bound.add(server.subscribe(roomId, ROSTER, guarded(ROSTER, node ->
                parseRoster(node).ifPresent(session::onRosterSnapshot))));

        // 地图数据的两个来源：一次性的状态消息 + 持续的状态订阅
        bound.add(server.subscribe(roomId, ROOM_STATE, guarded(ROOM_STATE, node ->
                convert(node, RoomStateDto.class).ifPresent(session::onRoomState))));

        bound.add(server.subscribeState(roomId, guarded("state", node ->
                convert(node, RoomStateDto.class).ifPresent(session::onRoomState))));

        return () -> bound.forEach(Subscription::cancel);
    }

    private Consumer<JsonNode> guarded(String name, Consumer<JsonNode> handler) {
        return node -> {
            try {
                handler.accept(node);
            } catch (Exception e) {
                logger.error("Error handling {} message", name, e);
            }
        };
    }

    private <T> Optional<T> convert(JsonNode node, Class<T> type) {
        if (node == null || !node.isObject()) {
            logger.warn("Expected object for {}, got {}", type.getSimpleName(), node);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.treeToValue(node, type));
        } catch (Exception e) {
            logger.warn("Malformed {} message: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 逐项解析；坏掉的一项只保留 account（仍算在快照里，避免误删玩家），不影响其它项
     */
    Optional<List<RosterEntryDto>> parseRoster(JsonNode node) {
        if (node == null || !node.isArray()) {
            logger.warn("Roster snapshot is not a list, skipping");
            return Optional.empty();
        }
        List<RosterEntryDto> entries = new ArrayList<>();
        for (JsonNode item : node) {
            try {
                entries.add(objectMapper.treeToValue(item, RosterEntryDto.class));
            } catch (Exception e) {
                JsonNode account = item.get("account");
                if (account != null && account.isTextual()) {
                    logger.warn("Malformed roster entry for {}: {}", account.asText(), e.getMessage());
                    entries.add(new RosterEntryDto(account.asText(), null, null, null, null));
                } else {
                    logger.warn("Malformed roster entry skipped: {}", e.getMessage());
                }
            }
        }
        return Optional.of(entries);
    }
}
