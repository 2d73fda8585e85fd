package com.projectgroup5.arenasync.service;

import com.projectgroup5.arenasync.config.ArenaProperties;
import com.projectgroup5.arenasync.game.ArenaSession;
import com.projectgroup5.arenasync.game.ArenaSessionManager;
import com.projectgroup5.arenasync.websocket.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * arena.auto-connect=true 时启动即连接并加入房间（无渲染层，直接在随机位置出生）
 */
@Component
public class ArenaClientRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(ArenaClientRunner.class);

    private final ArenaProperties props;
    private final ServerConnector connector;
    private final ArenaSessionManager sessionManager;

    public ArenaClientRunner(ArenaProperties props,
                             ServerConnector connector,
                             ArenaSessionManager sessionManager) {
        this.props = props;
        this.connector = connector;
        this.sessionManager = sessionManager;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isAutoConnect()) {
            logger.info("Auto-connect disabled, waiting for an explicit join");
            return;
        }

        connector.connect(props.getServerUrl())
                .thenAccept(server -> {
                    ArenaSession session = sessionManager.join(props.getRoomId(), props.getPlayerName(), server);
                    session.attachWorld(System.currentTimeMillis());
                })
                .exceptionally(e -> {
                    logger.error("Failed to join room {} at {}", props.getRoomId(), props.getServerUrl(), e);
                    return null;
                });
    }
}
