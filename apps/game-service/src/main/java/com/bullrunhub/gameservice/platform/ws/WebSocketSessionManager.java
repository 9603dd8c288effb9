package com.bullrunhub.gameservice.platform.ws;

import com.bullrunhub.gameservice.games.bullrun.application.SessionCoordinator;
import com.bullrunhub.gameservice.games.bullrun.domain.dto.LeaveResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * 监听 STOMP 连接/断开事件。
 *
 * 断开检测基于底层连接关闭，浏览器崩溃、网络中断也能收到，
 * 因此断开一律按"离开房间"处理。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final SessionCoordinator coordinator;

    public WebSocketSessionManager(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @EventListener
    public void handleSessionConnected(SessionConnectedEvent event) {
        Principal principal = event.getUser();
        log.info("WebSocket 已连接: player={}", principal == null ? null : principal.getName());
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String playerId = resolvePlayerId(event);
        if (playerId == null) {
            log.warn("收到 SessionDisconnectEvent 但无法确定玩家身份");
            return;
        }
        try {
            LeaveResult result = coordinator.leaveRoom(playerId);
            if (result.leftRoom()) {
                log.info("断线离开房间: player={}, room={}, roomClosed={}", playerId, result.roomCode(), result.roomClosed());
            } else {
                log.debug("断线: player={} 不在任何房间", playerId);
            }
        } catch (RuntimeException e) {
            log.warn("断线清理失败: player={}", playerId, e);
        }
    }

    /** 优先取连接上的 Principal，取不到时退回会话 id（二者相同） */
    static String resolvePlayerId(SessionDisconnectEvent event) {
        Principal principal = event.getUser();
        if (principal != null) {
            return principal.getName();
        }
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        return accessor.getSessionId() != null ? accessor.getSessionId() : event.getSessionId();
    }
}
