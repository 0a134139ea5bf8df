package com.dinoroyale.matchservice.platform.ws;

import com.dinoroyale.matchservice.match.application.MatchCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 监听 STOMP 连接/断开事件，把会话映射为玩家加入/离开。
 * 同一玩家只保留最新连接：新连接登记后踢掉旧连接，旧连接的断开不再视为玩家离开。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final MatchCoordinator coordinator;
    private final WebSocketDisconnectHelper disconnectHelper;

    // playerId -> 当前有效 sessionId
    private final ConcurrentMap<String, String> activeSessions = new ConcurrentHashMap<>();
    // sessionId -> playerId（断开事件可能不带用户）
    private final ConcurrentMap<String, String> sessionOwners = new ConcurrentHashMap<>();

    public WebSocketSessionManager(MatchCoordinator coordinator, WebSocketDisconnectHelper disconnectHelper) {
        this.coordinator = coordinator;
        this.disconnectHelper = disconnectHelper;
    }

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal principal = accessor.getUser();
        String sessionId = accessor.getSessionId();
        if (principal == null || sessionId == null) {
            log.warn("收到 SessionConnectEvent 但缺少玩家身份或 sessionId，session={}", sessionId);
            return;
        }
        String playerId = principal.getName();
        String displayName = principal instanceof PlayerPrincipal p ? p.displayName() : playerId;

        sessionOwners.put(sessionId, playerId);
        String previous = activeSessions.put(playerId, sessionId);
        if (previous != null && !previous.equals(sessionId)) {
            log.info("玩家 {} 重复连接，新连接 {} 踢掉旧连接 {}", playerId, sessionId, previous);
            disconnectHelper.sendKickMessage(playerId, previous, "账号已在其他终端连接");
            disconnectHelper.forceDisconnect(previous);
        }
        coordinator.onPlayerJoined(playerId, displayName);
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        String playerId = sessionOwners.remove(sessionId);
        if (playerId == null && event.getUser() != null) {
            playerId = event.getUser().getName();
        }
        if (playerId == null) {
            log.debug("断开的会话未绑定玩家: sessionId={}", sessionId);
            return;
        }
        // 只有当前有效连接断开才算玩家离开
        if (activeSessions.remove(playerId, sessionId)) {
            log.info("玩家断开连接: playerId={}, sessionId={}", playerId, sessionId);
            coordinator.onPlayerLeft(playerId);
        } else {
            log.debug("旧连接断开，玩家仍在线: playerId={}, sessionId={}", playerId, sessionId);
        }
    }
}
