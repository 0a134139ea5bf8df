package com.dinoroyale.matchservice.match.interfaces.ws;

import com.dinoroyale.matchservice.match.application.MatchCoordinator;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents;
import com.dinoroyale.matchservice.match.domain.model.Position;
import com.dinoroyale.matchservice.match.domain.port.BroadcastChannel;
import com.dinoroyale.matchservice.match.interfaces.ws.dto.MatchMessages.ModeChangeCmd;
import com.dinoroyale.matchservice.match.interfaces.ws.dto.MatchMessages.PositionCmd;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * 对局 WebSocket 控制器
 * ----------------------------------------
 *   - /app/match.mode     ：大厅内切换模式，被拒绝时只回给发起人一条 Error
 *   - /app/match.position ：位置上报
 *   - /app/match.sync     ：向发起人回一份完整快照（重连 / 晚到订阅者对齐状态）
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class MatchWsController {

    private final MatchCoordinator coordinator;
    private final BroadcastChannel broadcast;

    @MessageMapping("/match.mode")
    public void changeMode(ModeChangeCmd cmd, Principal principal) {
        String playerId = playerId(principal);
        if (playerId == null) return;
        String mode = cmd == null ? null : cmd.getMode();
        if (!coordinator.requestModeChange(mode)) {
            broadcast.sendTo(playerId, MatchEvents.ERROR,
                    new MatchEvents.ErrorNotice("mode change rejected: " + mode));
        }
    }

    @MessageMapping("/match.position")
    public void reportPosition(PositionCmd cmd, Principal principal) {
        String playerId = playerId(principal);
        if (playerId == null || cmd == null) return;
        if (!coordinator.reportPosition(playerId, new Position(cmd.getX(), cmd.getY(), cmd.getZ()))) {
            log.debug("位置上报被忽略，玩家不在名册: {}", playerId);
        }
    }

    @MessageMapping("/match.sync")
    public void sync(Principal principal) {
        String playerId = playerId(principal);
        if (playerId == null) return;
        broadcast.sendTo(playerId, MatchEvents.MATCH_SNAPSHOT, coordinator.snapshot());
    }

    private static String playerId(Principal principal) {
        if (principal == null) {
            log.warn("收到未绑定玩家身份的 STOMP 消息，已忽略");
            return null;
        }
        return principal.getName();
    }
}
