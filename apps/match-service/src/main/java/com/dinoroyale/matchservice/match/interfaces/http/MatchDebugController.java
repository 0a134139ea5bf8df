package com.dinoroyale.matchservice.match.interfaces.http;

import com.dinoroyale.matchservice.common.ApiResponse;
import com.dinoroyale.matchservice.match.application.MatchCoordinator;
import com.dinoroyale.matchservice.match.domain.model.PlayerRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 临时调试用接口：不建 WebSocket 连接直接模拟玩家加入 / 离开 / 被淘汰。
 *
 * 用法（示例）：
 *   POST /api/match/debug/join?playerId=p1&name=Alice
 *   POST /api/match/debug/eliminate?playerId=p1&killerId=p2
 */
@RestController
@RequestMapping("/api/match/debug")
@RequiredArgsConstructor
public class MatchDebugController {

    private final MatchCoordinator coordinator;

    @PostMapping("/join")
    public ApiResponse<Map<String, Object>> join(@RequestParam String playerId,
                                                 @RequestParam(required = false) String name) {
        PlayerRecord r = coordinator.onPlayerJoined(playerId, name);
        return ApiResponse.success(Map.of("playerId", r.getPlayerId(), "displayName", r.getDisplayName()));
    }

    @PostMapping("/leave")
    public ApiResponse<Void> leave(@RequestParam String playerId) {
        coordinator.onPlayerLeft(playerId);
        return ApiResponse.success();
    }

    @PostMapping("/eliminate")
    public ApiResponse<Void> eliminate(@RequestParam String playerId,
                                       @RequestParam(required = false) String killerId) {
        coordinator.eliminatePlayer(playerId, killerId);
        return ApiResponse.success();
    }
}
