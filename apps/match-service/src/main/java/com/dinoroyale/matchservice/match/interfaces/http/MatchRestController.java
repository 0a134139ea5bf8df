package com.dinoroyale.matchservice.match.interfaces.http;

import com.dinoroyale.matchservice.common.ApiResponse;
import com.dinoroyale.matchservice.match.application.MatchCoordinator;
import com.dinoroyale.matchservice.match.application.MatchSnapshot;
import com.dinoroyale.matchservice.match.domain.model.AliveCounts;
import com.dinoroyale.matchservice.match.domain.model.ModeConfig;
import com.dinoroyale.matchservice.match.domain.model.ZoneState;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 对局状态查询与模式切换（REST）。
 * 广播不保留历史，客户端任何时候都可以通过这里拉取当前状态。
 */
@RestController
@RequestMapping("/api/match")
@RequiredArgsConstructor
public class MatchRestController {

    private final MatchCoordinator coordinator;

    @GetMapping("/state")
    public ApiResponse<MatchSnapshot> state() {
        return ApiResponse.success(coordinator.snapshot());
    }

    @GetMapping("/phase")
    public ApiResponse<Map<String, String>> phase() {
        return ApiResponse.success(Map.of("phase", coordinator.getPhase().displayName()));
    }

    @GetMapping("/mode")
    public ApiResponse<ModeConfig> mode() {
        return ApiResponse.success(coordinator.getMode());
    }

    @GetMapping("/zone")
    public ApiResponse<ZoneState> zone() {
        return ApiResponse.success(coordinator.getZoneState());
    }

    @GetMapping("/alive")
    public ApiResponse<AliveCounts> alive() {
        return ApiResponse.success(coordinator.getAliveCounts());
    }

    /**
     * 切换模式：body {"mode":"duos"}；非大厅阶段或未知模式返回 409。
     */
    @PostMapping("/mode")
    public ApiResponse<ModeConfig> changeMode(@RequestBody ModeChangeRequest req) {
        if (req == null || StringUtils.isBlank(req.mode())) {
            throw new IllegalArgumentException("mode 不能为空");
        }
        if (!coordinator.requestModeChange(req.mode())) {
            throw new IllegalStateException("mode change rejected: " + req.mode()
                    + " (phase=" + coordinator.getPhase().displayName() + ")");
        }
        return ApiResponse.success(coordinator.getMode());
    }

    public record ModeChangeRequest(String mode) {
    }
}
