package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.domain.model.MatchPhase;
import com.dinoroyale.matchservice.match.domain.model.ModeConfig;
import lombok.Data;

/**
 * 单局可变状态，只由对局驱动在锁内读写（phase / mode 额外 volatile，供查询接口无锁读取）。
 */
@Data
class MatchContext {

    private volatile MatchPhase phase = MatchPhase.LOBBY;
    /** 大厅里选中的模式 */
    private volatile ModeConfig mode;
    /** STARTING 起冻结的本局模式，CLEANUP 后清空 */
    private volatile ModeConfig activeMode;

    /** 当前阶段的进入动作是否已执行 */
    private boolean phaseEntered;
    private long lastTickAt;

    private long lobbyRemainingMillis;
    private int countdownRemaining;
    private long nextCountdownAt;
    /** DROPPING / ENDING / CLEANUP 的截止时间 */
    private long phaseDeadline;
    private long matchStartedAt;
}
