package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.domain.model.AliveCounts;
import com.dinoroyale.matchservice.match.domain.model.ZoneState;

/**
 * 对局状态快照，给断线重连、晚到的订阅者对齐状态用。
 */
public record MatchSnapshot(String matchId,
                            String phase,
                            String mode,
                            int teamSize,
                            ZoneState zone,
                            AliveCounts alive,
                            int connectedPlayers,
                            int teams,
                            long serverTime) {
}
