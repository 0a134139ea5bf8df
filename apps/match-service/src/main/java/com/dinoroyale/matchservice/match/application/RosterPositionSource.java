package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.domain.port.PlayerPositionSource;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 默认位置来源：直接读名册。名册里的玩家即在线玩家。
 */
@RequiredArgsConstructor
public class RosterPositionSource implements PlayerPositionSource {

    private final PlayerRoster roster;

    @Override
    public List<TrackedPlayer> trackedPlayers() {
        return roster.snapshot().stream()
                .map(r -> new TrackedPlayer(r.getPlayerId(), r.getPosition(), r.isAlive(), true))
                .toList();
    }
}
