package com.dinoroyale.matchservice.match.domain.port;

import com.dinoroyale.matchservice.match.domain.model.Position;

import java.util.List;

/**
 * 玩家位置来源：供缩圈伤害循环读取每个在线玩家的位置与存活状态。
 */
public interface PlayerPositionSource {

    /**
     * 当前在线玩家的快照。
     */
    List<TrackedPlayer> trackedPlayers();

    /**
     * @param playerId  玩家 ID
     * @param position  当前位置；null 表示没有有效身体（跳过伤害结算）
     * @param alive     是否存活
     * @param connected 是否在线
     */
    record TrackedPlayer(String playerId, Position position, boolean alive, boolean connected) {
    }
}
