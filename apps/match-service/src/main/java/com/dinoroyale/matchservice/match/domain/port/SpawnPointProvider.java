package com.dinoroyale.matchservice.match.domain.port;

import com.dinoroyale.matchservice.match.domain.model.Position;

import java.util.List;
import java.util.Optional;

/**
 * 地图出生点提供方（外部协作者，由地图/地形模块实现）。
 * 不可用时对局协调器退回到默认地图尺寸计算出的环形落点。
 */
public interface SpawnPointProvider {

    List<Position> getPlayerSpawnPoints();

    Position getMapCenter();

    double getMapSize();

    /** 大厅出生点；没有专门的大厅点时返回 empty */
    Optional<Position> getLobbySpawn();
}
