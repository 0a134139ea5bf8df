package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.config.MatchProperties;
import com.dinoroyale.matchservice.match.domain.model.Position;
import com.dinoroyale.matchservice.match.domain.port.SpawnPointProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 地图几何：优先问出生点协作方，协作方缺失或出错时退回配置里的默认地图。
 */
@Slf4j
public class MapLayout {

    private final SpawnPointProvider provider;
    private final MatchProperties.MapSettings settings;

    /**
     * @param provider 可为 null
     * @param settings 默认地图配置
     */
    public MapLayout(SpawnPointProvider provider, MatchProperties.MapSettings settings) {
        this.provider = provider;
        this.settings = settings;
        if (provider == null) {
            log.info("未配置出生点协作方，使用默认地图: size={}", settings.getDefaultSize());
        }
    }

    public Position mapCenter() {
        if (provider != null) {
            try {
                Position c = provider.getMapCenter();
                if (c != null) return c;
            } catch (RuntimeException e) {
                log.warn("获取地图中心失败，使用默认值", e);
            }
        }
        return new Position(settings.getCenterX(), settings.getCenterY(), settings.getCenterZ());
    }

    public double mapSize() {
        if (provider != null) {
            try {
                double size = provider.getMapSize();
                if (size > 0) return size;
            } catch (RuntimeException e) {
                log.warn("获取地图尺寸失败，使用默认值", e);
            }
        }
        return settings.getDefaultSize();
    }

    /**
     * 空投落点：优先使用协作方出生点（高度替换为空投高度），否则绕地图中心取一圈等距点。
     */
    public List<Position> dropPositions(double dropHeight) {
        if (provider != null) {
            try {
                List<Position> points = provider.getPlayerSpawnPoints();
                if (points != null && !points.isEmpty()) {
                    return points.stream().map(p -> p.withY(dropHeight)).toList();
                }
            } catch (RuntimeException e) {
                log.warn("获取出生点失败，改用环形落点", e);
            }
        }
        Position center = mapCenter();
        double radius = mapSize() * settings.getDropRingFraction();
        int n = Math.max(1, settings.getDropRingPoints());
        List<Position> ring = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            double angle = (double) i / n * Math.PI * 2;
            ring.add(new Position(
                    center.x() + Math.cos(angle) * radius,
                    dropHeight,
                    center.z() + Math.sin(angle) * radius));
        }
        return ring;
    }

    /**
     * 回大厅位置：协作方的大厅点；否则地图中心抬高到大厅高度。
     */
    public Position lobbySpawn() {
        if (provider != null) {
            try {
                Optional<Position> lobby = provider.getLobbySpawn();
                if (lobby != null && lobby.isPresent()) return lobby.get();
            } catch (RuntimeException e) {
                log.warn("获取大厅出生点失败，使用地图中心", e);
            }
        }
        return mapCenter().withY(settings.getLobbySpawnHeight());
    }
}
