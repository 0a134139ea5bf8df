package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.domain.model.PlayerRecord;
import com.dinoroyale.matchservice.match.domain.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 在线玩家名册（playerId -> PlayerRecord）。
 * 遍历顺序按加入顺序，保证组队与落点分配的确定性。
 */
@Slf4j
public class PlayerRoster {

    private final ConcurrentMap<String, PlayerRecord> players = new ConcurrentHashMap<>();
    private final AtomicLong joinSeq = new AtomicLong();

    /**
     * 加入名册；同一 ID 重复加入时返回已有记录。
     */
    public PlayerRecord join(String playerId, String displayName) {
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException("playerId 不能为空");
        }
        return players.computeIfAbsent(playerId,
                id -> new PlayerRecord(id, StringUtils.defaultIfBlank(displayName, id), joinSeq.incrementAndGet()));
    }

    public Optional<PlayerRecord> remove(String playerId) {
        if (playerId == null) return Optional.empty();
        return Optional.ofNullable(players.remove(playerId));
    }

    public Optional<PlayerRecord> find(String playerId) {
        if (playerId == null) return Optional.empty();
        return Optional.ofNullable(players.get(playerId));
    }

    public boolean contains(String playerId) {
        return playerId != null && players.containsKey(playerId);
    }

    public int size() {
        return players.size();
    }

    /** 按加入顺序的快照 */
    public List<PlayerRecord> snapshot() {
        return players.values().stream()
                .sorted(Comparator.comparingLong(PlayerRecord::getJoinSeq))
                .toList();
    }

    public List<String> playerIds() {
        return snapshot().stream().map(PlayerRecord::getPlayerId).toList();
    }

    /** 存活表（按加入顺序） */
    public Map<String, Boolean> aliveById() {
        Map<String, Boolean> alive = new LinkedHashMap<>();
        for (PlayerRecord r : snapshot()) {
            alive.put(r.getPlayerId(), r.isAlive());
        }
        return alive;
    }

    public void clearAlive() {
        players.values().forEach(PlayerRecord::clearAlive);
    }

    /**
     * 更新玩家位置。
     * @return 玩家不在名册中返回 false
     */
    public boolean updatePosition(String playerId, Position position) {
        PlayerRecord r = playerId == null ? null : players.get(playerId);
        if (r == null) return false;
        r.setPosition(position);
        return true;
    }
}
