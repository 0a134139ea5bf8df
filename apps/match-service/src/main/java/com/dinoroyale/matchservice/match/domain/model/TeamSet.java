package com.dinoroyale.matchservice.match.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一局内冻结的队伍划分（不可变）。
 * 保证：各队成员互不相交，并且覆盖组队时名册中的全部玩家。
 */
public final class TeamSet {

    private static final TeamSet EMPTY = new TeamSet(List.of());

    private final List<Team> teams;
    // playerId -> teamKey
    private final Map<String, String> teamKeyByPlayer;

    public TeamSet(List<Team> teams) {
        this.teams = List.copyOf(teams);
        Map<String, String> index = new HashMap<>();
        for (Team t : this.teams) {
            for (String member : t.members()) {
                String prev = index.put(member, t.key());
                if (prev != null) {
                    throw new IllegalArgumentException("player " + member + " assigned to both " + prev + " and " + t.key());
                }
            }
        }
        this.teamKeyByPlayer = Collections.unmodifiableMap(index);
    }

    public static TeamSet empty() {
        return EMPTY;
    }

    public List<Team> teams() {
        return teams;
    }

    public int size() {
        return teams.size();
    }

    public boolean isEmpty() {
        return teams.isEmpty();
    }

    public Optional<Team> teamOf(String playerId) {
        String key = teamKeyByPlayer.get(playerId);
        if (key == null) return Optional.empty();
        return teams.stream().filter(t -> t.key().equals(key)).findFirst();
    }

    /** 全部成员（按队伍顺序、队内顺序展开） */
    public List<String> allMembers() {
        return teams.stream().flatMap(t -> t.members().stream()).toList();
    }
}
