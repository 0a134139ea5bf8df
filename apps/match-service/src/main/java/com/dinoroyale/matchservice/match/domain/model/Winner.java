package com.dinoroyale.matchservice.match.domain.model;

import java.util.List;

/**
 * 胜者：单人模式为玩家，组队模式为队伍。
 *
 * @param kind    胜者类型
 * @param id      玩家 ID 或队伍 key
 * @param members 胜方成员（单人模式只有自己）
 */
public record Winner(Kind kind, String id, List<String> members) {

    public enum Kind { PLAYER, TEAM }

    public Winner {
        members = List.copyOf(members);
    }

    public static Winner player(String playerId) {
        return new Winner(Kind.PLAYER, playerId, List.of(playerId));
    }

    public static Winner team(Team team) {
        return new Winner(Kind.TEAM, team.key(), team.members());
    }
}
