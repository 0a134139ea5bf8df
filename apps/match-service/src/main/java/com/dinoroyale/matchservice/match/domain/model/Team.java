package com.dinoroyale.matchservice.match.domain.model;

import java.util.List;

/**
 * 队伍：有序的玩家 ID 列表。
 * 单人模式下 key 就是玩家自己的 ID；组队模式下为顺序生成的 team_N。
 * 只持有玩家 ID，不持有 PlayerRecord（玩家记录归名册所有）。
 */
public record Team(String key, List<String> members) {

    public Team {
        members = List.copyOf(members);
    }
}
