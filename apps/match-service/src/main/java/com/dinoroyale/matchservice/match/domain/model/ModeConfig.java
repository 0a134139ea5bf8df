package com.dinoroyale.matchservice.match.domain.model;

/**
 * 模式配置（solo / duos / trios），开局进入 STARTING 后本局内不可变。
 *
 * @param id          模式键，小写
 * @param displayName 展示名
 * @param teamSize    每队人数，1 表示单人模式
 */
public record ModeConfig(String id, String displayName, int teamSize) {

    public ModeConfig {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("mode id is blank");
        if (teamSize < 1) throw new IllegalArgumentException("teamSize must be >= 1: " + id);
    }

    /** 单人模式：每个玩家自成一队 */
    public boolean isSolo() {
        return teamSize == 1;
    }
}
