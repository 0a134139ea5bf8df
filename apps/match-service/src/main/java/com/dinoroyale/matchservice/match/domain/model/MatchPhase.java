package com.dinoroyale.matchservice.match.domain.model;

/**
 * 对局阶段。严格按固定顺序循环推进，不允许跳过任何阶段：
 * LOBBY -> STARTING -> DROPPING -> MATCH -> ENDING -> CLEANUP -> LOBBY
 */
public enum MatchPhase {

    LOBBY("Lobby"),         // 大厅等人
    STARTING("Starting"),   // 组队 + 开局倒计时
    DROPPING("Dropping"),   // 空投落点
    MATCH("Match"),         // 对局进行中（缩圈、胜负轮询）
    ENDING("Ending"),       // 结算展示
    CLEANUP("Cleanup");     // 清理本局状态

    private final String displayName;

    MatchPhase(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** 唯一合法的后继阶段（CLEANUP 之后回到 LOBBY） */
    public MatchPhase next() {
        MatchPhase[] all = values();
        return all[(ordinal() + 1) % all.length];
    }
}
