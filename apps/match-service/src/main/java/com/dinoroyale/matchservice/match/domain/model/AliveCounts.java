package com.dinoroyale.matchservice.match.domain.model;

/**
 * 存活统计：存活玩家数、至少有一名存活成员的队伍数。
 */
public record AliveCounts(int players, int teams) {
}
