package com.dinoroyale.matchservice.match.domain.model;

/**
 * 安全区状态快照（只读），任何阶段都可以安全获取。
 *
 * @param phase                 当前缩圈阶段，0 表示未开始（或宽限期）
 * @param currentRadius         当前半径
 * @param targetRadius          目标半径
 * @param currentCenter         当前圆心
 * @param targetCenter          目标圆心
 * @param active                是否在运行
 * @param damage                当前每次伤害结算的伤害值
 * @param inGracePeriod         是否处于开局宽限期（不结算伤害）
 * @param graceSecondsRemaining 宽限期剩余秒数
 */
public record ZoneState(int phase,
                        double currentRadius,
                        double targetRadius,
                        Position currentCenter,
                        Position targetCenter,
                        boolean active,
                        double damage,
                        boolean inGracePeriod,
                        int graceSecondsRemaining) {
}
