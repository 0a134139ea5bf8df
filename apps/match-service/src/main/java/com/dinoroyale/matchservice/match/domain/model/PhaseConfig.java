package com.dinoroyale.matchservice.match.domain.model;

/**
 * 缩圈阶段配置（静态表中的一行），加载后不可变。
 *
 * @param delaySeconds         开始收缩前的等待时间
 * @param shrinkSeconds        收缩持续时间
 * @param endRadius            本阶段结束时的半径
 * @param centerOffsetFraction 新圆心最大偏移量，占当前半径的比例
 * @param damage               圈外每次伤害结算的伤害值
 */
public record PhaseConfig(int delaySeconds,
                          int shrinkSeconds,
                          double endRadius,
                          double centerOffsetFraction,
                          double damage) {
}
