package com.dinoroyale.matchservice.match.domain.port;

/**
 * 伤害落地（外部协作者）：缩圈伤害循环通过它对玩家扣血。
 */
public interface DamageSink {

    void applyDamage(String playerId, double amount);
}
