package com.dinoroyale.matchservice.match.domain.model;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 已连接玩家的记录。
 * 生命周期：加入时创建，断开时由名册移除；存活标记在每局 STARTING 结束时重置。
 *
 * 并发约定：
 * - alive 只由对局协调器写（淘汰 / 开局 / 清理），缩圈伤害循环与胜负判定只读；
 * - position 由客户端上报或落点分配写入，整体替换不可变的 Position；
 * - health 只由伤害结算写入，开局时由协调器重置（此时缩圈未运行）。
 */
public class PlayerRecord {

    @Getter private final String playerId;
    @Getter private final String displayName;
    /** 加入顺序，用于名册的稳定遍历顺序 */
    @Getter private final long joinSeq;

    private final AtomicBoolean alive = new AtomicBoolean(false);
    private volatile Position position;
    private volatile double health;

    public PlayerRecord(String playerId, String displayName, long joinSeq) {
        this.playerId = playerId;
        this.displayName = displayName;
        this.joinSeq = joinSeq;
    }

    public boolean isAlive() {
        return alive.get();
    }

    /** 开局复活，同时回满血 */
    public void revive(double maxHealth) {
        this.health = maxHealth;
        alive.set(true);
    }

    /**
     * 标记淘汰。
     * @return true 表示本次调用完成了“存活 -> 淘汰”的转换；已淘汰则返回 false
     */
    public boolean markEliminated() {
        return alive.compareAndSet(true, false);
    }

    /** 清理阶段：直接清除存活标记，不产生淘汰事件 */
    public void clearAlive() {
        alive.set(false);
    }

    /** null 表示当前没有有效的角色身体（如尚未生成） */
    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = position;
    }

    public double getHealth() {
        return health;
    }

    /**
     * 扣血。
     * @return 扣血后的剩余血量（不小于 0）
     */
    public double takeDamage(double amount) {
        double left = Math.max(0, health - amount);
        this.health = left;
        return left;
    }
}
