package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.domain.model.PlayerRecord;
import com.dinoroyale.matchservice.match.domain.port.DamageSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 默认伤害落地：扣名册中的血量，血量归零时通知监听方（通常是对局协调器的淘汰入口）。
 * 扣血本身不改存活标记。
 */
@Slf4j
@RequiredArgsConstructor
public class RosterDamageSink implements DamageSink {

    @FunctionalInterface
    public interface DepletionListener {
        void onDepleted(String playerId);
    }

    private final PlayerRoster roster;
    private volatile DepletionListener depletionListener;

    public void setDepletionListener(DepletionListener listener) {
        this.depletionListener = listener;
    }

    @Override
    public void applyDamage(String playerId, double amount) {
        PlayerRecord r = roster.find(playerId).orElse(null);
        if (r == null || !r.isAlive() || amount <= 0) return;

        double left = r.takeDamage(amount);
        log.debug("伤害结算: playerId={}, amount={}, health={}", playerId, amount, left);
        if (left <= 0) {
            DepletionListener l = depletionListener;
            if (l != null) {
                l.onDepleted(playerId);
            } else {
                log.warn("玩家血量归零但未设置监听: playerId={}", playerId);
            }
        }
    }
}
