package com.dinoroyale.matchservice.match.domain.port;

/**
 * 物资控制（外部协作者）。DROPPING 进入时全图刷物资，CLEANUP 时重置。
 */
public interface LootController {

    void spawnAllLoot();

    void resetLoot();
}
