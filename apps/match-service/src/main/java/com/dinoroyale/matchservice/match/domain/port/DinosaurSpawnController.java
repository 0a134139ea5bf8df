package com.dinoroyale.matchservice.match.domain.port;

/**
 * 恐龙刷新控制（外部协作者）。MATCH 开始时启动，ENDING 时停止，CLEANUP 时全部清除。
 * 缺失时只记日志并跳过。
 */
public interface DinosaurSpawnController {

    void startSpawning();

    void stopSpawning();

    void despawnAll();
}
