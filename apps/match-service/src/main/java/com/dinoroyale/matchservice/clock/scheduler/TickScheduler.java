package com.dinoroyale.matchservice.clock.scheduler;

/**
 * TickScheduler
 * ---------------------------------------
 * 通用的“周期调度器”接口，完全独立于具体业务（对局阶段、缩圈、伤害等）。
 *
 * 设计目标：
 *  - 按业务 key 启动/停止周期任务，同一 key 同一时刻只存在一个任务。
 *  - 暴露统一的时间源 {@link #currentTimeMillis()}，上层所有“等待”都用截止时间与它比较，
 *    从而可以在测试中注入假时钟，避免依赖真实 sleep。
 *  - 不关心消息广播、对局规则等业务细节，由上层协调器负责。
 */
public interface TickScheduler {

    /**
     * 启动（或替换）指定 key 的周期任务。
     * 若该 key 已有任务，先停止旧任务再启动新任务。
     * @param key                业务键（如 "match:driver"、"zone:damage"）
     * @param initialDelayMillis 首次执行延迟（毫秒）
     * @param periodMillis       执行周期（毫秒）
     * @param task               任务主体；单次执行内抛出的异常由实现记录，不影响后续周期
     */
    void startAtFixedRate(String key, long initialDelayMillis, long periodMillis, Runnable task);

    /**
     * 停止指定 key 的周期任务（不打断正在执行的那一次）。
     * @param key 业务键
     */
    void stop(String key);

    /**
     * 指定 key 当前是否有任务在调度中。
     */
    boolean isRunning(String key);

    /**
     * 调度器的时间源（毫秒）。
     */
    long currentTimeMillis();
}
