package com.dinoroyale.matchservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * TickSchedulerImpl
 * ---------------------------------------
 * 通用周期调度引擎的默认实现。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 按固定周期调度任务；
 *  - 以 key 维护任务句柄，保证同一 key 只有一个任务；
 *  - 包装任务主体：单次执行失败只记日志，下一个周期照常执行。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（如阶段推进、广播）。
 */
public class TickSchedulerImpl implements TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(TickSchedulerImpl.class);

    // 调度线程池
    private final ScheduledThreadPoolExecutor scheduler;
    // 时间源
    private final Clock clock;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    /**
     * @param scheduler 调度线程池
     * @param clock     时间源
     */
    public TickSchedulerImpl(ScheduledThreadPoolExecutor scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void startAtFixedRate(String key, long initialDelayMillis, long periodMillis, Runnable task) {
        // 防止重复任务：先取消老任务
        stop(key);
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(
                () -> runSafely(key, task),
                Math.max(0, initialDelayMillis),
                periodMillis,
                TimeUnit.MILLISECONDS);
        // 记录任务句柄
        activeTasks.put(key, fut);
        log.debug("周期任务已启动: key={}, periodMs={}", key, periodMillis);
    }

    @Override
    public void stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        // 取消调度，但不打断正在运行
        if (f != null) {
            f.cancel(false);
            log.debug("周期任务已停止: key={}", key);
        }
    }

    @Override
    public boolean isRunning(String key) {
        ScheduledFuture<?> f = activeTasks.get(key);
        return f != null && !f.isDone();
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    /**
     * 执行一次任务主体。scheduleAtFixedRate 在任务抛异常后会静默终止后续周期，
     * 因此这里必须兜住异常。
     */
    private void runSafely(String key, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("周期任务执行失败，下个周期重试: key={}", key, t);
        }
    }
}
