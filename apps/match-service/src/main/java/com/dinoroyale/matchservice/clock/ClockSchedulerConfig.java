package com.dinoroyale.matchservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 对局周期任务的线程池：驱动 tick、缩圈插值、缩圈伤害共用。
 * 线程数由 scheduler.clock.core-pool-size 控制，守护线程。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.core-pool-size:3}")
    private int corePoolSize;

    @Bean(name = "matchTickExecutor")
    public ScheduledThreadPoolExecutor matchTickExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "match-tick-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(Math.max(1, corePoolSize), tf, new ThreadPoolExecutor.DiscardPolicy());
        // 定时任务 cancel 后，调度队列里干净地移除
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
