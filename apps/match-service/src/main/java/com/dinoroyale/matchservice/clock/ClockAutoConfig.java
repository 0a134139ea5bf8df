package com.dinoroyale.matchservice.clock;

import com.dinoroyale.matchservice.clock.scheduler.TickScheduler;
import com.dinoroyale.matchservice.clock.scheduler.TickSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 调度相关 Bean 的装配：把线程池与系统时钟注入到通用调度引擎中。
 *
 * 说明：
 *  - 线程池由 {@link ClockSchedulerConfig} 提供；
 *  - 这里不关心任何业务细节，只负责把基础设施拼起来。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public Clock matchClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TickScheduler tickScheduler(@Qualifier("matchTickExecutor") ScheduledThreadPoolExecutor matchTickExecutor,
                                       Clock matchClock) {
        return new TickSchedulerImpl(matchTickExecutor, matchClock); // 纯引擎，无业务逻辑
    }
}
