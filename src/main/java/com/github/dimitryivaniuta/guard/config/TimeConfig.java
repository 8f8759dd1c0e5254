package com.github.dimitryivaniuta.guard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Time sources shared by the guard: an injectable clock (breaker timers, entry timestamps) and a
 * small scheduler for queue wait timeouts and upstream request timeouts.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService guardScheduler() {
        CustomizableThreadFactory tf = new CustomizableThreadFactory("upstream-guard-timer-");
        tf.setDaemon(true);
        return Executors.newScheduledThreadPool(2, tf);
    }
}
