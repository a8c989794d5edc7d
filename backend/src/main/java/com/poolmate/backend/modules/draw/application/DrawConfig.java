package com.poolmate.backend.modules.draw.application;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableScheduling
public class DrawConfig {

    @Bean(name = "drawTaskScheduler")
    public ThreadPoolTaskScheduler drawTaskScheduler(DrawProperties drawProperties, Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(drawProperties.schedulerPoolSize());
        scheduler.setThreadNamePrefix("draw-");
        scheduler.setClock(clock);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
