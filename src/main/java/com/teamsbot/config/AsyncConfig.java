package com.teamsbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the long-running per-bot tasks. Each pool hands out a dedicated thread per
 * task (no queue), so a pool at capacity rejects new bots instead of starving running ones.
 */
@Configuration
public class AsyncConfig {

    @Value("${bot.max-concurrent-bots:10}")
    private int maxConcurrentBots;

    /**
     * Runs one state-machine loop per bot.
     */
    @Bean(name = "botSessionExecutor")
    public ThreadPoolTaskExecutor botSessionExecutor() {
        return dedicatedThreads("bot-", maxConcurrentBots, maxConcurrentBots);
    }

    /**
     * Audio sender and fragment pump for each transcription stream (two threads per bot).
     */
    @Bean(name = "transcriptionExecutor")
    public ThreadPoolTaskExecutor transcriptionExecutor() {
        return dedicatedThreads("stt-", 2, maxConcurrentBots * 2);
    }

    /**
     * One Playwright driver thread per bot. Playwright objects must stay on the thread that created them.
     */
    @Bean(name = "meetingExecutor")
    public ThreadPoolTaskExecutor meetingExecutor() {
        return dedicatedThreads("meeting-", 1, maxConcurrentBots);
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(2, maxConcurrentBots / 2));
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private ThreadPoolTaskExecutor dedicatedThreads(String prefix, int core, int max) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(core, max));
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
