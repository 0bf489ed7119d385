package net.shelfwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Shelfwatch: scans storefront product pages and alerts merchants about broken purchase flows.
 */
@SpringBootApplication
@EnableScheduling
public class ShelfwatchApplication {

    private static final int SCHEDULER_POOL_SIZE = 2;
    private static final int SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String SCHEDULER_THREAD_PREFIX = "ShelfwatchScheduler-";

    public static void main(String[] args) {
        SpringApplication.run(ShelfwatchApplication.class, args);
    }

    /**
     * Runs the daily sweep cron and delayed confirmation rescans.
     *
     * @return application task scheduler used by Spring scheduling infrastructure
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }
}
