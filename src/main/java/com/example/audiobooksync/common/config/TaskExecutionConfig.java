package com.example.audiobooksync.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService importJobExecutor;
    private ScheduledExecutorService writeBackScheduler;

    @Bean
    public ExecutorService importJobExecutor(AppImportProperties appImportProperties) {
        int core = Math.max(1, appImportProperties.getWorkerThreads());
        int queueSize = Math.max(1, appImportProperties.getQueueCapacity());
        this.importJobExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("import-job-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.importJobExecutor;
    }

    @Bean
    public ScheduledExecutorService writeBackScheduler() {
        this.writeBackScheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("write-back-"));
        return this.writeBackScheduler;
    }

    @PreDestroy
    public void shutdown() {
        if (importJobExecutor != null) {
            importJobExecutor.shutdown();
        }
        if (writeBackScheduler != null) {
            writeBackScheduler.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
