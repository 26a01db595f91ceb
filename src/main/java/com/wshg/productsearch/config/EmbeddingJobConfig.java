package com.wshg.productsearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 向量任务线程池与轮询调度。
 * 线程数限制对 Ollama 的并发请求，队列满时轮询器停止领取任务。
 */
@Configuration
@EnableScheduling
public class EmbeddingJobConfig {

    @Bean(name = "embeddingJobExecutor")
    public ThreadPoolTaskExecutor embeddingJobExecutor(ProductSearchProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, props.getJobWorkerThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(1, props.getJobQueueCapacity()));
        executor.setThreadNamePrefix("embedding-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
