package com.seekr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 线程池与时钟
 *
 * @author seekr
 */
@Configuration
public class ExecutorConfig {

    /**
     * 检索阶段(查询嵌入、向量召回)执行器,调用方在截止时间到达后取消任务。
     * 饱和时直接拒绝,不在调用线程上执行
     */
    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("retrieval-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 批量嵌入执行器
     */
    @Bean(name = "embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor(RAGConfig ragConfig) {
        int workers = ragConfig.getEmbedding().getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("embedding-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
