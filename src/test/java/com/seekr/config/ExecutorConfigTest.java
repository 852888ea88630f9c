package com.seekr.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorConfigTest {

    private final ExecutorConfig executorConfig = new ExecutorConfig();

    @Test
    void retrievalExecutorRejectsWhenSaturated() {
        ThreadPoolTaskExecutor executor = executorConfig.retrievalExecutor();
        try {
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void embeddingExecutorUsesConfiguredWorkers() {
        RAGConfig ragConfig = new RAGConfig();
        ragConfig.getEmbedding().setWorkers(3);
        ThreadPoolTaskExecutor executor = executorConfig.embeddingExecutor(ragConfig);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(3);
            assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        } finally {
            executor.shutdown();
        }
    }
}
