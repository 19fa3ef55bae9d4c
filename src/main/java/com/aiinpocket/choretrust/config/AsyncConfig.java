package com.aiinpocket.choretrust.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 非同步任務配置。
 *
 * <p>{@code notificationExecutor} 專門用於通知分發（審核結果、徽章、救贖加成），
 * 通知管道回應緩慢時不會拖住審核請求的執行緒。
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * 通知分發執行緒池。
     * 核心 2 線程 / 最大 4 線程，隊列容量 100；滿載時由呼叫端執行緒自行處理。
     */
    @Bean
    public TaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
