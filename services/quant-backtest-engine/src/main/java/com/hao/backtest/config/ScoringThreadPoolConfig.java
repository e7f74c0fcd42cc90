package com.hao.backtest.config;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 共识评分线程池配置
 *
 * 设计目的：
 * 1. 同一交易日的股票池评分互不依赖，使用专用线程池并行计算。
 * 2. 回放主循环本身保持单线程，不使用该线程池。
 *
 * @author hli
 * @date 2026-03-07
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ScoringThreadPoolConfig {

    private static final int CPU_CORES = Runtime.getRuntime().availableProcessors();

    private final BacktestProperties properties;

    private ThreadPoolTaskExecutor scoringExecutor;

    /**
     * 评分线程池
     * <p>
     * 评分为纯 CPU 计算，核心线程数默认取 CPU 核数，最大线程数为其 2 倍。
     *
     * @return ThreadPoolTaskExecutor 评分专用线程池
     */
    @Bean("scoringExecutor")
    public ThreadPoolTaskExecutor scoringExecutor() {
        BacktestProperties.ScoringPool pool = properties.getScoringPool();
        int corePoolSize = pool.getCorePoolSize() > 0 ? pool.getCorePoolSize() : CPU_CORES;
        int maxPoolSize = Math.max(corePoolSize, pool.getMaxPoolSize() > 0 ? pool.getMaxPoolSize() : CPU_CORES * 2);
        log.info("初始化评分线程池|Init_scoring_thread_pool,cpuCores={}", CPU_CORES);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());

        // 线程名称前缀：便于日志追踪
        executor.setThreadNamePrefix("scoring-");
        executor.setAllowCoreThreadTimeOut(true);

        // 拒绝策略：调用者运行，队列满时由回放主线程直接评分，不丢任务
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();
        this.scoringExecutor = executor;

        log.info("评分线程池初始化完成|Scoring_thread_pool_ready,coreSize={},maxSize={},queueSize={}",
                corePoolSize, maxPoolSize, pool.getQueueCapacity());
        return executor;
    }

    /**
     * 应用关闭时清理线程池
     */
    @PreDestroy
    public void destroy() {
        if (scoringExecutor != null) {
            log.info("开始关闭评分线程池|Shutdown_scoring_pool");
            try {
                scoringExecutor.shutdown();
                if (!scoringExecutor.getThreadPoolExecutor().awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("评分线程池关闭超时_强制关闭|Scoring_pool_timeout_force_shutdown");
                    scoringExecutor.getThreadPoolExecutor().shutdownNow();
                }
                log.info("评分线程池已关闭|Scoring_pool_shutdown_success");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("评分线程池关闭被中断|Scoring_pool_shutdown_interrupted", e);
            }
        }
    }
}
