package com.hao.backtest.runner;

import com.hao.backtest.engine.BacktestResult;
import com.hao.backtest.engine.LookAheadViolationException;
import com.hao.backtest.metrics.PerformanceMetrics;
import com.hao.backtest.service.BacktestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 启动即回测任务
 * <p>
 * 仅在 backtest.enabled=true 时装配。未来数据访问属于回测失效，异常向上抛出使进程以失败退出。
 *
 * @author hli
 * @date 2026-03-09
 */
@Slf4j
@Component
@Order(100)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "backtest", name = "enabled", havingValue = "true")
public class BacktestJobRunner implements CommandLineRunner {

    private final BacktestService backtestService;

    @Override
    public void run(String... args) {
        log.info("========== 配置回测开始|Configured_backtest_start ==========");
        try {
            BacktestResult result = backtestService.runConfigured();
            PerformanceMetrics metrics = result.getMetrics();
            log.info("========== 配置回测完成|Configured_backtest_done,runId={},status={},trades={},totalReturn={},sharpe={},maxDrawdown={} ==========",
                    result.getRunId(), result.getStatus(), result.getTrades().size(),
                    metrics == null ? null : metrics.getTotalReturn(),
                    metrics == null ? null : metrics.getSharpeRatio(),
                    metrics == null ? null : metrics.getMaxDrawdown());
        } catch (LookAheadViolationException e) {
            log.error("回测因未来数据访问失效|Backtest_invalidated_by_look_ahead,resource={},requested={},current={}",
                    e.getResource(), e.getRequestedDate(), e.getCurrentDate());
            throw e;
        }
    }
}
