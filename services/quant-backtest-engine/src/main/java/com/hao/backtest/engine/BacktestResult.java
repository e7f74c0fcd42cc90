package com.hao.backtest.engine;

import com.hao.backtest.consensus.ConsensusScore;
import com.hao.backtest.domain.EquityPoint;
import com.hao.backtest.domain.Trade;
import com.hao.backtest.metrics.PerformanceMetrics;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 回测结果（只读）
 * <p>
 * 对外暴露净值序列、成交记录与共识评分历史，供报告等下游使用。
 *
 * @author hli
 * @date 2026-03-06
 */
@Value
@Builder
public class BacktestResult {

    String runId;

    RunStatus status;

    LocalDate startDate;

    LocalDate endDate;

    BigDecimal initialCapital;

    BigDecimal finalCash;

    List<EquityPoint> equitySeries;

    List<Trade> trades;

    List<ConsensusScore> scoreHistory;

    List<DayOutcome> dayOutcomes;

    /**
     * 仅 COMPLETED 状态计算
     */
    PerformanceMetrics metrics;

    /**
     * INVALID 状态下的中止原因
     */
    String abortReason;

    public boolean isValid() {
        return status == RunStatus.COMPLETED;
    }
}
