package com.hao.backtest.engine;

import exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 回测运行参数
 *
 * @author hli
 * @date 2026-03-06
 */
@Value
@Builder(toBuilder = true)
public class BacktestRequest {

    /**
     * 运行编号，为空时由起止日期生成
     */
    String runId;

    BigDecimal initialCapital;

    /**
     * 最大持仓标的数
     */
    @Builder.Default
    int maxPositions = 5;

    /**
     * 参与评分的股票池
     */
    List<String> universe;

    /**
     * 升序交易日历，驱动回放循环
     */
    List<LocalDate> tradingDays;

    public String resolveRunId() {
        if (runId != null && !runId.isBlank()) {
            return runId;
        }
        return "BT-" + getStartDate() + "-" + getEndDate();
    }

    public LocalDate getStartDate() {
        return tradingDays == null || tradingDays.isEmpty() ? null : tradingDays.get(0);
    }

    public LocalDate getEndDate() {
        return tradingDays == null || tradingDays.isEmpty() ? null : tradingDays.get(tradingDays.size() - 1);
    }

    public BacktestRequest validate() {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new ConfigurationException("initialCapital must be positive: " + initialCapital);
        }
        if (maxPositions <= 0) {
            throw new ConfigurationException("maxPositions must be positive: " + maxPositions);
        }
        if (tradingDays == null || tradingDays.isEmpty()) {
            throw new ConfigurationException("tradingDays must not be empty");
        }
        for (int i = 1; i < tradingDays.size(); i++) {
            if (!tradingDays.get(i).isAfter(tradingDays.get(i - 1))) {
                throw new ConfigurationException("tradingDays must be strictly ascending at " + tradingDays.get(i));
            }
        }
        return this;
    }
}
