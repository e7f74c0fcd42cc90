package com.hao.backtest.metrics;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 回测绩效指标
 * <p>
 * 比例类指标以小数表示（0.05 即 5%）。无法定义的指标（空序列、零波动、零交易）为 null。
 *
 * @author hli
 * @date 2026-03-06
 */
@Value
@Builder
public class PerformanceMetrics {

    int tradingDays;

    BigDecimal initialCapital;

    BigDecimal finalValue;

    Double totalReturn;

    Double annualizedReturn;

    /**
     * 最大回撤，非正数，如 -0.12
     */
    Double maxDrawdown;

    /**
     * 年化波动率
     */
    Double annualizedVolatility;

    Double sharpeRatio;

    /**
     * 胜率：已实现盈亏为正的卖出成交占比
     */
    Double winRate;

    int roundTrips;

    int winningTrades;

    int buyCount;

    int sellCount;

    BigDecimal totalCommission;

    BigDecimal totalStampDuty;

    BigDecimal totalTransferFee;

    BigDecimal totalSlippage;

    BigDecimal realizedPnl;
}
