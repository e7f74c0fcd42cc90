package com.hao.backtest.metrics;

import com.hao.backtest.domain.CostBreakdown;
import com.hao.backtest.domain.EquityPoint;
import com.hao.backtest.domain.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.function.Function;

/**
 * 绩效指标计算器
 *
 * 计算口径：
 * - 总收益率 = 期末总资产 / 初始资金 − 1
 * - 年化收益率 = (1 + 总收益率)^(252 / 交易日数) − 1
 * - 最大回撤 = min(总资产 / 历史峰值 − 1)，峰值以初始资金起算
 * - 夏普比率 = (年化收益率 − 无风险利率) / (日收益率总体标准差 × √252)
 * - 胜率 = 已实现盈亏为正的卖出笔数 / 卖出笔数
 *
 * 零交易日、零波动、零卖出均返回 null，不做除零。
 *
 * @author hli
 * @date 2026-03-06
 */
@Slf4j
public class MetricsCalculator {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    /**
     * 低于该值的标准差视为零波动
     */
    private static final double ZERO_VARIANCE_EPSILON = 1e-12;

    private final double riskFreeRate;

    public MetricsCalculator(double riskFreeRate) {
        this.riskFreeRate = riskFreeRate;
    }

    public double getRiskFreeRate() {
        return riskFreeRate;
    }

    public PerformanceMetrics calculate(BigDecimal initialCapital, List<EquityPoint> equitySeries, List<Trade> trades) {
        Assert.isTrue(initialCapital != null && initialCapital.signum() > 0, "initialCapital must be positive");
        List<EquityPoint> series = equitySeries == null ? List.of() : equitySeries;
        List<Trade> tradeLog = trades == null ? List.of() : trades;

        Double totalReturn = totalReturn(initialCapital, series);
        Double annualized = annualizedReturn(totalReturn, series.size());
        Double volatility = annualizedVolatility(series);
        Double sharpe = sharpeRatio(annualized, volatility);

        int sellCount = (int) tradeLog.stream().filter(Trade::isSell).count();
        int winning = (int) tradeLog.stream()
                .filter(Trade::isSell)
                .filter(t -> t.getRealizedPnl() != null && t.getRealizedPnl().signum() > 0)
                .count();

        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .tradingDays(series.size())
                .initialCapital(initialCapital)
                .finalValue(series.isEmpty() ? initialCapital : series.get(series.size() - 1).totalValue())
                .totalReturn(totalReturn)
                .annualizedReturn(annualized)
                .maxDrawdown(maxDrawdown(initialCapital, series))
                .annualizedVolatility(volatility)
                .sharpeRatio(sharpe)
                .winRate(sellCount == 0 ? null : (double) winning / sellCount)
                .roundTrips(sellCount)
                .winningTrades(winning)
                .buyCount(tradeLog.size() - sellCount)
                .sellCount(sellCount)
                .totalCommission(sum(tradeLog, CostBreakdown::getCommission))
                .totalStampDuty(sum(tradeLog, CostBreakdown::getStampDuty))
                .totalTransferFee(sum(tradeLog, CostBreakdown::getTransferFee))
                .totalSlippage(sum(tradeLog, CostBreakdown::getSlippage))
                .realizedPnl(tradeLog.stream()
                        .map(Trade::getRealizedPnl)
                        .filter(p -> p != null)
                        .reduce(BigDecimal.ZERO, BigDecimal::add))
                .build();

        log.info("绩效计算完成|Metrics_calculated,days={},totalReturn={},annualized={},maxDrawdown={},sharpe={},winRate={}",
                metrics.getTradingDays(), metrics.getTotalReturn(), metrics.getAnnualizedReturn(),
                metrics.getMaxDrawdown(), metrics.getSharpeRatio(), metrics.getWinRate());
        return metrics;
    }

    // ==================== 收益 ====================

    Double totalReturn(BigDecimal initialCapital, List<EquityPoint> series) {
        if (series.isEmpty()) {
            return null;
        }
        BigDecimal finalValue = series.get(series.size() - 1).totalValue();
        return finalValue.divide(initialCapital, MathContext.DECIMAL64).doubleValue() - 1.0;
    }

    Double annualizedReturn(Double totalReturn, int tradingDays) {
        if (totalReturn == null || tradingDays <= 0) {
            return null;
        }
        double growth = 1.0 + totalReturn;
        if (growth <= 0.0) {
            return -1.0;
        }
        return Math.pow(growth, (double) TRADING_DAYS_PER_YEAR / tradingDays) - 1.0;
    }

    // ==================== 风险 ====================

    Double maxDrawdown(BigDecimal initialCapital, List<EquityPoint> series) {
        if (series.isEmpty()) {
            return null;
        }
        double peak = initialCapital.doubleValue();
        double worst = 0.0;
        for (EquityPoint point : series) {
            double value = point.totalValue().doubleValue();
            peak = Math.max(peak, value);
            worst = Math.min(worst, value / peak - 1.0);
        }
        return worst;
    }

    Double annualizedVolatility(List<EquityPoint> series) {
        if (series.size() < 2) {
            return null;
        }
        double mean = series.stream().mapToDouble(EquityPoint::dailyReturn).average().orElse(0.0);
        double variance = series.stream()
                .mapToDouble(p -> (p.dailyReturn() - mean) * (p.dailyReturn() - mean))
                .sum() / series.size();
        double std = Math.sqrt(variance);
        if (Double.isNaN(std) || std < ZERO_VARIANCE_EPSILON) {
            return null;
        }
        return std * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    Double sharpeRatio(Double annualizedReturn, Double annualizedVolatility) {
        if (annualizedReturn == null || annualizedVolatility == null) {
            return null;
        }
        return (annualizedReturn - riskFreeRate) / annualizedVolatility;
    }

    private static BigDecimal sum(List<Trade> trades, Function<CostBreakdown, BigDecimal> field) {
        return trades.stream()
                .map(Trade::getCosts)
                .map(field)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
