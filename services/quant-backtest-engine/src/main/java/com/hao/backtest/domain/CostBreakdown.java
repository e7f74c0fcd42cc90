package com.hao.backtest.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 单笔成交的费用明细
 * <p>
 * 各项费用均已按 0.01 元取整后再汇总。滑点已体现在成交价中，
 * 因此 netCashDelta = ±notional − commission − stampDuty − transferFee。
 *
 * @author hli
 * @date 2026-03-03
 */
@Value
@Builder
public class CostBreakdown {

    /**
     * 参考价（滑点前）
     */
    BigDecimal referencePrice;

    /**
     * 成交价（滑点后）
     */
    BigDecimal fillPrice;

    /**
     * 成交金额 = 成交价 × 数量
     */
    BigDecimal notional;

    BigDecimal commission;

    BigDecimal stampDuty;

    BigDecimal transferFee;

    BigDecimal slippage;

    /**
     * 总成本 = 佣金 + 印花税 + 过户费 + 滑点
     */
    BigDecimal totalCost;

    /**
     * 现金变动：买入为负，卖出为正
     */
    BigDecimal netCashDelta;
}
