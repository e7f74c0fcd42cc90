package com.hao.backtest.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 单个持仓的只读视图
 *
 * @author hli
 * @date 2026-03-04
 */
@Value
@Builder
public class PositionSnapshot {

    String symbol;

    long quantity;

    /**
     * 当前日期已结算可卖数量
     */
    long sellableQuantity;

    /**
     * 持仓均价（含买入费用），保留 4 位小数
     */
    BigDecimal averageCost;

    BigDecimal lastPrice;

    BigDecimal marketValue;

    BigDecimal unrealizedPnl;
}
