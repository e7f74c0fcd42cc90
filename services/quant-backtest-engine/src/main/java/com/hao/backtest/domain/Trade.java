package com.hao.backtest.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 成交记录（只追加）
 *
 * @author hli
 * @date 2026-03-03
 */
@Value
@Builder
public class Trade {

    long tradeId;

    String symbol;

    OrderSide side;

    LocalDate tradeDate;

    long quantity;

    BigDecimal fillPrice;

    CostBreakdown costs;

    BigDecimal netCashDelta;

    /**
     * 已实现盈亏，仅卖出成交有值：卖出净收入 − 对应批次成本
     */
    BigDecimal realizedPnl;

    public boolean isSell() {
        return side == OrderSide.SELL;
    }
}
