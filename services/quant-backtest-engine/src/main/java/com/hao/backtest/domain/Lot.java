package com.hao.backtest.domain;

import constants.NumberFormatConstants;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 持仓批次
 * <p>
 * 每笔买入成交形成一个批次，记录取得日期和含费成本。T+1 规则按批次判断可卖。
 *
 * @author hli
 * @date 2026-03-03
 */
@Value
public class Lot {

    String symbol;

    long quantity;

    LocalDate acquisitionDate;

    /**
     * 批次总成本（成交金额 + 买入费用）
     */
    BigDecimal costBasis;

    /**
     * 卖出部分股数后的剩余批次，成本按股数比例分摊
     *
     * @param soldQuantity 本批次卖出股数，须小于批次股数
     * @return 剩余批次
     */
    public Lot remainderAfter(long soldQuantity) {
        if (soldQuantity <= 0 || soldQuantity >= quantity) {
            throw new IllegalArgumentException("partial sale must be within (0, " + quantity + "): " + soldQuantity);
        }
        long remaining = quantity - soldQuantity;
        BigDecimal remainingCost = costBasis
                .multiply(BigDecimal.valueOf(remaining))
                .divide(BigDecimal.valueOf(quantity), NumberFormatConstants.PRICE_SCALE, NumberFormatConstants.PRICE_ROUNDING);
        return new Lot(symbol, remaining, acquisitionDate, remainingCost);
    }
}
