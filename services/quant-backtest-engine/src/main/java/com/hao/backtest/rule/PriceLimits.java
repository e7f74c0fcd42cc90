package com.hao.backtest.rule;

import java.math.BigDecimal;

/**
 * 涨跌停价（派生值，不落盘）
 *
 * @author hli
 * @date 2026-03-03
 */
public record PriceLimits(BigDecimal limitUp, BigDecimal limitDown) {

    /**
     * 价格是否触及涨停（含等于）
     */
    public boolean isAtOrAboveLimitUp(BigDecimal price) {
        return price.compareTo(limitUp) >= 0;
    }

    /**
     * 价格是否触及跌停（含等于）
     */
    public boolean isAtOrBelowLimitDown(BigDecimal price) {
        return price.compareTo(limitDown) <= 0;
    }
}
