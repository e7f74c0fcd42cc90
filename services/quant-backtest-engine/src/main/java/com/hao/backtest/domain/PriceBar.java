package com.hao.backtest.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 日线行情
 * <p>
 * 停牌 / 数据缺失的日线满足 open = high = low = close = previousClose 且 volume = 0，
 * 估值时使用前值填充价，永远不会出现空价格或零价格。
 *
 * @author hli
 * @date 2026-03-03
 */
@Value
@Builder(toBuilder = true)
public class PriceBar {

    String symbol;

    LocalDate tradeDate;

    BigDecimal open;

    BigDecimal high;

    BigDecimal low;

    BigDecimal close;

    long volume;

    /**
     * 成交额（元）
     */
    BigDecimal amount;

    BigDecimal previousClose;

    BarStatus status;

    /**
     * 停牌原因，可为空
     */
    String suspensionReason;

    public boolean isHalted() {
        return status != null && status.isHalted();
    }

    /**
     * 构造前值填充的日线（停牌或数据缺失）
     *
     * @param symbol         证券代码
     * @param tradeDate      交易日
     * @param carriedPrice   前值价格（最近一次收盘价）
     * @param status         SUSPENDED 或 DATA_MISSING
     * @param reason         原因描述
     * @return OHLC 与前收相等、成交量为 0 的日线
     */
    public static PriceBar carriedForward(String symbol, LocalDate tradeDate, BigDecimal carriedPrice,
                                          BarStatus status, String reason) {
        if (status == null || !status.isHalted()) {
            throw new IllegalArgumentException("carried-forward bar requires a halted status: " + status);
        }
        return PriceBar.builder()
                .symbol(symbol)
                .tradeDate(tradeDate)
                .open(carriedPrice)
                .high(carriedPrice)
                .low(carriedPrice)
                .close(carriedPrice)
                .previousClose(carriedPrice)
                .volume(0L)
                .amount(BigDecimal.ZERO)
                .status(status)
                .suspensionReason(reason)
                .build();
    }
}
