package com.hao.backtest.domain.signal;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 技术面原始指标
 * <p>
 * 整组存在或整组缺失，存在时各字段均不为空。
 *
 * @param close              当日收盘价
 * @param high52Week         近 52 周最高价
 * @param shortMovingAverage 短期均线
 * @param longMovingAverage  长期均线
 * @author hli
 * @date 2026-03-03
 */
public record TechnicalSignal(BigDecimal close,
                              BigDecimal high52Week,
                              BigDecimal shortMovingAverage,
                              BigDecimal longMovingAverage) {

    public TechnicalSignal {
        Objects.requireNonNull(close, "close");
        Objects.requireNonNull(high52Week, "high52Week");
        Objects.requireNonNull(shortMovingAverage, "shortMovingAverage");
        Objects.requireNonNull(longMovingAverage, "longMovingAverage");
    }
}
