package com.hao.backtest.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 每日净值点
 *
 * @param tradeDate   交易日
 * @param cash        收盘现金
 * @param marketValue 持仓市值（停牌按前值估值）
 * @param totalValue  总资产
 * @param dailyReturn 日收益率，首日相对初始资金
 * @author hli
 * @date 2026-03-03
 */
public record EquityPoint(LocalDate tradeDate,
                          BigDecimal cash,
                          BigDecimal marketValue,
                          BigDecimal totalValue,
                          double dailyReturn) {
}
