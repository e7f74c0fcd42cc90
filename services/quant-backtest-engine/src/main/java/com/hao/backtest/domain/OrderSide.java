package com.hao.backtest.domain;

/**
 * 买卖方向
 *
 * @author hli
 * @date 2026-03-03
 */
public enum OrderSide {
    BUY,
    SELL
}
