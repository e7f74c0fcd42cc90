package com.hao.backtest.engine;

/**
 * 委托处理结果
 *
 * @author hli
 * @date 2026-03-06
 */
public enum OrderStatus {
    /**
     * 已成交
     */
    EXECUTED,
    /**
     * 被交易规则拒绝
     */
    REJECTED,
    /**
     * 通过规则校验但成交复核失败
     */
    FAILED
}
