package com.hao.backtest.engine;

import lombok.Getter;

/**
 * 成交失败原因（通过规则校验、但在成交时复核失败）
 *
 * @author hli
 * @date 2026-03-06
 */
@Getter
public enum ExecutionFailureReason {

    INSUFFICIENT_FUNDS("E001", "可用资金不足"),

    INSUFFICIENT_LOTS("E002", "可卖持仓不足"),

    MAX_POSITIONS_REACHED("E003", "持仓数量已达上限");

    private final String code;
    private final String description;

    ExecutionFailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }
}
