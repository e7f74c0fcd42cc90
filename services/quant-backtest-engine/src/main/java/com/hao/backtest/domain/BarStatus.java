package com.hao.backtest.domain;

import lombok.Getter;

/**
 * 日线状态
 *
 * @author hli
 * @date 2026-03-03
 */
@Getter
public enum BarStatus {

    NORMAL("正常"),

    /**
     * 收盘价触及或超过涨停价
     */
    LIMIT_UP("涨停"),

    /**
     * 收盘价触及或低于跌停价
     */
    LIMIT_DOWN("跌停"),

    SUSPENDED("停牌"),

    /**
     * 数据缺失，按前收盘价填充估值
     */
    DATA_MISSING("数据缺失");

    private final String description;

    BarStatus(String description) {
        this.description = description;
    }

    /**
     * 停牌或数据缺失时不可交易
     */
    public boolean isHalted() {
        return this == SUSPENDED || this == DATA_MISSING;
    }
}
