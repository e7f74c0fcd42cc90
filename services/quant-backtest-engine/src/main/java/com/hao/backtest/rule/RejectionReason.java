package com.hao.backtest.rule;

import lombok.Getter;

/**
 * 规则拒单原因码
 * <p>
 * 调用方按枚举判断，不依赖描述文本。
 *
 * @author hli
 * @date 2026-03-03
 */
@Getter
public enum RejectionReason {

    SUSPENDED("R001", "停牌或数据缺失，禁止交易"),

    LIMIT_BAND("R002", "涨停禁止买入 / 跌停禁止卖出"),

    LOT_SIZE("R003", "买入数量须为最小交易单位整数倍"),

    SETTLEMENT("R004", "T+1 可卖数量不足");

    private final String code;
    private final String description;

    RejectionReason(String code, String description) {
        this.code = code;
        this.description = description;
    }
}
