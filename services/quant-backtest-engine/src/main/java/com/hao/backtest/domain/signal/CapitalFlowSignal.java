package com.hao.backtest.domain.signal;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 资金面原始指标
 * <p>
 * 北向资金净流入与融资净买入相互独立，任一存在即视为资金面有数据。
 *
 * @author hli
 * @date 2026-03-03
 */
public record CapitalFlowSignal(Optional<BigDecimal> northboundNetInflow,
                                Optional<BigDecimal> marginNetBuy) {

    public CapitalFlowSignal {
        northboundNetInflow = northboundNetInflow == null ? Optional.empty() : northboundNetInflow;
        marginNetBuy = marginNetBuy == null ? Optional.empty() : marginNetBuy;
        if (northboundNetInflow.isEmpty() && marginNetBuy.isEmpty()) {
            throw new IllegalArgumentException("capital flow signal requires at least one input");
        }
    }

    /**
     * 由可空原始值构造，两项都为空时返回 empty
     */
    public static Optional<CapitalFlowSignal> of(BigDecimal northboundNetInflow, BigDecimal marginNetBuy) {
        if (northboundNetInflow == null && marginNetBuy == null) {
            return Optional.empty();
        }
        return Optional.of(new CapitalFlowSignal(Optional.ofNullable(northboundNetInflow), Optional.ofNullable(marginNetBuy)));
    }
}
