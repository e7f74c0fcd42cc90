package com.hao.backtest.engine;

import com.hao.backtest.domain.EquityPoint;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * 单个交易日的汇总结果
 *
 * @author hli
 * @date 2026-03-06
 */
@Value
public class DayOutcome {

    LocalDate tradeDate;

    List<OrderOutcome> orderOutcomes;

    EquityPoint equityPoint;

    public long count(OrderStatus status) {
        return orderOutcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
