package com.hao.backtest.engine;

import com.hao.backtest.domain.Order;
import com.hao.backtest.domain.Trade;
import com.hao.backtest.rule.RejectionReason;
import com.hao.backtest.rule.ValidationResult;
import lombok.Value;

/**
 * 单笔委托的处理结果
 *
 * @author hli
 * @date 2026-03-06
 */
@Value
public class OrderOutcome {

    Order order;

    OrderStatus status;

    RejectionReason rejectionReason;

    ExecutionFailureReason failureReason;

    String detail;

    Trade trade;

    public static OrderOutcome executed(Order order, Trade trade) {
        return new OrderOutcome(order, OrderStatus.EXECUTED, null, null, null, trade);
    }

    public static OrderOutcome rejected(Order order, ValidationResult validation) {
        return new OrderOutcome(order, OrderStatus.REJECTED, validation.reason(), null, validation.detail(), null);
    }

    public static OrderOutcome failed(Order order, ExecutionFailureReason reason, String detail) {
        return new OrderOutcome(order, OrderStatus.FAILED, null, reason, detail, null);
    }
}
