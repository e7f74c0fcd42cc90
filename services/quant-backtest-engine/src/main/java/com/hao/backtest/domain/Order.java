package com.hao.backtest.domain;

import lombok.Value;
import org.springframework.util.Assert;

import java.time.LocalDate;

/**
 * 委托单
 * <p>
 * 由决策策略生成，仅被校验器和引擎消费一次，不单独持久化。
 *
 * @author hli
 * @date 2026-03-03
 */
@Value
public class Order {

    String symbol;

    OrderSide side;

    /**
     * 委托数量（股）
     */
    long quantity;

    LocalDate requestedDate;

    public Order(String symbol, OrderSide side, long quantity, LocalDate requestedDate) {
        Assert.hasText(symbol, "symbol must not be empty");
        Assert.notNull(side, "side must not be null");
        Assert.isTrue(quantity > 0, "quantity must be positive");
        this.symbol = symbol;
        this.side = side;
        this.quantity = quantity;
        this.requestedDate = requestedDate;
    }

    public static Order buy(String symbol, long quantity, LocalDate requestedDate) {
        return new Order(symbol, OrderSide.BUY, quantity, requestedDate);
    }

    public static Order sell(String symbol, long quantity, LocalDate requestedDate) {
        return new Order(symbol, OrderSide.SELL, quantity, requestedDate);
    }

    public boolean isBuy() {
        return side == OrderSide.BUY;
    }
}
