package com.hao.backtest.ledger;

import com.hao.backtest.domain.CostBreakdown;
import com.hao.backtest.domain.Lot;
import com.hao.backtest.domain.Order;
import com.hao.backtest.domain.OrderSide;
import com.hao.backtest.domain.Trade;
import com.hao.backtest.rule.TradingRuleSet;
import constants.NumberFormatConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * 组合账本
 *
 * 设计目的：
 * 1. 维护现金、按取得日期排队的持仓批次和只追加的成交记录。
 * 2. 仅由回测引擎单线程写入，每笔成交原子地更新账本后才处理下一笔委托。
 *
 * 实现思路：
 * - 每个标的一个 Deque，买入追加到队尾，卖出按先进先出（取得日期升序）消耗已结算批次。
 * - 部分卖出时拆分批次，成本按股数比例分摊，剩余成本保留在批次中。
 * - 已实现盈亏 = 卖出净收入 − 被消耗批次成本。
 *
 * 线程安全说明：
 * - 非线程安全，实例封闭在单次回测运行中。
 *
 * @author hli
 * @date 2026-03-04
 */
@Slf4j
public class PortfolioLedger {

    private static final int AVG_COST_SCALE = 4;

    private final BigDecimal initialCapital;

    private final TradingRuleSet rules;

    private BigDecimal cash;

    /**
     * 代码 → 批次队列（取得日期升序）
     */
    private final TreeMap<String, Deque<Lot>> holdings = new TreeMap<>();

    private final List<Trade> trades = new ArrayList<>();

    private long tradeSequence = 0L;

    public PortfolioLedger(BigDecimal initialCapital, TradingRuleSet rules) {
        Assert.isTrue(initialCapital != null && initialCapital.signum() > 0, "initialCapital must be positive");
        Assert.notNull(rules, "TradingRuleSet must not be null");
        this.initialCapital = initialCapital.setScale(NumberFormatConstants.PRICE_SCALE, NumberFormatConstants.PRICE_ROUNDING);
        this.cash = this.initialCapital;
        this.rules = rules;
    }

    // ==================== 查询 ====================

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    public BigDecimal getCash() {
        return cash;
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<Lot> lotsOf(String symbol) {
        Deque<Lot> lots = holdings.get(symbol);
        return lots == null ? List.of() : List.copyOf(lots);
    }

    public NavigableSet<String> heldSymbols() {
        return Collections.unmodifiableNavigableSet(holdings.navigableKeySet());
    }

    public boolean holds(String symbol) {
        return holdings.containsKey(symbol);
    }

    public int positionCount() {
        return holdings.size();
    }

    public long heldQuantity(String symbol) {
        Deque<Lot> lots = holdings.get(symbol);
        return lots == null ? 0L : lots.stream().mapToLong(Lot::getQuantity).sum();
    }

    public long sellableQuantity(String symbol, LocalDate currentDate) {
        Deque<Lot> lots = holdings.get(symbol);
        if (lots == null) {
            return 0L;
        }
        return lots.stream()
                .filter(lot -> rules.isSettled(lot.getAcquisitionDate(), currentDate))
                .mapToLong(Lot::getQuantity)
                .sum();
    }

    // ==================== 记账 ====================

    /**
     * 记录买入成交
     *
     * @throws IllegalStateException 现金不足（引擎应在调用前复核）
     */
    public Trade applyBuy(Order order, CostBreakdown costs, LocalDate tradeDate) {
        Assert.isTrue(order.getSide() == OrderSide.BUY, "order must be a buy");
        BigDecimal required = costs.getNetCashDelta().negate();
        if (required.compareTo(cash) > 0) {
            throw new IllegalStateException("insufficient cash: required=" + required + ", available=" + cash);
        }
        cash = cash.subtract(required);
        holdings.computeIfAbsent(order.getSymbol(), k -> new ArrayDeque<>())
                .addLast(new Lot(order.getSymbol(), order.getQuantity(), tradeDate, required));

        Trade trade = record(order, costs, tradeDate, null);
        log.debug("买入记账|Ledger_buy,date={},symbol={},qty={},fill={},cash={}",
                tradeDate, order.getSymbol(), order.getQuantity(), costs.getFillPrice(), cash);
        return trade;
    }

    /**
     * 记录卖出成交，先进先出消耗已结算批次
     *
     * @throws IllegalStateException 可卖数量不足（引擎应在调用前复核）
     */
    public Trade applySell(Order order, CostBreakdown costs, LocalDate tradeDate) {
        Assert.isTrue(order.getSide() == OrderSide.SELL, "order must be a sell");
        long sellable = sellableQuantity(order.getSymbol(), tradeDate);
        if (sellable < order.getQuantity()) {
            throw new IllegalStateException("insufficient settled lots: sellable=" + sellable
                    + ", requested=" + order.getQuantity());
        }

        Deque<Lot> lots = holdings.get(order.getSymbol());
        long remaining = order.getQuantity();
        BigDecimal consumedCost = BigDecimal.ZERO;
        Deque<Lot> rebuilt = new ArrayDeque<>();
        Iterator<Lot> iterator = lots.iterator();
        while (iterator.hasNext()) {
            Lot lot = iterator.next();
            if (remaining == 0 || !rules.isSettled(lot.getAcquisitionDate(), tradeDate)) {
                rebuilt.addLast(lot);
                continue;
            }
            if (lot.getQuantity() <= remaining) {
                consumedCost = consumedCost.add(lot.getCostBasis());
                remaining -= lot.getQuantity();
            } else {
                Lot rest = lot.remainderAfter(remaining);
                consumedCost = consumedCost.add(lot.getCostBasis().subtract(rest.getCostBasis()));
                remaining = 0;
                rebuilt.addLast(rest);
            }
        }
        if (rebuilt.isEmpty()) {
            holdings.remove(order.getSymbol());
        } else {
            holdings.put(order.getSymbol(), rebuilt);
        }

        cash = cash.add(costs.getNetCashDelta());
        BigDecimal realizedPnl = costs.getNetCashDelta().subtract(consumedCost);
        Trade trade = record(order, costs, tradeDate, realizedPnl);
        log.debug("卖出记账|Ledger_sell,date={},symbol={},qty={},fill={},pnl={},cash={}",
                tradeDate, order.getSymbol(), order.getQuantity(), costs.getFillPrice(), realizedPnl, cash);
        return trade;
    }

    private Trade record(Order order, CostBreakdown costs, LocalDate tradeDate, BigDecimal realizedPnl) {
        Trade trade = Trade.builder()
                .tradeId(++tradeSequence)
                .symbol(order.getSymbol())
                .side(order.getSide())
                .tradeDate(tradeDate)
                .quantity(order.getQuantity())
                .fillPrice(costs.getFillPrice())
                .costs(costs)
                .netCashDelta(costs.getNetCashDelta())
                .realizedPnl(realizedPnl)
                .build();
        trades.add(trade);
        return trade;
    }

    // ==================== 估值 ====================

    /**
     * 按给定价格计算持仓市值
     *
     * @param prices 代码 → 估值价（停牌标的须传入前值填充价）
     */
    public BigDecimal marketValue(Map<String, BigDecimal> prices) {
        BigDecimal total = BigDecimal.ZERO;
        for (String symbol : holdings.keySet()) {
            BigDecimal price = priceOf(symbol, prices);
            total = total.add(price.multiply(BigDecimal.valueOf(heldQuantity(symbol))));
        }
        return total.setScale(NumberFormatConstants.PRICE_SCALE, NumberFormatConstants.PRICE_ROUNDING);
    }

    /**
     * 生成账户快照
     */
    public PortfolioSnapshot snapshot(LocalDate asOfDate, Map<String, BigDecimal> prices) {
        List<PositionSnapshot> positions = new ArrayList<>();
        for (Map.Entry<String, Deque<Lot>> entry : holdings.entrySet()) {
            String symbol = entry.getKey();
            long quantity = heldQuantity(symbol);
            BigDecimal cost = entry.getValue().stream().map(Lot::getCostBasis).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal price = priceOf(symbol, prices);
            BigDecimal value = price.multiply(BigDecimal.valueOf(quantity))
                    .setScale(NumberFormatConstants.PRICE_SCALE, NumberFormatConstants.PRICE_ROUNDING);
            positions.add(PositionSnapshot.builder()
                    .symbol(symbol)
                    .quantity(quantity)
                    .sellableQuantity(sellableQuantity(symbol, asOfDate))
                    .averageCost(cost.divide(BigDecimal.valueOf(quantity), AVG_COST_SCALE, RoundingMode.HALF_UP))
                    .lastPrice(price)
                    .marketValue(value)
                    .unrealizedPnl(value.subtract(cost))
                    .build());
        }
        BigDecimal marketValue = positions.stream().map(PositionSnapshot::getMarketValue).reduce(BigDecimal.ZERO, BigDecimal::add);
        return PortfolioSnapshot.builder()
                .asOfDate(asOfDate)
                .cash(cash)
                .marketValue(marketValue)
                .totalValue(cash.add(marketValue))
                .positions(List.copyOf(positions))
                .build();
    }

    private BigDecimal priceOf(String symbol, Map<String, BigDecimal> prices) {
        BigDecimal price = prices.get(symbol);
        if (price == null) {
            // 无任何历史价格时按成本估值
            Deque<Lot> lots = holdings.get(symbol);
            BigDecimal cost = lots.stream().map(Lot::getCostBasis).reduce(BigDecimal.ZERO, BigDecimal::add);
            return cost.divide(BigDecimal.valueOf(heldQuantity(symbol)), NumberFormatConstants.PRICE_SCALE,
                    NumberFormatConstants.PRICE_ROUNDING);
        }
        return price;
    }
}
