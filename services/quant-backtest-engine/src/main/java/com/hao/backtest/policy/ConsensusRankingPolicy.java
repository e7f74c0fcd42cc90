package com.hao.backtest.policy;

import com.hao.backtest.consensus.ConsensusScore;
import com.hao.backtest.domain.Order;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.feed.DecisionPolicy;
import com.hao.backtest.feed.PriceFeed;
import com.hao.backtest.ledger.PortfolioSnapshot;
import com.hao.backtest.ledger.PositionSnapshot;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 共识排名决策策略（内置示例）
 *
 * 规则：
 * 1. 卖出：持仓标的当日共识分低于退出分（无评分按 0 分）时，卖出全部可卖数量。
 * 2. 买入：按排名依次选取总分与完整度达标、且未持仓的标的，补足目标持仓数；
 *    每个空位分得等额现金预算，按当日收盘价预留成本缓冲后向下取整到整手。
 *
 * 价格读取经由回测引擎提供的因果视图。
 *
 * @author hli
 * @date 2026-03-07
 */
@Slf4j
public class ConsensusRankingPolicy implements DecisionPolicy {

    private final PriceFeed marketData;

    private final Settings settings;

    public ConsensusRankingPolicy(PriceFeed marketData, Settings settings) {
        Assert.notNull(marketData, "PriceFeed must not be null");
        Assert.notNull(settings, "Settings must not be null");
        this.marketData = marketData;
        this.settings = settings;
    }

    @Override
    public List<Order> proposeOrders(LocalDate currentDate, PortfolioSnapshot snapshot, List<ConsensusScore> scores) {
        Map<String, ConsensusScore> bySymbol = scores.stream()
                .collect(Collectors.toMap(ConsensusScore::getSymbol, Function.identity(), (a, b) -> a));
        List<Order> orders = new ArrayList<>();

        // 卖出：评分跌破退出线
        Set<String> exiting = new HashSet<>();
        for (PositionSnapshot position : snapshot.getPositions()) {
            int score = Optional.ofNullable(bySymbol.get(position.getSymbol())).map(ConsensusScore::getTotalScore).orElse(0);
            if (score < settings.getExitScore() && position.getSellableQuantity() > 0) {
                orders.add(Order.sell(position.getSymbol(), position.getSellableQuantity(), currentDate));
                exiting.add(position.getSymbol());
            }
        }

        // 买入：补足目标持仓数
        int openSlots = settings.getTargetPositions() - (snapshot.positionCount() - exiting.size());
        if (openSlots <= 0) {
            return orders;
        }
        BigDecimal budget = snapshot.getCash().divide(BigDecimal.valueOf(openSlots), 2, RoundingMode.DOWN);
        for (ConsensusScore score : scores) {
            if (openSlots <= 0) {
                break;
            }
            if (score.getTotalScore() < settings.getEntryScore()
                    || score.getCompleteness() < settings.getMinCompleteness()
                    || snapshot.holds(score.getSymbol())) {
                continue;
            }
            Optional<PriceBar> bar = marketData.getPriceBar(score.getSymbol(), currentDate);
            if (bar.isEmpty() || bar.get().isHalted()) {
                continue;
            }
            long quantity = affordableQuantity(budget, bar.get().getClose());
            if (quantity > 0) {
                orders.add(Order.buy(score.getSymbol(), quantity, currentDate));
                openSlots--;
            }
        }
        log.debug("策略委托生成|Policy_orders_proposed,date={},orders={}", currentDate, orders.size());
        return orders;
    }

    long affordableQuantity(BigDecimal budget, BigDecimal price) {
        BigDecimal bufferedPrice = price.multiply(BigDecimal.ONE.add(settings.getCostBuffer()));
        long shares = budget.divide(bufferedPrice, 0, RoundingMode.DOWN).longValue();
        return shares / settings.getLotSize() * settings.getLotSize();
    }

    /**
     * 策略参数
     */
    @Value
    @Builder
    public static class Settings {

        @Builder.Default
        int entryScore = 60;

        @Builder.Default
        double minCompleteness = 0.5;

        @Builder.Default
        int exitScore = 30;

        @Builder.Default
        int targetPositions = 5;

        @Builder.Default
        long lotSize = 100L;

        /**
         * 预留的滑点与费用缓冲比例
         */
        @Builder.Default
        BigDecimal costBuffer = new BigDecimal("0.01");
    }
}
