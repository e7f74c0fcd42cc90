package com.hao.backtest.engine;

import com.hao.backtest.consensus.ConsensusScorer;
import com.hao.backtest.consensus.ConsensusThresholds;
import com.hao.backtest.cost.CostModel;
import com.hao.backtest.cost.CostRates;
import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.EquityPoint;
import com.hao.backtest.domain.Order;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.feed.DecisionPolicy;
import com.hao.backtest.feed.PriceFeed;
import com.hao.backtest.feed.memory.InMemoryInstrumentRegistry;
import com.hao.backtest.feed.memory.InMemoryPriceBarStore;
import com.hao.backtest.feed.memory.InMemorySignalStore;
import com.hao.backtest.metrics.MetricsCalculator;
import com.hao.backtest.rule.PriceLimitCalculator;
import com.hao.backtest.rule.RejectionReason;
import com.hao.backtest.rule.TradingRuleSet;
import com.hao.backtest.rule.TradingRuleValidator;
import exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 回测引擎端到端测试
 * <p>
 * 测试范围：
 * 1. 买入 / 卖出的现金流精确到分（滑点 1%，沪市主板）
 * 2. T+1、涨跌停、停牌拒绝
 * 3. 资金不足、持仓上限等成交失败
 * 4. 未来数据访问中止并返回 INVALID 部分结果
 * 5. 同输入重复运行结果一致
 *
 * @author hli
 * @date 2026-03-10
 */
@Slf4j
class BacktestEngineTest {

    private static final String MAIN = "600000.SH";
    private static final String STAR = "688001.SH";
    private static final LocalDate D1 = LocalDate.of(2024, 3, 4);
    private static final LocalDate D2 = LocalDate.of(2024, 3, 5);
    private static final LocalDate D3 = LocalDate.of(2024, 3, 6);
    private static final BigDecimal CAPITAL = new BigDecimal("1000000");

    private InMemoryInstrumentRegistry registry;
    private InMemoryPriceBarStore priceStore;
    private BacktestEngine engine;

    @BeforeEach
    void setUp() {
        registry = new InMemoryInstrumentRegistry();
        TradingRuleSet rules = TradingRuleSet.chinaAShare();
        priceStore = new InMemoryPriceBarStore(registry, new PriceLimitCalculator(rules));
        engine = BacktestEngine.builder()
                .instrumentFeed(registry)
                .priceFeed(priceStore)
                .signalFeed(new InMemorySignalStore())
                .validator(new TradingRuleValidator(rules))
                .costModel(new CostModel(CostRates.builder().slippageRate(new BigDecimal("0.01")).build()))
                .scorer(new ConsensusScorer(ConsensusThresholds.defaults()))
                .metricsCalculator(new MetricsCalculator(0.03))
                .build();
    }

    // ==================== 成交与现金流 ====================

    @Test
    @DisplayName("端到端 - 首日买入、次日卖出，现金精确到分")
    void testBuyThenSellCashExact() {
        // Given
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        priceStore.add(bar(MAIN, D2, "100.00", "105.00"));
        DecisionPolicy policy = scripted(Map.of(
                D1, List.of(Order.buy(MAIN, 100, D1)),
                D2, List.of(Order.sell(MAIN, 100, D2))));

        // When
        BacktestResult result = engine.run(request(List.of(D1, D2), MAIN), policy);

        // Then
        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals("BT-2024-03-04-2024-03-05", result.getRunId());
        assertEquals(2, result.getTrades().size());

        EquityPoint day1 = result.getEquitySeries().get(0);
        assertEquals(new BigDecimal("989894.90"), day1.cash());
        assertEquals(new BigDecimal("10000.00"), day1.marketValue());
        assertEquals(new BigDecimal("999894.90"), day1.totalValue());

        assertEquals(new BigDecimal("1000279.60"), result.getFinalCash());
        assertEquals(new BigDecimal("279.60"), result.getTrades().get(1).getRealizedPnl());
        assertEquals(new BigDecimal("5.20"), result.getTrades().get(1).getCosts().getStampDuty());
        assertEquals(0.00027960, result.getMetrics().getTotalReturn(), 1e-10);
        assertEquals(1.0, result.getMetrics().getWinRate());
        assertFalse(engine.isRunning());
        log.info("端到端现金流测试通过,finalCash={}", result.getFinalCash());
    }

    @Test
    @DisplayName("T+1 - 同日买入后卖出被拒绝")
    void testSameDaySellRejected() {
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        DecisionPolicy policy = scripted(Map.of(
                D1, List.of(Order.buy(MAIN, 100, D1), Order.sell(MAIN, 100, D1))));

        BacktestResult result = engine.run(request(List.of(D1), MAIN), policy);

        List<OrderOutcome> outcomes = result.getDayOutcomes().get(0).getOrderOutcomes();
        assertEquals(OrderStatus.EXECUTED, outcomes.get(0).getStatus());
        assertEquals(OrderStatus.REJECTED, outcomes.get(1).getStatus());
        assertEquals(RejectionReason.SETTLEMENT, outcomes.get(1).getRejectionReason());
        assertEquals(1, result.getTrades().size());
    }

    @Test
    @DisplayName("科创板涨停 - 买入被拒绝")
    void testStarLimitUpBuyRejected() {
        priceStore.add(bar(STAR, D1, "50.00", "60.00"));
        assertEquals(BarStatus.LIMIT_UP, priceStore.getPriceBar(STAR, D1).orElseThrow().getStatus());

        BacktestResult result = engine.run(request(List.of(D1), STAR),
                scripted(Map.of(D1, List.of(Order.buy(STAR, 100, D1)))));

        OrderOutcome outcome = result.getDayOutcomes().get(0).getOrderOutcomes().get(0);
        assertEquals(RejectionReason.LIMIT_BAND, outcome.getRejectionReason());
        assertTrue(result.getTrades().isEmpty());
        assertEquals(new BigDecimal("1000000.00"), result.getFinalCash());
    }

    @Test
    @DisplayName("停牌持仓 - 拒绝卖出并按前值估值")
    void testSuspendedHoldingMarkedAtCarriedPrice() {
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        priceStore.add(PriceBar.carriedForward(MAIN, D2, new BigDecimal("100.00"), BarStatus.SUSPENDED, "重大资产重组"));
        DecisionPolicy policy = scripted(Map.of(
                D1, List.of(Order.buy(MAIN, 100, D1)),
                D2, List.of(Order.sell(MAIN, 100, D2))));

        BacktestResult result = engine.run(request(List.of(D1, D2, D3), MAIN), policy);

        assertEquals(RejectionReason.SUSPENDED,
                result.getDayOutcomes().get(1).getOrderOutcomes().get(0).getRejectionReason());
        // D3 无日线：沿用最近收盘价 100.00
        for (EquityPoint point : result.getEquitySeries()) {
            assertEquals(new BigDecimal("10000.00"), point.marketValue());
            assertEquals(new BigDecimal("999894.90"), point.totalValue());
        }
    }

    @Test
    @DisplayName("停牌日线价格为 0 - 入库按前收修正，持仓不被估值为 0")
    void testZeroPricedSuspendedBarKeepsCarriedValue() {
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        priceStore.add(PriceBar.builder()
                .symbol(MAIN)
                .tradeDate(D2)
                .open(BigDecimal.ZERO).high(BigDecimal.ZERO).low(BigDecimal.ZERO).close(BigDecimal.ZERO)
                .previousClose(new BigDecimal("100.00"))
                .volume(0L)
                .status(BarStatus.SUSPENDED)
                .build());

        BacktestResult result = engine.run(request(List.of(D1, D2), MAIN),
                scripted(Map.of(D1, List.of(Order.buy(MAIN, 100, D1)))));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(new BigDecimal("10000.00"), result.getEquitySeries().get(1).marketValue());
        assertEquals(result.getEquitySeries().get(0).totalValue(), result.getEquitySeries().get(1).totalValue());
    }

    @Test
    @DisplayName("日线缺少收盘价 - 委托按停牌拒绝，回测照常完成")
    void testBarWithoutCloseRejectedWithoutAbort() {
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        PriceBar noClose = bar(MAIN, D2, "100.00", "100.00").toBuilder().close(null).build();
        PriceFeed gapped = new PriceFeed() {
            @Override
            public Optional<PriceBar> getPriceBar(String symbol, LocalDate date) {
                return D2.equals(date) && MAIN.equals(symbol) ? Optional.of(noClose) : priceStore.getPriceBar(symbol, date);
            }

            @Override
            public List<PriceBar> getHistory(String symbol, LocalDate endDate, int limit) {
                return priceStore.getHistory(symbol, endDate, limit);
            }
        };
        TradingRuleSet rules = TradingRuleSet.chinaAShare();
        BacktestEngine gappedEngine = BacktestEngine.builder()
                .instrumentFeed(registry)
                .priceFeed(gapped)
                .signalFeed(new InMemorySignalStore())
                .validator(new TradingRuleValidator(rules))
                .costModel(new CostModel(CostRates.builder().slippageRate(new BigDecimal("0.01")).build()))
                .scorer(new ConsensusScorer(ConsensusThresholds.defaults()))
                .metricsCalculator(new MetricsCalculator(0.03))
                .build();

        BacktestResult result = gappedEngine.run(request(List.of(D1, D2), MAIN), scripted(Map.of(
                D1, List.of(Order.buy(MAIN, 100, D1)),
                D2, List.of(Order.buy(MAIN, 100, D2)))));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getEquitySeries().size());
        assertEquals(1, result.getTrades().size());
        OrderOutcome outcome = result.getDayOutcomes().get(1).getOrderOutcomes().get(0);
        assertEquals(OrderStatus.REJECTED, outcome.getStatus());
        assertEquals(RejectionReason.SUSPENDED, outcome.getRejectionReason());
        assertTrue(result.getEquitySeries().get(1).marketValue().signum() > 0);
    }

    @Test
    @DisplayName("资金不足 / 持仓上限 - 记为成交失败而非规则拒绝")
    void testExecutionFailures() {
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        priceStore.add(bar("600036.SH", D1, "30.00", "30.00"));

        BacktestRequest maxOne = request(List.of(D1), MAIN, "600036.SH").toBuilder().maxPositions(1).build();
        BacktestResult capped = engine.run(maxOne, scripted(Map.of(
                D1, List.of(Order.buy(MAIN, 100, D1), Order.buy("600036.SH", 100, D1)))));
        OrderOutcome second = capped.getDayOutcomes().get(0).getOrderOutcomes().get(1);
        assertEquals(OrderStatus.FAILED, second.getStatus());
        assertEquals(ExecutionFailureReason.MAX_POSITIONS_REACHED, second.getFailureReason());
        assertNull(second.getRejectionReason());

        BacktestRequest poor = request(List.of(D1), MAIN).toBuilder().initialCapital(new BigDecimal("5000")).build();
        BacktestResult broke = engine.run(poor, scripted(Map.of(D1, List.of(Order.buy(MAIN, 100, D1)))));
        OrderOutcome outcome = broke.getDayOutcomes().get(0).getOrderOutcomes().get(0);
        assertEquals(ExecutionFailureReason.INSUFFICIENT_FUNDS, outcome.getFailureReason());
        assertEquals(new BigDecimal("5000.00"), broke.getFinalCash());
    }

    // ==================== 因果性 ====================

    @Test
    @DisplayName("未来数据访问 - 中止并返回 INVALID 部分结果")
    void testLookAheadAborts() {
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        priceStore.add(bar(MAIN, D2, "100.00", "101.00"));
        priceStore.add(bar(MAIN, D3, "101.00", "102.00"));
        CausalMarketDataView view = engine.getMarketData();
        DecisionPolicy peeking = (date, snapshot, scores) -> {
            if (date.equals(D2)) {
                view.getPriceBar(MAIN, D3);
            }
            return List.of();
        };

        LookAheadViolationException e = assertThrows(LookAheadViolationException.class,
                () -> engine.run(request(List.of(D1, D2, D3), MAIN), peeking));

        assertEquals(D2, e.getCurrentDate());
        assertEquals(D3, e.getRequestedDate());
        BacktestResult partial = e.getPartialResult();
        assertNotNull(partial);
        assertEquals(RunStatus.INVALID, partial.getStatus());
        assertFalse(partial.isValid());
        assertNull(partial.getMetrics());
        assertEquals(1, partial.getEquitySeries().size());
        assertFalse(engine.isRunning());
        assertTrue(view.getClock().currentDate().isEmpty());
    }

    // ==================== 确定性 ====================

    @Test
    @DisplayName("同输入重复运行 - 结果完全一致")
    void testDeterministicReplay() {
        priceStore.add(bar(MAIN, D1, "100.00", "100.00"));
        priceStore.add(bar(MAIN, D2, "100.00", "103.00"));
        priceStore.add(bar(MAIN, D3, "103.00", "99.00"));
        DecisionPolicy policy = scripted(Map.of(
                D1, List.of(Order.buy(MAIN, 300, D1)),
                D3, List.of(Order.sell(MAIN, 200, D3))));
        BacktestRequest request = request(List.of(D1, D2, D3), MAIN);

        BacktestResult first = engine.run(request, policy);
        BacktestResult second = engine.run(request, policy);

        assertEquals(first, second);
        assertEquals(3, first.getScoreHistory().size());
    }

    @Test
    @DisplayName("非法运行参数 - 启动前拒绝")
    void testInvalidRequest() {
        BacktestRequest unordered = request(List.of(D2, D1), MAIN);
        BacktestRequest empty = request(List.of(), MAIN);

        assertThrows(ConfigurationException.class, () -> engine.run(unordered, scripted(Map.of())));
        assertThrows(ConfigurationException.class, () -> engine.run(empty, scripted(Map.of())));
    }

    private static BacktestRequest request(List<LocalDate> days, String... universe) {
        return BacktestRequest.builder()
                .initialCapital(CAPITAL)
                .universe(List.of(universe))
                .tradingDays(days)
                .build();
    }

    private static DecisionPolicy scripted(Map<LocalDate, List<Order>> script) {
        Map<LocalDate, List<Order>> copy = new HashMap<>(script);
        return (date, snapshot, scores) -> copy.getOrDefault(date, List.of());
    }

    private static PriceBar bar(String symbol, LocalDate date, String previousClose, String close) {
        BigDecimal price = new BigDecimal(close);
        return PriceBar.builder()
                .symbol(symbol)
                .tradeDate(date)
                .open(price).high(price).low(price).close(price)
                .previousClose(new BigDecimal(previousClose))
                .volume(10000L)
                .build();
    }
}
