package com.hao.backtest.engine;

import com.hao.backtest.consensus.ConsensusFilterService;
import com.hao.backtest.consensus.ConsensusScore;
import com.hao.backtest.consensus.ConsensusScorer;
import com.hao.backtest.consensus.technical.PriceDerivedSignalFeed;
import com.hao.backtest.consensus.technical.TechnicalSignalDeriver;
import com.hao.backtest.cost.CostModel;
import com.hao.backtest.domain.CostBreakdown;
import com.hao.backtest.domain.EquityPoint;
import com.hao.backtest.domain.Instrument;
import com.hao.backtest.domain.Order;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.domain.Trade;
import com.hao.backtest.feed.DecisionPolicy;
import com.hao.backtest.feed.InstrumentFeed;
import com.hao.backtest.feed.PriceFeed;
import com.hao.backtest.feed.SignalFeed;
import com.hao.backtest.ledger.PortfolioLedger;
import com.hao.backtest.ledger.PortfolioSnapshot;
import com.hao.backtest.metrics.MetricsCalculator;
import com.hao.backtest.metrics.PerformanceMetrics;
import com.hao.backtest.rule.TradingRuleValidator;
import com.hao.backtest.rule.ValidationResult;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 回测模拟引擎
 *
 * 设计目的：
 * 1. 按交易日逐日回放：推进时钟 → 评分 → 征询决策策略 → 逐笔校验与成交 → 盯市 → 记录净值。
 * 2. 所有数据读取经由 {@link CausalMarketDataView}，访问未来数据立即中止整次回测。
 * 3. 同一 (数据, 策略) 重复运行得到完全相同的净值序列与成交记录。
 *
 * 错误分层：
 * - 规则拒单：{@link ValidationResult} 返回，记入当日结果，不中断。
 * - 成交失败：资金 / 可卖数量 / 持仓数复核失败，以 {@link ExecutionFailureReason} 区分，不中断。
 * - 因果性违规：抛出 {@link LookAheadViolationException}，附带标记为 INVALID 的部分结果。
 * - 数据缺口：评分按 0 分、估值按前值填充，在读取点吸收。
 *
 * 线程模型：
 * - 回放主循环单线程；仅同日股票池评分提交到评分线程池，完成后统一排序。
 * - 账本只由本引擎写入，决策策略只能看到 {@link PortfolioSnapshot}。
 *
 * @author hli
 * @date 2026-03-06
 */
@Slf4j
public class BacktestEngine {

    private final SimulationClock clock;
    private final CausalMarketDataView marketData;
    private final TradingRuleValidator validator;
    private final CostModel costModel;
    private final ConsensusFilterService filterService;
    private final MetricsCalculator metricsCalculator;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param instrumentFeed   标的分类数据源
     * @param priceFeed        日线数据源
     * @param signalFeed       共识信号数据源
     * @param validator        交易规则校验器
     * @param costModel        成本模型
     * @param scorer           共识评分器
     * @param metricsCalculator 绩效计算器
     * @param scoringExecutor  评分线程池，可为空（顺序评分）
     * @param technicalDeriver 技术面推导器，可为空（不由日线补全技术面）
     */
    @Builder
    public BacktestEngine(InstrumentFeed instrumentFeed,
                          PriceFeed priceFeed,
                          SignalFeed signalFeed,
                          TradingRuleValidator validator,
                          CostModel costModel,
                          ConsensusScorer scorer,
                          MetricsCalculator metricsCalculator,
                          Executor scoringExecutor,
                          TechnicalSignalDeriver technicalDeriver) {
        Assert.notNull(validator, "TradingRuleValidator must not be null");
        Assert.notNull(costModel, "CostModel must not be null");
        Assert.notNull(scorer, "ConsensusScorer must not be null");
        Assert.notNull(metricsCalculator, "MetricsCalculator must not be null");

        this.clock = new SimulationClock();
        this.marketData = new CausalMarketDataView(clock, instrumentFeed, priceFeed, signalFeed);
        this.validator = validator;
        this.costModel = costModel;
        this.metricsCalculator = metricsCalculator;

        // 评分读取的信号同样经过因果视图；技术面补全时日线历史也走因果视图
        SignalFeed scoringFeed = technicalDeriver == null
                ? marketData
                : new PriceDerivedSignalFeed(marketData, marketData, technicalDeriver);
        this.filterService = new ConsensusFilterService(scorer, scoringFeed, scoringExecutor);

        log.info("BacktestEngine初始化完成|BacktestEngine_initialized,parallelScoring={},deriveTechnical={}",
                scoringExecutor != null, technicalDeriver != null);
    }

    /**
     * 因果安全的数据视图，决策策略应通过它读取行情
     */
    public CausalMarketDataView getMarketData() {
        return marketData;
    }

    public ConsensusFilterService getFilterService() {
        return filterService;
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== 公开接口 ====================

    /**
     * 执行一次完整回测，每次运行使用全新的账本与时钟
     *
     * @param request 运行参数
     * @param policy  决策策略
     * @return 回测结果（COMPLETED）
     * @throws LookAheadViolationException 发生未来数据访问时抛出，携带 INVALID 部分结果
     */
    public BacktestResult run(BacktestRequest request, DecisionPolicy policy) {
        Assert.notNull(request, "BacktestRequest must not be null");
        Assert.notNull(policy, "DecisionPolicy must not be null");
        request.validate();

        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("backtest already running");
        }
        try {
            return doRun(request, policy);
        } finally {
            clock.reset();
            running.set(false);
        }
    }

    // ==================== 核心回放逻辑 ====================

    private BacktestResult doRun(BacktestRequest request, DecisionPolicy policy) {
        String runId = request.resolveRunId();
        log.info("=== 回测启动|Backtest_start,runId={} ===", runId);
        log.info("参数|Params,start={},end={},days={},capital={},maxPositions={},universe={}",
                request.getStartDate(), request.getEndDate(), request.getTradingDays().size(),
                request.getInitialCapital(), request.getMaxPositions(),
                request.getUniverse() == null ? 0 : request.getUniverse().size());

        StopWatch stopWatch = new StopWatch(runId);
        stopWatch.start("replay");

        clock.reset();
        RunState state = new RunState(new PortfolioLedger(request.getInitialCapital(), validator.getRules()));
        try {
            for (LocalDate date : request.getTradingDays()) {
                simulateDay(state, request, policy, date);
            }
        } catch (LookAheadViolationException e) {
            stopWatch.stop();
            log.error("因果性违规_回测中止|Backtest_aborted_look_ahead,runId={},currentDate={},requestedDate={},resource={}",
                    runId, e.getCurrentDate(), e.getRequestedDate(), e.getResource());
            throw new LookAheadViolationException(e, assemble(runId, request, state, RunStatus.INVALID, e.getMessage()));
        }

        stopWatch.stop();
        BacktestResult result = assemble(runId, request, state, RunStatus.COMPLETED, null);
        log.info("=== 回测完成|Backtest_done,runId={},days={},trades={},finalValue={},costMs={} ===",
                runId, result.getEquitySeries().size(), result.getTrades().size(),
                result.getMetrics().getFinalValue(), stopWatch.getTotalTimeMillis());
        return result;
    }

    private void simulateDay(RunState state, BacktestRequest request, DecisionPolicy policy, LocalDate date) {
        // 1. 推进时钟
        clock.advanceTo(date);
        PortfolioLedger ledger = state.ledger;

        // 2. 股票池评分（可并行，结果已排序）
        List<ConsensusScore> scores = filterService.scoreAll(
                request.getUniverse() == null ? List.of() : request.getUniverse(), date);
        state.scoreHistory.addAll(scores);

        // 3. 征询决策策略
        PortfolioSnapshot snapshot = ledger.snapshot(date, markPrices(ledger, date));
        List<Order> orders = policy.proposeOrders(date, snapshot, Collections.unmodifiableList(scores));
        if (orders == null) {
            orders = List.of();
        }

        // 4. 逐笔校验与成交，后一笔可见前一笔的账本变化
        List<OrderOutcome> outcomes = new ArrayList<>(orders.size());
        for (Order order : orders) {
            outcomes.add(processOrder(ledger, order, date, request.getMaxPositions()));
        }

        // 5. 盯市并记录净值
        BigDecimal marketValue = ledger.marketValue(markPrices(ledger, date));
        BigDecimal totalValue = ledger.getCash().add(marketValue);
        double dailyReturn = totalValue.divide(state.previousTotal, MathContext.DECIMAL64).doubleValue() - 1.0;
        EquityPoint point = new EquityPoint(date, ledger.getCash(), marketValue, totalValue, dailyReturn);
        state.equitySeries.add(point);
        state.previousTotal = totalValue;

        DayOutcome day = new DayOutcome(date, List.copyOf(outcomes), point);
        state.dayOutcomes.add(day);
        log.debug("交易日完成|Day_done,date={},orders={},executed={},rejected={},failed={},totalValue={}",
                date, outcomes.size(), day.count(OrderStatus.EXECUTED), day.count(OrderStatus.REJECTED),
                day.count(OrderStatus.FAILED), totalValue);
    }

    private OrderOutcome processOrder(PortfolioLedger ledger, Order order, LocalDate date, int maxPositions) {
        if (order.getRequestedDate() != null && !order.getRequestedDate().equals(date)) {
            log.warn("委托日期与模拟日期不一致_按当日处理|Order_date_mismatch,symbol={},requested={},current={}",
                    order.getSymbol(), order.getRequestedDate(), date);
        }

        String symbol = order.getSymbol();
        Instrument instrument = marketData.getInstrument(symbol, date);
        PriceBar bar = marketData.getBarOrCarryForward(symbol, date).orElse(null);

        ValidationResult validation = validator.validate(order, instrument, bar, ledger.lotsOf(symbol), date);
        if (!validation.accepted()) {
            return OrderOutcome.rejected(order, validation);
        }

        // 成交复核：以账本最新状态为准
        Trade trade;
        if (order.isBuy()) {
            if (!ledger.holds(symbol) && ledger.positionCount() >= maxPositions) {
                return fail(order, date, ExecutionFailureReason.MAX_POSITIONS_REACHED,
                        "positions=" + ledger.positionCount() + ", max=" + maxPositions);
            }
            CostBreakdown costs = costModel.priceOrder(order, bar.getClose(), instrument.getVenue());
            BigDecimal required = costs.getNetCashDelta().negate();
            if (required.compareTo(ledger.getCash()) > 0) {
                return fail(order, date, ExecutionFailureReason.INSUFFICIENT_FUNDS,
                        "required=" + required + ", available=" + ledger.getCash());
            }
            trade = ledger.applyBuy(order, costs, date);
        } else {
            long sellable = ledger.sellableQuantity(symbol, date);
            if (sellable < order.getQuantity()) {
                return fail(order, date, ExecutionFailureReason.INSUFFICIENT_LOTS,
                        "sellable=" + sellable + ", requested=" + order.getQuantity());
            }
            CostBreakdown costs = costModel.priceOrder(order, bar.getClose(), instrument.getVenue());
            trade = ledger.applySell(order, costs, date);
        }

        log.info("委托成交|Order_filled,date={},symbol={},side={},qty={},fill={},totalCost={},cash={}",
                date, symbol, order.getSide(), order.getQuantity(), trade.getFillPrice(),
                trade.getCosts().getTotalCost(), ledger.getCash());
        return OrderOutcome.executed(order, trade);
    }

    private OrderOutcome fail(Order order, LocalDate date, ExecutionFailureReason reason, String detail) {
        log.warn("委托成交失败|Order_execution_failed,date={},symbol={},side={},qty={},reason={},detail={}",
                date, order.getSymbol(), order.getSide(), order.getQuantity(), reason, detail);
        return OrderOutcome.failed(order, reason, detail);
    }

    /**
     * 持仓估值价：当日收盘价，停牌或缺失时为前收；无正价格的标的不入表，由账本按成本估值
     */
    private Map<String, BigDecimal> markPrices(PortfolioLedger ledger, LocalDate date) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        for (String symbol : ledger.heldSymbols()) {
            marketData.getBarOrCarryForward(symbol, date).ifPresent(bar -> {
                BigDecimal mark = bar.isHalted() ? bar.getPreviousClose() : bar.getClose();
                if (mark != null && mark.signum() > 0) {
                    prices.put(symbol, mark);
                } else {
                    log.warn("持仓估值价无效_跳过|Mark_price_unusable,date={},symbol={},status={}",
                            date, symbol, bar.getStatus());
                }
            });
        }
        return prices;
    }

    private BacktestResult assemble(String runId, BacktestRequest request, RunState state,
                                    RunStatus status, String abortReason) {
        PortfolioLedger ledger = state.ledger;
        List<EquityPoint> equity = List.copyOf(state.equitySeries);
        List<Trade> trades = List.copyOf(ledger.getTrades());
        PerformanceMetrics metrics = status == RunStatus.COMPLETED
                ? metricsCalculator.calculate(ledger.getInitialCapital(), equity, trades)
                : null;
        return BacktestResult.builder()
                .runId(runId)
                .status(status)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(ledger.getInitialCapital())
                .finalCash(ledger.getCash())
                .equitySeries(equity)
                .trades(trades)
                .scoreHistory(List.copyOf(state.scoreHistory))
                .dayOutcomes(List.copyOf(state.dayOutcomes))
                .metrics(metrics)
                .abortReason(abortReason)
                .build();
    }

    /**
     * 单次运行的可变状态，封闭在回放主线程内
     */
    private static final class RunState {
        private final PortfolioLedger ledger;
        private final List<EquityPoint> equitySeries = new ArrayList<>();
        private final List<ConsensusScore> scoreHistory = new ArrayList<>();
        private final List<DayOutcome> dayOutcomes = new ArrayList<>();
        private BigDecimal previousTotal;

        private RunState(PortfolioLedger ledger) {
            this.ledger = ledger;
            this.previousTotal = ledger.getInitialCapital();
        }
    }
}
