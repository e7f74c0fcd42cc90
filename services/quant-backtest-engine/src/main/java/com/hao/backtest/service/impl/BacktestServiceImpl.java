package com.hao.backtest.service.impl;

import com.hao.backtest.config.BacktestProperties;
import com.hao.backtest.consensus.ConsensusScorer;
import com.hao.backtest.consensus.technical.TechnicalSignalDeriver;
import com.hao.backtest.cost.CostModel;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.engine.BacktestEngine;
import com.hao.backtest.engine.BacktestRequest;
import com.hao.backtest.engine.BacktestResult;
import com.hao.backtest.engine.CausalMarketDataView;
import com.hao.backtest.engine.LookAheadViolationException;
import com.hao.backtest.feed.DecisionPolicy;
import com.hao.backtest.feed.memory.InMemoryInstrumentRegistry;
import com.hao.backtest.feed.memory.InMemoryPriceBarStore;
import com.hao.backtest.feed.memory.InMemorySignalStore;
import com.hao.backtest.metrics.MetricsCalculator;
import com.hao.backtest.policy.ConsensusRankingPolicy;
import com.hao.backtest.repository.BacktestReportWriter;
import com.hao.backtest.repository.JsonlMarketDataRepository;
import com.hao.backtest.repository.MarketDataBundle;
import com.hao.backtest.rule.PriceLimitCalculator;
import com.hao.backtest.rule.TradingRuleValidator;
import com.hao.backtest.service.BacktestService;
import constants.DateTimeFormatConstants;
import exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import util.TradingDateValidator;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 回测服务实现类
 *
 * 设计目的：
 * 1. 把“装载数据 → 构建内存仓库 → 组装引擎 → 运行 → 输出报告”串成一条流程。
 * 2. 每次运行重新构建仓库与引擎，运行之间不共享任何可变状态。
 *
 * 实现思路：
 * - 交易日历取配置区间内出现过的 K 线日期（剔除周末），起止日期缺省时取数据边界。
 * - 股票池缺省时取数据中出现的全部标的。
 * - 发生未来数据访问时仍输出 INVALID 报告，再向上抛出异常。
 *
 * @author hli
 * @date 2026-03-09
 */
@Slf4j
@Service
public class BacktestServiceImpl implements BacktestService {

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern(DateTimeFormatConstants.DEFAULT_DATE_FORMAT);

    private final BacktestProperties properties;
    private final TradingRuleValidator validator;
    private final PriceLimitCalculator limitCalculator;
    private final CostModel costModel;
    private final ConsensusScorer scorer;
    private final MetricsCalculator metricsCalculator;
    private final TechnicalSignalDeriver technicalDeriver;
    private final Executor scoringExecutor;
    private final JsonlMarketDataRepository repository;
    private final BacktestReportWriter reportWriter;
    private final ConsensusRankingPolicy.Settings policySettings;

    public BacktestServiceImpl(BacktestProperties properties,
                               TradingRuleValidator validator,
                               PriceLimitCalculator limitCalculator,
                               CostModel costModel,
                               ConsensusScorer scorer,
                               MetricsCalculator metricsCalculator,
                               TechnicalSignalDeriver technicalDeriver,
                               @Qualifier("scoringExecutor") Executor scoringExecutor,
                               JsonlMarketDataRepository repository,
                               BacktestReportWriter reportWriter,
                               ConsensusRankingPolicy.Settings policySettings) {
        this.properties = properties;
        this.validator = validator;
        this.limitCalculator = limitCalculator;
        this.costModel = costModel;
        this.scorer = scorer;
        this.metricsCalculator = metricsCalculator;
        this.technicalDeriver = technicalDeriver;
        this.scoringExecutor = scoringExecutor;
        this.repository = repository;
        this.reportWriter = reportWriter;
        this.policySettings = policySettings;
    }

    // ==================== 公开接口 ====================

    @Override
    public BacktestRequest buildRequest(MarketDataBundle bundle) {
        Assert.notNull(bundle, "bundle must not be null");
        TreeSet<LocalDate> barDates = bundle.getPriceBars().stream()
                .map(PriceBar::getTradeDate)
                .collect(Collectors.toCollection(TreeSet::new));
        if (barDates.isEmpty()) {
            throw new ConfigurationException("no price bars available to build a trading calendar");
        }
        LocalDate startDate = parseDate(properties.getStartDate(), barDates.first());
        LocalDate endDate = parseDate(properties.getEndDate(), barDates.last());
        if (startDate.isAfter(endDate)) {
            throw new ConfigurationException("backtest start-date " + startDate + " is after end-date " + endDate);
        }

        List<LocalDate> tradingDays = TradingDateValidator.tradingDaysBetween(barDates, startDate, endDate);
        if (tradingDays.isEmpty()) {
            throw new ConfigurationException("no trading days between " + startDate + " and " + endDate);
        }

        List<String> universe = properties.getUniverse() == null || properties.getUniverse().isEmpty()
                ? new ArrayList<>(bundle.getPriceBars().stream()
                        .map(PriceBar::getSymbol)
                        .collect(Collectors.toCollection(TreeSet::new)))
                : List.copyOf(properties.getUniverse());

        log.info("回测参数构建完成|Backtest_request_built,start={},end={},tradingDays={},universe={}",
                tradingDays.get(0), tradingDays.get(tradingDays.size() - 1), tradingDays.size(), universe.size());
        return BacktestRequest.builder()
                .initialCapital(properties.getInitialCapital())
                .maxPositions(properties.getMaxPositions())
                .universe(universe)
                .tradingDays(tradingDays)
                .build();
    }

    @Override
    public BacktestResult run(MarketDataBundle bundle, BacktestRequest request,
                              Function<CausalMarketDataView, DecisionPolicy> policyFactory) {
        Assert.notNull(bundle, "bundle must not be null");
        Assert.notNull(policyFactory, "policyFactory must not be null");

        BacktestEngine engine = buildEngine(bundle);
        DecisionPolicy policy = policyFactory.apply(engine.getMarketData());
        return engine.run(request, policy);
    }

    @Override
    public BacktestResult runConfigured() {
        Path dataDir = Paths.get(properties.getDataDir());
        Path reportDir = Paths.get(properties.getReportDir());

        MarketDataBundle bundle = repository.load(dataDir);
        BacktestRequest request = buildRequest(bundle);
        try {
            BacktestResult result = run(bundle, request, view -> new ConsensusRankingPolicy(view, policySettings));
            reportWriter.write(result, reportDir);
            return result;
        } catch (LookAheadViolationException e) {
            if (e.getPartialResult() != null) {
                reportWriter.write(e.getPartialResult(), reportDir);
            }
            throw e;
        }
    }

    // ==================== 内部方法 ====================

    private BacktestEngine buildEngine(MarketDataBundle bundle) {
        InMemoryInstrumentRegistry registry = new InMemoryInstrumentRegistry();
        bundle.getInstruments().forEach(listing -> registry.register(listing.getInstrument(), listing.getEffectiveDate()));

        InMemoryPriceBarStore priceStore = new InMemoryPriceBarStore(registry, limitCalculator);
        priceStore.addAll(bundle.getPriceBars());

        InMemorySignalStore signalStore = new InMemorySignalStore();
        signalStore.addAll(bundle.getSignals());

        boolean parallel = properties.getScoringPool().isEnabled();
        boolean deriveTechnical = properties.getConsensus().isDeriveTechnicalFromPrices();
        return BacktestEngine.builder()
                .instrumentFeed(registry)
                .priceFeed(priceStore)
                .signalFeed(signalStore)
                .validator(validator)
                .costModel(costModel)
                .scorer(scorer)
                .metricsCalculator(metricsCalculator)
                .scoringExecutor(parallel ? scoringExecutor : null)
                .technicalDeriver(deriveTechnical ? technicalDeriver : null)
                .build();
    }

    private static LocalDate parseDate(String text, LocalDate fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        try {
            return LocalDate.parse(text.trim(), DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("invalid date '" + text + "', expected "
                    + DateTimeFormatConstants.DEFAULT_DATE_FORMAT, e);
        }
    }
}
