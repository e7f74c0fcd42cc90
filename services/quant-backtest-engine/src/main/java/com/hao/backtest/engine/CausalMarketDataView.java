package com.hao.backtest.engine;

import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.Instrument;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.feed.InstrumentFeed;
import com.hao.backtest.feed.PriceFeed;
import com.hao.backtest.feed.SignalFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 因果安全的行情视图
 *
 * 设计目的：
 * 1. 包装标的、日线、信号三类数据源，每一次读取都先经过模拟时钟校验，
 *    访问晚于当前模拟日期的数据立即抛出 LookAheadViolationException。
 * 2. 引擎、评分器和决策策略只通过本视图读数据，校验是硬前置条件而非约定。
 *
 * 数据缺口处理：
 * - 持仓标的当日无日线时，以最近一根历史日线收盘价生成 DATA_MISSING 日线（前值填充）。
 *
 * @author hli
 * @date 2026-03-06
 */
@Slf4j
public class CausalMarketDataView implements InstrumentFeed, PriceFeed, SignalFeed {

    static final String RESOURCE_INSTRUMENT = "instrument";
    static final String RESOURCE_PRICE_BAR = "price_bar";
    static final String RESOURCE_PRICE_HISTORY = "price_history";
    static final String RESOURCE_SIGNAL = "consensus_signal";

    private final SimulationClock clock;
    private final InstrumentFeed instrumentFeed;
    private final PriceFeed priceFeed;
    private final SignalFeed signalFeed;

    public CausalMarketDataView(SimulationClock clock, InstrumentFeed instrumentFeed,
                                PriceFeed priceFeed, SignalFeed signalFeed) {
        Assert.notNull(clock, "SimulationClock must not be null");
        Assert.notNull(instrumentFeed, "InstrumentFeed must not be null");
        Assert.notNull(priceFeed, "PriceFeed must not be null");
        Assert.notNull(signalFeed, "SignalFeed must not be null");
        this.clock = clock;
        this.instrumentFeed = instrumentFeed;
        this.priceFeed = priceFeed;
        this.signalFeed = signalFeed;
    }

    public SimulationClock getClock() {
        return clock;
    }

    @Override
    public Instrument getInstrument(String symbol, LocalDate asOf) {
        clock.checkAccess(RESOURCE_INSTRUMENT, asOf);
        return instrumentFeed.getInstrument(symbol, asOf);
    }

    @Override
    public Optional<PriceBar> getPriceBar(String symbol, LocalDate date) {
        clock.checkAccess(RESOURCE_PRICE_BAR, date);
        return priceFeed.getPriceBar(symbol, date);
    }

    @Override
    public List<PriceBar> getHistory(String symbol, LocalDate endDate, int limit) {
        clock.checkAccess(RESOURCE_PRICE_HISTORY, endDate);
        return priceFeed.getHistory(symbol, endDate, limit);
    }

    @Override
    public ConsensusSignal getSignals(String symbol, LocalDate date) {
        clock.checkAccess(RESOURCE_SIGNAL, date);
        return signalFeed.getSignals(symbol, date);
    }

    /**
     * 取当日日线，缺失时前值填充
     *
     * @return 当日日线；无当日日线时为 DATA_MISSING 填充日线；从无历史时为 empty
     */
    public Optional<PriceBar> getBarOrCarryForward(String symbol, LocalDate date) {
        Optional<PriceBar> bar = getPriceBar(symbol, date);
        if (bar.isPresent()) {
            return bar;
        }
        List<PriceBar> previous = priceFeed.getHistory(symbol, date.minusDays(1), 1);
        if (previous.isEmpty()) {
            return Optional.empty();
        }
        PriceBar last = previous.get(0);
        log.debug("日线缺失_前值填充|Price_bar_carried_forward,symbol={},date={},from={},price={}",
                symbol, date, last.getTradeDate(), last.getClose());
        return Optional.of(PriceBar.carriedForward(symbol, date, last.getClose(), BarStatus.DATA_MISSING,
                "no bar, carried forward from " + last.getTradeDate()));
    }
}
