package com.hao.backtest.feed.memory;

import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.feed.InstrumentFeed;
import com.hao.backtest.feed.PriceFeed;
import com.hao.backtest.rule.PriceLimitCalculator;
import exception.DataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 内存日线仓库
 *
 * 设计目的：
 * 1. 按 (symbol, date) 索引只读日线，回测开始前一次性装载。
 * 2. 入库时补全涨跌停状态，读取方无需再计算。
 * 3. 停牌日线一律按前收估值，价格缺失的正常日线视为数据错误。
 *
 * 实现思路：
 * - 每个标的一个 TreeMap，支持按日期区间回溯历史。
 * - 同一 (symbol, date) 重复入库视为数据错误。
 *
 * @author hli
 * @date 2026-03-04
 */
@Slf4j
public class InMemoryPriceBarStore implements PriceFeed {

    private final Map<String, NavigableMap<LocalDate, PriceBar>> bars = new TreeMap<>();

    private final InstrumentFeed instrumentFeed;

    private final PriceLimitCalculator limitCalculator;

    public InMemoryPriceBarStore(InstrumentFeed instrumentFeed, PriceLimitCalculator limitCalculator) {
        Assert.notNull(instrumentFeed, "InstrumentFeed must not be null");
        Assert.notNull(limitCalculator, "PriceLimitCalculator must not be null");
        this.instrumentFeed = instrumentFeed;
        this.limitCalculator = limitCalculator;
    }

    public void addAll(Collection<PriceBar> priceBars) {
        priceBars.forEach(this::add);
        log.info("日线装载完成|Price_bars_loaded,symbols={},bars={}", bars.size(), size());
    }

    public void add(PriceBar bar) {
        Assert.notNull(bar, "bar must not be null");
        Assert.hasText(bar.getSymbol(), "symbol must not be empty");
        Assert.notNull(bar.getTradeDate(), "tradeDate must not be null");

        PriceBar normalized = normalize(bar);
        PriceBar resolved = limitCalculator.resolveStatus(
                instrumentFeed.getInstrument(bar.getSymbol(), bar.getTradeDate()), normalized);

        PriceBar existing = bars.computeIfAbsent(bar.getSymbol(), k -> new TreeMap<>())
                .putIfAbsent(bar.getTradeDate(), resolved);
        if (existing != null) {
            throw new DataException("duplicate price bar for " + bar.getSymbol() + " on " + bar.getTradeDate());
        }
    }

    /**
     * 停牌 / 缺失日线按前收重建，正常日线要求正收盘价
     */
    private static PriceBar normalize(PriceBar bar) {
        if (bar.isHalted()) {
            BigDecimal carried = bar.getPreviousClose();
            if (carried == null || carried.signum() <= 0) {
                throw new DataException("halted price bar without positive previous close for "
                        + bar.getSymbol() + " on " + bar.getTradeDate());
            }
            if (isCarriedForward(bar, carried)) {
                return bar;
            }
            log.warn("停牌日线价格与前收不一致_按前收修正|Halted_bar_normalized,symbol={},date={},close={},prevClose={}",
                    bar.getSymbol(), bar.getTradeDate(), bar.getClose(), carried);
            return PriceBar.carriedForward(bar.getSymbol(), bar.getTradeDate(), carried,
                    bar.getStatus(), bar.getSuspensionReason());
        }
        if (bar.getClose() == null || bar.getClose().signum() <= 0) {
            throw new DataException("price bar without positive close for " + bar.getSymbol() + " on " + bar.getTradeDate());
        }
        return bar.getStatus() == null ? bar.toBuilder().status(BarStatus.NORMAL).build() : bar;
    }

    private static boolean isCarriedForward(PriceBar bar, BigDecimal carried) {
        return bar.getVolume() == 0L
                && bar.getOpen() != null && carried.compareTo(bar.getOpen()) == 0
                && bar.getHigh() != null && carried.compareTo(bar.getHigh()) == 0
                && bar.getLow() != null && carried.compareTo(bar.getLow()) == 0
                && bar.getClose() != null && carried.compareTo(bar.getClose()) == 0;
    }

    @Override
    public Optional<PriceBar> getPriceBar(String symbol, LocalDate date) {
        NavigableMap<LocalDate, PriceBar> series = bars.get(symbol);
        return series == null ? Optional.empty() : Optional.ofNullable(series.get(date));
    }

    @Override
    public List<PriceBar> getHistory(String symbol, LocalDate endDate, int limit) {
        NavigableMap<LocalDate, PriceBar> series = bars.get(symbol);
        if (series == null || limit <= 0) {
            return List.of();
        }
        List<PriceBar> reversed = new ArrayList<>(limit);
        for (PriceBar bar : series.headMap(endDate, true).descendingMap().values()) {
            reversed.add(bar);
            if (reversed.size() >= limit) {
                break;
            }
        }
        List<PriceBar> history = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            history.add(reversed.get(i));
        }
        return history;
    }

    public Set<String> symbols() {
        return bars.keySet();
    }

    /**
     * 全部出现过的日线日期，用于推导交易日历
     */
    public Set<LocalDate> allDates() {
        Set<LocalDate> dates = new TreeSet<>();
        bars.values().forEach(series -> dates.addAll(series.keySet()));
        return dates;
    }

    public int size() {
        return bars.values().stream().mapToInt(Map::size).sum();
    }
}
