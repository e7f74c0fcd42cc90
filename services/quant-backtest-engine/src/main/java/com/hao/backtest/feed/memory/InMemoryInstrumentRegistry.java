package com.hao.backtest.feed.memory;

import com.hao.backtest.domain.Instrument;
import com.hao.backtest.feed.InstrumentFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.time.LocalDate;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存标的注册表
 * <p>
 * 每个标的维护一条按生效日期排序的分类时间线，查询时取 asOf 之前（含）最近一次生效的记录；
 * 早于首条记录或从未登记的标的，按代码前缀推断分类。
 *
 * @author hli
 * @date 2026-03-04
 */
@Slf4j
public class InMemoryInstrumentRegistry implements InstrumentFeed {

    private final Map<String, NavigableMap<LocalDate, Instrument>> timelines = new ConcurrentHashMap<>();

    /**
     * 登记分类记录
     *
     * @param instrument    标的信息
     * @param effectiveDate 生效日期，null 表示自始有效
     */
    public void register(Instrument instrument, LocalDate effectiveDate) {
        Assert.notNull(instrument, "instrument must not be null");
        Assert.hasText(instrument.getSymbol(), "symbol must not be empty");
        LocalDate key = effectiveDate == null ? LocalDate.MIN : effectiveDate;
        timelines.computeIfAbsent(instrument.getSymbol(), k -> new TreeMap<>()).put(key, instrument);
    }

    @Override
    public Instrument getInstrument(String symbol, LocalDate asOf) {
        NavigableMap<LocalDate, Instrument> timeline = timelines.get(symbol);
        if (timeline != null) {
            Map.Entry<LocalDate, Instrument> entry = timeline.floorEntry(asOf);
            if (entry != null) {
                return entry.getValue();
            }
        }
        log.debug("标的未登记_按代码推断|Instrument_inferred,symbol={},asOf={}", symbol, asOf);
        return InstrumentClassifier.classify(symbol, null);
    }

    public int size() {
        return timelines.size();
    }
}
