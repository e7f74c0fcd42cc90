package com.hao.backtest.consensus.technical;

import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.domain.signal.TechnicalSignal;
import com.hao.backtest.feed.memory.InMemoryInstrumentRegistry;
import com.hao.backtest.feed.memory.InMemoryPriceBarStore;
import com.hao.backtest.feed.memory.InMemorySignalStore;
import com.hao.backtest.rule.PriceLimitCalculator;
import com.hao.backtest.rule.TradingRuleSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 由日线推导技术面测试
 *
 * @author hli
 * @date 2026-03-10
 */
class TechnicalSignalDeriverTest {

    private static final String SYMBOL = "600000.SH";
    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    @DisplayName("历史不足长均线窗口 - 不推导")
    void testInsufficientHistory() {
        TechnicalSignalDeriver deriver = new TechnicalSignalDeriver(2, 4, 10);

        assertTrue(deriver.derive(bars(1, 2, 3)).isEmpty());
        assertTrue(deriver.derive(null).isEmpty());
    }

    @Test
    @DisplayName("收盘价、高点、长短均线")
    void testDerive() {
        TechnicalSignalDeriver deriver = new TechnicalSignalDeriver(2, 4, 10);

        TechnicalSignal signal = deriver.derive(bars(10, 20, 12, 14, 16)).orElseThrow();

        assertEquals(0, new BigDecimal("16").compareTo(signal.close()));
        assertEquals(0, new BigDecimal("20").compareTo(signal.high52Week()));
        assertEquals(0, new BigDecimal("15").compareTo(signal.shortMovingAverage()));
        assertEquals(0, new BigDecimal("15.5").compareTo(signal.longMovingAverage()));
    }

    @Test
    @DisplayName("窗口参数非法 - 拒绝构造")
    void testInvalidWindows() {
        assertThrows(IllegalArgumentException.class, () -> new TechnicalSignalDeriver(5, 5, 250));
        assertThrows(IllegalArgumentException.class, () -> new TechnicalSignalDeriver(5, 20, 10));
    }

    @Test
    @DisplayName("信号源缺少技术面时由日线补全，已有技术面时保持原值")
    void testPriceDerivedSignalFeed() {
        InMemoryPriceBarStore priceStore = new InMemoryPriceBarStore(new InMemoryInstrumentRegistry(),
                new PriceLimitCalculator(TradingRuleSet.chinaAShare()));
        priceStore.addAll(bars(10, 10.5, 11, 11.5, 12));
        InMemorySignalStore signalStore = new InMemorySignalStore();
        LocalDate last = START.plusDays(4);
        TechnicalSignal provided = new TechnicalSignal(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE);
        signalStore.add(ConsensusSignal.builder().symbol("000001.SZ").tradeDate(last).technical(provided).build());

        PriceDerivedSignalFeed feed = new PriceDerivedSignalFeed(signalStore, priceStore, new TechnicalSignalDeriver(2, 4, 10));

        TechnicalSignal derived = feed.getSignals(SYMBOL, last).technical().orElseThrow();
        assertEquals(0, new BigDecimal("12").compareTo(derived.close()));
        assertEquals(provided, feed.getSignals("000001.SZ", last).technical().orElseThrow());
        // 首日历史不足，不补全
        assertTrue(feed.getSignals(SYMBOL, START).technical().isEmpty());
    }

    private static List<PriceBar> bars(double... closes) {
        List<PriceBar> bars = new ArrayList<>();
        BigDecimal previous = BigDecimal.valueOf(closes[0]);
        for (int i = 0; i < closes.length; i++) {
            BigDecimal close = BigDecimal.valueOf(closes[i]);
            bars.add(PriceBar.builder()
                    .symbol(SYMBOL)
                    .tradeDate(START.plusDays(i))
                    .open(close).high(close).low(close).close(close)
                    .previousClose(previous)
                    .volume(100L)
                    .status(BarStatus.NORMAL)
                    .build());
            previous = close;
        }
        return bars;
    }
}
