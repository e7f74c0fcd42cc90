package com.hao.backtest.engine;

import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.feed.memory.InMemoryInstrumentRegistry;
import com.hao.backtest.feed.memory.InMemoryPriceBarStore;
import com.hao.backtest.feed.memory.InMemorySignalStore;
import com.hao.backtest.rule.PriceLimitCalculator;
import com.hao.backtest.rule.TradingRuleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 因果数据视图测试
 *
 * @author hli
 * @date 2026-03-10
 */
class CausalMarketDataViewTest {

    private static final String SYMBOL = "600000.SH";
    private static final LocalDate D1 = LocalDate.of(2024, 3, 4);
    private static final LocalDate D2 = LocalDate.of(2024, 3, 5);
    private static final LocalDate D3 = LocalDate.of(2024, 3, 6);

    private SimulationClock clock;
    private CausalMarketDataView view;

    @BeforeEach
    void setUp() {
        InMemoryInstrumentRegistry registry = new InMemoryInstrumentRegistry();
        InMemoryPriceBarStore store = new InMemoryPriceBarStore(registry, new PriceLimitCalculator(TradingRuleSet.chinaAShare()));
        store.add(bar(D1, "10.00"));
        store.add(bar(D3, "10.20"));
        clock = new SimulationClock();
        view = new CausalMarketDataView(clock, registry, store, new InMemorySignalStore());
    }

    @Test
    @DisplayName("任何资源读取未来日期均抛出")
    void testEveryResourceGuarded() {
        clock.advanceTo(D1);

        assertThrows(LookAheadViolationException.class, () -> view.getPriceBar(SYMBOL, D2));
        assertThrows(LookAheadViolationException.class, () -> view.getHistory(SYMBOL, D3, 5));
        assertThrows(LookAheadViolationException.class, () -> view.getSignals(SYMBOL, D2));
        assertThrows(LookAheadViolationException.class, () -> view.getInstrument(SYMBOL, D2));
        assertThrows(LookAheadViolationException.class, () -> view.getBarOrCarryForward(SYMBOL, D3));
    }

    @Test
    @DisplayName("历史查询截止当日，不含未来日线")
    void testHistoryUpToCurrent() {
        clock.advanceTo(D2);

        List<PriceBar> history = view.getHistory(SYMBOL, D2, 10);

        assertEquals(1, history.size());
        assertEquals(D1, history.get(0).getTradeDate());
    }

    @Test
    @DisplayName("当日缺少日线 - 前值填充为 DATA_MISSING")
    void testCarryForward() {
        clock.advanceTo(D2);

        PriceBar carried = view.getBarOrCarryForward(SYMBOL, D2).orElseThrow();

        assertEquals(BarStatus.DATA_MISSING, carried.getStatus());
        assertEquals(new BigDecimal("10.00"), carried.getClose());
        assertEquals(new BigDecimal("10.00"), carried.getPreviousClose());
        assertEquals(0L, carried.getVolume());
        assertTrue(view.getBarOrCarryForward("000001.SZ", D2).isEmpty());
    }

    private static PriceBar bar(LocalDate date, String close) {
        BigDecimal price = new BigDecimal(close);
        return PriceBar.builder()
                .symbol(SYMBOL)
                .tradeDate(date)
                .open(price).high(price).low(price).close(price)
                .previousClose(new BigDecimal("10.00"))
                .volume(1000L)
                .build();
    }
}
