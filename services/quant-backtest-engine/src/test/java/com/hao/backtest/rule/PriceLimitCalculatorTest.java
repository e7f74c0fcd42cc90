package com.hao.backtest.rule;

import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.Instrument;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.feed.memory.InstrumentClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 涨跌停价计算与状态识别测试
 *
 * @author hli
 * @date 2026-03-10
 */
class PriceLimitCalculatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    private PriceLimitCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new PriceLimitCalculator(TradingRuleSet.chinaAShare());
    }

    @Test
    @DisplayName("主板 - 前收 9.99 的涨跌停价四舍五入到分")
    void testMainBoardRounding() {
        Instrument instrument = InstrumentClassifier.classify("600000.SH", "浦发银行");

        PriceLimits limits = calculator.calculate(instrument, new BigDecimal("9.99"));

        assertEquals(new BigDecimal("10.99"), limits.limitUp());
        assertEquals(new BigDecimal("8.99"), limits.limitDown());
    }

    @Test
    @DisplayName("科创板 - 20% 涨跌幅")
    void testStarBoard() {
        Instrument instrument = InstrumentClassifier.classify("688001.SH", "华兴源创");

        PriceLimits limits = calculator.calculate(instrument, new BigDecimal("50"));

        assertEquals(new BigDecimal("60.00"), limits.limitUp());
        assertEquals(new BigDecimal("40.00"), limits.limitDown());
    }

    @Test
    @DisplayName("创业板 - 20% 涨跌幅")
    void testChiNext() {
        Instrument instrument = InstrumentClassifier.classify("300750.SZ", "宁德时代");

        PriceLimits limits = calculator.calculate(instrument, new BigDecimal("200.00"));

        assertEquals(new BigDecimal("240.00"), limits.limitUp());
        assertEquals(new BigDecimal("160.00"), limits.limitDown());
    }

    @Test
    @DisplayName("主板 ST - 5% 涨跌幅")
    void testSpecialTreatment() {
        Instrument instrument = InstrumentClassifier.classify("600001.SH", "*ST 样本");
        assertTrue(instrument.isSpecialTreatment());

        PriceLimits limits = calculator.calculate(instrument, new BigDecimal("10.00"));

        assertEquals(new BigDecimal("10.50"), limits.limitUp());
        assertEquals(new BigDecimal("9.50"), limits.limitDown());
    }

    @Test
    @DisplayName("状态识别 - 收盘价等于涨停价视为涨停")
    void testResolveLimitUpInclusive() {
        Instrument instrument = InstrumentClassifier.classify("688001.SH", "华兴源创");
        PriceBar bar = bar("688001.SH", "50.00", "60.00");

        PriceBar resolved = calculator.resolveStatus(instrument, bar);

        assertEquals(BarStatus.LIMIT_UP, resolved.getStatus());
    }

    @Test
    @DisplayName("状态识别 - 收盘价等于跌停价视为跌停")
    void testResolveLimitDownInclusive() {
        Instrument instrument = InstrumentClassifier.classify("600000.SH", "浦发银行");
        PriceBar bar = bar("600000.SH", "10.00", "9.00");

        PriceBar resolved = calculator.resolveStatus(instrument, bar);

        assertEquals(BarStatus.LIMIT_DOWN, resolved.getStatus());
    }

    @Test
    @DisplayName("状态识别 - 区间内保持正常，停牌日线原样返回")
    void testResolveNormalAndHalted() {
        Instrument instrument = InstrumentClassifier.classify("600000.SH", "浦发银行");

        assertEquals(BarStatus.NORMAL, calculator.resolveStatus(instrument, bar("600000.SH", "10.00", "10.50")).getStatus());

        PriceBar halted = PriceBar.carriedForward("600000.SH", DAY, new BigDecimal("10.00"), BarStatus.SUSPENDED, "重大事项");
        assertSame(halted, calculator.resolveStatus(instrument, halted));
    }

    private static PriceBar bar(String symbol, String previousClose, String close) {
        BigDecimal c = new BigDecimal(close);
        return PriceBar.builder()
                .symbol(symbol)
                .tradeDate(DAY)
                .open(c).high(c).low(c).close(c)
                .volume(1000L)
                .previousClose(new BigDecimal(previousClose))
                .status(BarStatus.NORMAL)
                .build();
    }
}
