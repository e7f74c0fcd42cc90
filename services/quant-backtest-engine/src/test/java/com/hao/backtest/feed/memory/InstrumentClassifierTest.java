package com.hao.backtest.feed.memory;

import com.hao.backtest.domain.Instrument;
import enums.market.BoardTypeEnum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 标的分类测试
 *
 * @author hli
 * @date 2026-03-10
 */
class InstrumentClassifierTest {

    @Test
    @DisplayName("板块按代码前缀识别")
    void testBoard() {
        assertEquals(BoardTypeEnum.STAR, InstrumentClassifier.classify("688981.SH", "中芯国际").getBoard());
        assertEquals(BoardTypeEnum.CHINEXT, InstrumentClassifier.classify("301001.SZ", "样本").getBoard());
        assertEquals(BoardTypeEnum.MAIN, InstrumentClassifier.classify("000001.SZ", "平安银行").getBoard());
    }

    @Test
    @DisplayName("ST 按名称前缀识别")
    void testSpecialTreatment() {
        assertTrue(InstrumentClassifier.isSpecialTreatmentName("*ST 海润"));
        assertTrue(InstrumentClassifier.isSpecialTreatmentName("ST康美"));
        assertTrue(InstrumentClassifier.isSpecialTreatmentName("S*ST 前锋"));
        assertFalse(InstrumentClassifier.isSpecialTreatmentName("贵州茅台"));
        assertFalse(InstrumentClassifier.isSpecialTreatmentName(null));
    }

    @Test
    @DisplayName("交易所后缀")
    void testVenue() {
        Instrument instrument = InstrumentClassifier.classify("600000.sh", null);

        assertEquals("SH", instrument.getVenue());
        assertEquals("600000.sh", instrument.getName());
        assertTrue(instrument.isTradable());
    }
}
