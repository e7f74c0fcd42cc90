package util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 交易日校验工具测试
 *
 * @author hli
 * @date 2026-03-02
 */
class TradingDateValidatorTest {

    private static final LocalDate FRI = LocalDate.of(2024, 3, 1);
    private static final LocalDate SAT = LocalDate.of(2024, 3, 2);
    private static final LocalDate SUN = LocalDate.of(2024, 3, 3);
    private static final LocalDate MON = LocalDate.of(2024, 3, 4);
    private static final LocalDate TUE = LocalDate.of(2024, 3, 5);

    @Test
    @DisplayName("区间筛选 - 闭区间、剔除周末、升序去重")
    void testTradingDaysBetween() {
        // Given: 乱序、重复、含周末与空值的候选日期
        List<LocalDate> candidates = Arrays.asList(TUE, SAT, FRI, null, MON, SUN, MON);

        // When
        List<LocalDate> days = TradingDateValidator.tradingDaysBetween(candidates, FRI, TUE);

        // Then
        assertEquals(List.of(FRI, MON, TUE), days);
        assertEquals(List.of(MON), TradingDateValidator.tradingDaysBetween(candidates, SAT, MON));
    }

    @Test
    @DisplayName("区间非法或候选为空 - 返回空日历")
    void testEmptyRange() {
        List<LocalDate> candidates = List.of(FRI, MON);

        assertTrue(TradingDateValidator.tradingDaysBetween(candidates, MON, FRI).isEmpty());
        assertTrue(TradingDateValidator.tradingDaysBetween(candidates, null, MON).isEmpty());
        assertTrue(TradingDateValidator.tradingDaysBetween(List.of(), FRI, MON).isEmpty());
        assertTrue(TradingDateValidator.tradingDaysBetween(candidates, SAT, SUN).isEmpty());
    }

    @Test
    @DisplayName("周末判断")
    void testWeekend() {
        assertTrue(TradingDateValidator.isWeekend(SAT));
        assertTrue(TradingDateValidator.isWeekend(SUN));
        assertFalse(TradingDateValidator.isWeekend(FRI));
        assertFalse(TradingDateValidator.isWeekend(null));
    }
}
