package com.hao.backtest.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 模拟时钟测试
 *
 * @author hli
 * @date 2026-03-10
 */
class SimulationClockTest {

    private static final LocalDate D1 = LocalDate.of(2024, 3, 4);
    private static final LocalDate D2 = LocalDate.of(2024, 3, 5);

    private SimulationClock clock;

    @BeforeEach
    void setUp() {
        clock = new SimulationClock();
    }

    @Test
    @DisplayName("未启动 - 数据准备阶段不做限制")
    void testUnsetClockAllowsAccess() {
        assertTrue(clock.currentDate().isEmpty());
        assertDoesNotThrow(() -> clock.checkAccess("price_bar", LocalDate.of(2030, 1, 1)));
    }

    @Test
    @DisplayName("推进后 - 当日及以前可读，次日起抛出")
    void testFutureAccessRejected() {
        clock.advanceTo(D1);

        assertDoesNotThrow(() -> clock.checkAccess("price_bar", D1));
        assertDoesNotThrow(() -> clock.checkAccess("price_bar", D1.minusDays(30)));
        LookAheadViolationException e = assertThrows(LookAheadViolationException.class,
                () -> clock.checkAccess("price_bar", D2));
        assertEquals("price_bar", e.getResource());
        assertEquals(D2, e.getRequestedDate());
        assertEquals(D1, e.getCurrentDate());
        assertEquals(4100, e.getErrorCode());
    }

    @Test
    @DisplayName("时钟只能向前推进")
    void testMonotonic() {
        clock.advanceTo(D2);

        assertThrows(IllegalStateException.class, () -> clock.advanceTo(D2));
        assertThrows(IllegalStateException.class, () -> clock.advanceTo(D1));

        clock.reset();
        clock.advanceTo(D1);
        assertEquals(D1, clock.currentDate().orElseThrow());
    }
}
