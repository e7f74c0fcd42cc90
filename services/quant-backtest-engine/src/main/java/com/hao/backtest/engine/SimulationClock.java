package com.hao.backtest.engine;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 模拟时钟
 *
 * 设计目的：
 * 1. 作为回测中“当前模拟日期”的唯一来源，所有行情/信号访问都以此为准做因果校验。
 * 2. 只能单调前进；回测结束后复位，复位状态下（数据准备阶段）不做校验。
 *
 * 线程安全说明：
 * - 仅回测主线程推进时钟；评分工作线程只读，currentDate 使用 volatile 保证可见性。
 *
 * @author hli
 * @date 2026-03-06
 */
public class SimulationClock {

    private volatile LocalDate currentDate;

    public Optional<LocalDate> currentDate() {
        return Optional.ofNullable(currentDate);
    }

    /**
     * 推进到下一交易日，日期必须严格递增
     */
    public void advanceTo(LocalDate nextDate) {
        LocalDate current = currentDate;
        if (nextDate == null) {
            throw new IllegalArgumentException("nextDate must not be null");
        }
        if (current != null && !nextDate.isAfter(current)) {
            throw new IllegalStateException("clock must move forward: current=" + current + ", next=" + nextDate);
        }
        currentDate = nextDate;
    }

    public void reset() {
        currentDate = null;
    }

    /**
     * 因果校验：请求日期晚于当前模拟日期时抛出 LookAheadViolationException
     *
     * @param resource      访问的数据类型，用于错误定位
     * @param requestedDate 请求的数据日期
     */
    public void checkAccess(String resource, LocalDate requestedDate) {
        LocalDate current = currentDate;
        if (current != null && requestedDate != null && requestedDate.isAfter(current)) {
            throw new LookAheadViolationException(resource, requestedDate, current);
        }
    }
}
