package util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 交易日校验工具类
 *
 * 设计目的：
 * 1. 提供统一的交易日校验入口，回测引擎与数据仓库共用。
 * 2. 由历史 K 线日期推导回测交易日历，避免依赖外部日历服务。
 *
 * 使用说明：
 * - 交易日历以“出现过 K 线的日期”为准，周末日期即使有数据也会被剔除。
 * - 返回的日历升序、去重，可直接作为回放循环的驱动序列。
 *
 * @author hli
 * @date 2026-03-02
 */
public class TradingDateValidator {

    private TradingDateValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 判断是否为周末（A 股周末休市）
     */
    public static boolean isWeekend(LocalDate date) {
        if (date == null) {
            return false;
        }
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        return dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY;
    }

    /**
     * 从候选日期中筛选 [startDate, endDate] 闭区间内的交易日
     *
     * @param candidateDates 候选日期（通常为全部 K 线日期，可重复、可乱序）
     * @param startDate      起始日期（包含）
     * @param endDate        结束日期（包含）
     * @return 升序去重后的交易日历
     */
    public static List<LocalDate> tradingDaysBetween(Collection<LocalDate> candidateDates,
                                                     LocalDate startDate, LocalDate endDate) {
        if (candidateDates == null || candidateDates.isEmpty() || startDate == null || endDate == null
                || startDate.isAfter(endDate)) {
            return List.of();
        }
        return candidateDates.stream()
                .filter(Objects::nonNull)
                .filter(d -> !d.isBefore(startDate) && !d.isAfter(endDate))
                .filter(d -> !isWeekend(d))
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }
}
