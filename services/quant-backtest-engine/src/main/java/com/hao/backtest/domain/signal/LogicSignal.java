package com.hao.backtest.domain.signal;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * 逻辑面原始指标：分析师买入评级数量、所属板块热度排名（1 为最热）
 *
 * @author hli
 * @date 2026-03-03
 */
public record LogicSignal(OptionalInt analystBuyCount,
                          OptionalInt sectorHeatRank) {

    public LogicSignal {
        analystBuyCount = analystBuyCount == null ? OptionalInt.empty() : analystBuyCount;
        sectorHeatRank = sectorHeatRank == null ? OptionalInt.empty() : sectorHeatRank;
        if (analystBuyCount.isEmpty() && sectorHeatRank.isEmpty()) {
            throw new IllegalArgumentException("logic signal requires at least one input");
        }
    }

    public static Optional<LogicSignal> of(Integer analystBuyCount, Integer sectorHeatRank) {
        if (analystBuyCount == null && sectorHeatRank == null) {
            return Optional.empty();
        }
        return Optional.of(new LogicSignal(
                analystBuyCount == null ? OptionalInt.empty() : OptionalInt.of(analystBuyCount),
                sectorHeatRank == null ? OptionalInt.empty() : OptionalInt.of(sectorHeatRank)));
    }
}
