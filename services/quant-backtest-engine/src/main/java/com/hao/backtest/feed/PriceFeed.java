package com.hao.backtest.feed;

import com.hao.backtest.domain.PriceBar;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 日线数据源
 * <p>
 * 返回的日线须已补全涨跌停 / 停牌状态。
 *
 * @author hli
 * @date 2026-03-04
 */
public interface PriceFeed {

    Optional<PriceBar> getPriceBar(String symbol, LocalDate date);

    /**
     * 截至 endDate（含）最近的 limit 根日线，按日期升序
     */
    List<PriceBar> getHistory(String symbol, LocalDate endDate, int limit);
}
