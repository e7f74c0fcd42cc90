package com.hao.backtest.feed;

import com.hao.backtest.domain.Instrument;

import java.time.LocalDate;

/**
 * 标的分类数据源
 * <p>
 * 同一历史日期的多次调用必须返回相同结果，运行期间不允许追溯改分类。
 *
 * @author hli
 * @date 2026-03-04
 */
public interface InstrumentFeed {

    /**
     * @param symbol 证券代码
     * @param asOf   查询日期
     * @return 截至该日期生效的标的信息，不返回 null
     */
    Instrument getInstrument(String symbol, LocalDate asOf);
}
