package com.hao.backtest.repository;

import com.hao.backtest.domain.Instrument;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.domain.signal.ConsensusSignal;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * 一次回测所需的全部历史数据
 *
 * @author hli
 * @date 2026-03-08
 */
@Value
@Builder
public class MarketDataBundle {

    @Singular
    List<InstrumentListing> instruments;

    @Singular
    List<PriceBar> priceBars;

    @Singular
    List<ConsensusSignal> signals;

    /**
     * 带生效日期的标的信息，effectiveDate 为空表示自始有效
     */
    @Value
    public static class InstrumentListing {
        Instrument instrument;
        LocalDate effectiveDate;
    }
}
