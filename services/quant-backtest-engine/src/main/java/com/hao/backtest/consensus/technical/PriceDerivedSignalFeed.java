package com.hao.backtest.consensus.technical;

import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.feed.PriceFeed;
import com.hao.backtest.feed.SignalFeed;
import org.springframework.util.Assert;

import java.time.LocalDate;

/**
 * 技术面补全信号源（装饰器）
 * <p>
 * 原始信号缺少技术面时，用截至当日的日线推导补全；原始信号已有技术面时原样返回。
 * 日线读取经由传入的 PriceFeed，回测中即为带时间校验的因果视图。
 *
 * @author hli
 * @date 2026-03-05
 */
public class PriceDerivedSignalFeed implements SignalFeed {

    private final SignalFeed delegate;

    private final PriceFeed priceFeed;

    private final TechnicalSignalDeriver deriver;

    public PriceDerivedSignalFeed(SignalFeed delegate, PriceFeed priceFeed, TechnicalSignalDeriver deriver) {
        Assert.notNull(delegate, "delegate SignalFeed must not be null");
        Assert.notNull(priceFeed, "PriceFeed must not be null");
        Assert.notNull(deriver, "TechnicalSignalDeriver must not be null");
        this.delegate = delegate;
        this.priceFeed = priceFeed;
        this.deriver = deriver;
    }

    @Override
    public ConsensusSignal getSignals(String symbol, LocalDate date) {
        ConsensusSignal signal = delegate.getSignals(symbol, date);
        if (signal.technical().isPresent()) {
            return signal;
        }
        return deriver.derive(priceFeed.getHistory(symbol, date, deriver.getHighLookback()))
                .map(signal::withTechnical)
                .orElse(signal);
    }
}
