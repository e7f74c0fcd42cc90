package com.hao.backtest.feed;

import com.hao.backtest.domain.signal.ConsensusSignal;

import java.time.LocalDate;

/**
 * 共识信号数据源
 * <p>
 * 缺失数据以空的因子族表达，永远不因缺失而抛出异常。
 *
 * @author hli
 * @date 2026-03-04
 */
public interface SignalFeed {

    ConsensusSignal getSignals(String symbol, LocalDate date);
}
