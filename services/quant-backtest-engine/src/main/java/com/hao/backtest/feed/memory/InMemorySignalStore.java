package com.hao.backtest.feed.memory;

import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.feed.SignalFeed;
import exception.DataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * 内存共识信号仓库
 * <p>
 * 未收录的 (symbol, date) 返回四族全缺失的信号，不抛异常。
 *
 * @author hli
 * @date 2026-03-04
 */
@Slf4j
public class InMemorySignalStore implements SignalFeed {

    private final Map<String, Map<LocalDate, ConsensusSignal>> signals = new HashMap<>();

    public void addAll(Collection<ConsensusSignal> consensusSignals) {
        consensusSignals.forEach(this::add);
        log.info("共识信号装载完成|Consensus_signals_loaded,symbols={},records={}", signals.size(), consensusSignals.size());
    }

    public void add(ConsensusSignal signal) {
        Assert.notNull(signal, "signal must not be null");
        Assert.hasText(signal.getSymbol(), "symbol must not be empty");
        Assert.notNull(signal.getTradeDate(), "tradeDate must not be null");
        ConsensusSignal existing = signals.computeIfAbsent(signal.getSymbol(), k -> new HashMap<>())
                .putIfAbsent(signal.getTradeDate(), signal);
        if (existing != null) {
            throw new DataException("duplicate consensus signal for " + signal.getSymbol() + " on " + signal.getTradeDate());
        }
    }

    @Override
    public ConsensusSignal getSignals(String symbol, LocalDate date) {
        Map<LocalDate, ConsensusSignal> series = signals.get(symbol);
        ConsensusSignal signal = series == null ? null : series.get(date);
        return signal == null ? ConsensusSignal.absent(symbol, date) : signal;
    }
}
