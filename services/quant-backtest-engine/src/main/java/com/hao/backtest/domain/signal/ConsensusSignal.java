package com.hao.backtest.domain.signal;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 单只股票单日的共识信号
 * <p>
 * 四个因子族各自整体存在或缺失。缺失以 Optional.empty 表达，
 * 由评分引擎在边界处统一判断，不会被当作“原始值为 0”参与运算。
 *
 * @author hli
 * @date 2026-03-03
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConsensusSignal {

    private final String symbol;

    private final LocalDate tradeDate;

    @Getter(lombok.AccessLevel.NONE)
    private final TechnicalSignal technical;

    @Getter(lombok.AccessLevel.NONE)
    private final CapitalFlowSignal capitalFlow;

    @Getter(lombok.AccessLevel.NONE)
    private final LogicSignal logic;

    @Getter(lombok.AccessLevel.NONE)
    private final SentimentSignal sentiment;

    @Builder(toBuilder = true)
    private ConsensusSignal(String symbol, LocalDate tradeDate, TechnicalSignal technical,
                            CapitalFlowSignal capitalFlow, LogicSignal logic, SentimentSignal sentiment) {
        this.symbol = symbol;
        this.tradeDate = tradeDate;
        this.technical = technical;
        this.capitalFlow = capitalFlow;
        this.logic = logic;
        this.sentiment = sentiment;
    }

    /**
     * 四个因子族全部缺失的信号
     */
    public static ConsensusSignal absent(String symbol, LocalDate tradeDate) {
        return ConsensusSignal.builder().symbol(symbol).tradeDate(tradeDate).build();
    }

    public Optional<TechnicalSignal> technical() {
        return Optional.ofNullable(technical);
    }

    public Optional<CapitalFlowSignal> capitalFlow() {
        return Optional.ofNullable(capitalFlow);
    }

    public Optional<LogicSignal> logic() {
        return Optional.ofNullable(logic);
    }

    public Optional<SentimentSignal> sentiment() {
        return Optional.ofNullable(sentiment);
    }

    /**
     * 补充技术面（用于由 K 线推导技术指标的场景）
     */
    public ConsensusSignal withTechnical(TechnicalSignal derived) {
        return toBuilder().technical(derived).build();
    }
}
