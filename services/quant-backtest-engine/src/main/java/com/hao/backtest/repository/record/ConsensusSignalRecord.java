package com.hao.backtest.repository.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hao.backtest.domain.signal.CapitalFlowSignal;
import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.domain.signal.LogicSignal;
import com.hao.backtest.domain.signal.SentimentSignal;
import com.hao.backtest.domain.signal.TechnicalSignal;
import exception.DataException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 共识信号 JSONL 行（consensus_signals.jsonl）
 * <p>
 * 缺失的因子族直接省略对应对象；技术面对象存在时四个字段必须齐全。
 *
 * @author hli
 * @date 2026-03-08
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConsensusSignalRecord {

    private String symbol;

    private LocalDate date;

    private Technical technical;

    private CapitalFlow capitalFlow;

    private Logic logic;

    private Sentiment sentiment;

    public ConsensusSignal toDomain() {
        ConsensusSignal.ConsensusSignalBuilder builder = ConsensusSignal.builder().symbol(symbol).tradeDate(date);
        if (technical != null) {
            if (technical.close == null || technical.high52Week == null || technical.shortMa == null || technical.longMa == null) {
                throw new DataException("incomplete technical family for " + symbol + " on " + date);
            }
            builder.technical(new TechnicalSignal(technical.close, technical.high52Week, technical.shortMa, technical.longMa));
        }
        if (capitalFlow != null) {
            CapitalFlowSignal.of(capitalFlow.northboundNetInflow, capitalFlow.marginNetBuy).ifPresent(builder::capitalFlow);
        }
        if (logic != null) {
            LogicSignal.of(logic.analystBuyCount, logic.sectorHeatRank).ifPresent(builder::logic);
        }
        if (sentiment != null && sentiment.discussionVolume != null) {
            builder.sentiment(new SentimentSignal(sentiment.discussionVolume));
        }
        return builder.build();
    }

    public static ConsensusSignalRecord from(ConsensusSignal signal) {
        ConsensusSignalRecord record = new ConsensusSignalRecord();
        record.setSymbol(signal.getSymbol());
        record.setDate(signal.getTradeDate());
        signal.technical().ifPresent(t -> record.setTechnical(
                new Technical(t.close(), t.high52Week(), t.shortMovingAverage(), t.longMovingAverage())));
        signal.capitalFlow().ifPresent(c -> record.setCapitalFlow(
                new CapitalFlow(c.northboundNetInflow().orElse(null), c.marginNetBuy().orElse(null))));
        signal.logic().ifPresent(l -> record.setLogic(new Logic(
                l.analystBuyCount().isPresent() ? l.analystBuyCount().getAsInt() : null,
                l.sectorHeatRank().isPresent() ? l.sectorHeatRank().getAsInt() : null)));
        signal.sentiment().ifPresent(s -> record.setSentiment(new Sentiment(s.discussionVolume())));
        return record;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Technical {
        private BigDecimal close;
        private BigDecimal high52Week;
        private BigDecimal shortMa;
        private BigDecimal longMa;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CapitalFlow {
        /**
         * 北向资金净流入（元）
         */
        private BigDecimal northboundNetInflow;
        /**
         * 融资净买入（元）
         */
        private BigDecimal marginNetBuy;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Logic {
        private Integer analystBuyCount;
        /**
         * 板块热度排名，1 为最热
         */
        private Integer sectorHeatRank;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Sentiment {
        private Long discussionVolume;
    }
}
