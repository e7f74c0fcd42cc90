package com.hao.backtest.consensus;

import com.hao.backtest.domain.signal.CapitalFlowSignal;
import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.domain.signal.LogicSignal;
import com.hao.backtest.domain.signal.SentimentSignal;
import com.hao.backtest.domain.signal.TechnicalSignal;
import exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 共识评分测试
 * <p>
 * 技术面 20、资金面 30、逻辑面 30、情绪面 20，缺失族计 0 分并降低完整度。
 *
 * @author hli
 * @date 2026-03-10
 */
class ConsensusScorerTest {

    private static final String SYMBOL = "600519.SH";
    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    private ConsensusScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new ConsensusScorer(ConsensusThresholds.defaults());
    }

    @Test
    @DisplayName("四族全部缺失 - 0 分，完整度 0")
    void testAllAbsent() {
        ConsensusScore score = scorer.score(ConsensusSignal.absent(SYMBOL, DAY));

        assertEquals(0, score.getTotalScore());
        assertEquals(0.0, score.getCompleteness());
        assertEquals(EnumSet.allOf(ConsensusFamily.class), score.getMissingFamilies());
    }

    @Test
    @DisplayName("四族全部满足 - 满分 100")
    void testFullScore() {
        ConsensusSignal signal = ConsensusSignal.builder()
                .symbol(SYMBOL)
                .tradeDate(DAY)
                .technical(technical("96", "100", "95", "90"))
                .capitalFlow(CapitalFlowSignal.of(new BigDecimal("20000000"), new BigDecimal("6000000")).orElseThrow())
                .logic(LogicSignal.of(8, 3).orElseThrow())
                .sentiment(new SentimentSignal(15000))
                .build();

        ConsensusScore score = scorer.score(signal);

        assertEquals(20, score.getTechnicalScore());
        assertEquals(30, score.getCapitalFlowScore());
        assertEquals(30, score.getLogicScore());
        assertEquals(20, score.getSentimentScore());
        assertEquals(100, score.getTotalScore());
        assertEquals(1.0, score.getCompleteness());
        assertTrue(score.getMissingFamilies().isEmpty());
    }

    @Test
    @DisplayName("技术面 - 距高点 5% 以内含边界；均线多头")
    void testTechnical() {
        // 95 = 100 * (1 - 0.05)，边界视为接近高点
        assertEquals(10, familyScore(ConsensusFamily.TECHNICAL, technicalOnly("95", "100", "90", "95")));
        assertEquals(0, familyScore(ConsensusFamily.TECHNICAL, technicalOnly("94.99", "100", "90", "95")));
        assertEquals(10, familyScore(ConsensusFamily.TECHNICAL, technicalOnly("80", "100", "96", "95")));
        // 均线相等不算多头
        assertEquals(0, familyScore(ConsensusFamily.TECHNICAL, technicalOnly("80", "100", "95", "95")));
    }

    @Test
    @DisplayName("资金面 - 严格大于阈值才得分，单项缺失不影响另一项")
    void testCapitalFlow() {
        ConsensusSignal atThreshold = ConsensusSignal.builder().symbol(SYMBOL).tradeDate(DAY)
                .capitalFlow(CapitalFlowSignal.of(new BigDecimal("10000000"), new BigDecimal("5000000")).orElseThrow())
                .build();
        ConsensusSignal marginOnly = ConsensusSignal.builder().symbol(SYMBOL).tradeDate(DAY)
                .capitalFlow(CapitalFlowSignal.of(null, new BigDecimal("5000001")).orElseThrow())
                .build();

        assertEquals(0, familyScore(ConsensusFamily.CAPITAL_FLOW, atThreshold));
        assertEquals(15, familyScore(ConsensusFamily.CAPITAL_FLOW, marginOnly));
        assertEquals(0.25, scorer.score(marginOnly).getCompleteness());
    }

    @Test
    @DisplayName("逻辑面 - 分析师数量 >= 5；板块排名在 [1, 10]")
    void testLogic() {
        assertEquals(15, familyScore(ConsensusFamily.LOGIC, logicOnly(5, null)));
        assertEquals(0, familyScore(ConsensusFamily.LOGIC, logicOnly(4, null)));
        assertEquals(15, familyScore(ConsensusFamily.LOGIC, logicOnly(null, 10)));
        assertEquals(0, familyScore(ConsensusFamily.LOGIC, logicOnly(null, 11)));
        assertEquals(0, familyScore(ConsensusFamily.LOGIC, logicOnly(null, 0)));
    }

    @Test
    @DisplayName("情绪面 - 三档热度，阈值边界不升档")
    void testSentimentTiers() {
        assertEquals(20, familyScore(ConsensusFamily.SENTIMENT, sentimentOnly(10001)));
        assertEquals(10, familyScore(ConsensusFamily.SENTIMENT, sentimentOnly(10000)));
        assertEquals(10, familyScore(ConsensusFamily.SENTIMENT, sentimentOnly(3001)));
        assertEquals(0, familyScore(ConsensusFamily.SENTIMENT, sentimentOnly(3000)));
        assertEquals(0, familyScore(ConsensusFamily.SENTIMENT, sentimentOnly(0)));
    }

    @Test
    @DisplayName("存在但不达标的族不计入缺失")
    void testPresentButZeroIsNotMissing() {
        ConsensusScore score = scorer.score(sentimentOnly(0));

        assertEquals(0, score.getTotalScore());
        assertEquals(0.25, score.getCompleteness());
        assertFalse(score.getMissingFamilies().contains(ConsensusFamily.SENTIMENT));
    }

    @Test
    @DisplayName("非法阈值 - 拒绝构造")
    void testInvalidThresholds() {
        ConsensusThresholds broken = ConsensusThresholds.builder().sentimentLowThreshold(20000).build();

        assertThrows(ConfigurationException.class, () -> new ConsensusScorer(broken));
    }

    private int familyScore(ConsensusFamily family, ConsensusSignal signal) {
        ConsensusScore score = scorer.score(signal);
        switch (family) {
            case TECHNICAL:
                return score.getTechnicalScore();
            case CAPITAL_FLOW:
                return score.getCapitalFlowScore();
            case LOGIC:
                return score.getLogicScore();
            default:
                return score.getSentimentScore();
        }
    }

    private static TechnicalSignal technical(String close, String high, String shortMa, String longMa) {
        return new TechnicalSignal(new BigDecimal(close), new BigDecimal(high), new BigDecimal(shortMa), new BigDecimal(longMa));
    }

    private static ConsensusSignal technicalOnly(String close, String high, String shortMa, String longMa) {
        return ConsensusSignal.builder().symbol(SYMBOL).tradeDate(DAY).technical(technical(close, high, shortMa, longMa)).build();
    }

    private static ConsensusSignal logicOnly(Integer analysts, Integer rank) {
        return ConsensusSignal.builder().symbol(SYMBOL).tradeDate(DAY).logic(LogicSignal.of(analysts, rank).orElseThrow()).build();
    }

    private static ConsensusSignal sentimentOnly(long volume) {
        return ConsensusSignal.builder().symbol(SYMBOL).tradeDate(DAY).sentiment(new SentimentSignal(volume)).build();
    }
}
