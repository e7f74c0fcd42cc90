package com.hao.backtest.consensus;

import com.hao.backtest.domain.signal.CapitalFlowSignal;
import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.domain.signal.LogicSignal;
import com.hao.backtest.domain.signal.TechnicalSignal;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 共识因子族枚举 (Consensus Factor Family)
 *
 * <p>每个因子族自带评分逻辑，族内为阈值阶梯函数，不做线性混合。
 * Each family carries its own step-function scoring; no linear blending inside a family.
 *
 * <h3>缺失处理 (Missing Data):</h3>
 * <ul>
 *   <li>整族缺失：得 0 分，并计入缺失族，完整度分母始终为 4</li>
 *   <li>资金面、逻辑面的两个子项各自独立，缺失子项得 0 分</li>
 * </ul>
 *
 * @author hli
 * @date 2026-03-05
 */
@Getter
public enum ConsensusFamily {

    /**
     * 技术面：接近 52 周高点 +10，短均线在长均线上方 +10
     */
    TECHNICAL(20, "技术面", "Technical") {
        @Override
        public boolean isPresent(ConsensusSignal signal) {
            return signal.technical().isPresent();
        }

        @Override
        public int score(ConsensusSignal signal, ConsensusThresholds thresholds) {
            if (signal.technical().isEmpty()) {
                return 0;
            }
            TechnicalSignal technical = signal.technical().get();
            int score = 0;
            BigDecimal nearHighLine = technical.high52Week().multiply(BigDecimal.ONE.subtract(thresholds.getNearHighTolerance()));
            if (technical.close().compareTo(nearHighLine) >= 0) {
                score += 10;
            }
            if (technical.shortMovingAverage().compareTo(technical.longMovingAverage()) > 0) {
                score += 10;
            }
            return score;
        }
    },

    /**
     * 资金面：北向净流入超阈值 +15，融资净买入超阈值 +15
     */
    CAPITAL_FLOW(30, "资金面", "Capital Flow") {
        @Override
        public boolean isPresent(ConsensusSignal signal) {
            return signal.capitalFlow().isPresent();
        }

        @Override
        public int score(ConsensusSignal signal, ConsensusThresholds thresholds) {
            if (signal.capitalFlow().isEmpty()) {
                return 0;
            }
            CapitalFlowSignal flow = signal.capitalFlow().get();
            int score = 0;
            if (flow.northboundNetInflow().filter(v -> v.compareTo(thresholds.getNorthboundInflowThreshold()) > 0).isPresent()) {
                score += 15;
            }
            if (flow.marginNetBuy().filter(v -> v.compareTo(thresholds.getMarginNetBuyThreshold()) > 0).isPresent()) {
                score += 15;
            }
            return score;
        }
    },

    /**
     * 逻辑面：分析师买入评级达标 +15，板块热度进入前 N +15
     */
    LOGIC(30, "逻辑面", "Logic") {
        @Override
        public boolean isPresent(ConsensusSignal signal) {
            return signal.logic().isPresent();
        }

        @Override
        public int score(ConsensusSignal signal, ConsensusThresholds thresholds) {
            if (signal.logic().isEmpty()) {
                return 0;
            }
            LogicSignal logic = signal.logic().get();
            int score = 0;
            if (logic.analystBuyCount().isPresent() && logic.analystBuyCount().getAsInt() >= thresholds.getAnalystBuyMinimum()) {
                score += 15;
            }
            if (logic.sectorHeatRank().isPresent()) {
                int rank = logic.sectorHeatRank().getAsInt();
                if (rank >= 1 && rank <= thresholds.getSectorHeatTopN()) {
                    score += 15;
                }
            }
            return score;
        }
    },

    /**
     * 情绪面：按讨论热度档位给 20 / 10 / 0 分
     */
    SENTIMENT(20, "情绪面", "Sentiment") {
        @Override
        public boolean isPresent(ConsensusSignal signal) {
            return signal.sentiment().isPresent();
        }

        @Override
        public int score(ConsensusSignal signal, ConsensusThresholds thresholds) {
            return signal.sentiment()
                    .map(s -> SentimentTier.matchTier(s.discussionVolume(), thresholds).getScore())
                    .orElse(0);
        }
    };

    /**
     * 该族满分
     */
    private final int maxScore;

    private final String name;

    private final String englishName;

    ConsensusFamily(int maxScore, String name, String englishName) {
        this.maxScore = maxScore;
        this.name = name;
        this.englishName = englishName;
    }

    // ==================== 核心评分方法 ====================

    /**
     * 该族是否至少有一项输入
     */
    public abstract boolean isPresent(ConsensusSignal signal);

    /**
     * 计算该族得分，结果位于 [0, maxScore]
     */
    public abstract int score(ConsensusSignal signal, ConsensusThresholds thresholds);
}
