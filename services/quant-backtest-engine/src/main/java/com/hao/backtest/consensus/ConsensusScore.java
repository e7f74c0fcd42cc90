package com.hao.backtest.consensus;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Set;

/**
 * 共识评分结果
 *
 * @author hli
 * @date 2026-03-05
 */
@Value
@Builder
public class ConsensusScore {

    /**
     * 排序规则：总分降序，同分按代码字典序升序
     */
    public static final Comparator<ConsensusScore> RANKING =
            Comparator.comparingInt(ConsensusScore::getTotalScore).reversed()
                    .thenComparing(ConsensusScore::getSymbol);

    String symbol;

    LocalDate tradeDate;

    /**
     * 技术面 [0, 20]
     */
    int technicalScore;

    /**
     * 资金面 [0, 30]
     */
    int capitalFlowScore;

    /**
     * 逻辑面 [0, 30]
     */
    int logicScore;

    /**
     * 情绪面 [0, 20]
     */
    int sentimentScore;

    /**
     * 总分 [0, 100]
     */
    int totalScore;

    Set<ConsensusFamily> missingFamilies;

    /**
     * 数据完整度 = 1 − 缺失族数 / 4
     */
    double completeness;
}
