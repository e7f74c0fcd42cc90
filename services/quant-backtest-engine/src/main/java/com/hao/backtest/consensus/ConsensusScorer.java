package com.hao.backtest.consensus;

import com.hao.backtest.domain.signal.ConsensusSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 共识评分器
 *
 * 设计目的：
 * 1. 对单条共识信号计算四族得分、总分与完整度，纯函数、无共享可变状态，可并行调用。
 * 2. 缺失数据不是异常路径：四族全缺失时总分 0、完整度 0.0。
 *
 * @author hli
 * @date 2026-03-05
 */
@Slf4j
public class ConsensusScorer {

    private static final int FAMILY_COUNT = ConsensusFamily.values().length;

    private final ConsensusThresholds thresholds;

    public ConsensusScorer(ConsensusThresholds thresholds) {
        Assert.notNull(thresholds, "ConsensusThresholds must not be null");
        this.thresholds = thresholds.validate();
    }

    public ConsensusThresholds getThresholds() {
        return thresholds;
    }

    /**
     * 计算共识评分
     *
     * @param signal 共识信号（任意因子族可缺失）
     * @return 评分结果
     */
    public ConsensusScore score(ConsensusSignal signal) {
        Assert.notNull(signal, "signal must not be null");

        Map<ConsensusFamily, Integer> familyScores = new EnumMap<>(ConsensusFamily.class);
        Set<ConsensusFamily> missing = EnumSet.noneOf(ConsensusFamily.class);
        for (ConsensusFamily family : ConsensusFamily.values()) {
            if (!family.isPresent(signal)) {
                missing.add(family);
                familyScores.put(family, 0);
                continue;
            }
            familyScores.put(family, family.score(signal, thresholds));
        }

        int total = familyScores.values().stream().mapToInt(Integer::intValue).sum();
        double completeness = 1.0 - (double) missing.size() / FAMILY_COUNT;
        if (!missing.isEmpty()) {
            log.debug("共识数据缺失_按0分处理|Consensus_family_missing,symbol={},date={},missing={}",
                    signal.getSymbol(), signal.getTradeDate(), missing);
        }

        return ConsensusScore.builder()
                .symbol(signal.getSymbol())
                .tradeDate(signal.getTradeDate())
                .technicalScore(familyScores.get(ConsensusFamily.TECHNICAL))
                .capitalFlowScore(familyScores.get(ConsensusFamily.CAPITAL_FLOW))
                .logicScore(familyScores.get(ConsensusFamily.LOGIC))
                .sentimentScore(familyScores.get(ConsensusFamily.SENTIMENT))
                .totalScore(total)
                .missingFamilies(Collections.unmodifiableSet(missing))
                .completeness(completeness)
                .build();
    }
}
