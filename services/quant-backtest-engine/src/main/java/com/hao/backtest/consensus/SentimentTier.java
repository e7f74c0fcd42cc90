package com.hao.backtest.consensus;

import lombok.Getter;

import java.util.Arrays;

/**
 * 情绪热度档位
 * <p>
 * 按讨论热度从高到低匹配，首个命中的档位给分。
 *
 * @author hli
 * @date 2026-03-05
 */
@Getter
public enum SentimentTier {

    HOT(20, "高热度") {
        @Override
        boolean matches(long discussionVolume, ConsensusThresholds thresholds) {
            return discussionVolume > thresholds.getSentimentHighThreshold();
        }
    },

    WARM(10, "中热度") {
        @Override
        boolean matches(long discussionVolume, ConsensusThresholds thresholds) {
            return discussionVolume > thresholds.getSentimentLowThreshold();
        }
    },

    COLD(0, "低热度") {
        @Override
        boolean matches(long discussionVolume, ConsensusThresholds thresholds) {
            return true;
        }
    };

    private final int score;
    private final String description;

    SentimentTier(int score, String description) {
        this.score = score;
        this.description = description;
    }

    abstract boolean matches(long discussionVolume, ConsensusThresholds thresholds);

    /**
     * 根据讨论热度匹配档位（替代 if-else 链）
     */
    public static SentimentTier matchTier(long discussionVolume, ConsensusThresholds thresholds) {
        return Arrays.stream(values())
                .filter(tier -> tier.matches(discussionVolume, thresholds))
                .findFirst()
                .orElse(COLD);
    }
}
