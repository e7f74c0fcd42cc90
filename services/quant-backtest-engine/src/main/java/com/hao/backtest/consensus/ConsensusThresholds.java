package com.hao.backtest.consensus;

import exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 共识评分阈值
 *
 * @author hli
 * @date 2026-03-05
 */
@Value
@Builder(toBuilder = true)
public class ConsensusThresholds {

    /**
     * 收盘价距 52 周高点的容忍度，0.05 表示 close ≥ 0.95 × high
     */
    @Builder.Default
    BigDecimal nearHighTolerance = new BigDecimal("0.05");

    /**
     * 北向资金净流入阈值（元）
     */
    @Builder.Default
    BigDecimal northboundInflowThreshold = new BigDecimal("10000000");

    /**
     * 融资净买入阈值（元）
     */
    @Builder.Default
    BigDecimal marginNetBuyThreshold = new BigDecimal("5000000");

    /**
     * 分析师买入评级最少家数
     */
    @Builder.Default
    int analystBuyMinimum = 5;

    /**
     * 板块热度排名前 N
     */
    @Builder.Default
    int sectorHeatTopN = 10;

    /**
     * 讨论热度高阈值
     */
    @Builder.Default
    long sentimentHighThreshold = 10000L;

    /**
     * 讨论热度低阈值
     */
    @Builder.Default
    long sentimentLowThreshold = 3000L;

    public static ConsensusThresholds defaults() {
        return ConsensusThresholds.builder().build();
    }

    public ConsensusThresholds validate() {
        if (nearHighTolerance == null || nearHighTolerance.signum() < 0 || nearHighTolerance.compareTo(BigDecimal.ONE) >= 0) {
            throw new ConfigurationException("nearHighTolerance must be within [0, 1): " + nearHighTolerance);
        }
        if (northboundInflowThreshold == null || marginNetBuyThreshold == null) {
            throw new ConfigurationException("capital flow thresholds must not be null");
        }
        if (sectorHeatTopN <= 0) {
            throw new ConfigurationException("sectorHeatTopN must be positive: " + sectorHeatTopN);
        }
        if (sentimentLowThreshold > sentimentHighThreshold) {
            throw new ConfigurationException("sentimentLowThreshold must not exceed sentimentHighThreshold");
        }
        return this;
    }
}
