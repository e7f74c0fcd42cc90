package com.hao.backtest.config;

import com.hao.backtest.consensus.ConsensusScorer;
import com.hao.backtest.consensus.ConsensusThresholds;
import com.hao.backtest.consensus.technical.TechnicalSignalDeriver;
import com.hao.backtest.cost.CostModel;
import com.hao.backtest.cost.CostRates;
import com.hao.backtest.metrics.MetricsCalculator;
import com.hao.backtest.policy.ConsensusRankingPolicy;
import com.hao.backtest.rule.PriceLimitCalculator;
import com.hao.backtest.rule.TradingRuleSet;
import com.hao.backtest.rule.TradingRuleValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 回测核心组件装配
 * <p>
 * 规则表、费率、评分阈值均由配置转换为不可变值对象后注入各组件，非法配置在启动阶段抛出 ConfigurationException。
 *
 * @author hli
 * @date 2026-03-07
 */
@Slf4j
@Configuration
public class BacktestComponentConfig {

    @Bean
    public TradingRuleSet tradingRuleSet(BacktestProperties properties) {
        BacktestProperties.Rules rules = properties.getRules();
        TradingRuleSet ruleSet = TradingRuleSet.builder()
                .lotSize(rules.getLotSize())
                .mainBoardLimitRatio(rules.getMainBoardLimitRatio())
                .growthBoardLimitRatio(rules.getGrowthBoardLimitRatio())
                .specialTreatmentLimitRatio(rules.getSpecialTreatmentLimitRatio())
                .settlementDays(rules.getSettlementDays())
                .build()
                .validate();
        log.info("交易规则加载完成|Trading_rules_loaded,rules={}", ruleSet);
        return ruleSet;
    }

    @Bean
    public TradingRuleValidator tradingRuleValidator(TradingRuleSet tradingRuleSet) {
        return new TradingRuleValidator(tradingRuleSet);
    }

    @Bean
    public PriceLimitCalculator priceLimitCalculator(TradingRuleSet tradingRuleSet) {
        return new PriceLimitCalculator(tradingRuleSet);
    }

    @Bean
    public CostModel costModel(BacktestProperties properties) {
        BacktestProperties.Cost cost = properties.getCost();
        CostRates rates = CostRates.builder()
                .commissionRate(cost.getCommissionRate())
                .minimumCommission(cost.getMinimumCommission())
                .stampDutyRate(cost.getStampDutyRate())
                .transferFeeRate(cost.getTransferFeeRate())
                .transferFeeVenue(cost.getTransferFeeVenue())
                .slippageRate(cost.getSlippageRate())
                .build();
        log.info("费率加载完成|Cost_rates_loaded,rates={}", rates);
        return new CostModel(rates);
    }

    @Bean
    public ConsensusScorer consensusScorer(BacktestProperties properties) {
        BacktestProperties.Consensus consensus = properties.getConsensus();
        ConsensusThresholds thresholds = ConsensusThresholds.builder()
                .nearHighTolerance(consensus.getNearHighTolerance())
                .northboundInflowThreshold(consensus.getNorthboundInflowThreshold())
                .marginNetBuyThreshold(consensus.getMarginNetBuyThreshold())
                .analystBuyMinimum(consensus.getAnalystBuyMinimum())
                .sectorHeatTopN(consensus.getSectorHeatTopN())
                .sentimentHighThreshold(consensus.getSentimentHighThreshold())
                .sentimentLowThreshold(consensus.getSentimentLowThreshold())
                .build();
        return new ConsensusScorer(thresholds);
    }

    @Bean
    public TechnicalSignalDeriver technicalSignalDeriver(BacktestProperties properties) {
        BacktestProperties.Consensus consensus = properties.getConsensus();
        return new TechnicalSignalDeriver(consensus.getShortMaWindow(), consensus.getLongMaWindow(),
                consensus.getHighLookbackDays());
    }

    @Bean
    public MetricsCalculator metricsCalculator(BacktestProperties properties) {
        return new MetricsCalculator(properties.getMetrics().getRiskFreeRate());
    }

    @Bean
    public ConsensusRankingPolicy.Settings consensusRankingPolicySettings(BacktestProperties properties) {
        BacktestProperties.Policy policy = properties.getPolicy();
        return ConsensusRankingPolicy.Settings.builder()
                .entryScore(policy.getEntryScore())
                .minCompleteness(policy.getMinCompleteness())
                .exitScore(policy.getExitScore())
                .targetPositions(policy.getTargetPositions())
                .lotSize(properties.getRules().getLotSize())
                .costBuffer(policy.getCostBuffer())
                .build();
    }
}
