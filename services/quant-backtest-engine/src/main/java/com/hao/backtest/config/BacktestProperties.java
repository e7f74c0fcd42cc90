package com.hao.backtest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 回测配置属性类
 *
 * 设计目的：
 * 1. 集中管理回测区间、资金、交易规则、费率、评分阈值与内置策略参数。
 * 2. 通过 @ConfigurationProperties 实现类型安全的配置绑定，默认值即 A 股常用口径。
 *
 * 配置示例（application.yml）：
 * <pre>
 * backtest:
 *   enabled: true
 *   start-date: 2024-01-02
 *   end-date: 2024-06-28
 *   initial-capital: 1000000
 *   data-dir: ./data
 *   cost:
 *     slippage-rate: 0.001
 * </pre>
 *
 * @author hli
 * @date 2026-03-07
 */
@Data
@Component
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    /**
     * 是否在启动时自动执行回测
     */
    private boolean enabled = false;

    /**
     * 回测起始日期，格式：yyyy-MM-dd；为空时取数据最早日期
     */
    private String startDate;

    /**
     * 回测结束日期，格式：yyyy-MM-dd；为空时取数据最晚日期
     */
    private String endDate;

    private BigDecimal initialCapital = new BigDecimal("1000000");

    private int maxPositions = 5;

    /**
     * 股票池，为空时使用数据中的全部标的
     */
    private List<String> universe = new ArrayList<>();

    /**
     * JSONL 数据目录
     */
    private String dataDir = "./data";

    /**
     * 回测报告输出目录
     */
    private String reportDir = "./reports";

    private Rules rules = new Rules();

    private Cost cost = new Cost();

    private Consensus consensus = new Consensus();

    private ScoringPool scoringPool = new ScoringPool();

    private Policy policy = new Policy();

    private Metrics metrics = new Metrics();

    /**
     * 交易规则
     */
    @Data
    public static class Rules {
        private long lotSize = 100L;
        private BigDecimal mainBoardLimitRatio = new BigDecimal("0.10");
        private BigDecimal growthBoardLimitRatio = new BigDecimal("0.20");
        private BigDecimal specialTreatmentLimitRatio = new BigDecimal("0.05");
        /**
         * 结算延迟（自然日），1 即 T+1
         */
        private int settlementDays = 1;
    }

    /**
     * 交易费率
     */
    @Data
    public static class Cost {
        private BigDecimal commissionRate = new BigDecimal("0.0003");
        private BigDecimal minimumCommission = new BigDecimal("5.00");
        private BigDecimal stampDutyRate = new BigDecimal("0.0005");
        private BigDecimal transferFeeRate = new BigDecimal("0.00001");
        private String transferFeeVenue = "SH";
        private BigDecimal slippageRate = new BigDecimal("0.001");
    }

    /**
     * 共识评分
     */
    @Data
    public static class Consensus {
        private BigDecimal nearHighTolerance = new BigDecimal("0.05");
        private BigDecimal northboundInflowThreshold = new BigDecimal("10000000");
        private BigDecimal marginNetBuyThreshold = new BigDecimal("5000000");
        private int analystBuyMinimum = 5;
        private int sectorHeatTopN = 10;
        private long sentimentHighThreshold = 10000L;
        private long sentimentLowThreshold = 3000L;
        /**
         * 信号缺少技术面时是否由日线推导
         */
        private boolean deriveTechnicalFromPrices = true;
        private int shortMaWindow = 5;
        private int longMaWindow = 20;
        /**
         * 52 周高点回看交易日数
         */
        private int highLookbackDays = 250;
    }

    /**
     * 评分线程池
     */
    @Data
    public static class ScoringPool {
        /**
         * 关闭时评分在回放主线程顺序执行
         */
        private boolean enabled = true;
        /**
         * 核心线程数，0 表示取 CPU 核数
         */
        private int corePoolSize = 0;
        private int maxPoolSize = 0;
        private int queueCapacity = 500;
        private int keepAliveSeconds = 60;
    }

    /**
     * 内置共识排名策略
     */
    @Data
    public static class Policy {
        private int entryScore = 60;
        private double minCompleteness = 0.5;
        private int exitScore = 30;
        private int targetPositions = 5;
        private BigDecimal costBuffer = new BigDecimal("0.01");
    }

    /**
     * 绩效指标
     */
    @Data
    public static class Metrics {
        /**
         * 年化无风险利率
         */
        private double riskFreeRate = 0.03;
    }
}
