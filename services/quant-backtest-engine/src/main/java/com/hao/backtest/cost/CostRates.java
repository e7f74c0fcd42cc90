package com.hao.backtest.cost;

import exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 交易费率配置
 *
 * @author hli
 * @date 2026-03-04
 */
@Value
@Builder(toBuilder = true)
public class CostRates {

    /**
     * 佣金费率，双向收取
     */
    @Builder.Default
    BigDecimal commissionRate = new BigDecimal("0.0003");

    /**
     * 单笔最低佣金（元）
     */
    @Builder.Default
    BigDecimal minimumCommission = new BigDecimal("5.00");

    /**
     * 印花税率，仅卖出收取
     */
    @Builder.Default
    BigDecimal stampDutyRate = new BigDecimal("0.0005");

    /**
     * 过户费率，仅对 transferFeeVenue 对应交易所收取
     */
    @Builder.Default
    BigDecimal transferFeeRate = new BigDecimal("0.00001");

    @Builder.Default
    String transferFeeVenue = "SH";

    /**
     * 滑点比例，买入上浮、卖出下浮
     */
    @Builder.Default
    BigDecimal slippageRate = new BigDecimal("0.001");

    public static CostRates defaults() {
        return CostRates.builder().build();
    }

    public CostRates validate() {
        nonNegative("commissionRate", commissionRate);
        nonNegative("minimumCommission", minimumCommission);
        nonNegative("stampDutyRate", stampDutyRate);
        nonNegative("transferFeeRate", transferFeeRate);
        nonNegative("slippageRate", slippageRate);
        if (slippageRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new ConfigurationException("slippageRate must be below 1: " + slippageRate);
        }
        return this;
    }

    private static void nonNegative(String name, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new ConfigurationException(name + " must not be negative: " + value);
        }
    }
}
