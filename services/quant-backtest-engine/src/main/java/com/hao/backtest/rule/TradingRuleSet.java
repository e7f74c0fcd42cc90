package com.hao.backtest.rule;

import com.hao.backtest.domain.Instrument;
import exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 交易规则表（配置值对象）
 * <p>
 * 最小交易单位、涨跌幅档位、结算延迟均作为参数注入同一个校验器，
 * 切换市场规则只需替换本对象，不需要子类或运行期类型判断。
 *
 * @author hli
 * @date 2026-03-03
 */
@Value
@Builder(toBuilder = true)
public class TradingRuleSet {

    /**
     * 最小交易单位（股），A 股买入须为 100 股整数倍
     */
    @Builder.Default
    long lotSize = 100L;

    /**
     * 主板涨跌幅
     */
    @Builder.Default
    BigDecimal mainBoardLimitRatio = new BigDecimal("0.10");

    /**
     * 科创板 / 创业板涨跌幅
     */
    @Builder.Default
    BigDecimal growthBoardLimitRatio = new BigDecimal("0.20");

    /**
     * ST 股涨跌幅
     */
    @Builder.Default
    BigDecimal specialTreatmentLimitRatio = new BigDecimal("0.05");

    /**
     * 结算延迟（自然日），1 即 T+1，0 即 T+0
     */
    @Builder.Default
    int settlementDays = 1;

    /**
     * A 股默认规则：100 股一手，10% / 20% / 5% 涨跌幅，T+1
     */
    public static TradingRuleSet chinaAShare() {
        return TradingRuleSet.builder().build();
    }

    /**
     * 按优先级选取涨跌幅：科创板/创业板 → 20%；否则 ST → 5%；否则 10%
     */
    public BigDecimal limitRatioFor(Instrument instrument) {
        if (instrument.getBoard() != null && instrument.getBoard().isGrowthBoard()) {
            return growthBoardLimitRatio;
        }
        if (instrument.isSpecialTreatment()) {
            return specialTreatmentLimitRatio;
        }
        return mainBoardLimitRatio;
    }

    /**
     * 批次在当前日期是否已完成结算（可卖）
     * <p>
     * T+1 时等价于取得日期严格早于当前日期。
     */
    public boolean isSettled(LocalDate acquisitionDate, LocalDate currentDate) {
        return !acquisitionDate.plusDays(settlementDays).isAfter(currentDate);
    }

    public boolean isLotMultiple(long quantity) {
        return quantity > 0 && quantity % lotSize == 0;
    }

    /**
     * 校验规则表自身合法性，非法时抛出 ConfigurationException
     */
    public TradingRuleSet validate() {
        if (lotSize <= 0) {
            throw new ConfigurationException("lotSize must be positive: " + lotSize);
        }
        if (settlementDays < 0) {
            throw new ConfigurationException("settlementDays must not be negative: " + settlementDays);
        }
        checkRatio("mainBoardLimitRatio", mainBoardLimitRatio);
        checkRatio("growthBoardLimitRatio", growthBoardLimitRatio);
        checkRatio("specialTreatmentLimitRatio", specialTreatmentLimitRatio);
        return this;
    }

    private static void checkRatio(String name, BigDecimal ratio) {
        if (ratio == null || ratio.signum() <= 0 || ratio.compareTo(BigDecimal.ONE) >= 0) {
            throw new ConfigurationException(name + " must be within (0, 1): " + ratio);
        }
    }
}
