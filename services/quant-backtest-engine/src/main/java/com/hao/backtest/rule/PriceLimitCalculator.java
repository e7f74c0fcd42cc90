package com.hao.backtest.rule;

import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.Instrument;
import com.hao.backtest.domain.PriceBar;
import constants.NumberFormatConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.math.BigDecimal;

/**
 * 涨跌停价计算器
 *
 * 设计目的：
 * 1. 涨跌停价 = round(前收 × (1 ± r), 2)，r 由规则表按板块与 ST 标记选取。
 * 2. 为未标注涨跌停状态的日线补全状态，触及涨跌停价即视为涨跌停（≥ / ≤）。
 *
 * @author hli
 * @date 2026-03-03
 */
@Slf4j
public class PriceLimitCalculator {

    private final TradingRuleSet rules;

    public PriceLimitCalculator(TradingRuleSet rules) {
        Assert.notNull(rules, "TradingRuleSet must not be null");
        this.rules = rules;
    }

    /**
     * 计算涨跌停价
     *
     * @param ratio         涨跌幅比例
     * @param previousClose 前收盘价
     * @return 四舍五入到 0.01 元的涨跌停价
     */
    public static PriceLimits calculate(BigDecimal ratio, BigDecimal previousClose) {
        Assert.notNull(previousClose, "previousClose must not be null");
        BigDecimal up = previousClose.multiply(BigDecimal.ONE.add(ratio))
                .setScale(NumberFormatConstants.PRICE_SCALE, NumberFormatConstants.PRICE_ROUNDING);
        BigDecimal down = previousClose.multiply(BigDecimal.ONE.subtract(ratio))
                .setScale(NumberFormatConstants.PRICE_SCALE, NumberFormatConstants.PRICE_ROUNDING);
        return new PriceLimits(up, down);
    }

    public PriceLimits calculate(Instrument instrument, BigDecimal previousClose) {
        return calculate(rules.limitRatioFor(instrument), previousClose);
    }

    /**
     * 补全日线的涨跌停状态
     * <p>
     * 已停牌 / 数据缺失、已标注涨跌停、或缺少前收 / 收盘价的日线原样返回。
     *
     * @param instrument 标的分类信息
     * @param bar        原始日线
     * @return 状态已补全的日线
     */
    public PriceBar resolveStatus(Instrument instrument, PriceBar bar) {
        if (bar == null || bar.isHalted() || bar.getPreviousClose() == null || bar.getClose() == null) {
            return bar;
        }
        if (bar.getStatus() == BarStatus.LIMIT_UP || bar.getStatus() == BarStatus.LIMIT_DOWN) {
            return bar;
        }
        PriceLimits limits = calculate(instrument, bar.getPreviousClose());
        BarStatus resolved = BarStatus.NORMAL;
        if (limits.isAtOrAboveLimitUp(bar.getClose())) {
            resolved = BarStatus.LIMIT_UP;
        } else if (limits.isAtOrBelowLimitDown(bar.getClose())) {
            resolved = BarStatus.LIMIT_DOWN;
        }
        if (resolved != BarStatus.NORMAL) {
            log.debug("涨跌停状态识别|Limit_status_resolved,symbol={},date={},close={},limitUp={},limitDown={},status={}",
                    bar.getSymbol(), bar.getTradeDate(), bar.getClose(), limits.limitUp(), limits.limitDown(), resolved);
        }
        return resolved == bar.getStatus() ? bar : bar.toBuilder().status(resolved).build();
    }
}
