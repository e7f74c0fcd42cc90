package com.hao.backtest.rule;

import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.Instrument;
import com.hao.backtest.domain.Lot;
import com.hao.backtest.domain.Order;
import com.hao.backtest.domain.PriceBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.time.LocalDate;
import java.util.List;

/**
 * 交易规则校验器
 *
 * 设计目的：
 * 1. 以纯函数方式判定委托是否符合 A 股微观结构约束，拒单以原因码返回而不是抛异常。
 * 2. 校验顺序固定且短路：停牌 → 涨跌停 → 交易单位（仅买入）→ T+1（仅卖出），
 *    保证同一输入总是得到同一拒单原因。
 *
 * 资金是否充足、持仓数量是否超限需要定价，由回测引擎在成交时复核，不属于规则校验。
 *
 * @author hli
 * @date 2026-03-03
 */
@Slf4j
public class TradingRuleValidator {

    private final TradingRuleSet rules;

    public TradingRuleValidator(TradingRuleSet rules) {
        Assert.notNull(rules, "TradingRuleSet must not be null");
        this.rules = rules.validate();
    }

    public TradingRuleSet getRules() {
        return rules;
    }

    /**
     * 校验委托
     *
     * @param order       委托单
     * @param instrument  标的分类（上市状态非正常时按停牌处理）
     * @param priceBar    当日日线，状态须已补全；为 null 或无正收盘价时按停牌处理
     * @param holdingLots 该标的当前全部持仓批次
     * @param currentDate 模拟当前日期
     * @return 校验结果
     */
    public ValidationResult validate(Order order, Instrument instrument, PriceBar priceBar,
                                     List<Lot> holdingLots, LocalDate currentDate) {
        Assert.notNull(order, "order must not be null");
        Assert.notNull(currentDate, "currentDate must not be null");

        ValidationResult result = doValidate(order, instrument, priceBar, holdingLots, currentDate);
        if (!result.accepted()) {
            log.info("委托被规则拒绝|Order_rejected,date={},symbol={},side={},qty={},reason={},detail={}",
                    currentDate, order.getSymbol(), order.getSide(), order.getQuantity(),
                    result.reason(), result.detail());
        }
        return result;
    }

    private ValidationResult doValidate(Order order, Instrument instrument, PriceBar priceBar,
                                        List<Lot> holdingLots, LocalDate currentDate) {
        // 1. 停牌检查
        if (priceBar == null || priceBar.isHalted()) {
            String status = priceBar == null ? "NO_BAR" : priceBar.getStatus().name();
            return ValidationResult.reject(RejectionReason.SUSPENDED,
                    "symbol " + order.getSymbol() + " is not trading on " + currentDate + " (" + status + ")");
        }
        if (priceBar.getClose() == null || priceBar.getClose().signum() <= 0) {
            return ValidationResult.reject(RejectionReason.SUSPENDED,
                    "symbol " + order.getSymbol() + " has no usable close on " + currentDate);
        }
        if (instrument != null && !instrument.isTradable()) {
            return ValidationResult.reject(RejectionReason.SUSPENDED,
                    "symbol " + order.getSymbol() + " listing status is " + instrument.getListingStatus());
        }

        // 2. 涨跌停检查
        if (order.isBuy() && priceBar.getStatus() == BarStatus.LIMIT_UP) {
            return ValidationResult.reject(RejectionReason.LIMIT_BAND,
                    "buy blocked at limit-up, close=" + priceBar.getClose());
        }
        if (!order.isBuy() && priceBar.getStatus() == BarStatus.LIMIT_DOWN) {
            return ValidationResult.reject(RejectionReason.LIMIT_BAND,
                    "sell blocked at limit-down, close=" + priceBar.getClose());
        }

        // 3. 交易单位检查（仅买入，卖出允许零股）
        if (order.isBuy() && !rules.isLotMultiple(order.getQuantity())) {
            return ValidationResult.reject(RejectionReason.LOT_SIZE,
                    "quantity " + order.getQuantity() + " is not a multiple of " + rules.getLotSize());
        }

        // 4. T+1 检查（仅卖出）：只统计已结算批次
        if (!order.isBuy()) {
            long sellable = sellableQuantity(holdingLots, currentDate);
            if (sellable < order.getQuantity()) {
                return ValidationResult.reject(RejectionReason.SETTLEMENT,
                        "sellable " + sellable + " < requested " + order.getQuantity());
            }
        }
        return ValidationResult.accept();
    }

    /**
     * 计算当前日期可卖数量：取得日期已满足结算延迟的批次之和
     */
    public long sellableQuantity(List<Lot> holdingLots, LocalDate currentDate) {
        if (holdingLots == null || holdingLots.isEmpty()) {
            return 0L;
        }
        return holdingLots.stream()
                .filter(lot -> rules.isSettled(lot.getAcquisitionDate(), currentDate))
                .mapToLong(Lot::getQuantity)
                .sum();
    }
}
