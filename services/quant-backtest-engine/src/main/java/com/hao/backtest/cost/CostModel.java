package com.hao.backtest.cost;

import com.hao.backtest.domain.CostBreakdown;
import com.hao.backtest.domain.Order;
import constants.NumberFormatConstants;
import org.springframework.util.Assert;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 交易成本模型
 *
 * 计算规则：
 * - 成交价 = round(参考价 × (1 ± 滑点率), 2)，买入上浮、卖出下浮
 * - 佣金 = max(round(成交金额 × 佣金费率, 2), 最低佣金)
 * - 印花税 = round(成交金额 × 印花税率, 2)，仅卖出
 * - 过户费 = round(成交金额 × 过户费率, 2)，仅沪市
 * - 滑点成本 = |成交价 − 参考价| × 数量
 *
 * 每项先取整再汇总，避免多笔交易累计舍入误差。
 *
 * @author hli
 * @date 2026-03-04
 */
public class CostModel {

    private static final int SCALE = NumberFormatConstants.PRICE_SCALE;
    private static final RoundingMode ROUNDING = NumberFormatConstants.PRICE_ROUNDING;

    private final CostRates rates;

    public CostModel(CostRates rates) {
        Assert.notNull(rates, "CostRates must not be null");
        this.rates = rates.validate();
    }

    public CostRates getRates() {
        return rates;
    }

    /**
     * 含滑点的成交价
     */
    public BigDecimal fillPrice(Order order, BigDecimal referencePrice) {
        BigDecimal factor = order.isBuy()
                ? BigDecimal.ONE.add(rates.getSlippageRate())
                : BigDecimal.ONE.subtract(rates.getSlippageRate());
        return round(referencePrice.multiply(factor));
    }

    /**
     * 计算委托的完整费用明细
     *
     * @param order          委托单
     * @param referencePrice 参考价（当日收盘价）
     * @param venue          交易所后缀，如 SH / SZ
     * @return 费用明细与现金变动
     */
    public CostBreakdown priceOrder(Order order, BigDecimal referencePrice, String venue) {
        Assert.notNull(order, "order must not be null");
        Assert.isTrue(referencePrice != null && referencePrice.signum() > 0, "referencePrice must be positive");

        BigDecimal quantity = BigDecimal.valueOf(order.getQuantity());
        BigDecimal fill = fillPrice(order, referencePrice);
        BigDecimal notional = round(fill.multiply(quantity));

        BigDecimal commission = round(notional.multiply(rates.getCommissionRate())).max(rates.getMinimumCommission());
        BigDecimal stampDuty = order.isBuy() ? zero() : round(notional.multiply(rates.getStampDutyRate()));
        BigDecimal transferFee = rates.getTransferFeeVenue().equalsIgnoreCase(venue)
                ? round(notional.multiply(rates.getTransferFeeRate()))
                : zero();
        BigDecimal slippage = round(fill.subtract(referencePrice).abs().multiply(quantity));

        BigDecimal fees = commission.add(stampDuty).add(transferFee);
        BigDecimal netCashDelta = order.isBuy() ? notional.add(fees).negate() : notional.subtract(fees);

        return CostBreakdown.builder()
                .referencePrice(round(referencePrice))
                .fillPrice(fill)
                .notional(notional)
                .commission(commission.setScale(SCALE, ROUNDING))
                .stampDuty(stampDuty)
                .transferFee(transferFee)
                .slippage(slippage)
                .totalCost(fees.add(slippage))
                .netCashDelta(netCashDelta)
                .build();
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE, ROUNDING);
    }
}
