package com.hao.backtest.cost;

import com.hao.backtest.domain.CostBreakdown;
import com.hao.backtest.domain.Order;
import exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 交易成本测试
 * <p>
 * 滑点 1%，佣金万三最低 5 元，印花税万五仅卖出，过户费十万分之一仅沪市。
 *
 * @author hli
 * @date 2026-03-10
 */
class CostModelTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);

    private CostModel costModel;

    @BeforeEach
    void setUp() {
        costModel = new CostModel(CostRates.builder().slippageRate(new BigDecimal("0.01")).build());
    }

    @Test
    @DisplayName("沪市买入 - 最低佣金、过户费、无印花税")
    void testBuyOnShanghai() {
        CostBreakdown costs = costModel.priceOrder(Order.buy("600000.SH", 100, DAY), new BigDecimal("100.00"), "SH");

        assertEquals(new BigDecimal("101.00"), costs.getFillPrice());
        assertEquals(new BigDecimal("10100.00"), costs.getNotional());
        assertEquals(new BigDecimal("5.00"), costs.getCommission());
        assertEquals(new BigDecimal("0.00"), costs.getStampDuty());
        assertEquals(new BigDecimal("0.10"), costs.getTransferFee());
        assertEquals(new BigDecimal("100.00"), costs.getSlippage());
        assertEquals(new BigDecimal("-10105.10"), costs.getNetCashDelta());
        assertEquals(new BigDecimal("105.10"), costs.getTotalCost());
    }

    @Test
    @DisplayName("沪市卖出 - 印花税四舍五入到分")
    void testSellOnShanghai() {
        CostBreakdown costs = costModel.priceOrder(Order.sell("600000.SH", 100, DAY), new BigDecimal("105.00"), "SH");

        assertEquals(new BigDecimal("103.95"), costs.getFillPrice());
        assertEquals(new BigDecimal("10395.00"), costs.getNotional());
        assertEquals(new BigDecimal("5.00"), costs.getCommission());
        assertEquals(new BigDecimal("5.20"), costs.getStampDuty());
        assertEquals(new BigDecimal("0.10"), costs.getTransferFee());
        assertEquals(new BigDecimal("10384.70"), costs.getNetCashDelta());
    }

    @Test
    @DisplayName("深市 - 不收过户费；大额成交按费率收佣")
    void testShenzhenAndProportionalCommission() {
        CostBreakdown costs = costModel.priceOrder(Order.buy("000001.SZ", 10000, DAY), new BigDecimal("10.00"), "SZ");

        // 成交价 10.10，成交额 101000.00，佣金 30.30
        assertEquals(new BigDecimal("101000.00"), costs.getNotional());
        assertEquals(new BigDecimal("30.30"), costs.getCommission());
        assertEquals(new BigDecimal("0.00"), costs.getTransferFee());
        assertEquals(new BigDecimal("-101030.30"), costs.getNetCashDelta());
    }

    @Test
    @DisplayName("成交价 - 买入上浮、卖出下浮并保留两位小数")
    void testFillPriceRounding() {
        CostModel model = new CostModel(CostRates.defaults());

        assertEquals(new BigDecimal("9.99"), model.fillPrice(Order.buy("600000.SH", 100, DAY), new BigDecimal("9.98")));
        assertEquals(new BigDecimal("9.97"), model.fillPrice(Order.sell("600000.SH", 100, DAY), new BigDecimal("9.98")));
    }

    @Test
    @DisplayName("参考价非正 / 费率为负 - 拒绝")
    void testInvalidInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> costModel.priceOrder(Order.buy("600000.SH", 100, DAY), BigDecimal.ZERO, "SH"));
        assertThrows(ConfigurationException.class,
                () -> new CostModel(CostRates.builder().commissionRate(new BigDecimal("-0.1")).build()));
    }
}
