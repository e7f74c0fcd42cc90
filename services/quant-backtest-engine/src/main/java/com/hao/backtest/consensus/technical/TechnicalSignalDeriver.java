package com.hao.backtest.consensus.technical;

import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.domain.signal.TechnicalSignal;
import constants.NumberFormatConstants;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * 由日线推导技术面指标
 * <p>
 * 52 周高点取窗口内最高收盘价，均线为收盘价简单移动平均。
 * 历史不足长均线周期时返回 empty，由评分按缺失处理。
 *
 * @author hli
 * @date 2026-03-05
 */
@Getter
public class TechnicalSignalDeriver {

    private final int shortWindow;

    private final int longWindow;

    private final int highLookback;

    public TechnicalSignalDeriver(int shortWindow, int longWindow, int highLookback) {
        if (shortWindow <= 0 || longWindow <= shortWindow || highLookback < longWindow) {
            throw new IllegalArgumentException("require 0 < shortWindow < longWindow <= highLookback, got "
                    + shortWindow + "/" + longWindow + "/" + highLookback);
        }
        this.shortWindow = shortWindow;
        this.longWindow = longWindow;
        this.highLookback = highLookback;
    }

    /**
     * @param history 按日期升序、截至评分日的日线
     */
    public Optional<TechnicalSignal> derive(List<PriceBar> history) {
        if (history == null || history.size() < longWindow) {
            return Optional.empty();
        }
        PriceHistoryWindow window = new PriceHistoryWindow(highLookback);
        for (PriceBar bar : history) {
            if (bar.getClose() != null) {
                window.append(bar.getClose().doubleValue());
            }
        }
        if (window.getSize() < longWindow) {
            return Optional.empty();
        }
        return Optional.of(new TechnicalSignal(
                toPrice(window.getClose(0)),
                toPrice(window.highest(highLookback)),
                toPrice(window.movingAverage(shortWindow)),
                toPrice(window.movingAverage(longWindow))));
    }

    private static BigDecimal toPrice(double value) {
        return BigDecimal.valueOf(value).setScale(NumberFormatConstants.RATIO_SCALE, NumberFormatConstants.PRICE_ROUNDING);
    }
}
