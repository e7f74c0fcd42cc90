package com.hao.backtest.repository.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hao.backtest.domain.BarStatus;
import com.hao.backtest.domain.PriceBar;
import exception.DataException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 日线 JSONL 行（price_bars.jsonl）
 *
 * @author hli
 * @date 2026-03-08
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PriceBarRecord {

    private String symbol;

    private LocalDate date;

    private BigDecimal open;

    private BigDecimal high;

    private BigDecimal low;

    private BigDecimal close;

    private Long volume;

    private BigDecimal amount;

    private BigDecimal prevClose;

    /**
     * normal / limit_up / limit_down / suspended / data_missing，为空视为 normal
     */
    private String status;

    private String suspensionReason;

    /**
     * 转换为领域日线
     * <p>
     * 停牌 / 缺失行统一按前收填充，行内 OHLC 不参与估值；正常行必须带正收盘价。
     *
     * @throws DataException 状态未知、停牌行缺少正前收、正常行缺少正收盘价
     */
    public PriceBar toDomain() {
        BarStatus barStatus = parseStatus();
        if (barStatus.isHalted()) {
            if (!isPositive(prevClose)) {
                throw new DataException("halted bar without positive prev_close for " + symbol + " on " + date);
            }
            return PriceBar.carriedForward(symbol, date, prevClose, barStatus, suspensionReason);
        }
        if (!isPositive(close)) {
            throw new DataException("price bar without positive close for " + symbol + " on " + date);
        }
        return PriceBar.builder()
                .symbol(symbol)
                .tradeDate(date)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume == null ? 0L : volume)
                .amount(amount)
                .previousClose(prevClose)
                .status(barStatus)
                .suspensionReason(suspensionReason)
                .build();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private BarStatus parseStatus() {
        if (status == null || status.isBlank()) {
            return BarStatus.NORMAL;
        }
        try {
            return BarStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new DataException("unknown bar status '" + status + "' for " + symbol + " on " + date, e);
        }
    }

    public static PriceBarRecord from(PriceBar bar) {
        return PriceBarRecord.builder()
                .symbol(bar.getSymbol())
                .date(bar.getTradeDate())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .amount(bar.getAmount())
                .prevClose(bar.getPreviousClose())
                .status(bar.getStatus() == null ? null : bar.getStatus().name().toLowerCase())
                .suspensionReason(bar.getSuspensionReason())
                .build();
    }
}
