package com.hao.backtest.domain;

import enums.market.BoardTypeEnum;
import enums.market.ListingStatusEnum;
import lombok.Builder;
import lombok.Value;

/**
 * 证券标的（按交易日不可变）
 * <p>
 * symbol 为带交易所后缀的代码，如 600000.SH、300750.SZ。
 *
 * @author hli
 * @date 2026-03-03
 */
@Value
@Builder(toBuilder = true)
public class Instrument {

    private static final char VENUE_SEPARATOR = '.';

    String symbol;

    String name;

    BoardTypeEnum board;

    /**
     * 是否为 ST / *ST 等风险警示股
     */
    boolean specialTreatment;

    ListingStatusEnum listingStatus;

    /**
     * 交易所后缀（SH / SZ），无后缀时返回空串
     */
    public String getVenue() {
        int idx = symbol == null ? -1 : symbol.lastIndexOf(VENUE_SEPARATOR);
        return idx < 0 ? "" : symbol.substring(idx + 1).toUpperCase();
    }

    public boolean isTradable() {
        return listingStatus == null || listingStatus.isTradable();
    }
}
