package com.hao.backtest.feed.memory;

import com.hao.backtest.domain.Instrument;
import enums.market.BoardTypeEnum;
import enums.market.ListingStatusEnum;

import java.util.List;

/**
 * 标的分类工具
 * <p>
 * 数据未给出分类时，按代码前缀识别板块、按名称前缀识别 ST。
 *
 * @author hli
 * @date 2026-03-04
 */
public class InstrumentClassifier {

    /**
     * ST 名称前缀，长前缀在前
     */
    private static final List<String> SPECIAL_TREATMENT_PREFIXES = List.of("S*ST", "*ST", "SST", "ST", "退市");

    private InstrumentClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isSpecialTreatmentName(String name) {
        if (name == null) {
            return false;
        }
        String trimmed = name.trim().toUpperCase();
        return SPECIAL_TREATMENT_PREFIXES.stream().anyMatch(trimmed::startsWith);
    }

    /**
     * 仅凭代码与名称推断的标的信息，上市状态视为正常
     */
    public static Instrument classify(String symbol, String name) {
        return Instrument.builder()
                .symbol(symbol)
                .name(name == null ? symbol : name)
                .board(BoardTypeEnum.fromSymbol(symbol))
                .specialTreatment(isSpecialTreatmentName(name))
                .listingStatus(ListingStatusEnum.ACTIVE)
                .build();
    }
}
