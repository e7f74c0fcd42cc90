package com.hao.backtest.repository.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hao.backtest.domain.Instrument;
import com.hao.backtest.feed.memory.InstrumentClassifier;
import enums.market.BoardTypeEnum;
import enums.market.ListingStatusEnum;
import exception.DataException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 标的 JSONL 行（instruments.jsonl）
 * <p>
 * board / special_treatment / listing_status 可省略，省略时按代码与名称推断。
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
public class InstrumentRecord {

    private String symbol;

    private String name;

    private String board;

    private Boolean specialTreatment;

    private String listingStatus;

    /**
     * 生效日期，为空表示自始有效
     */
    private LocalDate effectiveDate;

    public Instrument toDomain() {
        try {
            return merge(InstrumentClassifier.classify(symbol, name));
        } catch (IllegalArgumentException e) {
            throw new DataException("invalid instrument record for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private Instrument merge(Instrument inferred) {
        return inferred.toBuilder()
                .board(board == null || board.isBlank() ? inferred.getBoard() : BoardTypeEnum.valueOf(board.trim().toUpperCase()))
                .specialTreatment(specialTreatment == null ? inferred.isSpecialTreatment() : specialTreatment)
                .listingStatus(listingStatus == null || listingStatus.isBlank()
                        ? ListingStatusEnum.ACTIVE
                        : ListingStatusEnum.valueOf(listingStatus.trim().toUpperCase()))
                .build();
    }

    public static InstrumentRecord from(Instrument instrument, LocalDate effectiveDate) {
        return InstrumentRecord.builder()
                .symbol(instrument.getSymbol())
                .name(instrument.getName())
                .board(instrument.getBoard() == null ? null : instrument.getBoard().name())
                .specialTreatment(instrument.isSpecialTreatment())
                .listingStatus(instrument.getListingStatus() == null ? null : instrument.getListingStatus().name())
                .effectiveDate(effectiveDate)
                .build();
    }
}
