package com.hao.backtest.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hao.backtest.domain.Instrument;
import com.hao.backtest.domain.PriceBar;
import com.hao.backtest.domain.signal.ConsensusSignal;
import com.hao.backtest.repository.record.ConsensusSignalRecord;
import com.hao.backtest.repository.record.InstrumentRecord;
import com.hao.backtest.repository.record.PriceBarRecord;
import constants.NumberFormatConstants;
import exception.DataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * JSONL 历史数据仓库
 *
 * 设计目的：
 * 1. 以追加写的 JSONL 文件保存日线、共识信号与标的信息，一行一条记录，键为 (symbol, date)。
 * 2. 回测前一次性装载为 {@link MarketDataBundle}，行格式错误时带行号抛出 DataException。
 *
 * 实现思路：
 * - 价格写入前统一保留两位小数；停牌 / 缺失日线必须满足 OHLC 等于前收。
 * - 写入前扫描已有文件的键，重复键直接拒绝，不做覆盖。
 *
 * @author hli
 * @date 2026-03-08
 */
@Slf4j
@Component
public class JsonlMarketDataRepository {

    public static final String PRICE_BARS_FILE = "price_bars.jsonl";

    public static final String SIGNALS_FILE = "consensus_signals.jsonl";

    public static final String INSTRUMENTS_FILE = "instruments.jsonl";

    private final ObjectMapper objectMapper;

    public JsonlMarketDataRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ==================== 读取 ====================

    /**
     * 装载数据目录下的全部 JSONL 文件，缺失的文件视为空
     */
    public MarketDataBundle load(Path dataDir) {
        Assert.notNull(dataDir, "dataDir must not be null");
        if (!Files.isDirectory(dataDir)) {
            throw new DataException("data directory not found: " + dataDir.toAbsolutePath());
        }
        StopWatch stopWatch = new StopWatch("jsonl-load");
        stopWatch.start();

        List<MarketDataBundle.InstrumentListing> listings = readLines(dataDir.resolve(INSTRUMENTS_FILE),
                InstrumentRecord.class, record -> {
                    requireSymbol(record.getSymbol());
                    return new MarketDataBundle.InstrumentListing(record.toDomain(), record.getEffectiveDate());
                });
        List<PriceBar> priceBars = readLines(dataDir.resolve(PRICE_BARS_FILE), PriceBarRecord.class, record -> {
            requireSymbol(record.getSymbol());
            return record.toDomain();
        });
        List<ConsensusSignal> signals = readLines(dataDir.resolve(SIGNALS_FILE), ConsensusSignalRecord.class, record -> {
            requireSymbol(record.getSymbol());
            return record.toDomain();
        });

        MarketDataBundle.MarketDataBundleBuilder builder = MarketDataBundle.builder();
        Set<String> keys = new HashSet<>();
        for (MarketDataBundle.InstrumentListing listing : listings) {
            requireUnique(keys, INSTRUMENTS_FILE, listing.getInstrument().getSymbol(), listing.getEffectiveDate());
            builder.instrument(listing);
        }
        keys.clear();
        for (PriceBar bar : priceBars) {
            requireUnique(keys, PRICE_BARS_FILE, bar.getSymbol(), bar.getTradeDate());
            builder.priceBar(bar);
        }
        keys.clear();
        for (ConsensusSignal signal : signals) {
            requireUnique(keys, SIGNALS_FILE, signal.getSymbol(), signal.getTradeDate());
            builder.signal(signal);
        }
        MarketDataBundle bundle = builder.build();

        stopWatch.stop();
        log.info("历史数据装载完成|Market_data_loaded,dir={},instruments={},bars={},signals={},costMs={}",
                dataDir, bundle.getInstruments().size(), bundle.getPriceBars().size(), bundle.getSignals().size(),
                stopWatch.getTotalTimeMillis());
        return bundle;
    }

    // ==================== 追加写 ====================

    public void appendPriceBar(Path dataDir, PriceBar bar) {
        Assert.notNull(bar, "bar must not be null");
        PriceBar rounded = roundPrices(bar);
        if (rounded.isHalted()) {
            requireCarriedForward(rounded);
        } else if (rounded.getClose() == null || rounded.getClose().signum() <= 0) {
            throw new DataException("price bar without positive close: " + rounded.getSymbol() + " " + rounded.getTradeDate());
        }
        Path file = dataDir.resolve(PRICE_BARS_FILE);
        rejectExistingKey(file, PriceBarRecord.class, r -> key(r.getSymbol(), r.getDate()),
                key(rounded.getSymbol(), rounded.getTradeDate()));
        appendLine(file, PriceBarRecord.from(rounded));
    }

    public void appendSignal(Path dataDir, ConsensusSignal signal) {
        Assert.notNull(signal, "signal must not be null");
        Path file = dataDir.resolve(SIGNALS_FILE);
        rejectExistingKey(file, ConsensusSignalRecord.class, r -> key(r.getSymbol(), r.getDate()),
                key(signal.getSymbol(), signal.getTradeDate()));
        appendLine(file, ConsensusSignalRecord.from(signal));
    }

    public void appendInstrument(Path dataDir, Instrument instrument, LocalDate effectiveDate) {
        Assert.notNull(instrument, "instrument must not be null");
        Path file = dataDir.resolve(INSTRUMENTS_FILE);
        rejectExistingKey(file, InstrumentRecord.class, r -> key(r.getSymbol(), r.getEffectiveDate()),
                key(instrument.getSymbol(), effectiveDate));
        appendLine(file, InstrumentRecord.from(instrument, effectiveDate));
    }

    // ==================== 内部方法 ====================

    private <T> List<T> readLines(Path file, Class<T> type) {
        return readLines(file, type, Function.identity());
    }

    /**
     * 逐行解析并转换，解析或校验失败时带文件名与行号抛出
     */
    private <T, R> List<R> readLines(Path file, Class<T> type, Function<T, R> converter) {
        List<R> results = new ArrayList<>();
        if (!Files.exists(file)) {
            log.warn("数据文件不存在，按空处理|Data_file_missing,file={}", file);
            return results;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                T record;
                try {
                    record = objectMapper.readValue(line, type);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    throw new DataException("malformed record in " + file.getFileName() + " at line " + lineNo
                            + ": " + e.getMessage(), e);
                }
                try {
                    results.add(converter.apply(record));
                } catch (DataException e) {
                    throw new DataException("invalid record in " + file.getFileName() + " at line " + lineNo
                            + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new DataException("failed to read " + file, e);
        }
        return results;
    }

    private <T> void rejectExistingKey(Path file, Class<T> type, Function<T, String> keyOf, String key) {
        for (T existing : readLines(file, type)) {
            if (key.equals(keyOf.apply(existing))) {
                throw new DataException("duplicate key in " + file.getFileName() + ": " + key);
            }
        }
    }

    private void appendLine(Path file, Object record) {
        try {
            Files.createDirectories(file.getParent());
            String json = objectMapper.writeValueAsString(record) + System.lineSeparator();
            Files.writeString(file, json, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            throw new DataException("failed to serialize record for " + file.getFileName(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to append to " + file, e);
        }
    }

    private static void requireSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new DataException("record without symbol");
        }
    }

    private static void requireUnique(Set<String> keys, String fileName, String symbol, LocalDate date) {
        if (!keys.add(key(symbol, date))) {
            throw new DataException("duplicate key in " + fileName + ": " + key(symbol, date));
        }
    }

    private static void requireCarriedForward(PriceBar bar) {
        BigDecimal carried = bar.getPreviousClose();
        if (carried == null
                || carried.compareTo(bar.getOpen()) != 0
                || carried.compareTo(bar.getHigh()) != 0
                || carried.compareTo(bar.getLow()) != 0
                || carried.compareTo(bar.getClose()) != 0
                || bar.getVolume() != 0L) {
            throw new DataException("halted bar must carry previous close forward: "
                    + bar.getSymbol() + " " + bar.getTradeDate());
        }
    }

    private static PriceBar roundPrices(PriceBar bar) {
        return bar.toBuilder()
                .open(round(bar.getOpen()))
                .high(round(bar.getHigh()))
                .low(round(bar.getLow()))
                .close(round(bar.getClose()))
                .previousClose(round(bar.getPreviousClose()))
                .amount(round(bar.getAmount()))
                .build();
    }

    private static BigDecimal round(BigDecimal value) {
        return value == null ? null : value.setScale(NumberFormatConstants.PRICE_SCALE, NumberFormatConstants.PRICE_ROUNDING);
    }

    private static String key(String symbol, LocalDate date) {
        return symbol + "@" + (date == null ? "-" : date.toString());
    }
}
