package com.hao.backtest.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hao.backtest.engine.BacktestResult;
import exception.DataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 回测报告输出：{runId}.json，格式化 JSON
 *
 * @author hli
 * @date 2026-03-08
 */
@Slf4j
@Component
public class BacktestReportWriter {

    private final ObjectMapper objectMapper;

    public BacktestReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(BacktestResult result, Path reportDir) {
        Assert.notNull(result, "result must not be null");
        Assert.notNull(reportDir, "reportDir must not be null");
        Path file = reportDir.resolve(result.getRunId() + ".json");
        try {
            Files.createDirectories(reportDir);
            objectMapper.writeValue(file.toFile(), result);
        } catch (IOException e) {
            throw new DataException("failed to write backtest report " + file, e);
        }
        log.info("回测报告已输出|Backtest_report_written,runId={},status={},file={}",
                result.getRunId(), result.getStatus(), file.toAbsolutePath());
        return file;
    }
}
