package com.hao.backtest.domain.signal;

/**
 * 情绪面原始指标：讨论热度（如股吧发帖量）
 *
 * @author hli
 * @date 2026-03-03
 */
public record SentimentSignal(long discussionVolume) {
}
