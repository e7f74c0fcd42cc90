package com.hao.backtest.consensus;

import com.hao.backtest.feed.SignalFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 共识筛选服务
 *
 * 设计目的：
 * 1. 对股票池在同一交易日批量评分，并按阈值筛选、排序。
 * 2. 同日不同股票的评分互不依赖，可提交到线程池并行计算；
 *    完成后统一按“总分降序 + 代码升序”重排，结果与并行度无关。
 *
 * 异常传播：
 * - 工作线程中的运行期异常（如未来数据访问）解包后原样抛出，不吞掉。
 *
 * @author hli
 * @date 2026-03-05
 */
@Slf4j
public class ConsensusFilterService {

    private final ConsensusScorer scorer;

    private final SignalFeed signalFeed;

    /**
     * 评分线程池，为 null 时在调用线程顺序计算
     */
    private final Executor scoringExecutor;

    public ConsensusFilterService(ConsensusScorer scorer, SignalFeed signalFeed, Executor scoringExecutor) {
        Assert.notNull(scorer, "ConsensusScorer must not be null");
        Assert.notNull(signalFeed, "SignalFeed must not be null");
        this.scorer = scorer;
        this.signalFeed = signalFeed;
        this.scoringExecutor = scoringExecutor;
    }

    /**
     * 单只股票评分
     */
    public ConsensusScore score(String symbol, LocalDate date) {
        return scorer.score(signalFeed.getSignals(symbol, date));
    }

    /**
     * 股票池全量评分
     *
     * @return 按总分降序、代码升序排列的评分
     */
    public List<ConsensusScore> scoreAll(Collection<String> universe, LocalDate date) {
        if (universe == null || universe.isEmpty()) {
            return List.of();
        }
        List<ConsensusScore> scores;
        if (scoringExecutor == null) {
            scores = universe.stream().distinct().map(symbol -> score(symbol, date)).collect(Collectors.toList());
        } else {
            List<CompletableFuture<ConsensusScore>> futures = universe.stream()
                    .distinct()
                    .map(symbol -> CompletableFuture.supplyAsync(() -> score(symbol, date), scoringExecutor))
                    .collect(Collectors.toList());
            scores = new ArrayList<>(futures.size());
            for (CompletableFuture<ConsensusScore> future : futures) {
                scores.add(join(future));
            }
        }
        scores.sort(ConsensusScore.RANKING);
        return scores;
    }

    /**
     * 按阈值筛选
     *
     * @param universe        股票池
     * @param date            交易日
     * @param minScore        最低总分（含）
     * @param minCompleteness 最低完整度（含）
     * @return 排序后的入选评分
     */
    public List<ConsensusScore> filter(Collection<String> universe, LocalDate date, int minScore, double minCompleteness) {
        List<ConsensusScore> selected = scoreAll(universe, date).stream()
                .filter(s -> s.getTotalScore() >= minScore)
                .filter(s -> s.getCompleteness() >= minCompleteness)
                .collect(Collectors.toList());
        log.debug("共识筛选完成|Consensus_filter_done,date={},universe={},selected={},minScore={},minCompleteness={}",
                date, universe == null ? 0 : universe.size(), selected.size(), minScore, minCompleteness);
        return selected;
    }

    private static ConsensusScore join(CompletableFuture<ConsensusScore> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
