package com.hao.backtest.feed;

import com.hao.backtest.consensus.ConsensusScore;
import com.hao.backtest.domain.Order;
import com.hao.backtest.ledger.PortfolioSnapshot;

import java.time.LocalDate;
import java.util.List;

/**
 * 决策策略（外部参与者）
 * <p>
 * 每个模拟交易日恰好调用一次，返回值是当日唯一的委托来源。
 *
 * @author hli
 * @date 2026-03-04
 */
@FunctionalInterface
public interface DecisionPolicy {

    /**
     * @param currentDate 模拟当前日期
     * @param snapshot    账户只读快照
     * @param scores      当日全部共识评分，按总分降序、代码升序
     * @return 待执行委托，按列表顺序逐笔处理
     */
    List<Order> proposeOrders(LocalDate currentDate, PortfolioSnapshot snapshot, List<ConsensusScore> scores);
}
