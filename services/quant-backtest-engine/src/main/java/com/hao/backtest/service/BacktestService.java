package com.hao.backtest.service;

import com.hao.backtest.engine.BacktestRequest;
import com.hao.backtest.engine.BacktestResult;
import com.hao.backtest.engine.CausalMarketDataView;
import com.hao.backtest.feed.DecisionPolicy;
import com.hao.backtest.repository.MarketDataBundle;

import java.util.function.Function;

/**
 * 回测服务接口
 *
 * @author hli
 * @date 2026-03-09
 */
public interface BacktestService {

    /**
     * 按配置的区间、资金与股票池，从数据中构造运行参数
     *
     * @param bundle 历史数据
     * @return 运行参数（交易日历取区间内的 K 线日期）
     */
    BacktestRequest buildRequest(MarketDataBundle bundle);

    /**
     * 在给定数据上执行一次回测
     * <p>
     * 决策策略由工厂基于因果数据视图创建，确保策略读取行情时同样受时钟约束。
     *
     * @param bundle        历史数据
     * @param request       运行参数
     * @param policyFactory 决策策略工厂
     * @return 回测结果
     */
    BacktestResult run(MarketDataBundle bundle, BacktestRequest request,
                       Function<CausalMarketDataView, DecisionPolicy> policyFactory);

    /**
     * 从配置的数据目录装载数据，使用内置共识排名策略执行回测并输出报告
     *
     * @return 回测结果
     */
    BacktestResult runConfigured();
}
