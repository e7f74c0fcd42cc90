package com.hao.backtest.engine;

/**
 * 回测运行状态
 *
 * @author hli
 * @date 2026-03-06
 */
public enum RunStatus {
    /**
     * 完整跑完全部交易日
     */
    COMPLETED,
    /**
     * 因因果性违规中止，结果不可用于评估
     */
    INVALID
}
