package com.hao.backtest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 回测引擎服务启动类
 *
 * 设计目的：
 * 1. 装配交易规则、费率、共识评分与绩效计算组件。
 * 2. backtest.enabled=true 时启动即按配置执行一次回测并输出报告。
 *
 * 核心实现思路：
 * - 数据来自本地 JSONL 文件，不依赖数据库与消息中间件。
 * - 回放主循环单线程，评分使用独立线程池。
 *
 * @author hli
 * @date 2026-03-09
 */
@Slf4j
@SpringBootApplication
public class BacktestEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BacktestEngineApplication.class, args);
        log.info("回测引擎服务启动完成|Backtest_engine_service_started");
    }
}
