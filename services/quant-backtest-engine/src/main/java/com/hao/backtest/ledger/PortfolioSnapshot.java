package com.hao.backtest.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 账户快照
 * <p>
 * 决策策略读取账户状态的唯一入口，不暴露内部批次结构。
 *
 * @author hli
 * @date 2026-03-04
 */
@Value
@Builder
public class PortfolioSnapshot {

    LocalDate asOfDate;

    BigDecimal cash;

    BigDecimal marketValue;

    BigDecimal totalValue;

    /**
     * 按代码升序排列的持仓
     */
    List<PositionSnapshot> positions;

    public Optional<PositionSnapshot> position(String symbol) {
        return positions.stream().filter(p -> p.getSymbol().equals(symbol)).findFirst();
    }

    public boolean holds(String symbol) {
        return position(symbol).isPresent();
    }

    public int positionCount() {
        return positions.size();
    }
}
