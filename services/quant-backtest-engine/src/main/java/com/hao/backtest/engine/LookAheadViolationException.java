package com.hao.backtest.engine;

import exception.BusinessException;
import lombok.Getter;

import java.time.LocalDate;

/**
 * 因果性违规异常（访问未来数据）
 * <p>
 * 属于程序错误而非业务结果：一旦抛出，整次回测立即中止，
 * 引擎将已产生的部分结果标记为无效后随异常一并抛出。
 *
 * @author hli
 * @date 2026-03-06
 */
@Getter
public class LookAheadViolationException extends BusinessException {

    private final String resource;

    private final LocalDate requestedDate;

    private final LocalDate currentDate;

    /**
     * 中止时已产生的部分结果（状态为 INVALID），由引擎附加
     */
    private final BacktestResult partialResult;

    public LookAheadViolationException(String resource, LocalDate requestedDate, LocalDate currentDate) {
        super(LOOK_AHEAD_VIOLATION, "禁止访问未来数据|Look_ahead_access,resource=" + resource
                + ",currentDate=" + currentDate + ",requestedDate=" + requestedDate);
        this.resource = resource;
        this.requestedDate = requestedDate;
        this.currentDate = currentDate;
        this.partialResult = null;
    }

    /**
     * 附加部分结果后重新抛出
     */
    public LookAheadViolationException(LookAheadViolationException cause, BacktestResult partialResult) {
        super(LOOK_AHEAD_VIOLATION, cause.getMessage(), cause);
        this.resource = cause.getResource();
        this.requestedDate = cause.getRequestedDate();
        this.currentDate = cause.getCurrentDate();
        this.partialResult = partialResult;
    }
}
