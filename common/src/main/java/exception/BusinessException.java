package exception;

import lombok.Getter;

/**
 * 回测业务异常基类
 *
 * 设计目的：
 * 1. 为回测链路中的致命错误提供统一的错误码载体（数据损坏、配置非法、未来数据访问）。
 * 2. 可预期的业务结果（规则拒单、成交失败、数据缺失）不走异常，以返回值表达。
 *
 * 错误码分段：
 * - 4001：行情/信号数据异常
 * - 4002：回测配置异常
 * - 4100：因果性违规（访问未来数据）
 *
 * @author hli
 * @date 2026-03-02
 */
@Getter
public class BusinessException extends RuntimeException {

    public static final int DATA_ERROR = 4001;
    public static final int CONFIGURATION_ERROR = 4002;
    public static final int LOOK_AHEAD_VIOLATION = 4100;

    private final int errorCode;

    public BusinessException(int errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * @param cause 原始异常（JSON 解析、IO 等）
     */
    public BusinessException(int errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
