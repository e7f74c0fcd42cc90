package exception;

/**
 * 行情数据异常类
 *
 * 设计目的：
 * 1. 封装历史数据加载与落盘过程中的硬错误，如 JSONL 行无法解析、同一 (symbol, date) 重复写入、
 *    停牌 K 线价格未做前值填充等。
 * 2. 与“数据缺失”区分：缺失是常态，按默认值降级处理，不抛出本异常。
 *
 * @author hli
 * @date 2026-03-02
 */
public class DataException extends BusinessException {

    public DataException(String message) {
        super(DATA_ERROR, message);
    }

    public DataException(String message, Throwable cause) {
        super(DATA_ERROR, message, cause);
    }

    public DataException(int errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
