package exception;

/**
 * 回测配置异常类
 *
 * 设计目的：
 * 1. 回测参数非法时（起止日期倒置、初始资金非正、费率为负、阈值越界等）在启动阶段快速失败。
 * 2. 与运行期数据异常区分，便于定位是配置问题还是数据问题。
 *
 * @author hli
 * @date 2026-03-02
 */
public class ConfigurationException extends BusinessException {

    public ConfigurationException(String message) {
        super(CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(CONFIGURATION_ERROR, message, cause);
    }
}
