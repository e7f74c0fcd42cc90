package constants;

import java.math.RoundingMode;

/**
 * 数字格式化常量类
 * <p>
 * 类职责：
 * 统一管理价格精度、金额精度与日志输出模板，避免魔法值。
 * <p>
 * 使用场景：
 * - 涨跌停价、成交价、各项费用按最小价格变动单位（0.01 元）取整
 * - 日志输出收益率、回撤等指标
 *
 * @author hli
 * @date 2026-03-02
 */
public class NumberFormatConstants {

    // ===================== 精度 =====================

    /**
     * 价格与金额精度：2 位小数（A 股最小价格变动单位 0.01 元）
     */
    public static final int PRICE_SCALE = 2;

    /**
     * 费率、比例等中间计算精度
     */
    public static final int RATIO_SCALE = 8;

    /**
     * 统一舍入方式：四舍五入
     */
    public static final RoundingMode PRICE_ROUNDING = RoundingMode.HALF_UP;

    // ===================== 小数位格式 =====================

    /**
     * 保留 2 位小数
     * <p>
     * 示例: 12.34
     */
    public static final String DECIMAL_2 = "%.2f";

    /**
     * 保留 4 位小数
     * <p>
     * 示例: 1.2346
     */
    public static final String DECIMAL_4 = "%.4f";

    // ===================== 百分比格式 =====================

    /**
     * 百分比格式（2 位小数）
     * <p>
     * 示例: 12.34%
     */
    public static final String PERCENT_2 = "%.2f%%";

    /**
     * 私有构造函数，防止实例化
     */
    private NumberFormatConstants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
