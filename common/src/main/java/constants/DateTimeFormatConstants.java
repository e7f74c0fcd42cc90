package constants;

/**
 * 日期时间格式常量类
 *
 * @author hli
 * @date 2026-03-02
 */
public class DateTimeFormatConstants {

    /**
     * 标准日期格式，JSONL 数据文件与回测报告统一使用
     */
    public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";

    /**
     * 紧凑日期格式，用于回测运行编号与报告文件名
     */
    public static final String EIGHT_DIGIT_DATE_FORMAT = "yyyyMMdd";

    /**
     * 紧凑时间戳格式，用于回测运行编号
     */
    public static final String COMPACT_DATETIME_FORMAT = "yyyyMMddHHmmss";

    private DateTimeFormatConstants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
