package enums.market;

import lombok.Getter;

/**
 * 上市状态枚举
 *
 * @author hli
 * @date 2026-03-02
 */
@Getter
public enum ListingStatusEnum {

    ACTIVE("正常上市"),

    /**
     * 长期停牌，复牌时间未知
     */
    SUSPENDED_UNKNOWN_DURATION("长期停牌"),

    DELISTED("已退市");

    private final String description;

    ListingStatusEnum(String description) {
        this.description = description;
    }

    /**
     * 是否允许交易
     */
    public boolean isTradable() {
        return this == ACTIVE;
    }
}
