package enums.market;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * A 股板块类型枚举
 * <p>
 * 板块决定涨跌幅限制档位：科创板、创业板为 20%，主板为 10%（ST 为 5%）。
 * 具体比例由交易规则配置给出，本枚举只负责识别板块。
 *
 * @author hli
 * @date 2026-03-02
 */
@Getter
public enum BoardTypeEnum {

    /**
     * 主板（沪市 600/601/603/605，深市 000/001/002/003）
     */
    MAIN("主板", "Main Board", List.of()),

    /**
     * 科创板（688 开头）
     */
    STAR("科创板", "STAR Market", List.of("688", "689")),

    /**
     * 创业板（300/301 开头）
     */
    CHINEXT("创业板", "ChiNext", List.of("300", "301"));

    private final String name;
    private final String englishName;
    private final List<String> codePrefixes;

    BoardTypeEnum(String name, String englishName, List<String> codePrefixes) {
        this.name = name;
        this.englishName = englishName;
        this.codePrefixes = codePrefixes;
    }

    /**
     * 是否属于 20% 涨跌幅的成长型板块
     */
    public boolean isGrowthBoard() {
        return this == STAR || this == CHINEXT;
    }

    /**
     * 根据证券代码识别板块，未命中任何前缀时归为主板
     *
     * @param symbol 证券代码，可带交易所后缀（如 688001.SH）
     * @return 板块类型
     */
    public static BoardTypeEnum fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return MAIN;
        }
        String code = symbol.trim();
        return Arrays.stream(values())
                .filter(board -> board.codePrefixes.stream().anyMatch(code::startsWith))
                .findFirst()
                .orElse(MAIN);
    }
}
