package cn.hjw.dev.flowscript.generator.tools;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * Summarize 支持的聚合动作 (封闭枚举), 每项带可接受的别名
 */
@Getter
enum AggregationAction {

    SUM("sum", "Sum", "sum"),
    COUNT("size", "Count", "count"),
    COUNT_NON_NULL("count", "CountNonNull", "countnonnull", "countnotnull"),
    COUNT_DISTINCT("nunique", "CountDistinct", "countdistinct", "countunique"),
    AVERAGE("mean", "Avg", "avg", "average", "mean"),
    MIN("min", "Min", "min", "minimum"),
    MAX("max", "Max", "max", "maximum"),
    FIRST("first", "First", "first"),
    LAST("last", "Last", "last");

    // pandas 聚合函数名
    private final String function;

    // 默认输出字段名前缀, 如 Sum_Amount
    private final String label;

    private final String[] aliases;

    AggregationAction(String function, String label, String... aliases) {
        this.function = function;
        this.label = label;
        this.aliases = aliases;
    }

    static Optional<AggregationAction> parse(String action) {
        String key = action.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
        for (AggregationAction a : values()) {
            for (String alias : a.aliases) {
                if (alias.equals(key)) {
                    return Optional.of(a);
                }
            }
        }
        return Optional.empty();
    }
}
