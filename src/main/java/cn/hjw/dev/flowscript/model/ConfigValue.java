package cn.hjw.dev.flowscript.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 工具配置值 (封闭的标签变体)
 * 取值方式由各工具的生成方法显式决定, 调用方不做运行时类型判断
 * <ul>
 *     <li>{@link TextValue} 文本标量</li>
 *     <li>{@link NumberValue} 数值标量, 保留原始字面量</li>
 *     <li>{@link BooleanValue} 布尔标量</li>
 *     <li>{@link ListValue} 有序列表</li>
 *     <li>{@link ConfigMap} 有序映射</li>
 * </ul>
 */
public abstract class ConfigValue {

    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    ConfigValue() {
    }

    /**
     * 按字面量创建标量: true/false (忽略大小写) 为布尔, 纯十进制为数值, 其余为文本
     */
    public static ConfigValue scalar(String literal) {
        String s = literal == null ? "" : literal;
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
            return new BooleanValue(s, Boolean.parseBoolean(s.toLowerCase(Locale.ROOT)));
        }
        if (DECIMAL.matcher(s).matches()) {
            return new NumberValue(s, new BigDecimal(s));
        }
        return new TextValue(s);
    }

    /**
     * 标量的原始字面量; 映射取其 #text 项; 列表取首个元素
     */
    public abstract Optional<String> text();

    public List<ConfigValue> asList() {
        return Collections.singletonList(this);
    }

    public Optional<ConfigMap> asMap() {
        return Optional.empty();
    }

    public Optional<BigDecimal> asNumber() {
        return text().map(String::trim).filter(s -> DECIMAL.matcher(s).matches()).map(BigDecimal::new);
    }

    public Optional<Boolean> asBoolean() {
        return text().map(String::trim)
                .filter(s -> "true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))
                .map(s -> Boolean.parseBoolean(s.toLowerCase(Locale.ROOT)));
    }
}
