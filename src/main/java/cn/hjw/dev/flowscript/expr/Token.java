package cn.hjw.dev.flowscript.expr;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 词法单元
 * text 为解码后的值 (字符串去引号并处理转义, 字段名处理 ]] 转义)
 * start/end 为在原公式中的半开区间
 */
@Getter
@RequiredArgsConstructor
public class Token {

    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;

    @Override
    public String toString() {
        return type + (text != null ? "(" + text + ")" : "") + "@" + start;
    }
}
