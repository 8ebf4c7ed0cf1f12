package cn.hjw.dev.flowscript.script;

import java.math.BigInteger;
import java.util.List;
import java.util.StringJoiner;

/**
 * 目标语言 (Python) 的字面量与标识符工具
 */
public final class PythonSyntax {

    private PythonSyntax() {
    }

    /**
     * 单引号字符串字面量, 转义反斜杠/引号/控制字符
     */
    public static String string(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('\'').toString();
    }

    /**
     * 数值字面量: Python 3 不接受带前导零的十进制整数, 如 007 写作 7
     */
    public static String number(String literal) {
        String text = literal.trim();
        if (text.matches("-?\\d+")) {
            return new BigInteger(text).toString();
        }
        return text;
    }

    public static String stringList(List<String> values) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (String v : values) {
            joiner.add(string(v));
        }
        return joiner.toString();
    }

    public static String bool(boolean value) {
        return value ? "True" : "False";
    }

    public static String column(String frame, String field) {
        return frame + "[" + string(field) + "]";
    }

    /**
     * 把工具ID转换为合法标识符片段: 字母数字保留, 其它字符写成 _xHH_
     */
    public static String identifierPart(String raw) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            } else {
                sb.append("_x").append(Integer.toHexString(c)).append('_');
            }
        }
        return sb.toString();
    }

    /**
     * 作为方法调用接收者时的写法: 变量名、列引用与已整体加括号的表达式原样返回, 其它加括号
     */
    public static String receiver(String code) {
        if (code.matches("[A-Za-z_][A-Za-z0-9_]*(?:\\['(?:[^'\\\\]|\\\\.)*'\\])?")) {
            return code;
        }
        if (isWrapped(code)) {
            return code;
        }
        return "(" + code + ")";
    }

    // 首个 '(' 是否恰好与末尾 ')' 匹配
    private static boolean isWrapped(String code) {
        if (code.length() < 2 || code.charAt(0) != '(' || code.charAt(code.length() - 1) != ')') {
            return false;
        }
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < code.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
