package cn.hjw.dev.flowscript.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 工具节点ID
 * 纯数字ID按数值排序, 其余ID按字典序排在所有数字ID之后
 */
@Getter
@EqualsAndHashCode(of = "raw")
public final class ToolId implements Comparable<ToolId> {

    private final String raw;

    // 非数字ID时为 null
    private final BigInteger numeric;

    private ToolId(String raw) {
        this.raw = raw;
        this.numeric = isDigits(raw) ? new BigInteger(raw) : null;
    }

    public static ToolId of(String raw) {
        Objects.requireNonNull(raw, "raw tool id");
        return new ToolId(raw.trim());
    }

    public static ToolId of(long id) {
        return new ToolId(Long.toString(id));
    }

    public boolean isNumeric() {
        return numeric != null;
    }

    @Override
    public int compareTo(ToolId other) {
        if (isNumeric() && other.isNumeric()) {
            int byValue = numeric.compareTo(other.numeric);
            // "01" 与 "1" 数值相同时退回原文比较, 保证全序
            return byValue != 0 ? byValue : raw.compareTo(other.raw);
        }
        if (isNumeric()) {
            return -1;
        }
        if (other.isNumeric()) {
            return 1;
        }
        return raw.compareTo(other.raw);
    }

    @Override
    public String toString() {
        return raw;
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
