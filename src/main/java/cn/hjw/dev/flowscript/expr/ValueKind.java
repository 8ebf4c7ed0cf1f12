package cn.hjw.dev.flowscript.expr;

/**
 * 表达式值类型提示, 用于下游的类型转换决策
 */
public enum ValueKind {
    NUMERIC,
    STRING,
    BOOLEAN,
    DATE,
    // 字段引用等编译期无法确定的类型
    UNKNOWN
}
