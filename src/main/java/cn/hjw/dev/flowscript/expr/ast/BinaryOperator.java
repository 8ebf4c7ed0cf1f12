package cn.hjw.dev.flowscript.expr.ast;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 二元运算符: 公式写法 -> pandas 写法
 * 逻辑运算映射为按位运算, 由生成的括号保证优先级
 */
@Getter
@RequiredArgsConstructor
public enum BinaryOperator {

    OR("OR", "|", Category.LOGICAL),
    AND("AND", "&", Category.LOGICAL),

    EQ("=", "==", Category.COMPARISON),
    NE("<>", "!=", Category.COMPARISON),
    LT("<", "<", Category.COMPARISON),
    LE("<=", "<=", Category.COMPARISON),
    GT(">", ">", Category.COMPARISON),
    GE(">=", ">=", Category.COMPARISON),

    ADD("+", "+", Category.ARITHMETIC),
    SUBTRACT("-", "-", Category.ARITHMETIC),
    MULTIPLY("*", "*", Category.ARITHMETIC),
    DIVIDE("/", "/", Category.ARITHMETIC);

    private final String symbol;
    private final String target;
    private final Category category;

    public enum Category {
        LOGICAL,
        COMPARISON,
        ARITHMETIC
    }
}
