package cn.hjw.dev.flowscript.expr.ast;

import cn.hjw.dev.flowscript.expr.ValueKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 字面量
 * value 为解码后的文本: 数值保留原始写法, 字符串已去引号, 布尔为 "true"/"false"
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public final class Literal extends Expr {

    private final ValueKind kind;
    private final String value;

    public static Literal number(String text) {
        return new Literal(ValueKind.NUMERIC, text);
    }

    public static Literal string(String text) {
        return new Literal(ValueKind.STRING, text);
    }

    public static Literal bool(boolean value) {
        return new Literal(ValueKind.BOOLEAN, String.valueOf(value));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return kind == ValueKind.STRING ? "\"" + value + "\"" : value;
    }
}
