package cn.hjw.dev.flowscript.expr.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * 函数调用
 * source 为调用在原公式中的文本, 无法翻译时原样写进占位符
 */
@Getter
@EqualsAndHashCode(callSuper = false, exclude = "source")
public final class Call extends Expr {

    private final String name;
    private final List<Expr> arguments;
    private final String source;

    public Call(String name, List<Expr> arguments, String source) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.source = source;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
