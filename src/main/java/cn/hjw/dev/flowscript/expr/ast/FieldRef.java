package cn.hjw.dev.flowscript.expr.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

// 列引用 [Name]
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public final class FieldRef extends Expr {

    private final String name;

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFieldRef(this);
    }

    @Override
    public String toString() {
        return "[" + name + "]";
    }
}
