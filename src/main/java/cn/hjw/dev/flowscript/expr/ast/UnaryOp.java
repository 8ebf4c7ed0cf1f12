package cn.hjw.dev.flowscript.expr.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(callSuper = false)
public final class UnaryOp extends Expr {

    private final UnaryOperator operator;
    private final Expr operand;

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return "(" + operator.getSymbol() + " " + operand + ")";
    }
}
