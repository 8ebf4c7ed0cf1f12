package cn.hjw.dev.flowscript.expr.ast;

/**
 * 公式语法树节点 (不可变)
 * 通过 {@link ExprVisitor} 分派, 调用方不做运行时类型判断
 */
public abstract class Expr {

    Expr() {
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);
}
