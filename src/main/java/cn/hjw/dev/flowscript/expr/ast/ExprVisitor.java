package cn.hjw.dev.flowscript.expr.ast;

public interface ExprVisitor<R> {

    R visitLiteral(Literal literal);

    R visitFieldRef(FieldRef fieldRef);

    R visitUnary(UnaryOp unary);

    R visitBinary(BinaryOp binary);

    R visitCall(Call call);
}
