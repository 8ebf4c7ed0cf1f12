package cn.hjw.dev.flowscript.expr;

import lombok.Getter;

/**
 * 公式语法错误
 * 只在翻译器内部传递, 最终转为占位表达式 + 警告, 不会终止转换
 */
@Getter
public class ExpressionSyntaxException extends RuntimeException {

    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }
}
