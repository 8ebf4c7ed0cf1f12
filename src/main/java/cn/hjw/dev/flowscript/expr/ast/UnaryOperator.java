package cn.hjw.dev.flowscript.expr.ast;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum UnaryOperator {

    NOT("NOT", "~"),
    NEGATE("-", "-");

    private final String symbol;
    private final String target;
}
