package cn.hjw.dev.flowscript.expr;

public enum TokenType {
    // 字面量与标识符
    NUMBER, // 42, 3.14, 1e3
    STRING, // "West", 'West'
    FIELD, // [Amount]
    IDENTIFIER, // 函数名

    // 关键字 (不区分大小写)
    AND, OR, NOT, TRUE, FALSE,
    IF, THEN, ELSEIF, ELSE, ENDIF,

    // 运算符
    EQ, // = ==
    NE, // <> !=
    LT, LE, GT, GE,
    PLUS, MINUS, STAR, SLASH,
    BANG, // !

    // 分隔符
    LPAREN, RPAREN, COMMA,

    EOF
}
