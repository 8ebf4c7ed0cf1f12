package cn.hjw.dev.flowscript.expr;

import cn.hjw.dev.flowscript.expr.ast.BinaryOp;
import cn.hjw.dev.flowscript.expr.ast.BinaryOperator;
import cn.hjw.dev.flowscript.expr.ast.Call;
import cn.hjw.dev.flowscript.expr.ast.Expr;
import cn.hjw.dev.flowscript.expr.ast.FieldRef;
import cn.hjw.dev.flowscript.expr.ast.Literal;
import cn.hjw.dev.flowscript.expr.ast.UnaryOp;
import cn.hjw.dev.flowscript.expr.ast.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * 公式递归下降解析
 *
 * 优先级 (低 -> 高):
 * OR, AND, 比较, 加减, 乘除, 一元 (-, NOT, !), 基本项
 *
 * 条件块 IF c THEN a ELSEIF c2 THEN b ELSE d ENDIF 展开为嵌套的 IIF 调用
 */
public final class ExpressionParser {

    public static final String CONDITIONAL_FUNCTION = "IIF";

    private final String source;
    private final List<Token> tokens;
    private int position;

    public ExpressionParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
        this.position = 0;
    }

    public static Expr parse(String formula) {
        ExpressionLexer lexer = new ExpressionLexer(formula);
        ExpressionParser parser = new ExpressionParser(formula, lexer.tokenize());
        return parser.parseFormula();
    }

    /**
     * 解析完整公式, 末尾不允许残留 token
     */
    public Expr parseFormula() {
        if (check(TokenType.EOF)) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        Expr expr = parseOrExpression();
        if (!check(TokenType.EOF)) {
            throw new ExpressionSyntaxException("Unexpected token '" + peek().getText() + "'", peek().getStart());
        }
        return expr;
    }

    private Expr parseOrExpression() {
        Expr left = parseAndExpression();
        while (check(TokenType.OR)) {
            advance();
            Expr right = parseAndExpression();
            left = new BinaryOp(BinaryOperator.OR, left, right);
        }
        return left;
    }

    private Expr parseAndExpression() {
        Expr left = parseComparisonExpression();
        while (check(TokenType.AND)) {
            advance();
            Expr right = parseComparisonExpression();
            left = new BinaryOp(BinaryOperator.AND, left, right);
        }
        return left;
    }

    private Expr parseComparisonExpression() {
        Expr left = parseAdditiveExpression();
        while (true) {
            BinaryOperator op = comparisonOperator(peek().getType());
            if (op == null) {
                return left;
            }
            advance();
            Expr right = parseAdditiveExpression();
            left = new BinaryOp(op, left, right);
        }
    }

    private Expr parseAdditiveExpression() {
        Expr left = parseMultiplicativeExpression();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            BinaryOperator op = advance().getType() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            Expr right = parseMultiplicativeExpression();
            left = new BinaryOp(op, left, right);
        }
        return left;
    }

    private Expr parseMultiplicativeExpression() {
        Expr left = parseUnaryExpression();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            BinaryOperator op = advance().getType() == TokenType.STAR ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            Expr right = parseUnaryExpression();
            left = new BinaryOp(op, left, right);
        }
        return left;
    }

    private Expr parseUnaryExpression() {
        if (check(TokenType.MINUS)) {
            advance();
            return new UnaryOp(UnaryOperator.NEGATE, parseUnaryExpression());
        }
        if (check(TokenType.NOT) || check(TokenType.BANG)) {
            advance();
            return new UnaryOp(UnaryOperator.NOT, parseUnaryExpression());
        }
        if (check(TokenType.PLUS)) {
            // 一元正号无语义
            advance();
            return parseUnaryExpression();
        }
        return parsePrimaryExpression();
    }

    private Expr parsePrimaryExpression() {
        Token token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return Literal.number(token.getText());
            case STRING:
                advance();
                return Literal.string(token.getText());
            case TRUE:
                advance();
                return Literal.bool(true);
            case FALSE:
                advance();
                return Literal.bool(false);
            case FIELD:
                advance();
                return new FieldRef(token.getText());
            case LPAREN:
                advance();
                Expr inner = parseOrExpression();
                consume(TokenType.RPAREN, "Expected ')'");
                return inner;
            case IF:
                return parseConditionalBlock();
            case IDENTIFIER:
                return parseCall();
            case EOF:
                throw new ExpressionSyntaxException("Unexpected end of expression", token.getStart());
            default:
                throw new ExpressionSyntaxException("Unexpected token '" + token.getText() + "'", token.getStart());
        }
    }

    /**
     * name(arg, ...): 标识符后必须紧跟 '('
     */
    private Expr parseCall() {
        Token name = advance();
        consume(TokenType.LPAREN, "Expected '(' after function name '" + name.getText() + "'");
        List<Expr> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            arguments.add(parseOrExpression());
            while (check(TokenType.COMMA)) {
                advance();
                arguments.add(parseOrExpression());
            }
        }
        Token close = consume(TokenType.RPAREN, "Expected ')' to close call to '" + name.getText() + "'");
        return new Call(name.getText(), arguments, source.substring(name.getStart(), close.getEnd()));
    }

    /**
     * IF c THEN a (ELSEIF c THEN a)* ELSE d ENDIF
     * ELSE 分支必须存在
     */
    private Expr parseConditionalBlock() {
        Token start = consume(TokenType.IF, "Expected IF");
        List<Expr> conditions = new ArrayList<>();
        List<Expr> branches = new ArrayList<>();

        conditions.add(parseOrExpression());
        consume(TokenType.THEN, "Expected THEN");
        branches.add(parseOrExpression());
        while (check(TokenType.ELSEIF)) {
            advance();
            conditions.add(parseOrExpression());
            consume(TokenType.THEN, "Expected THEN");
            branches.add(parseOrExpression());
        }
        consume(TokenType.ELSE, "Expected ELSE");
        Expr otherwise = parseOrExpression();
        Token end = consume(TokenType.ENDIF, "Expected ENDIF");

        String text = source.substring(start.getStart(), end.getEnd());
        // 从最后一个分支向前折叠
        Expr result = otherwise;
        for (int i = conditions.size() - 1; i >= 0; i--) {
            List<Expr> args = new ArrayList<>();
            args.add(conditions.get(i));
            args.add(branches.get(i));
            args.add(result);
            result = new Call(CONDITIONAL_FUNCTION, args, text);
        }
        return result;
    }

    private static BinaryOperator comparisonOperator(TokenType type) {
        switch (type) {
            case EQ:
                return BinaryOperator.EQ;
            case NE:
                return BinaryOperator.NE;
            case LT:
                return BinaryOperator.LT;
            case LE:
                return BinaryOperator.LE;
            case GT:
                return BinaryOperator.GT;
            case GE:
                return BinaryOperator.GE;
            default:
                return null;
        }
    }

    // ==================== Helper Methods ====================

    private Token peek() {
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private Token advance() {
        Token token = tokens.get(position);
        if (token.getType() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        Token actual = peek();
        String got = actual.getType() == TokenType.EOF ? "end of expression" : "'" + actual.getText() + "'";
        throw new ExpressionSyntaxException(message + ", got " + got, actual.getStart());
    }
}
