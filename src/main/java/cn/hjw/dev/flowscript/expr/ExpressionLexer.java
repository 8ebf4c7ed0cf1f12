package cn.hjw.dev.flowscript.expr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 公式词法分析
 * 将公式字符串切分为 Token 列表, 末尾总是 EOF
 */
public final class ExpressionLexer {

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("AND", TokenType.AND);
        KEYWORDS.put("OR", TokenType.OR);
        KEYWORDS.put("NOT", TokenType.NOT);
        KEYWORDS.put("TRUE", TokenType.TRUE);
        KEYWORDS.put("FALSE", TokenType.FALSE);
        KEYWORDS.put("IF", TokenType.IF);
        KEYWORDS.put("THEN", TokenType.THEN);
        KEYWORDS.put("ELSEIF", TokenType.ELSEIF);
        KEYWORDS.put("ELSE", TokenType.ELSE);
        KEYWORDS.put("ENDIF", TokenType.ENDIF);
    }

    private final String input;
    private int position;

    public ExpressionLexer(String input) {
        this.input = input;
        this.position = 0;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (position >= input.length()) {
                break;
            }
            tokens.add(nextToken());
        }
        tokens.add(new Token(TokenType.EOF, null, position, position));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isWhitespace(c)) {
                position++;
            } else if (input.startsWith("//", position)) {
                while (position < input.length() && input.charAt(position) != '\n') {
                    position++;
                }
            } else if (input.startsWith("/*", position)) {
                int close = input.indexOf("*/", position + 2);
                if (close < 0) {
                    throw new ExpressionSyntaxException("Unterminated block comment", position);
                }
                position = close + 2;
            } else {
                return;
            }
        }
    }

    private Token nextToken() {
        char c = input.charAt(position);
        int start = position;

        // 双字符运算符
        if (position + 1 < input.length()) {
            String two = input.substring(position, position + 2);
            TokenType type = null;
            switch (two) {
                case "<=": type = TokenType.LE; break;
                case ">=": type = TokenType.GE; break;
                case "<>": type = TokenType.NE; break;
                case "!=": type = TokenType.NE; break;
                case "==": type = TokenType.EQ; break;
                case "&&": type = TokenType.AND; break;
                case "||": type = TokenType.OR; break;
                default: break;
            }
            if (type != null) {
                position += 2;
                return new Token(type, two, start, position);
            }
        }

        // 单字符运算符与分隔符
        TokenType single = null;
        switch (c) {
            case '=': single = TokenType.EQ; break;
            case '<': single = TokenType.LT; break;
            case '>': single = TokenType.GT; break;
            case '+': single = TokenType.PLUS; break;
            case '-': single = TokenType.MINUS; break;
            case '*': single = TokenType.STAR; break;
            case '/': single = TokenType.SLASH; break;
            case '!': single = TokenType.BANG; break;
            case '(': single = TokenType.LPAREN; break;
            case ')': single = TokenType.RPAREN; break;
            case ',': single = TokenType.COMMA; break;
            default: break;
        }
        if (single != null) {
            position++;
            return new Token(single, String.valueOf(c), start, position);
        }

        if (c == '[') {
            return readFieldReference();
        }
        if (c == '"' || c == '\'') {
            return readString(c);
        }
        if (isDigit(c) || (c == '.' && position + 1 < input.length() && isDigit(input.charAt(position + 1)))) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword();
        }
        throw new ExpressionSyntaxException("Unexpected character '" + c + "'", position);
    }

    /**
     * [Name]: 除 ] 外任意字符, ]] 表示字面量 ]
     */
    private Token readFieldReference() {
        int start = position;
        position++;
        StringBuilder sb = new StringBuilder();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == ']') {
                if (position + 1 < input.length() && input.charAt(position + 1) == ']') {
                    sb.append(']');
                    position += 2;
                    continue;
                }
                position++;
                return new Token(TokenType.FIELD, sb.toString(), start, position);
            }
            sb.append(c);
            position++;
        }
        throw new ExpressionSyntaxException("Unterminated field reference", start);
    }

    /**
     * 引号字符串: 反斜杠转义, 或连续两个同种引号表示一个引号
     */
    private Token readString(char quote) {
        int start = position;
        position++;
        StringBuilder sb = new StringBuilder();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == '\\' && position + 1 < input.length()) {
                char next = input.charAt(position + 1);
                switch (next) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    default: sb.append(next); break;
                }
                position += 2;
                continue;
            }
            if (c == quote) {
                if (position + 1 < input.length() && input.charAt(position + 1) == quote) {
                    sb.append(quote);
                    position += 2;
                    continue;
                }
                position++;
                return new Token(TokenType.STRING, sb.toString(), start, position);
            }
            sb.append(c);
            position++;
        }
        throw new ExpressionSyntaxException("Unterminated string literal", start);
    }

    // 与区域设置无关: 只认 ASCII 数字和 '.'
    private Token readNumber() {
        int start = position;
        while (position < input.length() && isDigit(input.charAt(position))) {
            position++;
        }
        if (position < input.length() && input.charAt(position) == '.') {
            position++;
            while (position < input.length() && isDigit(input.charAt(position))) {
                position++;
            }
        }
        if (position < input.length() && (input.charAt(position) == 'e' || input.charAt(position) == 'E')) {
            int mark = position;
            position++;
            if (position < input.length() && (input.charAt(position) == '+' || input.charAt(position) == '-')) {
                position++;
            }
            if (position < input.length() && isDigit(input.charAt(position))) {
                while (position < input.length() && isDigit(input.charAt(position))) {
                    position++;
                }
            } else {
                // 不是指数, 回退
                position = mark;
            }
        }
        String text = input.substring(start, position);
        if (text.startsWith(".")) {
            text = "0" + text;
        }
        return new Token(TokenType.NUMBER, text, start, position);
    }

    private Token readIdentifierOrKeyword() {
        int start = position;
        while (position < input.length()
                && (Character.isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }
        String word = input.substring(start, position);
        TokenType keyword = KEYWORDS.get(word.toUpperCase(Locale.ROOT));
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, word, start, position);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
