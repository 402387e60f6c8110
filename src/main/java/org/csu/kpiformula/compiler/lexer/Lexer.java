package org.csu.kpiformula.compiler.lexer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的公式字符串分解为一系列的Token。
 * 词法分析器本身不报错：无法识别的字符会生成 ILLEGAL Token，由语法分析器统一处理。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    // 保留字映射表 (大小写敏感)
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("and", TokenType.AND);
        keywords.put("or", TokenType.OR);
        keywords.put("not", TokenType.NOT);
        keywords.put("is", TokenType.IS);
        keywords.put("in", TokenType.IN);
        keywords.put("if", TokenType.IF);
        keywords.put("else", TokenType.ELSE);
        keywords.put("for", TokenType.FOR);
        keywords.put("lambda", TokenType.LAMBDA);
        keywords.put("True", TokenType.TRUE);
        keywords.put("False", TokenType.FALSE);
        keywords.put("None", TokenType.NONE);
    }

    public Lexer(String input) {
        this.input = input;
    }

    public static boolean isReservedWord(String word) {
        return keywords.containsKey(word);
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", column());
        }

        char currentChar = peek();

        // 识别标识符或保留字
        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字，包括 ".5" 这种省略整数部分的小数
        if (isDigit(currentChar) || (currentChar == '.' && isDigit(peekNext()))) {
            return readNumber();
        }

        // 识别字符串 (只为了报告 "Unsafe construct")
        if (currentChar == '\'' || currentChar == '"') {
            return readString(currentChar);
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                if (peekNext() == '*') {
                    return consumeTwoAndReturn(TokenType.DOUBLE_STAR, "**");
                }
                return consumeAndReturn(TokenType.STAR, "*");
            case '/':
                if (peekNext() == '/') {
                    return consumeTwoAndReturn(TokenType.DOUBLE_SLASH, "//");
                }
                return consumeAndReturn(TokenType.SLASH, "/");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case '%':
                return consumeAndReturn(TokenType.PERCENT, "%");
            case '@':
                return consumeAndReturn(TokenType.AT, "@");
            case '&':
                return consumeAndReturn(TokenType.AMPERSAND, "&");
            case '|':
                return consumeAndReturn(TokenType.PIPE, "|");
            case '^':
                return consumeAndReturn(TokenType.CARET, "^");
            case '~':
                return consumeAndReturn(TokenType.TILDE, "~");
            case '.':
                return consumeAndReturn(TokenType.DOT, ".");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case '[':
                return consumeAndReturn(TokenType.LBRACKET, "[");
            case ']':
                return consumeAndReturn(TokenType.RBRACKET, "]");
            case '{':
                return consumeAndReturn(TokenType.LBRACE, "{");
            case '}':
                return consumeAndReturn(TokenType.RBRACE, "}");
            case ':':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.ASSIGN, ":=");
                }
                return consumeAndReturn(TokenType.COLON, ":");
            case '=':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.EQUAL_EQUAL, "==");
                }
                return consumeAndReturn(TokenType.ASSIGN, "=");
            case '!':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.NOT_EQUAL, "!=");
                }
                return consumeAndReturn(TokenType.ILLEGAL, "!");
            case '<':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.LESS_EQUAL, "<=");
                }
                if (peekNext() == '<') {
                    return consumeTwoAndReturn(TokenType.SHIFT_LEFT, "<<");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '>':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.GREATER_EQUAL, ">=");
                }
                if (peekNext() == '>') {
                    return consumeTwoAndReturn(TokenType.SHIFT_RIGHT, ">>");
                }
                return consumeAndReturn(TokenType.GREATER, ">");
            default:
                return consumeAndReturn(TokenType.ILLEGAL, String.valueOf(currentChar));
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column();
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column();
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        if (position < input.length() && peek() == '.') {
            // "5." 也是合法小数；但 "5.x" 中的 '.' 留给属性访问的判断
            if (isDigit(peekNext()) || !isLetter(peekNext())) {
                advance(); // 消耗掉 '.'
                while (position < input.length() && isDigit(peek())) {
                    advance();
                }
            }
        }
        return new Token(TokenType.NUMBER, input.substring(startPos, position), startCol);
    }

    private Token readString(char quote) {
        int startCol = column();
        advance(); // 跳过起始引号
        int startPos = position;
        while (position < input.length() && peek() != quote) {
            advance();
        }
        String text = input.substring(startPos, position);
        if (position >= input.length()) {
            return new Token(TokenType.ILLEGAL, quote + text, startCol); // 未闭合的字符串
        }
        advance(); // 跳过结束引号
        return new Token(TokenType.STRING_CONST, text, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
    }

    private int column() {
        return position + 1;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, column());
        advance();
        return token;
    }

    private Token consumeTwoAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, column());
        advance();
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
