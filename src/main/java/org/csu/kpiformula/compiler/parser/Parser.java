package org.csu.kpiformula.compiler.parser;

import org.csu.kpiformula.common.exception.FormulaTooComplexException;
import org.csu.kpiformula.common.exception.ParseException;
import org.csu.kpiformula.common.exception.UnsafeConstructException;
import org.csu.kpiformula.compiler.lexer.Token;
import org.csu.kpiformula.compiler.lexer.TokenType;
import org.csu.kpiformula.compiler.parser.ast.*;

import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * expression := term (("+" | "-") term)*
 * term       := factor (("*" | "/") factor)*
 * factor     := ("-" | "+")? primary
 * primary    := NUMBER | IDENTIFIER | "(" expression ")"
 * </pre>
 *
 * 遇到可以识别、但语言不允许的写法时抛出 UnsafeConstructException，
 * 其余的非法输入抛出 ParseException。
 */
public class Parser {

    private final List<Token> tokens;
    private final int maxDepth; // 括号最大嵌套深度，0 表示不限制
    private int position = 0;
    private int depth = 0;

    // 出现在运算符位置上的被禁止构造
    private static final Map<TokenType, String> FORBIDDEN_OPERATORS = Map.ofEntries(
            Map.entry(TokenType.DOUBLE_STAR, "power operator"),
            Map.entry(TokenType.DOUBLE_SLASH, "floor division"),
            Map.entry(TokenType.PERCENT, "modulo operator"),
            Map.entry(TokenType.AT, "matrix multiplication"),
            Map.entry(TokenType.EQUAL_EQUAL, "comparison"),
            Map.entry(TokenType.NOT_EQUAL, "comparison"),
            Map.entry(TokenType.LESS, "comparison"),
            Map.entry(TokenType.GREATER, "comparison"),
            Map.entry(TokenType.LESS_EQUAL, "comparison"),
            Map.entry(TokenType.GREATER_EQUAL, "comparison"),
            Map.entry(TokenType.IS, "comparison"),
            Map.entry(TokenType.IN, "comparison"),
            Map.entry(TokenType.NOT, "comparison"),
            Map.entry(TokenType.AND, "boolean operator"),
            Map.entry(TokenType.OR, "boolean operator"),
            Map.entry(TokenType.AMPERSAND, "bitwise operator"),
            Map.entry(TokenType.PIPE, "bitwise operator"),
            Map.entry(TokenType.CARET, "bitwise operator"),
            Map.entry(TokenType.SHIFT_LEFT, "bitwise operator"),
            Map.entry(TokenType.SHIFT_RIGHT, "bitwise operator"),
            Map.entry(TokenType.ASSIGN, "assignment"),
            Map.entry(TokenType.IF, "conditional expression"),
            Map.entry(TokenType.ELSE, "conditional expression"),
            Map.entry(TokenType.FOR, "comprehension"),
            Map.entry(TokenType.COMMA, "tuple")
    );

    // 紧跟在一个完整操作数之后的被禁止构造
    private static final Map<TokenType, String> FORBIDDEN_POSTFIX = Map.of(
            TokenType.LPAREN, "function call",
            TokenType.DOT, "attribute access",
            TokenType.LBRACKET, "subscript"
    );

    // 出现在操作数位置上的被禁止构造
    private static final Map<TokenType, String> FORBIDDEN_OPERANDS = Map.of(
            TokenType.LBRACKET, "collection literal",
            TokenType.LBRACE, "collection literal",
            TokenType.STRING_CONST, "string literal",
            TokenType.TRUE, "non-numeric constant",
            TokenType.FALSE, "non-numeric constant",
            TokenType.NONE, "non-numeric constant",
            TokenType.NOT, "boolean operator",
            TokenType.TILDE, "bitwise operator",
            TokenType.LAMBDA, "lambda"
    );

    public Parser(List<Token> tokens) {
        this(tokens, 0);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    public FormulaNode parse() {
        if (isAtEnd()) {
            throw new ParseException(peek(), "an expression");
        }

        FormulaNode formula = parseExpression();

        if (!isAtEnd()) {
            rejectForbiddenOperator();
            if (check(TokenType.RPAREN)) {
                throw new ParseException(peek(), "end of formula (unmatched ')')");
            }
            throw new ParseException(peek(), "an operator or end of formula");
        }
        return formula;
    }

    private FormulaNode parseExpression() {
        FormulaNode left = parseTerm();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator operator = previous().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            FormulaNode right = parseTerm();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private FormulaNode parseTerm() {
        FormulaNode left = parseFactor();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            BinaryOperator operator = previous().type() == TokenType.STAR ? BinaryOperator.MUL : BinaryOperator.DIV;
            FormulaNode right = parseFactor();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private FormulaNode parseFactor() {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            UnaryOperator operator = previous().type() == TokenType.MINUS ? UnaryOperator.NEG : UnaryOperator.POS;
            return new UnaryExpressionNode(operator, parsePrimary());
        }
        return parsePrimary();
    }

    private FormulaNode parsePrimary() {
        FormulaNode primary;
        if (match(TokenType.NUMBER)) {
            primary = new NumberLiteralNode(Double.parseDouble(previous().lexeme()));
        } else if (match(TokenType.IDENTIFIER)) {
            primary = new VariableRefNode(previous().lexeme());
        } else if (match(TokenType.LPAREN)) {
            enterNested();
            FormulaNode inner = parseExpression();
            if (!check(TokenType.RPAREN)) {
                rejectForbiddenOperator();
                throw new ParseException(peek(), "')'");
            }
            advance();
            depth--;
            primary = inner;
        } else {
            Token token = peek();
            if (token.type() == TokenType.ILLEGAL) {
                throw unrecognized(token);
            }
            String construct = FORBIDDEN_OPERANDS.get(token.type());
            if (construct != null) {
                throw new UnsafeConstructException(construct);
            }
            throw new ParseException(token, "a number, a variable or '('");
        }

        String postfix = FORBIDDEN_POSTFIX.get(peek().type());
        if (postfix != null) {
            throw new UnsafeConstructException(postfix);
        }
        return primary;
    }

    private void enterNested() {
        depth++;
        if (maxDepth > 0 && depth > maxDepth) {
            throw new FormulaTooComplexException(
                    "Formula nesting depth exceeds the limit of " + maxDepth);
        }
    }

    /**
     * 一个完整的表达式之后只能是 '+', '-', '*', '/', ')' 或结束；
     * 如果是可识别的被禁止运算符，报告对应的构造。
     */
    private void rejectForbiddenOperator() {
        Token token = peek();
        if (token.type() == TokenType.ILLEGAL) {
            throw unrecognized(token);
        }
        String construct = FORBIDDEN_OPERATORS.get(token.type());
        if (construct != null) {
            throw new UnsafeConstructException(construct);
        }
    }

    private ParseException unrecognized(Token token) {
        return new ParseException(String.format("Syntax error at column %d: Unrecognized character '%s'",
                token.column(), token.lexeme()));
    }

    // --- 辅助方法 ---

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
