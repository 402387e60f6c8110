package org.csu.kpiformula.common.exception;

import org.csu.kpiformula.compiler.lexer.Token;
import org.csu.kpiformula.compiler.lexer.TokenType;

/**
 * @author hidyouth
 * @description: 语法分析阶段的异常 (即 "Syntax error")
 */
public class ParseException extends FormulaException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(Token token, String expected) {
        super(String.format("Syntax error at column %d: Expected %s, but found %s",
                token.column(),
                expected,
                describe(token)));
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "end of formula";
        }
        return String.format("'%s' (%s)", token.lexeme(), token.type());
    }
}
