package org.csu.kpiformula.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param column 在公式中的列号 (从1开始)
 */
public record Token(TokenType type, String lexeme, int column) {

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-13s, Lexeme='%s', Column=%d]", type, lexeme, column);
    }
}
