package com.finplan.mgraph.formula;

import com.finplan.mgraph.error.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits (already safed) formula text into tokens.
 *
 * <p>
 * Identifiers are {@code [A-Za-z_][A-Za-z0-9_]*}; numbers accept a fraction and
 * an exponent; {@code **} is read as the power operator like {@code ^}.
 */
final class FormulaLexer {
    private final String text;
    private final String original;
    private int pos;

    FormulaLexer(String text, String original) {
        this.text = text;
        this.original = original;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, "", 0, pos));
                return tokens;
            }
            int start = pos;
            char c = text.charAt(pos);
            if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                tokens.add(number(start));
            } else if (isIdentStart(c)) {
                while (pos < text.length() && isIdentPart(text.charAt(pos)))
                    pos++;
                tokens.add(new Token(TokenType.IDENT, text.substring(start, pos), 0, start));
            } else {
                pos++;
                switch (c) {
                    case '+' -> tokens.add(new Token(TokenType.PLUS, "+", 0, start));
                    case '-' -> tokens.add(new Token(TokenType.MINUS, "-", 0, start));
                    case '/' -> tokens.add(new Token(TokenType.SLASH, "/", 0, start));
                    case '^' -> tokens.add(new Token(TokenType.CARET, "^", 0, start));
                    case '(' -> tokens.add(new Token(TokenType.LPAREN, "(", 0, start));
                    case ')' -> tokens.add(new Token(TokenType.RPAREN, ")", 0, start));
                    case ',' -> tokens.add(new Token(TokenType.COMMA, ",", 0, start));
                    case '*' -> {
                        if (pos < text.length() && text.charAt(pos) == '*') {
                            pos++;
                            tokens.add(new Token(TokenType.CARET, "**", 0, start));
                        } else {
                            tokens.add(new Token(TokenType.STAR, "*", 0, start));
                        }
                    }
                    default -> throw new FormulaSyntaxException(original, start, "unexpected character '" + c + "'");
                }
            }
        }
    }

    private Token number(int start) {
        while (pos < text.length() && Character.isDigit(text.charAt(pos)))
            pos++;
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos)))
                pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-'))
                pos++;
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos)))
                    pos++;
            } else {
                pos = mark; // not an exponent, e.g. "2e" followed by an identifier char
            }
        }
        if (pos < text.length() && isIdentStart(text.charAt(pos)))
            throw new FormulaSyntaxException(original, start, "identifier cannot start with a digit");
        String lexeme = text.substring(start, pos);
        return new Token(TokenType.NUMBER, lexeme, Double.parseDouble(lexeme), start);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
            pos++;
    }

    static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentPart(char c) {
        return isIdentStart(c) || (c >= '0' && c <= '9');
    }
}
