package com.finplan.mgraph.formula;

import com.finplan.mgraph.error.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser producing an {@link Expr} tree.
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/') unary)*
 * unary   := ('+' | '-') unary | power
 * power   := primary (('^' | '**') unary)?
 * primary := NUMBER | IDENT | IDENT '(' expr (',' expr)* ')' | '(' expr ')'
 * </pre>
 *
 * Power binds tighter than unary minus on its left ({@code -2^2 == -4}) and is
 * right associative.
 */
final class FormulaParser {
    private final String original;
    private final List<Token> tokens;
    private final Set<String> variables = new LinkedHashSet<>();
    private int pos;

    private FormulaParser(String safeText, String original) {
        this.original = original;
        this.tokens = new FormulaLexer(safeText, original).tokenize();
    }

    /** Parse result: the tree and the variables in order of first appearance. */
    record Parsed(Expr root, List<String> variables) {
    }

    static Parsed parse(String safeText, String original) {
        FormulaParser p = new FormulaParser(safeText, original);
        if (p.peek().type() == TokenType.EOF)
            throw new FormulaSyntaxException(original, 0, "empty formula");
        Expr root = p.expr();
        Token trailing = p.peek();
        if (trailing.type() != TokenType.EOF)
            throw new FormulaSyntaxException(original, trailing.position(), "unexpected '" + trailing.text() + "'");
        return new Parsed(root, List.copyOf(p.variables));
    }

    private Expr expr() {
        Expr left = term();
        while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
            char op = next().type() == TokenType.PLUS ? '+' : '-';
            left = new Expr.Binary(op, left, term());
        }
        return left;
    }

    private Expr term() {
        Expr left = unary();
        while (peek().type() == TokenType.STAR || peek().type() == TokenType.SLASH) {
            char op = next().type() == TokenType.STAR ? '*' : '/';
            left = new Expr.Binary(op, left, unary());
        }
        return left;
    }

    private Expr unary() {
        if (peek().type() == TokenType.MINUS) {
            next();
            Expr operand = unary();
            if (operand instanceof Expr.Num n)
                return new Expr.Num(-n.value());
            return new Expr.Neg(operand);
        }
        if (peek().type() == TokenType.PLUS) {
            next();
            return unary();
        }
        return power();
    }

    private Expr power() {
        Expr base = primary();
        if (peek().type() == TokenType.CARET) {
            next();
            return new Expr.Binary('^', base, unary());
        }
        return base;
    }

    private Expr primary() {
        Token t = next();
        switch (t.type()) {
            case NUMBER:
                return new Expr.Num(t.number());
            case IDENT:
                if (peek().type() == TokenType.LPAREN)
                    return call(t);
                variables.add(t.text());
                return new Expr.Var(t.text());
            case LPAREN: {
                Expr inner = expr();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case EOF:
                throw new FormulaSyntaxException(original, t.position(), "unexpected end of formula");
            default:
                throw new FormulaSyntaxException(original, t.position(), "unexpected '" + t.text() + "'");
        }
    }

    private Expr call(Token name) {
        FormulaFunction fn = FormulaFunction.lookup(name.text());
        if (fn == null)
            throw new FormulaSyntaxException(original, name.position(), "unknown function '" + name.text() + "'");
        expect(TokenType.LPAREN, "'('");
        List<Expr> args = new ArrayList<>();
        if (peek().type() != TokenType.RPAREN) {
            args.add(expr());
            while (peek().type() == TokenType.COMMA) {
                next();
                args.add(expr());
            }
        }
        expect(TokenType.RPAREN, "')'");
        if (!fn.acceptsArity(args.size()))
            throw new FormulaSyntaxException(original, name.position(),
                    name.text() + " takes " + fn.arityDescription() + ", got " + args.size());
        return new Expr.Call(fn, List.copyOf(args));
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF)
            pos++;
        return t;
    }

    private void expect(TokenType type, String what) {
        Token t = next();
        if (t.type() != type)
            throw new FormulaSyntaxException(original, t.position(), "expected " + what + " but found '"
                    + (t.type() == TokenType.EOF ? "end of formula" : t.text()) + "'");
    }
}
