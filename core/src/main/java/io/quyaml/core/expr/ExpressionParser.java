package io.quyaml.core.expr;

import io.quyaml.core.error.ExpressionEvalException;
import io.quyaml.core.expr.ParamExpr.BinaryOp;
import io.quyaml.core.expr.ParamExpr.BinaryOperator;
import io.quyaml.core.expr.ParamExpr.Constant;
import io.quyaml.core.expr.ParamExpr.Symbol;
import io.quyaml.core.expr.ParamExpr.UnaryOp;
import io.quyaml.core.expr.ParamExpr.UnaryOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses gate parameter expressions into a {@link ParamExpr} tree.
 *
 * <p>
 * Grammar, loosest binding first:
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := factor (('*' | '/' | '%') factor)*
 * factor  := ('+' | '-') factor | power
 * power   := primary ('**' factor)?
 * primary := NUMBER | '$' NAME | 'pi' | 'e' | '(' expr ')'
 * </pre>
 *
 * {@code **} is right-associative and binds tighter than a unary sign on its
 * left, so {@code -2**2} is {@code -(2**2)}. Every other construct is rejected
 * with an {@link ExpressionEvalException} naming it.
 *
 * <p>
 * Thread-safe: all state lives in a per-call cursor.
 */
public final class ExpressionParser {

    /** Bounds recursion on inputs like {@code ((((...))))} and {@code ----1}. */
    static final int MAX_DEPTH = 64;

    private static final Set<String> BOOLEAN_WORDS = Set.of("true", "false", "True", "False");

    private ExpressionParser() {
        // utility class
    }

    /**
     * Parses the given expression source.
     *
     * @param source the expression text, without the surrounding gate-call
     *               parentheses
     * @return the expression tree
     * @throws ExpressionEvalException if the text is empty or uses a construct
     *                                 outside the grammar
     */
    public static ParamExpr parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        List<Token> tokens = tokenize(source);
        if (tokens.size() == 1) {
            throw new ExpressionEvalException("Empty parameter expression", null);
        }
        Cursor cursor = new Cursor(source, tokens);
        ParamExpr expr = cursor.parseExpr();
        Token trailing = cursor.peek();
        if (trailing.type() != TokenType.END) {
            throw cursor.error("unexpected " + trailing.describe());
        }
        return expr;
    }

    // ── Tokenizer ──

    enum TokenType {
        NUMBER,
        PARAM,
        IDENT,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        PERCENT,
        POWER,
        LPAREN,
        RPAREN,
        END
    }

    record Token(TokenType type, String text, int position) {
        String describe() {
            return type == TokenType.END ? "end of expression" : "'" + text + "'";
        }
    }

    static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = source.length();
        while (pos < length) {
            char ch = source.charAt(pos);
            if (Character.isWhitespace(ch)) {
                pos++;
                continue;
            }
            if (Character.isDigit(ch) || (ch == '.' && pos + 1 < length && Character.isDigit(source.charAt(pos + 1)))) {
                int end = scanNumber(source, pos);
                tokens.add(new Token(TokenType.NUMBER, source.substring(pos, end), pos));
                pos = end;
                continue;
            }
            if (ch == '$') {
                int end = scanName(source, pos + 1);
                if (end == pos + 1) {
                    throw unsupported(source, "expected a parameter name after '$'");
                }
                tokens.add(new Token(TokenType.PARAM, source.substring(pos + 1, end), pos));
                pos = end;
                continue;
            }
            if (Character.isLetter(ch) || ch == '_') {
                int end = scanName(source, pos);
                tokens.add(new Token(TokenType.IDENT, source.substring(pos, end), pos));
                pos = end;
                continue;
            }
            switch (ch) {
                case '+' -> tokens.add(new Token(TokenType.PLUS, "+", pos));
                case '-' -> tokens.add(new Token(TokenType.MINUS, "-", pos));
                case '/' -> tokens.add(new Token(TokenType.SLASH, "/", pos));
                case '%' -> tokens.add(new Token(TokenType.PERCENT, "%", pos));
                case '(' -> tokens.add(new Token(TokenType.LPAREN, "(", pos));
                case ')' -> tokens.add(new Token(TokenType.RPAREN, ")", pos));
                case '*' -> {
                    if (pos + 1 < length && source.charAt(pos + 1) == '*') {
                        tokens.add(new Token(TokenType.POWER, "**", pos));
                        pos++;
                    } else {
                        tokens.add(new Token(TokenType.STAR, "*", pos));
                    }
                }
                case '\'', '"' -> throw unsupported(source, "string literals are not allowed");
                case '<', '>', '=', '!' -> throw unsupported(source, "comparison operators are not allowed");
                case '[', ']' -> throw unsupported(source, "indexing is not allowed");
                case '.' -> throw unsupported(source, "attribute access is not allowed");
                case ',' -> throw unsupported(source, "argument lists are not allowed");
                case '&', '|', '^', '~' -> throw unsupported(source, "bitwise and boolean operators are not allowed");
                default -> throw unsupported(source, "unexpected character '" + ch + "'");
            }
            pos++;
        }
        tokens.add(new Token(TokenType.END, "", length));
        return tokens;
    }

    private static int scanNumber(String source, int start) {
        int pos = start;
        int length = source.length();
        while (pos < length && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < length && source.charAt(pos) == '.') {
            pos++;
            while (pos < length && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < length && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int exp = pos + 1;
            if (exp < length && (source.charAt(exp) == '+' || source.charAt(exp) == '-')) {
                exp++;
            }
            if (exp < length && Character.isDigit(source.charAt(exp))) {
                pos = exp;
                while (pos < length && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
        }
        return pos;
    }

    private static int scanName(String source, int start) {
        int pos = start;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return pos;
    }

    private static ExpressionEvalException unsupported(String source, String what) {
        return new ExpressionEvalException(
                String.format("Unsupported expression element in '%s': %s", source, what), null);
    }

    // ── Recursive descent ──

    private static final class Cursor {

        private final String source;
        private final List<Token> tokens;
        private int index;
        private int depth;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            return tokens.get(index++);
        }

        boolean accept(TokenType type) {
            if (peek().type() == type) {
                index++;
                return true;
            }
            return false;
        }

        ExpressionEvalException error(String what) {
            return new ExpressionEvalException(
                    String.format("Invalid parameter expression '%s': %s", source, what), null);
        }

        private void enter() {
            if (++depth > MAX_DEPTH) {
                throw error("nesting deeper than " + MAX_DEPTH + " levels");
            }
        }

        ParamExpr parseExpr() {
            enter();
            ParamExpr left = parseTerm();
            while (true) {
                if (accept(TokenType.PLUS)) {
                    left = new BinaryOp(BinaryOperator.ADD, left, parseTerm());
                } else if (accept(TokenType.MINUS)) {
                    left = new BinaryOp(BinaryOperator.SUB, left, parseTerm());
                } else {
                    depth--;
                    return left;
                }
            }
        }

        private ParamExpr parseTerm() {
            ParamExpr left = parseFactor();
            while (true) {
                if (accept(TokenType.STAR)) {
                    left = new BinaryOp(BinaryOperator.MUL, left, parseFactor());
                } else if (accept(TokenType.SLASH)) {
                    left = new BinaryOp(BinaryOperator.DIV, left, parseFactor());
                } else if (accept(TokenType.PERCENT)) {
                    left = new BinaryOp(BinaryOperator.MOD, left, parseFactor());
                } else {
                    return left;
                }
            }
        }

        private ParamExpr parseFactor() {
            enter();
            ParamExpr result;
            if (accept(TokenType.PLUS)) {
                result = new UnaryOp(UnaryOperator.PLUS, parseFactor());
            } else if (accept(TokenType.MINUS)) {
                result = new UnaryOp(UnaryOperator.MINUS, parseFactor());
            } else {
                result = parsePower();
            }
            depth--;
            return result;
        }

        private ParamExpr parsePower() {
            ParamExpr base = parsePrimary();
            if (accept(TokenType.POWER)) {
                return new BinaryOp(BinaryOperator.POW, base, parseFactor());
            }
            return base;
        }

        private ParamExpr parsePrimary() {
            Token token = next();
            switch (token.type()) {
                case NUMBER:
                    return number(token);
                case PARAM:
                    return new Symbol(token.text());
                case IDENT:
                    return identifier(token);
                case LPAREN: {
                    ParamExpr inner = parseExpr();
                    if (!accept(TokenType.RPAREN)) {
                        throw error("expected ')' but found " + peek().describe());
                    }
                    return inner;
                }
                default:
                    throw error("unexpected " + token.describe());
            }
        }

        private ParamExpr number(Token token) {
            double value = Double.parseDouble(token.text());
            if (!Double.isFinite(value)) {
                throw error("numeric literal " + token.text() + " is out of range");
            }
            return new Constant(value);
        }

        private ParamExpr identifier(Token token) {
            String name = token.text();
            if (peek().type() == TokenType.LPAREN) {
                throw new ExpressionEvalException(
                        String.format(
                                "Unsupported expression element in '%s': function calls are not allowed ('%s')",
                                source, name),
                        null);
            }
            if ("pi".equals(name)) {
                return new Constant(Math.PI);
            }
            if ("e".equals(name)) {
                return new Constant(Math.E);
            }
            if (BOOLEAN_WORDS.contains(name)) {
                throw unsupported(source, "boolean literals are not allowed ('" + name + "')");
            }
            throw unsupported(
                    source,
                    "unknown name '" + name + "' (parameters are referenced as $" + name + ")");
        }
    }
}
