package com.exprgraph.expr;

/**
 * Evaluates fully substituted arithmetic text.
 *
 * <p>
 * Recursive descent over a deliberately small grammar:
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := unary (('*' | '/') unary)*
 * unary  := ('+' | '-') unary | atom
 * atom   := number | '(' expr ')'
 * number := digits ['.' digits] [('e' | 'E') ['+' | '-'] digits]
 * </pre>
 *
 * Binary operators are left-associative. Anything outside the grammar,
 * division by zero, literals or results that are not finite, and nesting of
 * parentheses or signs deeper than {@value #MAX_NESTING} all raise
 * {@link MalformedExpressionException}; NaN is never returned.
 */
public final class ArithmeticEvaluator {
    public static final int MAX_NESTING = 256;

    private ArithmeticEvaluator() {
        // Utility class
    }

    public static double evaluate(String text) {
        if (text == null || text.isBlank())
            throw new MalformedExpressionException("Empty expression");
        Parser p = new Parser(text);
        double v = p.parseExpr();
        p.skipWS();
        if (p.pos < text.length())
            throw p.err("Unexpected: " + text.charAt(p.pos));
        if (!Double.isFinite(v))
            throw new MalformedExpressionException("Non-finite result: " + v);
        return v;
    }

    private static final class Parser {
        private final String input;
        private int pos;
        private int depth;

        Parser(String input) {
            this.input = input;
        }

        double parseExpr() {
            double left = parseTerm();
            while (true) {
                skipWS();
                if (peek('+')) {
                    pos++;
                    left = left + parseTerm();
                } else if (peek('-')) {
                    pos++;
                    left = left - parseTerm();
                } else {
                    return left;
                }
            }
        }

        private double parseTerm() {
            double left = parseUnary();
            while (true) {
                skipWS();
                if (peek('*')) {
                    pos++;
                    left = left * parseUnary();
                } else if (peek('/')) {
                    int at = pos++;
                    double right = parseUnary();
                    if (right == 0)
                        throw new MalformedExpressionException("Division by zero", at);
                    left = left / right;
                } else {
                    return left;
                }
            }
        }

        private double parseUnary() {
            skipWS();
            if (peek('-')) {
                enter();
                pos++;
                double v = -parseUnary();
                depth--;
                return v;
            }
            if (peek('+')) {
                enter();
                pos++;
                double v = parseUnary();
                depth--;
                return v;
            }
            return parseAtom();
        }

        private double parseAtom() {
            skipWS();
            if (pos >= input.length())
                throw err("Unexpected end");
            char c = input.charAt(pos);
            if (c == '(') {
                enter();
                pos++;
                double v = parseExpr();
                expect(')');
                depth--;
                return v;
            }
            if (c == '.' || (c >= '0' && c <= '9'))
                return parseNumber();
            throw err("Unexpected: " + c);
        }

        private double parseNumber() {
            int s = pos;
            int digits = skipDigits();
            if (pos < input.length() && input.charAt(pos) == '.') {
                pos++;
                digits += skipDigits();
            }
            if (digits == 0)
                throw err("Expected digits");
            if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
                pos++;
                if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-'))
                    pos++;
                if (skipDigits() == 0)
                    throw err("Expected exponent");
            }
            double v = Double.parseDouble(input.substring(s, pos));
            if (!Double.isFinite(v))
                throw new MalformedExpressionException("Number out of range: " + input.substring(s, pos), s);
            return v;
        }

        private void enter() {
            if (++depth > MAX_NESTING)
                throw err("Nested deeper than " + MAX_NESTING);
        }

        private int skipDigits() {
            int n = 0;
            while (pos < input.length() && input.charAt(pos) >= '0' && input.charAt(pos) <= '9') {
                pos++;
                n++;
            }
            return n;
        }

        private boolean peek(char c) {
            return pos < input.length() && input.charAt(pos) == c;
        }

        private void expect(char c) {
            skipWS();
            if (!peek(c))
                throw err("Expected '" + c + "'");
            pos++;
        }

        void skipWS() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
                pos++;
        }

        MalformedExpressionException err(String msg) {
            return new MalformedExpressionException(msg, pos);
        }
    }
}
