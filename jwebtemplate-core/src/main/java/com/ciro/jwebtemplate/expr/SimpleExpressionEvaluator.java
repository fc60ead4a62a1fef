package com.ciro.jwebtemplate.expr;

import com.ciro.jwebtemplate.exception.EvaluationException;
import com.ciro.jwebtemplate.spi.ExpressionEvaluator;
import com.ciro.jwebtemplate.template.TemplateContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Default expression language for templates: a small JavaScript-flavoured subset.
 *
 * <pre>
 * program    := statement (';' statement)*
 * statement  := ['var'] assignment
 * assignment := ternary ['=' assignment]
 * ternary    := or ['?' assignment ':' assignment]
 * or         := and ('||' and)*
 * and        := equality ('&amp;&amp;' equality)*
 * equality   := relational (('==' | '!=') relational)*
 * relational := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)*
 * additive   := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('!' | '-') unary | postfix
 * postfix    := primary ('.' name | '[' assignment ']' | '(' args ')')*
 * primary    := number | string | true | false | null | name | '(' assignment ')'
 *             | '[' items ']' | '{' key ':' assignment, ... '}'
 * </pre>
 *
 * Source is parsed into a tree of closures first, so {@code &&}, {@code ||} and {@code ?:}
 * only evaluate the branch they need.
 */
public class SimpleExpressionEvaluator implements ExpressionEvaluator {

    @Override
    public Object evaluate(String source, TemplateContext context) {
        Objects.requireNonNull(context, "context");
        if (source == null || source.isBlank()) return null;
        Expr program = new Parser(source).parseProgram();
        return program.eval(context);
    }

    // ========================================================================
    // Tree
    // ========================================================================

    private interface Expr {
        Object eval(TemplateContext ctx);
    }

    private interface Assignable extends Expr {
        void assign(TemplateContext ctx, Object value);
    }

    private record Name(String name) implements Assignable {
        @Override
        public Object eval(TemplateContext ctx) {
            return ctx.get(name);
        }

        @Override
        public void assign(TemplateContext ctx, Object value) {
            ctx.set(name, value);
        }
    }

    private record Member(Expr target, String name) implements Assignable {
        @Override
        public Object eval(TemplateContext ctx) {
            return PropertyAccess.get(target.eval(ctx), name);
        }

        @Override
        public void assign(TemplateContext ctx, Object value) {
            PropertyAccess.set(target.eval(ctx), name, value);
        }
    }

    private record Index(Expr target, Expr key) implements Assignable {
        @Override
        public Object eval(TemplateContext ctx) {
            return PropertyAccess.index(target.eval(ctx), key.eval(ctx));
        }

        @Override
        public void assign(TemplateContext ctx, Object value) {
            PropertyAccess.set(target.eval(ctx), key.eval(ctx), value);
        }
    }

    private record Call(Expr callee, List<Expr> args) implements Expr {
        @Override
        public Object eval(TemplateContext ctx) {
            List<Object> values = new ArrayList<>(args.size());
            if (callee instanceof Member m) {
                Object target = m.target().eval(ctx);
                for (Expr a : args) values.add(a.eval(ctx));
                return PropertyAccess.call(target, m.name(), values);
            }
            Object fn = callee.eval(ctx);
            for (Expr a : args) values.add(a.eval(ctx));
            if (fn instanceof TemplateFunction f) {
                return f.call(values);
            }
            String label = callee instanceof Name n ? n.name() : "expression";
            throw new EvaluationException("'" + label + "' is not a function");
        }
    }

    // ========================================================================
    // Parser
    // ========================================================================

    private static final class Parser {
        private final String src;
        private final List<Token> tokens;
        private int pos;

        Parser(String src) {
            this.src = src;
            this.tokens = Lexer.lex(src);
        }

        Expr parseProgram() {
            List<Expr> statements = new ArrayList<>();
            while (!atEnd()) {
                if (match(";")) continue;
                statements.add(parseStatement());
                if (!atEnd() && !match(";")) {
                    throw error("Unexpected '" + peek().text() + "'");
                }
            }
            if (statements.size() == 1) return statements.get(0);
            return ctx -> {
                Object last = null;
                for (Expr s : statements) last = s.eval(ctx);
                return last;
            };
        }

        private Expr parseStatement() {
            if (peek().is(TokenType.NAME, "var") || peek().is(TokenType.NAME, "let")) {
                pos++;
                Token name = expect(TokenType.NAME);
                if (!match("=")) {
                    return ctx -> {
                        ctx.set(name.text(), null);
                        return null;
                    };
                }
                Expr value = parseAssignment();
                return ctx -> {
                    Object v = value.eval(ctx);
                    ctx.set(name.text(), v);
                    return v;
                };
            }
            return parseAssignment();
        }

        private Expr parseAssignment() {
            Expr left = parseTernary();
            if (match("=")) {
                if (!(left instanceof Assignable target)) {
                    throw error("Invalid assignment target");
                }
                Expr value = parseAssignment();
                return ctx -> {
                    Object v = value.eval(ctx);
                    target.assign(ctx, v);
                    return v;
                };
            }
            return left;
        }

        private Expr parseTernary() {
            Expr cond = parseOr();
            if (match("?")) {
                Expr then = parseAssignment();
                expect(":");
                Expr otherwise = parseAssignment();
                return ctx -> TemplateValues.isTruthy(cond.eval(ctx)) ? then.eval(ctx) : otherwise.eval(ctx);
            }
            return cond;
        }

        private Expr parseOr() {
            Expr left = parseAnd();
            while (match("||")) {
                Expr l = left;
                Expr r = parseAnd();
                left = ctx -> {
                    Object v = l.eval(ctx);
                    return TemplateValues.isTruthy(v) ? v : r.eval(ctx);
                };
            }
            return left;
        }

        private Expr parseAnd() {
            Expr left = parseEquality();
            while (match("&&")) {
                Expr l = left;
                Expr r = parseEquality();
                left = ctx -> {
                    Object v = l.eval(ctx);
                    return TemplateValues.isTruthy(v) ? r.eval(ctx) : v;
                };
            }
            return left;
        }

        private Expr parseEquality() {
            Expr left = parseRelational();
            while (true) {
                if (match("==") || match("===")) {
                    Expr l = left, r = parseRelational();
                    left = ctx -> Operators.looseEquals(l.eval(ctx), r.eval(ctx));
                } else if (match("!=") || match("!==")) {
                    Expr l = left, r = parseRelational();
                    left = ctx -> !Operators.looseEquals(l.eval(ctx), r.eval(ctx));
                } else {
                    return left;
                }
            }
        }

        private Expr parseRelational() {
            Expr left = parseAdditive();
            while (true) {
                String op = peek().type() == TokenType.PUNCT ? peek().text() : "";
                if (!op.equals("<") && !op.equals("<=") && !op.equals(">") && !op.equals(">=")) {
                    return left;
                }
                pos++;
                Expr l = left, r = parseAdditive();
                left = ctx -> Operators.compare(op, l.eval(ctx), r.eval(ctx));
            }
        }

        private Expr parseAdditive() {
            Expr left = parseTerm();
            while (true) {
                if (match("+")) {
                    Expr l = left, r = parseTerm();
                    left = ctx -> Operators.plus(l.eval(ctx), r.eval(ctx));
                } else if (match("-")) {
                    Expr l = left, r = parseTerm();
                    left = ctx -> Operators.arithmetic('-', l.eval(ctx), r.eval(ctx));
                } else {
                    return left;
                }
            }
        }

        private Expr parseTerm() {
            Expr left = parseUnary();
            while (true) {
                char op;
                if (match("*")) op = '*';
                else if (match("/")) op = '/';
                else if (match("%")) op = '%';
                else return left;
                Expr l = left, r = parseUnary();
                left = ctx -> Operators.arithmetic(op, l.eval(ctx), r.eval(ctx));
            }
        }

        private Expr parseUnary() {
            if (match("!")) {
                Expr operand = parseUnary();
                return ctx -> !TemplateValues.isTruthy(operand.eval(ctx));
            }
            if (match("-")) {
                Expr operand = parseUnary();
                return ctx -> Operators.negate(operand.eval(ctx));
            }
            return parsePostfix();
        }

        private Expr parsePostfix() {
            Expr e = parsePrimary();
            while (true) {
                if (match(".")) {
                    e = new Member(e, expect(TokenType.NAME).text());
                } else if (match("[")) {
                    Expr key = parseAssignment();
                    expect("]");
                    e = new Index(e, key);
                } else if (match("(")) {
                    List<Expr> args = new ArrayList<>();
                    if (!match(")")) {
                        do {
                            args.add(parseAssignment());
                        } while (match(","));
                        expect(")");
                    }
                    e = new Call(e, args);
                } else {
                    return e;
                }
            }
        }

        private Expr parsePrimary() {
            Token t = peek();
            switch (t.type()) {
                case NUMBER -> {
                    pos++;
                    Object n = parseNumber(t.text());
                    return ctx -> n;
                }
                case STRING -> {
                    pos++;
                    String s = t.text();
                    return ctx -> s;
                }
                case NAME -> {
                    pos++;
                    switch (t.text()) {
                        case "true":
                            return ctx -> Boolean.TRUE;
                        case "false":
                            return ctx -> Boolean.FALSE;
                        case "null":
                        case "undefined":
                            return ctx -> null;
                        default:
                            return new Name(t.text());
                    }
                }
                case PUNCT -> {
                    if (match("(")) {
                        Expr inner = parseAssignment();
                        expect(")");
                        return inner;
                    }
                    if (match("[")) {
                        return parseArrayLiteral();
                    }
                    if (match("{")) {
                        return parseObjectLiteral();
                    }
                    throw error("Unexpected '" + t.text() + "'");
                }
                default -> throw error("Unexpected end of expression");
            }
        }

        private Expr parseArrayLiteral() {
            List<Expr> items = new ArrayList<>();
            if (!match("]")) {
                do {
                    items.add(parseAssignment());
                } while (match(","));
                expect("]");
            }
            return ctx -> {
                List<Object> out = new ArrayList<>(items.size());
                for (Expr i : items) out.add(i.eval(ctx));
                return out;
            };
        }

        private Expr parseObjectLiteral() {
            Map<String, Expr> fields = new LinkedHashMap<>();
            if (!match("}")) {
                do {
                    Token key = peek();
                    if (key.type() != TokenType.NAME && key.type() != TokenType.STRING && key.type() != TokenType.NUMBER) {
                        throw error("Expected object key");
                    }
                    pos++;
                    expect(":");
                    fields.put(key.text(), parseAssignment());
                } while (match(","));
                expect("}");
            }
            return ctx -> {
                Map<String, Object> out = new LinkedHashMap<>();
                fields.forEach((k, v) -> out.put(k, v.eval(ctx)));
                return out;
            };
        }

        private Object parseNumber(String text) {
            try {
                if (text.contains(".") || text.contains("e") || text.contains("E")) {
                    return Double.parseDouble(text);
                }
                long l = Long.parseLong(text);
                return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (Object) (int) l : (Object) l;
            } catch (NumberFormatException e) {
                throw error("Invalid number literal '" + text + "'");
            }
        }

        // --- token helpers ---

        private boolean atEnd() {
            return peek().type() == TokenType.EOF;
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private boolean match(String punct) {
            if (peek().is(TokenType.PUNCT, punct)) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(String punct) {
            if (!match(punct)) {
                throw error("Expected '" + punct + "' but found '" + peek().text() + "'");
            }
        }

        private Token expect(TokenType type) {
            Token t = peek();
            if (t.type() != type) {
                throw error("Expected " + type.name().toLowerCase(Locale.ROOT) + " but found '" + t.text() + "'");
            }
            pos++;
            return t;
        }

        private EvaluationException error(String message) {
            return new EvaluationException(message + " in expression: " + src.trim());
        }
    }

    // ========================================================================
    // Lexer
    // ========================================================================

    private enum TokenType { NUMBER, STRING, NAME, PUNCT, EOF }

    private record Token(TokenType type, String text) {
        boolean is(TokenType t, String s) {
            return type == t && text.equals(s);
        }
    }

    private static final class Lexer {
        private static final String[] PUNCTUATION = {
            "===", "!==", "==", "!=", "<=", ">=", "&&", "||",
            "<", ">", "=", "!", "+", "-", "*", "/", "%", "?", ":", ".", ",", ";", "(", ")", "[", "]", "{", "}"
        };

        static List<Token> lex(String input) {
            List<Token> tokens = new ArrayList<>();
            int i = 0;
            int len = input.length();
            outer:
            while (i < len) {
                char c = input.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                    continue;
                }
                if (Character.isDigit(c) || (c == '.' && i + 1 < len && Character.isDigit(input.charAt(i + 1)))) {
                    int start = i;
                    while (i < len && (Character.isDigit(input.charAt(i)) || input.charAt(i) == '.')) i++;
                    if (i < len && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
                        i++;
                        if (i < len && (input.charAt(i) == '+' || input.charAt(i) == '-')) i++;
                        while (i < len && Character.isDigit(input.charAt(i))) i++;
                    }
                    tokens.add(new Token(TokenType.NUMBER, input.substring(start, i)));
                    continue;
                }
                if (Character.isJavaIdentifierStart(c)) {
                    int start = i;
                    while (i < len && Character.isJavaIdentifierPart(input.charAt(i))) i++;
                    tokens.add(new Token(TokenType.NAME, input.substring(start, i)));
                    continue;
                }
                if (c == '"' || c == '\'') {
                    i = readString(input, i, tokens);
                    continue;
                }
                for (String p : PUNCTUATION) {
                    if (input.startsWith(p, i)) {
                        tokens.add(new Token(TokenType.PUNCT, p));
                        i += p.length();
                        continue outer;
                    }
                }
                throw new EvaluationException("Unexpected character '" + c + "' in expression: " + input.trim());
            }
            tokens.add(new Token(TokenType.EOF, "<end>"));
            return tokens;
        }

        private static int readString(String input, int start, List<Token> tokens) {
            char quote = input.charAt(start);
            StringBuilder sb = new StringBuilder();
            int i = start + 1;
            while (i < input.length()) {
                char c = input.charAt(i);
                if (c == quote) {
                    tokens.add(new Token(TokenType.STRING, sb.toString()));
                    return i + 1;
                }
                if (c == '\\' && i + 1 < input.length()) {
                    char next = input.charAt(++i);
                    switch (next) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case 'r' -> sb.append('\r');
                        case 'u' -> {
                            if (i + 4 >= input.length()) {
                                throw new EvaluationException("Bad unicode escape in expression: " + input.trim());
                            }
                            try {
                                sb.append((char) Integer.parseInt(input.substring(i + 1, i + 5), 16));
                            } catch (NumberFormatException e) {
                                throw new EvaluationException("Bad unicode escape in expression: " + input.trim(), e);
                            }
                            i += 4;
                        }
                        default -> sb.append(next);
                    }
                } else {
                    sb.append(c);
                }
                i++;
            }
            throw new EvaluationException("Unterminated string in expression: " + input.trim());
        }
    }
}
