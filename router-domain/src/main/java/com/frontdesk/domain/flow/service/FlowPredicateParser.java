package com.frontdesk.domain.flow.service;

import com.frontdesk.domain.flow.model.valobj.FlowPredicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 边条件解析器。
 * <p>
 * 语法（优先级从低到高）：{@code ||}、{@code &&}、{@code !}、括号/比较/变量。
 * 比较形如 {@code name op literal}，op 为 {@code === !== == != >= <= > <}，
 * literal 为 true/false/null、数字或带引号的字符串。单独的 {@code always} 表示无条件。
 * 解析失败不抛异常，返回 {@link FlowPredicate.Invalid}。
 * </p>
 */
public final class FlowPredicateParser {

    private static final String ALWAYS = "always";
    private static final Set<String> OPERATORS = Set.of("===", "!==", "==", "!=", ">=", "<=", ">", "<");

    private final List<String> tokens;
    private int position;

    private FlowPredicateParser(List<String> tokens) {
        this.tokens = tokens;
    }

    public static FlowPredicate parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return new FlowPredicate.Invalid(text, "条件不能为空");
        }
        String trimmed = text.trim();
        if (ALWAYS.equals(trimmed)) {
            return new FlowPredicate.Always();
        }
        try {
            FlowPredicateParser parser = new FlowPredicateParser(tokenize(trimmed));
            FlowPredicate predicate = parser.parseOr();
            if (parser.position < parser.tokens.size()) {
                throw new IllegalArgumentException("多余的符号: " + parser.tokens.get(parser.position));
            }
            return predicate;
        } catch (IllegalArgumentException ex) {
            return new FlowPredicate.Invalid(trimmed, ex.getMessage());
        }
    }

    private FlowPredicate parseOr() {
        List<FlowPredicate> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (accept("||")) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new FlowPredicate.Or(operands);
    }

    private FlowPredicate parseAnd() {
        List<FlowPredicate> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (accept("&&")) {
            operands.add(parseUnary());
        }
        return operands.size() == 1 ? operands.get(0) : new FlowPredicate.And(operands);
    }

    private FlowPredicate parseUnary() {
        if (accept("!")) {
            return new FlowPredicate.Not(parseUnary());
        }
        if (accept("(")) {
            FlowPredicate inner = parseOr();
            expect(")");
            return inner;
        }
        String name = next();
        if (!isIdentifier(name)) {
            throw new IllegalArgumentException("期望变量名，实际为: " + name);
        }
        if (position < tokens.size() && OPERATORS.contains(tokens.get(position))) {
            String operator = tokens.get(position++);
            return new FlowPredicate.Comparison(name, operator, parseLiteral(next()));
        }
        return new FlowPredicate.Var(name);
    }

    private static Object parseLiteral(String token) {
        if ("true".equals(token)) {
            return Boolean.TRUE;
        }
        if ("false".equals(token)) {
            return Boolean.FALSE;
        }
        if ("null".equals(token)) {
            return null;
        }
        if (token.length() >= 2 && (token.startsWith("'") && token.endsWith("'")
                || token.startsWith("\"") && token.endsWith("\""))) {
            return token.substring(1, token.length() - 1);
        }
        try {
            if (token.contains(".")) {
                return Double.valueOf(token);
            }
            return Long.valueOf(token);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("非法字面量: " + token);
        }
    }

    private boolean accept(String expected) {
        if (position < tokens.size() && tokens.get(position).equals(expected)) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(String expected) {
        if (!accept(expected)) {
            throw new IllegalArgumentException("缺少 " + expected);
        }
    }

    private String next() {
        if (position >= tokens.size()) {
            throw new IllegalArgumentException("条件意外结束");
        }
        return tokens.get(position++);
    }

    private static boolean isIdentifier(String token) {
        if (token.isEmpty() || !Character.isJavaIdentifierStart(token.charAt(0))) {
            return false;
        }
        for (int i = 1; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!Character.isJavaIdentifierPart(c) && c != '.') {
                return false;
            }
        }
        return !"true".equals(token) && !"false".equals(token) && !"null".equals(token);
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '(' || c == ')') {
                tokens.add(String.valueOf(c));
                i++;
                continue;
            }
            if (c == '&' || c == '|') {
                if (i + 1 >= length || text.charAt(i + 1) != c) {
                    throw new IllegalArgumentException("非法运算符: " + c);
                }
                tokens.add(text.substring(i, i + 2));
                i += 2;
                continue;
            }
            if (c == '=' || c == '!' || c == '<' || c == '>') {
                int end = i + 1;
                while (end < length && text.charAt(end) == '=' && end - i < 3) {
                    end++;
                }
                String operator = text.substring(i, end);
                if (!"!".equals(operator) && !OPERATORS.contains(operator)) {
                    throw new IllegalArgumentException("非法运算符: " + operator);
                }
                tokens.add(operator);
                i = end;
                continue;
            }
            if (c == '\'' || c == '"') {
                int close = text.indexOf(c, i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("字符串未闭合");
                }
                tokens.add(text.substring(i, close + 1));
                i = close + 1;
                continue;
            }
            int end = i;
            while (end < length && isWordChar(text.charAt(end))) {
                end++;
            }
            if (end == i) {
                throw new IllegalArgumentException("非法字符: " + c);
            }
            tokens.add(text.substring(i, end));
            i = end;
        }
        return tokens;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.' || c == '-';
    }
}
