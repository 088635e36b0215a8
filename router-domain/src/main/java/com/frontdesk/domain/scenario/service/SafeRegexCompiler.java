package com.frontdesk.domain.scenario.service;

import com.frontdesk.domain.scenario.model.valobj.RegexTrigger;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 正则触发词的安全编译与限时匹配。
 * <p>
 * 编译期拒绝：超长表达式、嵌套的无界量词（如 {@code (a+)+}）、被量词修饰的反向引用；
 * 匹配期通过 {@link DeadlineCharSequence} 限制单次匹配耗时，超时按未命中处理。
 * 正则触发词不进入候选检索；{@link #matches} 是运行时评估正则触发词的唯一入口，
 * 候选检索诊断用它标出命中的正则。
 * </p>
 */
@Slf4j
public class SafeRegexCompiler {

    public static final int DEFAULT_MAX_LENGTH = 512;
    public static final long DEFAULT_MATCH_BUDGET_MS = 50L;

    private final int maxLength;
    private final long matchBudgetMs;

    public SafeRegexCompiler() {
        this(DEFAULT_MAX_LENGTH, DEFAULT_MATCH_BUDGET_MS);
    }

    public SafeRegexCompiler(int maxLength, long matchBudgetMs) {
        this.maxLength = maxLength > 0 ? maxLength : DEFAULT_MAX_LENGTH;
        this.matchBudgetMs = matchBudgetMs > 0 ? matchBudgetMs : DEFAULT_MATCH_BUDGET_MS;
    }

    /**
     * 编译正则触发词（大小写不敏感）。不安全或非法的表达式返回 empty，并记录 WARN。
     */
    public Optional<RegexTrigger> compile(String source, String scenarioId) {
        if (source == null || source.trim().isEmpty()) {
            return Optional.empty();
        }
        if (source.length() > maxLength) {
            log.warn("SCENARIO_REGEX_REJECTED scenarioId={}, reason=too_long, length={}, maxLength={}",
                    scenarioId, source.length(), maxLength);
            return Optional.empty();
        }
        String unsafeReason = findUnsafeConstruct(source);
        if (unsafeReason != null) {
            log.warn("SCENARIO_REGEX_REJECTED scenarioId={}, reason={}, pattern={}",
                    scenarioId, unsafeReason, source);
            return Optional.empty();
        }
        try {
            Pattern pattern = Pattern.compile(source, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return Optional.of(new RegexTrigger(source, pattern));
        } catch (PatternSyntaxException ex) {
            log.warn("SCENARIO_REGEX_REJECTED scenarioId={}, reason=syntax, pattern={}, error={}",
                    scenarioId, source, ex.getDescription());
            return Optional.empty();
        }
    }

    /**
     * 在时间预算内执行 find；超时返回 false。
     */
    public boolean matches(RegexTrigger trigger, String input) {
        if (trigger == null || input == null) {
            return false;
        }
        DeadlineCharSequence bounded = new DeadlineCharSequence(input, System.nanoTime() + matchBudgetMs * 1_000_000L);
        try {
            return trigger.getPattern().matcher(bounded).find();
        } catch (MatchTimeoutException ex) {
            log.warn("SCENARIO_REGEX_TIMEOUT pattern={}, inputLength={}, budgetMs={}",
                    trigger.getSource(), input.length(), matchBudgetMs);
            return false;
        }
    }

    public int getMaxLength() {
        return maxLength;
    }

    public long getMatchBudgetMs() {
        return matchBudgetMs;
    }

    /**
     * 单遍扫描表达式结构，返回第一个危险构造的原因；安全时返回 null。
     */
    static String findUnsafeConstruct(String source) {
        // 每层分组记录“组内是否出现过无界量词”
        Deque<boolean[]> groups = new ArrayDeque<>();
        boolean lastGroupUnbounded = false;
        boolean lastWasGroupClose = false;
        boolean lastWasBackReference = false;
        boolean inClass = false;
        int length = source.length();
        for (int i = 0; i < length; i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                boolean backReference = i + 1 < length
                        && !inClass
                        && (Character.isDigit(source.charAt(i + 1)) && source.charAt(i + 1) != '0'
                        || source.charAt(i + 1) == 'k');
                i++;
                lastWasGroupClose = false;
                lastWasBackReference = backReference;
                if (backReference && source.charAt(i) == 'k') {
                    int close = source.indexOf('>', i);
                    if (close > i) {
                        i = close;
                    }
                }
                continue;
            }
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                continue;
            }
            if (c == '[') {
                inClass = true;
                // "[]..." 与 "[^]..." 中的首个 ] 是字面量
                if (i + 1 < length && source.charAt(i + 1) == '^') {
                    i++;
                }
                if (i + 1 < length && source.charAt(i + 1) == ']') {
                    i++;
                }
                lastWasGroupClose = false;
                lastWasBackReference = false;
                continue;
            }
            if (c == '(') {
                groups.push(new boolean[]{false});
                lastWasGroupClose = false;
                lastWasBackReference = false;
                continue;
            }
            if (c == ')') {
                boolean[] closed = groups.isEmpty() ? new boolean[]{false} : groups.pop();
                lastGroupUnbounded = closed[0];
                if (closed[0] && !groups.isEmpty()) {
                    groups.peek()[0] = true;
                }
                lastWasGroupClose = true;
                lastWasBackReference = false;
                continue;
            }
            int quantifierEnd = quantifierEnd(source, i);
            if (quantifierEnd >= 0) {
                boolean unbounded = isUnbounded(source, i, quantifierEnd);
                if (lastWasGroupClose && lastGroupUnbounded) {
                    return "nested_quantifier";
                }
                if (lastWasBackReference) {
                    return "quantified_backreference";
                }
                if (unbounded && !groups.isEmpty()) {
                    groups.peek()[0] = true;
                }
                // 被无界量词修饰的分组，对外层而言同样是无界的
                if (lastWasGroupClose && unbounded && !groups.isEmpty()) {
                    groups.peek()[0] = true;
                }
                i = quantifierEnd;
                if (i + 1 < length && (source.charAt(i + 1) == '?' || source.charAt(i + 1) == '+')) {
                    i++;
                }
                lastWasGroupClose = false;
                lastWasBackReference = false;
                continue;
            }
            lastWasGroupClose = false;
            lastWasBackReference = false;
        }
        return null;
    }

    /**
     * 若 index 处是量词，返回量词最后一个字符的下标，否则返回 -1。
     */
    private static int quantifierEnd(String source, int index) {
        char c = source.charAt(index);
        if (c == '*' || c == '+' || c == '?') {
            return index;
        }
        if (c != '{') {
            return -1;
        }
        int close = source.indexOf('}', index);
        if (close < 0) {
            return -1;
        }
        String body = source.substring(index + 1, close);
        return body.matches("\\d+(,\\d*)?") ? close : -1;
    }

    private static boolean isUnbounded(String source, int start, int end) {
        char c = source.charAt(start);
        if (c == '*' || c == '+') {
            return true;
        }
        if (c == '?') {
            return false;
        }
        String body = source.substring(start + 1, end);
        return body.endsWith(",");
    }

    /**
     * 超过截止时间后在 charAt 中抛出异常，用来中断回溯。
     */
    static final class DeadlineCharSequence implements CharSequence {

        private final CharSequence delegate;
        private final long deadlineNanos;
        private int reads;

        DeadlineCharSequence(CharSequence delegate, long deadlineNanos) {
            this.delegate = delegate;
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public char charAt(int index) {
            // nanoTime 每 1024 次读取检查一次
            if ((++reads & 0x3FF) == 0 && System.nanoTime() > deadlineNanos) {
                throw new MatchTimeoutException();
            }
            return delegate.charAt(index);
        }

        @Override
        public int length() {
            return delegate.length();
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos);
        }

        @Override
        public String toString() {
            return delegate.toString();
        }
    }

    static final class MatchTimeoutException extends RuntimeException {

        private static final long serialVersionUID = 4180392717391204411L;

        MatchTimeoutException() {
            super("regex match budget exceeded", null, false, false);
        }
    }
}
