package com.frontdesk.domain.scenario.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 预编译的正则触发词。
 * <p>
 * 相等性只看源串与 flags，{@link Pattern} 本身没有值语义。
 * </p>
 */
public final class RegexTrigger {

    private final String source;
    private final Pattern pattern;

    public RegexTrigger(String source, Pattern pattern) {
        this.source = Objects.requireNonNull(source, "source");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public String getSource() {
        return source;
    }

    public int getFlags() {
        return pattern.flags();
    }

    @JsonIgnore
    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegexTrigger that)) {
            return false;
        }
        return source.equals(that.source) && pattern.flags() == that.pattern.flags();
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, pattern.flags());
    }

    @Override
    public String toString() {
        return "RegexTrigger{" + source + "}";
    }
}
