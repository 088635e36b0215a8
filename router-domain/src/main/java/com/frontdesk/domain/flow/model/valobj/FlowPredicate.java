package com.frontdesk.domain.flow.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Set;

/**
 * 边条件的结构化表示：always、变量、比较、非、与、或，以及无法解析时的 invalid。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FlowPredicate.Always.class, name = "always"),
        @JsonSubTypes.Type(value = FlowPredicate.Var.class, name = "var"),
        @JsonSubTypes.Type(value = FlowPredicate.Comparison.class, name = "comparison"),
        @JsonSubTypes.Type(value = FlowPredicate.Not.class, name = "not"),
        @JsonSubTypes.Type(value = FlowPredicate.And.class, name = "and"),
        @JsonSubTypes.Type(value = FlowPredicate.Or.class, name = "or"),
        @JsonSubTypes.Type(value = FlowPredicate.Invalid.class, name = "invalid")
})
public interface FlowPredicate {

    /**
     * 把引用到的变量名收集到 target。
     */
    void collectVariables(Set<String> target);

    @JsonIgnore
    default boolean isValid() {
        return true;
    }

    record Always() implements FlowPredicate {

        public String getText() {
            return "always";
        }

        @Override
        public void collectVariables(Set<String> target) {
        }
    }

    record Var(String name) implements FlowPredicate {

        @Override
        public void collectVariables(Set<String> target) {
            target.add(name);
        }
    }

    /**
     * 变量与字面量的比较，literal 为 Boolean、Number、String 或 null。
     */
    record Comparison(String variable, String operator, Object literal) implements FlowPredicate {

        @Override
        public void collectVariables(Set<String> target) {
            target.add(variable);
        }
    }

    record Not(FlowPredicate operand) implements FlowPredicate {

        @Override
        public void collectVariables(Set<String> target) {
            operand.collectVariables(target);
        }

        @Override
        public boolean isValid() {
            return operand.isValid();
        }
    }

    record And(List<FlowPredicate> operands) implements FlowPredicate {

        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public void collectVariables(Set<String> target) {
            operands.forEach(operand -> operand.collectVariables(target));
        }

        @Override
        public boolean isValid() {
            return operands.stream().allMatch(FlowPredicate::isValid);
        }
    }

    record Or(List<FlowPredicate> operands) implements FlowPredicate {

        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public void collectVariables(Set<String> target) {
            operands.forEach(operand -> operand.collectVariables(target));
        }

        @Override
        public boolean isValid() {
            return operands.stream().allMatch(FlowPredicate::isValid);
        }
    }

    record Invalid(String text, String error) implements FlowPredicate {

        @Override
        public void collectVariables(Set<String> target) {
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}
