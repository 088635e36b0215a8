package com.frontdesk.domain.scenario.model.valobj;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 原始场景记录（外部持久化层写入，编译器只读）。
 * <p>
 * 所有字段一律声明为 {@code Object}：管理端录入的数据可能把数字写成字符串、把列表写成单个值，
 * 绑定阶段原样接收，类型判断与默认值统一由 {@code ScenarioCompileDomainService} 处理，
 * 单个字段类型错误不会导致整条场景丢失。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawScenario {

    // 身份
    private Object scenarioId;
    private Object name;
    private Object status;
    private Object isActive;

    // 分类
    private Object scenarioType;
    private Object priority;
    private Object minConfidence;
    private Object cooldownSeconds;

    // 触发素材
    private Object triggers;
    private Object regexTriggers;
    private Object negativeTriggers;
    private Object exampleUserPhrases;
    private Object negativeUserPhrases;

    // 回复素材：元素为字符串或带 text 字段的对象
    private Object quickReplies;
    private Object fullReplies;
    @JsonAlias("quickReplies_noName")
    private Object quickRepliesNoName;
    @JsonAlias("fullReplies_noName")
    private Object fullRepliesNoName;
    private Object replyStrategy;

    // 跟进
    private Object followUpMode;
    private Object followUpQuestionText;
    private Object followUpFunnel;
    private Object transferTarget;

    // 接线提示
    private Object actionType;
    private Object flowId;
    private Object bookingIntent;
    private Object requiredSlots;
    private Object stopRouting;

    // 行为提示
    private Object behavior;
    private Object channel;
    private Object handoffPolicy;

    // Tier 2 配置
    private Object preconditions;
    private Object entityCapture;
    private Object entityValidation;
    private Object dynamicVariables;
    private Object actionHooks;
    private Object effects;
    private Object ttsOverride;
    private Object timedFollowUp;
    private Object silencePolicy;
}
