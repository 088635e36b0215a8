package com.frontdesk.domain.scenario.service;

import com.frontdesk.domain.scenario.model.valobj.CompileMeta;
import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.FollowUpSpec;
import com.frontdesk.domain.scenario.model.valobj.NeedsFlags;
import com.frontdesk.domain.scenario.model.valobj.RawPayload;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.domain.scenario.model.valobj.RegexTrigger;
import com.frontdesk.domain.scenario.model.valobj.ReplySet;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.TriggerSet;
import com.frontdesk.domain.scenario.model.valobj.WiringSpec;
import com.frontdesk.types.common.Constants;
import com.frontdesk.types.enums.ActionTypeEnum;
import com.frontdesk.types.enums.FollowUpModeEnum;
import com.frontdesk.types.enums.ReplyStrategyEnum;
import com.frontdesk.types.enums.ScenarioTypeEnum;
import com.google.common.hash.Hashing;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 场景编译领域服务：把管理端录入的原始场景规范化为不可变的 {@link RuntimeSpec}。
 * <p>
 * 编译是全函数：任何字段缺失或类型错误都逐字段回落到默认值，不抛异常，也不丢弃场景。
 * 单条非法正则只会被丢弃并记录 WARN，不影响整条场景。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Service
public class ScenarioCompileDomainService {

    public static final String DEFAULT_NAME = "Unnamed Scenario";
    public static final String DEFAULT_STATUS = "live";
    public static final int DEFAULT_PRIORITY = 50;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.6D;
    public static final String DEFAULT_BEHAVIOR = "calm_professional";
    public static final String DEFAULT_CHANNEL = "any";
    public static final String DEFAULT_HANDOFF_POLICY = "low_confidence";

    static final String FALLBACK_ID_PREFIX = "scenario_";
    private static final int FALLBACK_ID_HASH_LENGTH = 16;
    private static final int MIN_PHRASE_LENGTH = 2;

    private final SafeRegexCompiler regexCompiler;
    private final Clock clock;

    public ScenarioCompileDomainService(SafeRegexCompiler regexCompiler, Clock clock) {
        this.regexCompiler = regexCompiler;
        this.clock = clock;
    }

    public RuntimeSpec compile(RawScenario raw) {
        return compile(raw, CompileOptions.none());
    }

    public RuntimeSpec compile(RawScenario raw, CompileOptions options) {
        long compiledAt = clock.millis();
        RawScenario scenario = raw == null ? new RawScenario() : raw;
        CompileOptions compileOptions = options == null ? CompileOptions.none() : options;

        String name = StringUtils.defaultIfBlank(text(scenario.getName()), DEFAULT_NAME);
        List<String> normalizedTriggers = normalizePhrases(scenario.getTriggers());
        String id = hasExplicitId(scenario)
                ? text(scenario.getScenarioId()).trim()
                : fallbackId(compileOptions.templateId(), name, normalizedTriggers);
        String status = StringUtils.defaultIfBlank(StringUtils.trim(text(scenario.getStatus())), DEFAULT_STATUS);

        TriggerSet triggers = compileTriggers(scenario, id, normalizedTriggers);
        ReplySet replies = compileReplies(scenario);
        NeedsFlags needs = computeNeeds(scenario);

        CompileMeta meta = new CompileMeta(
                compiledAt,
                Math.max(0L, clock.millis() - compiledAt),
                triggers.normalized().size(),
                replies.quick().size() + replies.full().size(),
                !replies.quickNoName().isEmpty() || !replies.fullNoName().isEmpty());

        return new RuntimeSpec(
                id,
                name,
                compileOptions.templateId(),
                compileOptions.categoryName(),
                isActive(scenario),
                status,
                ScenarioTypeEnum.fromText(text(scenario.getScenarioType())),
                scenario.getPriority() instanceof Number priority ? priority.intValue() : DEFAULT_PRIORITY,
                clampConfidence(scenario.getMinConfidence()),
                scenario.getCooldownSeconds() instanceof Number cooldown ? Math.max(0, cooldown.intValue()) : 0,
                triggers,
                replies,
                new FollowUpSpec(
                        FollowUpModeEnum.fromText(text(scenario.getFollowUpMode())),
                        StringUtils.trimToNull(text(scenario.getFollowUpQuestionText())),
                        StringUtils.trimToNull(text(scenario.getFollowUpFunnel())),
                        StringUtils.trimToNull(text(scenario.getTransferTarget()))),
                new WiringSpec(
                        ActionTypeEnum.fromText(text(scenario.getActionType())),
                        StringUtils.trimToNull(text(scenario.getFlowId())),
                        Boolean.TRUE.equals(scenario.getBookingIntent()),
                        readStrings(scenario.getRequiredSlots()),
                        Boolean.TRUE.equals(scenario.getStopRouting())),
                StringUtils.defaultIfBlank(text(scenario.getBehavior()), DEFAULT_BEHAVIOR),
                StringUtils.defaultIfBlank(text(scenario.getChannel()), DEFAULT_CHANNEL),
                StringUtils.defaultIfBlank(text(scenario.getHandoffPolicy()), DEFAULT_HANDOFF_POLICY),
                needs,
                copyPayload(scenario),
                meta);
    }

    public static boolean hasExplicitId(RawScenario scenario) {
        return scenario != null && StringUtils.isNotBlank(text(scenario.getScenarioId()));
    }

    /**
     * 缺少 scenarioId 时按内容生成稳定 id：同一内容重复编译得到同一 id。
     * 内容完全相同的多条场景在池内由 {@code ScenarioPoolCompileDomainService} 追加序号区分。
     */
    static String fallbackId(String templateId, String name, List<String> normalizedTriggers) {
        String content = StringUtils.defaultString(templateId) + "\n" + name + "\n"
                + String.join("\n", normalizedTriggers);
        return FALLBACK_ID_PREFIX + Hashing.sha256().hashString(content, StandardCharsets.UTF_8)
                .toString().substring(0, FALLBACK_ID_HASH_LENGTH);
    }

    /**
     * isActive 显式为 false 时不可用；status 缺省视为 live，否则必须是 live。
     */
    static boolean isActive(RawScenario scenario) {
        if (Boolean.FALSE.equals(scenario.getIsActive())) {
            return false;
        }
        String status = StringUtils.trimToNull(text(scenario.getStatus()));
        return status == null || DEFAULT_STATUS.equalsIgnoreCase(status);
    }

    /**
     * 各标记互相独立，只读原始场景。
     */
    static NeedsFlags computeNeeds(RawScenario scenario) {
        return new NeedsFlags(
                hasNamePlaceholder(scenario.getQuickReplies()) || hasNamePlaceholder(scenario.getFullReplies()),
                isNonEmptyMap(scenario.getTtsOverride()),
                isEnabled(scenario.getTimedFollowUp()),
                isEnabled(scenario.getSilencePolicy()),
                isNonEmptyMap(scenario.getEntityValidation()),
                isNonEmptyList(scenario.getPreconditions()),
                isNonEmptyList(scenario.getActionHooks()),
                isNonEmptyList(scenario.getEffects()),
                isNonEmptyMap(scenario.getDynamicVariables()),
                isNonEmptyList(scenario.getEntityCapture()),
                ReplyStrategyEnum.fromText(text(scenario.getReplyStrategy())).isLlmRewrite());
    }

    private TriggerSet compileTriggers(RawScenario scenario, String scenarioId, List<String> normalized) {
        List<String> original = new ArrayList<>();
        for (Object item : list(scenario.getTriggers())) {
            if (item instanceof String text) {
                original.add(text);
            }
        }
        List<RegexTrigger> regex = new ArrayList<>();
        for (Object item : list(scenario.getRegexTriggers())) {
            if (item instanceof String source) {
                Optional<RegexTrigger> compiled = regexCompiler.compile(source, scenarioId);
                compiled.ifPresent(regex::add);
            }
        }
        return new TriggerSet(
                Collections.unmodifiableList(original),
                normalized,
                Collections.unmodifiableList(regex),
                normalizePhrases(scenario.getNegativeTriggers()),
                normalizePhrases(scenario.getExampleUserPhrases()),
                normalizePhrases(scenario.getNegativeUserPhrases()));
    }

    private ReplySet compileReplies(RawScenario scenario) {
        return new ReplySet(
                normalizeReplies(scenario.getQuickReplies()),
                normalizeReplies(scenario.getFullReplies()),
                normalizeReplies(scenario.getQuickRepliesNoName()),
                normalizeReplies(scenario.getFullRepliesNoName()),
                ReplyStrategyEnum.fromText(text(scenario.getReplyStrategy())));
    }

    /**
     * 小写、去首尾空白、保留长度不小于 2 的字符串；不去重。
     */
    public static List<String> normalizePhrases(Object value) {
        List<?> source = list(value);
        if (source.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(source.size());
        for (Object item : source) {
            if (!(item instanceof String text)) {
                continue;
            }
            String normalized = normalize(text);
            if (normalized.length() >= MIN_PHRASE_LENGTH) {
                result.add(normalized);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
    }

    private static List<String> normalizeReplies(Object value) {
        List<?> source = list(value);
        if (source.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(source.size());
        for (Object item : source) {
            String text = replyText(item);
            if (StringUtils.isNotBlank(text)) {
                result.add(text);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static String replyText(Object item) {
        if (item instanceof String text) {
            return text;
        }
        if (item instanceof Map<?, ?> map && map.get("text") instanceof String text) {
            return text;
        }
        return null;
    }

    private static boolean hasNamePlaceholder(Object replies) {
        for (Object item : list(replies)) {
            String text = replyText(item);
            if (text != null && StringUtils.containsIgnoreCase(text, Constants.NAME_PLACEHOLDER)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> readStrings(Object value) {
        List<?> source = list(value);
        if (source.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object item : source) {
            if (item instanceof String text && StringUtils.isNotBlank(text)) {
                result.add(text.trim());
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static double clampConfidence(Object value) {
        if (!(value instanceof Number number) || Double.isNaN(number.doubleValue())) {
            return DEFAULT_MIN_CONFIDENCE;
        }
        return Math.max(0D, Math.min(1D, number.doubleValue()));
    }

    private static boolean isEnabled(Object setting) {
        return setting instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get("enabled"));
    }

    private static boolean isNonEmptyMap(Object value) {
        return value instanceof Map<?, ?> map && !map.isEmpty();
    }

    private static boolean isNonEmptyList(Object value) {
        return value instanceof List<?> list && !list.isEmpty();
    }

    /**
     * 字符串原样返回，数字与布尔转成文本，其余类型视为缺失。
     */
    static String text(Object value) {
        if (value instanceof CharSequence chars) {
            return chars.toString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }

    private static List<?> list(Object value) {
        return value instanceof List<?> list ? list : Collections.emptyList();
    }

    private static RawPayload copyPayload(RawScenario scenario) {
        return new RawPayload(
                copyList(scenario.getPreconditions()),
                copyList(scenario.getEntityCapture()),
                copyMap(scenario.getEntityValidation()),
                copyMap(scenario.getDynamicVariables()),
                copyList(scenario.getActionHooks()),
                copyList(scenario.getEffects()),
                copyMap(scenario.getTtsOverride()),
                copyMap(scenario.getTimedFollowUp()),
                copyMap(scenario.getSilencePolicy()));
    }

    // 管理端数据可能含 null 元素，Guava 不可变集合不接受 null，这里用 JDK 不可变视图
    private static List<Object> copyList(Object value) {
        List<?> source = list(value);
        if (source.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> copy = new ArrayList<>(source.size());
        for (Object item : source) {
            copy.add(deepCopy(item));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Map<String, Object> copyMap(Object value) {
        if (!(value instanceof Map<?, ?> source) || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
