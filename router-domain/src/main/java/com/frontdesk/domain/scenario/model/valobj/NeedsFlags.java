package com.frontdesk.domain.scenario.model.valobj;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分级设置预算：运行时据此跳过不需要的 Tier 1/2/3 处理。
 * <p>
 * 每个标记都只由 {@link RawScenario} 推导，且为 true 时 {@link RawPayload} 中必然存在对应数据。
 * </p>
 */
public record NeedsFlags(
        // Tier 1
        boolean nameVariant,
        boolean ttsOverride,
        boolean timedFollowUp,
        boolean silencePolicy,
        boolean entityValidation,
        boolean preconditions,
        // Tier 2
        boolean actionHooks,
        boolean effects,
        boolean dynamicVariables,
        boolean entityCapture,
        // Tier 3
        boolean llmRewrite) {

    public static final NeedsFlags NONE =
            new NeedsFlags(false, false, false, false, false, false, false, false, false, false, false);

    /**
     * 按 tier1 -> tier2 -> tier3 的固定顺序输出全部标记。
     */
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put("nameVariant", nameVariant);
        flags.put("ttsOverride", ttsOverride);
        flags.put("timedFollowUp", timedFollowUp);
        flags.put("silencePolicy", silencePolicy);
        flags.put("entityValidation", entityValidation);
        flags.put("preconditions", preconditions);
        flags.put("actionHooks", actionHooks);
        flags.put("effects", effects);
        flags.put("dynamicVariables", dynamicVariables);
        flags.put("entityCapture", entityCapture);
        flags.put("llmRewrite", llmRewrite);
        return Collections.unmodifiableMap(flags);
    }

    /**
     * 为 true 的标记名，顺序与 {@link #asMap()} 一致。
     */
    public List<String> enabledSettings() {
        List<String> enabled = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : asMap().entrySet()) {
            if (Boolean.TRUE.equals(entry.getValue())) {
                enabled.add(entry.getKey());
            }
        }
        return enabled;
    }

    public boolean anyTier1() {
        return nameVariant || ttsOverride || timedFollowUp || silencePolicy || entityValidation || preconditions;
    }

    public boolean anyTier2() {
        return actionHooks || effects || dynamicVariables || entityCapture;
    }
}
