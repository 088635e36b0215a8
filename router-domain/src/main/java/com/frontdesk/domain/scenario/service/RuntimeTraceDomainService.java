package com.frontdesk.domain.scenario.service;

import com.frontdesk.domain.scenario.model.valobj.MatchInfo;
import com.frontdesk.domain.scenario.model.valobj.NeedsFlags;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.RuntimeTrace;
import com.frontdesk.domain.scenario.model.valobj.TurnTimings;
import com.frontdesk.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 单回合运行时 trace 构建。
 * <p>
 * appliedSettings 先列出 Tier 0 的固定三项，再按 tier1 -> tier2 -> tier3 追加 needs 中为 true 的项；
 * 未命中场景时只有 {@code fallback}。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Slf4j
@Service
public class RuntimeTraceDomainService {

    public static final List<String> TIER0_SETTINGS =
            List.of("replySelection", "placeholderRendering", "structureEnforcement");

    private static final String DEFAULT_METHOD = "unknown";
    private static final String DEFAULT_REPLY_TYPE = "quick";

    private final Clock clock;

    public RuntimeTraceDomainService(Clock clock) {
        this.clock = clock;
    }

    public RuntimeTrace buildTrace(RuntimeSpec spec, MatchInfo matchInfo, TurnTimings timings) {
        MatchInfo info = matchInfo == null ? new MatchInfo() : matchInfo;
        TurnTimings latency = timings == null ? TurnTimings.ZERO : timings;
        Map<String, Boolean> needs = spec == null || spec.needs() == null
                ? Collections.emptyMap()
                : spec.needs().asMap();
        return new RuntimeTrace(
                info.getCompanyId(),
                spec == null ? null : spec.templateId(),
                spec == null ? Constants.FALLBACK_SCENARIO_ID : spec.id(),
                spec == null ? null : spec.name(),
                StringUtils.defaultIfBlank(info.getMethod(), DEFAULT_METHOD),
                info.getConfidence() == null ? 0D : info.getConfidence(),
                info.getTier() == null ? 0 : info.getTier(),
                StringUtils.defaultIfBlank(info.getReplyType(), DEFAULT_REPLY_TYPE),
                info.getReplyIndex() == null ? 0 : info.getReplyIndex(),
                buildAppliedSettings(spec),
                latency,
                needs,
                clock.millis());
    }

    public static List<String> buildAppliedSettings(RuntimeSpec spec) {
        if (spec == null) {
            return List.of(Constants.FALLBACK_SCENARIO_ID);
        }
        List<String> applied = new ArrayList<>(TIER0_SETTINGS);
        NeedsFlags needs = spec.needs() == null ? NeedsFlags.NONE : spec.needs();
        applied.addAll(needs.enabledSettings());
        return Collections.unmodifiableList(applied);
    }

    public void logTrace(RuntimeTrace trace) {
        if (trace == null) {
            return;
        }
        TurnTimings latency = trace.latencyBreakdownMs() == null ? TurnTimings.ZERO : trace.latencyBreakdownMs();
        log.info("SCENARIO_RUNTIME_TRACE companyId={}, templateId={}, scenarioId={}, scenarioName={}, method={}, "
                        + "confidence={}, tier={}, replyType={}, replyIndex={}, appliedSettings={}, "
                        + "matchMs={}, renderMs={}, ttsMs={}, totalMs={}",
                trace.companyId(), trace.templateId(), trace.scenarioIdMatched(), trace.scenarioNameMatched(),
                trace.matchMethod(), trace.matchConfidence(), trace.matchTier(), trace.replyType(),
                trace.replyIndex(), String.join("|", trace.appliedSettings()),
                latency.match(), latency.render(), latency.tts(), latency.total());
    }
}
