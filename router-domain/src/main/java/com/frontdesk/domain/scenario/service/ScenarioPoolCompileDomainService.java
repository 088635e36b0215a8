package com.frontdesk.domain.scenario.service;

import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.ExactIndex;
import com.frontdesk.domain.scenario.model.valobj.PoolStats;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import com.frontdesk.domain.scenario.model.valobj.TriggerConflict;
import com.frontdesk.domain.scenario.model.valobj.WordIndex;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 场景池编译领域服务：批量编译场景并构建精确索引与词索引。
 * <p>
 * 停用场景只计入统计，不进入任何索引。精确索引先注册者优先，
 * 被遮蔽的触发词会记录为 {@link TriggerConflict} 并打印 WARN，供运营处理。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Slf4j
@Service
public class ScenarioPoolCompileDomainService {

    static final int MIN_TOKEN_LENGTH = 3;

    private final ScenarioCompileDomainService scenarioCompileDomainService;
    private final Clock clock;

    public ScenarioPoolCompileDomainService(ScenarioCompileDomainService scenarioCompileDomainService, Clock clock) {
        this.scenarioCompileDomainService = scenarioCompileDomainService;
        this.clock = clock;
    }

    public ScenarioPool compilePool(List<RawScenario> scenarios, CompileOptions options) {
        long startedAt = clock.millis();
        List<RawScenario> source = scenarios == null ? Collections.emptyList() : scenarios;

        List<RuntimeSpec> specs = new ArrayList<>();
        Map<String, RuntimeSpec> exact = new LinkedHashMap<>();
        Map<String, List<RuntimeSpec>> buckets = new LinkedHashMap<>();
        Map<String, Set<RuntimeSpec>> wordMembers = new LinkedHashMap<>();
        List<TriggerConflict> conflicts = new ArrayList<>();

        int activeCount = 0;
        int inactiveCount = 0;
        int totalTriggers = 0;
        int totalReplies = 0;

        Set<String> seenIds = new HashSet<>();
        for (int position = 0; position < source.size(); position++) {
            RawScenario raw = source.get(position);
            RuntimeSpec spec = scenarioCompileDomainService.compile(raw, options);
            // 内容相同的无 id 场景会得到相同的生成 id，按位置追加序号
            if (!ScenarioCompileDomainService.hasExplicitId(raw) && seenIds.contains(spec.id())) {
                spec = spec.withId(spec.id() + "_" + position);
            }
            seenIds.add(spec.id());
            if (!spec.active()) {
                inactiveCount++;
                continue;
            }
            specs.add(spec);
            activeCount++;
            totalTriggers += spec.triggers().normalized().size();
            totalReplies += spec.meta().replyCount();

            for (String trigger : spec.triggers().normalized()) {
                RuntimeSpec owner = exact.putIfAbsent(trigger, spec);
                if (owner != null && owner != spec) {
                    conflicts.add(new TriggerConflict(trigger, owner.id(), spec.id()));
                    log.warn("SCENARIO_TRIGGER_SHADOWED templateId={}, trigger={}, winner={}, shadowed={}",
                            options == null ? null : options.templateId(), trigger, owner.id(), spec.id());
                }

                buckets.computeIfAbsent(trigger, key -> new ArrayList<>()).add(spec);

                for (String token : tokenize(trigger)) {
                    String key = WordIndex.wordKey(token);
                    Set<RuntimeSpec> members = wordMembers.computeIfAbsent(key,
                            ignored -> Collections.newSetFromMap(new IdentityHashMap<>()));
                    if (members.add(spec)) {
                        buckets.computeIfAbsent(key, ignored -> new ArrayList<>()).add(spec);
                    }
                }
            }
        }

        ImmutableListMultimap.Builder<String, RuntimeSpec> wordBuilder = ImmutableListMultimap.builder();
        for (Map.Entry<String, List<RuntimeSpec>> entry : buckets.entrySet()) {
            wordBuilder.putAll(entry.getKey(), entry.getValue());
        }
        ExactIndex exactIndex = new ExactIndex(ImmutableMap.copyOf(exact));
        WordIndex wordIndex = new WordIndex(wordBuilder.build());

        long builtAt = clock.millis();
        PoolStats stats = new PoolStats(
                source.size(),
                activeCount,
                inactiveCount,
                totalTriggers,
                totalReplies,
                exact.size(),
                buckets.size(),
                conflicts.size(),
                Math.max(0L, builtAt - startedAt));

        log.info("SCENARIO_POOL_COMPILED templateId={}, totalScenarios={}, activeScenarios={}, inactiveScenarios={}, "
                        + "totalTriggers={}, totalReplies={}, exactIndexSize={}, indexSize={}, shadowedTriggers={}, "
                        + "compileTimeMs={}",
                options == null ? null : options.templateId(), stats.totalScenarios(), stats.activeScenarios(),
                stats.inactiveScenarios(), stats.totalTriggers(), stats.totalReplies(), stats.exactIndexSize(),
                stats.indexSize(), stats.shadowedTriggers(), stats.compileTimeMs());

        return new ScenarioPool(null, 0L, builtAt, ImmutableList.copyOf(specs), exactIndex, wordIndex, stats,
                ImmutableList.copyOf(conflicts));
    }

    /**
     * 按空白切分，保留长度不小于 3 的词。
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : text.trim().split("\\s+")) {
            if (part.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(part);
            }
        }
        return tokens;
    }
}
