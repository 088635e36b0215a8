package com.frontdesk.domain.scenario.service;

import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 场景池注册表：按公司持有已发布的不可变快照。
 * <p>
 * 重建时先在旁路完整编译新池，再一次性替换引用；读方只会看到完整的旧池或新池。
 * 版本号按公司单调递增，失效后重新发布也不会回退。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Slf4j
@Service
public class ScenarioPoolRegistry {

    private final ScenarioPoolCompileDomainService poolCompileDomainService;
    private final Map<String, AtomicReference<ScenarioPool>> pools = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> versions = new ConcurrentHashMap<>();

    public ScenarioPoolRegistry(ScenarioPoolCompileDomainService poolCompileDomainService) {
        this.poolCompileDomainService = poolCompileDomainService;
    }

    /**
     * 编译并发布；返回已发布的快照。
     */
    public ScenarioPool rebuild(String companyId, List<RawScenario> scenarios, CompileOptions options) {
        requireCompanyId(companyId);
        ScenarioPool built = poolCompileDomainService.compilePool(scenarios, options);
        return publish(built.withIdentity(companyId, 0L));
    }

    /**
     * 以新版本号发布快照，替换该公司当前快照。
     */
    public ScenarioPool publish(ScenarioPool pool) {
        if (pool == null) {
            throw new IllegalArgumentException("pool不能为空");
        }
        String companyId = requireCompanyId(pool.companyId());
        long version = versions.computeIfAbsent(companyId, key -> new AtomicLong()).incrementAndGet();
        ScenarioPool published = pool.withIdentity(companyId, version);
        ScenarioPool previous = pools.computeIfAbsent(companyId, key -> new AtomicReference<>())
                .getAndSet(published);
        log.info("SCENARIO_POOL_PUBLISHED companyId={}, version={}, previousVersion={}, activeScenarios={}",
                companyId, version, previous == null ? null : previous.version(),
                published.stats() == null ? 0 : published.stats().activeScenarios());
        return published;
    }

    public Optional<ScenarioPool> current(String companyId) {
        if (StringUtils.isBlank(companyId)) {
            return Optional.empty();
        }
        AtomicReference<ScenarioPool> holder = pools.get(companyId.trim());
        return holder == null ? Optional.empty() : Optional.ofNullable(holder.get());
    }

    public boolean invalidate(String companyId) {
        if (StringUtils.isBlank(companyId)) {
            return false;
        }
        AtomicReference<ScenarioPool> holder = pools.get(companyId.trim());
        ScenarioPool previous = holder == null ? null : holder.getAndSet(null);
        if (previous != null) {
            log.info("SCENARIO_POOL_INVALIDATED companyId={}, version={}", companyId, previous.version());
        }
        return previous != null;
    }

    public List<String> companyIds() {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, AtomicReference<ScenarioPool>> entry : pools.entrySet()) {
            if (entry.getValue().get() != null) {
                result.add(entry.getKey());
            }
        }
        Collections.sort(result);
        return result;
    }

    private static String requireCompanyId(String companyId) {
        if (StringUtils.isBlank(companyId)) {
            throw new IllegalArgumentException("companyId不能为空");
        }
        return companyId.trim();
    }
}
