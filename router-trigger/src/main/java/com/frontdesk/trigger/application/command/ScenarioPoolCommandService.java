package com.frontdesk.trigger.application.command;

import com.frontdesk.api.dto.PoolRebuildResponseDTO;
import com.frontdesk.domain.scenario.adapter.repository.IScenarioSourceRepository;
import com.frontdesk.domain.scenario.adapter.repository.IScenarioSourceRepository.ScenarioSource;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import com.frontdesk.domain.scenario.service.ScenarioPoolRegistry;
import com.frontdesk.trigger.application.common.ScenarioPoolViewAssembler;
import com.frontdesk.types.enums.ResponseCode;
import com.frontdesk.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 场景池重建写用例：读取场景源、编译并发布新快照。
 */
@Slf4j
@Service
public class ScenarioPoolCommandService {

    private final IScenarioSourceRepository scenarioSourceRepository;
    private final ScenarioPoolRegistry scenarioPoolRegistry;

    public ScenarioPoolCommandService(IScenarioSourceRepository scenarioSourceRepository,
                                      ScenarioPoolRegistry scenarioPoolRegistry) {
        this.scenarioSourceRepository = scenarioSourceRepository;
        this.scenarioPoolRegistry = scenarioPoolRegistry;
    }

    public PoolRebuildResponseDTO rebuild(String companyId) {
        return ScenarioPoolViewAssembler.toRebuildDTO(rebuildPool(companyId));
    }

    public ScenarioPool rebuildPool(String companyId) {
        if (StringUtils.isBlank(companyId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "companyId 不能为空");
        }
        ScenarioSource source = scenarioSourceRepository.findByCompanyId(companyId)
                .orElseThrow(() -> new AppException(ResponseCode.POOL_NOT_FOUND, "场景源不存在: " + companyId));
        return scenarioPoolRegistry.rebuild(companyId, source.scenarios(), source.options());
    }

    /**
     * 批量预热；单个公司失败只记录日志，不影响其余公司。
     *
     * @return 成功发布的公司列表
     */
    public List<String> preload(List<String> companyIds) {
        List<String> published = new ArrayList<>();
        if (companyIds == null) {
            return published;
        }
        for (String companyId : companyIds) {
            if (StringUtils.isBlank(companyId)) {
                continue;
            }
            try {
                ScenarioPool pool = rebuildPool(companyId.trim());
                published.add(pool.companyId());
            } catch (AppException | IllegalArgumentException ex) {
                log.warn("SCENARIO_POOL_PRELOAD_FAILED companyId={}, error={}", companyId, ex.getMessage());
            }
        }
        log.info("SCENARIO_POOL_PRELOADED requested={}, published={}", companyIds.size(), published);
        return published;
    }
}
