package com.frontdesk.trigger.http;

import com.frontdesk.api.dto.CandidateLookupResponseDTO;
import com.frontdesk.api.dto.PoolRebuildResponseDTO;
import com.frontdesk.api.response.Response;
import com.frontdesk.trigger.application.command.ScenarioPoolCommandService;
import com.frontdesk.trigger.application.query.ScenarioLookupQueryService;
import com.frontdesk.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 场景池运维 API：重建与候选检索诊断。
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/scenario-pools")
public class ScenarioPoolController {

    private final ScenarioPoolCommandService scenarioPoolCommandService;
    private final ScenarioLookupQueryService scenarioLookupQueryService;

    public ScenarioPoolController(ScenarioPoolCommandService scenarioPoolCommandService,
                                  ScenarioLookupQueryService scenarioLookupQueryService) {
        this.scenarioPoolCommandService = scenarioPoolCommandService;
        this.scenarioLookupQueryService = scenarioLookupQueryService;
    }

    @PostMapping("/{companyId}/rebuild")
    public Response<PoolRebuildResponseDTO> rebuild(@PathVariable("companyId") String companyId) {
        PoolRebuildResponseDTO data = scenarioPoolCommandService.rebuild(companyId);
        log.info("SCENARIO_POOL_REBUILD_REQUESTED companyId={}, version={}, conflicts={}",
                companyId, data.getVersion(), data.getConflicts().size());
        return Response.<PoolRebuildResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    @GetMapping("/{companyId}/lookup")
    public Response<CandidateLookupResponseDTO> lookup(@PathVariable("companyId") String companyId,
                                                       @RequestParam("q") String query) {
        return Response.<CandidateLookupResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(scenarioLookupQueryService.lookup(companyId, query))
                .build();
    }
}
