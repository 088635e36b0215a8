package com.frontdesk.trigger.application.query;

import com.frontdesk.api.dto.BundleValidationResponseDTO;
import com.frontdesk.domain.scenario.adapter.repository.IScenarioSourceRepository;
import com.frontdesk.domain.scenario.adapter.repository.IScenarioSourceRepository.ScenarioSource;
import com.frontdesk.domain.truth.model.valobj.BundleValidationResult;
import com.frontdesk.domain.truth.model.valobj.TruthBundle;
import com.frontdesk.domain.truth.model.valobj.TruthBundleRequest;
import com.frontdesk.domain.truth.service.TruthBundleExporter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Truth Bundle 导出与校验读用例。
 * <p>
 * 公司文档取自该公司场景源文件中的 {@code company} 字段，没有时按缺失处理。
 * </p>
 */
@Service
public class TruthBundleQueryService {

    private final TruthBundleExporter truthBundleExporter;
    private final IScenarioSourceRepository scenarioSourceRepository;

    public TruthBundleQueryService(TruthBundleExporter truthBundleExporter,
                                   IScenarioSourceRepository scenarioSourceRepository) {
        this.truthBundleExporter = truthBundleExporter;
        this.scenarioSourceRepository = scenarioSourceRepository;
    }

    public TruthBundle export(String companyId, String environment, Boolean allowDegraded) {
        Map<String, Object> company = StringUtils.isBlank(companyId)
                ? null
                : scenarioSourceRepository.findByCompanyId(companyId.trim())
                .map(ScenarioSource::company)
                .orElse(null);
        return truthBundleExporter.generate(new TruthBundleRequest(companyId, company, environment, allowDegraded));
    }

    public BundleValidationResponseDTO validate(Map<String, Object> bundle) {
        BundleValidationResult result = truthBundleExporter.validate(bundle);
        BundleValidationResponseDTO dto = new BundleValidationResponseDTO();
        dto.setValid(result.valid());
        dto.setErrors(result.errors());
        return dto;
    }
}
