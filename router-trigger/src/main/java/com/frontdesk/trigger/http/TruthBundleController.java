package com.frontdesk.trigger.http;

import com.frontdesk.api.dto.BundleValidationResponseDTO;
import com.frontdesk.api.response.Response;
import com.frontdesk.domain.truth.model.valobj.TruthBundle;
import com.frontdesk.trigger.application.query.TruthBundleQueryService;
import com.frontdesk.types.enums.BundleIntegrityEnum;
import com.frontdesk.types.enums.ResponseCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Truth Bundle 导出与校验 API。
 * <p>
 * 导出失败时 data 仍然是错误信封，调用方可以直接读取 meta.errors。
 * </p>
 */
@RestController
@RequestMapping("/api/v1/truth-bundle")
public class TruthBundleController {

    private final TruthBundleQueryService truthBundleQueryService;

    public TruthBundleController(TruthBundleQueryService truthBundleQueryService) {
        this.truthBundleQueryService = truthBundleQueryService;
    }

    @GetMapping
    public Response<TruthBundle> export(@RequestParam(value = "companyId", required = false) String companyId,
                                        @RequestParam(value = "environment", required = false) String environment,
                                        @RequestParam(value = "allowDegraded", required = false) Boolean allowDegraded) {
        TruthBundle bundle = truthBundleQueryService.export(companyId, environment, allowDegraded);
        if (!bundle.isEnvelope()) {
            return Response.<TruthBundle>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(bundle)
                    .build();
        }
        ResponseCode code = bundle.meta() != null && bundle.meta().getIntegrity() == BundleIntegrityEnum.INVALID
                ? ResponseCode.ILLEGAL_PARAMETER
                : ResponseCode.TRUTH_BUNDLE_FAILED;
        return Response.<TruthBundle>builder()
                .code(code.getCode())
                .info(StringUtils.defaultIfBlank(bundle.error(), code.getInfo()))
                .data(bundle)
                .build();
    }

    @PostMapping("/validate")
    public Response<BundleValidationResponseDTO> validate(@RequestBody(required = false) Map<String, Object> bundle) {
        return Response.<BundleValidationResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(truthBundleQueryService.validate(bundle))
                .build();
    }
}
