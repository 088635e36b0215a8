package com.frontdesk.trigger.http;

import com.frontdesk.api.dto.FlowTreeResponseDTO;
import com.frontdesk.api.dto.PathCheckRequestDTO;
import com.frontdesk.api.dto.PathCheckResponseDTO;
import com.frontdesk.api.response.Response;
import com.frontdesk.trigger.application.query.FlowTreeQueryService;
import com.frontdesk.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 流程树 API。
 */
@RestController
@RequestMapping("/api/v1/flow")
public class FlowController {

    private final FlowTreeQueryService flowTreeQueryService;

    public FlowController(FlowTreeQueryService flowTreeQueryService) {
        this.flowTreeQueryService = flowTreeQueryService;
    }

    @GetMapping("/tree")
    public Response<FlowTreeResponseDTO> getFlowTree() {
        return success(flowTreeQueryService.getFlowTree());
    }

    /**
     * 路径不在树内时仍返回成功，结果里带 OUT_OF_TREE_PATH 告警。
     */
    @PostMapping("/path-check")
    public Response<PathCheckResponseDTO> checkPath(@RequestBody(required = false) PathCheckRequestDTO request) {
        return success(flowTreeQueryService.checkPath(request));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
