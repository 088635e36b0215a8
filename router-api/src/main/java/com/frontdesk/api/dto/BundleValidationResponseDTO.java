package com.frontdesk.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Truth Bundle 校验结果 DTO。
 */
@Data
public class BundleValidationResponseDTO {

    private Boolean valid;
    private List<String> errors;
}
