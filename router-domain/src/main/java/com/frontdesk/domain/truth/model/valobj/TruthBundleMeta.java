package com.frontdesk.domain.truth.model.valobj;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.frontdesk.types.enums.BundleIntegrityEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Truth Bundle 元信息。错误信封只填写 schema 到 errors 之间的字段。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TruthBundleMeta {

    private String schema;
    private String generatedAt;
    private String companyId;
    private String environment;
    private BundleIntegrityEnum integrity;
    private List<String> errors;
    private String hash;
    private String flowTreeVersion;
    private Integer nodeCount;
    private Integer edgeCount;
    private Integer bindingCount;
}
