package com.frontdesk.domain.truth.model.valobj;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.frontdesk.domain.flow.model.valobj.FlowTree;
import com.frontdesk.domain.flow.model.valobj.RuntimeBinding;

import java.util.List;

/**
 * 部署期“真相包”：流程树、运行时绑定、接线报告与校验结果，由 meta.hash 封签。
 * <p>
 * 生成失败时只输出错误信封（meta + error + errors），不包含流程树等内容。
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TruthBundle(TruthBundleMeta meta,
                          Object wiringReport,
                          FlowTree flowTree,
                          List<RuntimeBinding> runtimeBindings,
                          BundleValidation validation,
                          String error,
                          List<String> errors) {

    public static TruthBundle envelope(TruthBundleMeta meta, String error, List<String> errors) {
        return new TruthBundle(meta, null, null, null, null, error, errors);
    }

    @JsonIgnore
    public boolean isEnvelope() {
        return flowTree == null;
    }
}
