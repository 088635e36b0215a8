package com.frontdesk.domain.truth.model.valobj;

import java.util.Map;

/**
 * Truth Bundle 导出请求。
 *
 * @param company 公司文档，生产环境缺失时降级
 * @param environment 为空时使用配置的默认环境
 * @param allowDegraded 为 true 时才允许输出非 COMPLETE 的 bundle
 */
public record TruthBundleRequest(String companyId,
                                 Map<String, Object> company,
                                 String environment,
                                 Boolean allowDegraded) {

    public static TruthBundleRequest of(String companyId, String environment) {
        return new TruthBundleRequest(companyId, null, environment, null);
    }
}
