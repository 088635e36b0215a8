package com.frontdesk.domain.truth.adapter.gateway;

import java.util.Map;

/**
 * 接线报告生成网关。
 * <p>
 * 报告描述公司配置在运行时的实际接线情况；返回值应当是 JSON 对象（Map 或可序列化为对象的值），
 * 否则导出方按降级处理。
 * </p>
 */
public interface IWiringReportGenerator {

    Object generate(String companyId, Map<String, Object> company, String environment);
}
