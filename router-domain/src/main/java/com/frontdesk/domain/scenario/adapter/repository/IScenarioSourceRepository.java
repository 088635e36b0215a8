package com.frontdesk.domain.scenario.adapter.repository;

import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 原始场景来源仓储接口。
 * <p>
 * 场景由管理端维护并在外部持久化，这里只负责按公司读取。
 * </p>
 */
public interface IScenarioSourceRepository {

    /**
     * 读取公司的全部原始场景；公司没有场景源时返回 empty。
     */
    Optional<ScenarioSource> findByCompanyId(String companyId);

    /**
     * 可用的公司标识列表。
     */
    List<String> listCompanyIds();

    /**
     * 一个公司的场景源：原始场景、来源信息，以及可选的公司文档。
     */
    record ScenarioSource(String companyId,
                          CompileOptions options,
                          List<RawScenario> scenarios,
                          Map<String, Object> company) {
    }
}
