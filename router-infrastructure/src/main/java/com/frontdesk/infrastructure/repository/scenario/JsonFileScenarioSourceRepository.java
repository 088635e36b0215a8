package com.frontdesk.infrastructure.repository.scenario;

import com.fasterxml.jackson.databind.JsonNode;
import com.frontdesk.domain.scenario.adapter.repository.IScenarioSourceRepository;
import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.infrastructure.util.JsonCodec;
import com.frontdesk.types.enums.ResponseCode;
import com.frontdesk.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 基于 JSON 文件的场景源仓储：{@code <dir>/<companyId>.json}。
 * <p>
 * 文件内容可以是场景数组，也可以是 {@code {templateId, categoryName, company, scenarios:[...]}}。
 * 场景字段按原样绑定，类型错误由编译器逐字段兜底，不会丢弃整条场景；
 * 数组中的非对象元素不是场景记录，忽略并记录 WARN；文件无法解析时抛出 SCENARIO_SOURCE_ERROR。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class JsonFileScenarioSourceRepository implements IScenarioSourceRepository {

    private static final Pattern COMPANY_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final String SUFFIX = ".json";

    private final JsonCodec jsonCodec;
    private final ResourcePatternResolver resourceResolver;
    private final String sourceDir;

    @Autowired
    public JsonFileScenarioSourceRepository(JsonCodec jsonCodec,
                                            @Value("${scenario-router.source.dir:classpath:scenarios}") String sourceDir) {
        this(jsonCodec, new PathMatchingResourcePatternResolver(), sourceDir);
    }

    public JsonFileScenarioSourceRepository(JsonCodec jsonCodec,
                                            ResourcePatternResolver resourceResolver,
                                            String sourceDir) {
        this.jsonCodec = jsonCodec;
        this.resourceResolver = resourceResolver;
        this.sourceDir = StringUtils.removeEnd(StringUtils.defaultIfBlank(sourceDir, "classpath:scenarios"), "/");
    }

    @Override
    public Optional<ScenarioSource> findByCompanyId(String companyId) {
        String safeCompanyId = requireCompanyId(companyId);
        Resource resource = resourceResolver.getResource(sourceDir + "/" + safeCompanyId + SUFFIX);
        if (!resource.exists()) {
            log.info("SCENARIO_SOURCE_MISSING companyId={}, dir={}", safeCompanyId, sourceDir);
            return Optional.empty();
        }
        JsonNode root;
        try (InputStream input = resource.getInputStream()) {
            root = jsonCodec.readTree(input, resource.getDescription());
        } catch (IOException ex) {
            throw new AppException(ResponseCode.SCENARIO_SOURCE_ERROR,
                    "Failed to read scenario source for " + safeCompanyId, ex);
        }
        ScenarioSource source = toSource(safeCompanyId, root);
        log.info("SCENARIO_SOURCE_LOADED companyId={}, templateId={}, scenarios={}",
                safeCompanyId, source.options().templateId(), source.scenarios().size());
        return Optional.of(source);
    }

    @Override
    public List<String> listCompanyIds() {
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(sourceDir + "/*" + SUFFIX);
        } catch (IOException ex) {
            log.warn("SCENARIO_SOURCE_LIST_FAILED dir={}, error={}", sourceDir, ex.getMessage());
            return Collections.emptyList();
        }
        List<String> companyIds = new ArrayList<>();
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null || !filename.endsWith(SUFFIX)) {
                continue;
            }
            String companyId = filename.substring(0, filename.length() - SUFFIX.length());
            if (COMPANY_ID_PATTERN.matcher(companyId).matches()) {
                companyIds.add(companyId);
            }
        }
        Collections.sort(companyIds);
        return companyIds;
    }

    private ScenarioSource toSource(String companyId, JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new ScenarioSource(companyId, CompileOptions.none(), Collections.emptyList(), null);
        }
        if (root.isArray()) {
            return new ScenarioSource(companyId, CompileOptions.none(), readScenarios(companyId, root), null);
        }
        if (!root.isObject()) {
            throw new AppException(ResponseCode.SCENARIO_SOURCE_ERROR,
                    "Scenario source for " + companyId + " must be an array or an object");
        }
        CompileOptions options = CompileOptions.of(textOrNull(root, "templateId"), textOrNull(root, "categoryName"));
        JsonNode company = root.get("company");
        Map<String, Object> companyDocument = company != null && company.isObject() ? jsonCodec.toMap(company) : null;
        return new ScenarioSource(companyId, options, readScenarios(companyId, root.get("scenarios")), companyDocument);
    }

    private List<RawScenario> readScenarios(String companyId, JsonNode node) {
        if (node == null || !node.isArray()) {
            return Collections.emptyList();
        }
        List<RawScenario> scenarios = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isObject()) {
                scenarios.add(jsonCodec.treeToValue(item, RawScenario.class));
            } else {
                log.warn("SCENARIO_RECORD_IGNORED companyId={}, nodeType={}", companyId, item.getNodeType());
            }
        }
        return scenarios;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : StringUtils.trimToNull(value.asText());
    }

    private static String requireCompanyId(String companyId) {
        String trimmed = StringUtils.trimToEmpty(companyId);
        if (!COMPANY_ID_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("companyId非法: " + companyId);
        }
        return trimmed;
    }
}
