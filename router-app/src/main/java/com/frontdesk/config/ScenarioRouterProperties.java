package com.frontdesk.config;

import com.frontdesk.domain.scenario.service.SafeRegexCompiler;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 场景路由配置，前缀 scenario-router。
 * <p>
 * 场景源目录 {@code scenario-router.source.dir} 由仓储直接读取，不在这里重复声明。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "scenario-router", ignoreInvalidFields = true)
public class ScenarioRouterProperties {

    private Compiler compiler = new Compiler();

    /** 启动时预先编译并发布场景池的公司 */
    private List<String> preloadCompanies = new ArrayList<>();

    @Data
    public static class Compiler {

        /** 正则触发词最大长度 */
        private int regexMaxLength = SafeRegexCompiler.DEFAULT_MAX_LENGTH;

        /** 单次正则匹配的时间预算（毫秒） */
        private long regexMatchBudgetMs = SafeRegexCompiler.DEFAULT_MATCH_BUDGET_MS;
    }
}
