package com.frontdesk.config;

import com.frontdesk.trigger.application.command.ScenarioPoolCommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 启动时为配置的公司编译并发布场景池。单个公司失败不会阻止启动。
 */
@Slf4j
@Component
public class ScenarioPoolPreloadRunner implements ApplicationRunner {

    private final ScenarioPoolCommandService scenarioPoolCommandService;
    private final ScenarioRouterProperties properties;

    public ScenarioPoolPreloadRunner(ScenarioPoolCommandService scenarioPoolCommandService,
                                     ScenarioRouterProperties properties) {
        this.scenarioPoolCommandService = scenarioPoolCommandService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> companies = properties.getPreloadCompanies();
        if (companies == null || companies.isEmpty()) {
            log.info("SCENARIO_POOL_PRELOAD_SKIPPED reason=no_companies_configured");
            return;
        }
        scenarioPoolCommandService.preload(companies);
    }
}
