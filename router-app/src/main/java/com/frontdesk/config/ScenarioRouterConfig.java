package com.frontdesk.config;

import com.frontdesk.domain.scenario.service.SafeRegexCompiler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 场景编译相关 Bean。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ScenarioRouterProperties.class)
public class ScenarioRouterConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SafeRegexCompiler safeRegexCompiler(ScenarioRouterProperties properties) {
        ScenarioRouterProperties.Compiler compiler = properties.getCompiler();
        SafeRegexCompiler regexCompiler = new SafeRegexCompiler(compiler.getRegexMaxLength(),
                compiler.getRegexMatchBudgetMs());
        log.info("SCENARIO_REGEX_POLICY maxLength={}, matchBudgetMs={}",
                regexCompiler.getMaxLength(), regexCompiler.getMatchBudgetMs());
        return regexCompiler;
    }
}
