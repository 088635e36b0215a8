package com.frontdesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置，前缀 observability.http-log。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    private boolean enabled = true;

    private List<String> includePathPatterns = Arrays.asList("/api/**");

    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** 查询参数中需要脱敏的键 */
    private List<String> maskQueryKeys = Arrays.asList("token", "secret", "apiKey");

    /** 超过该耗时的请求按 WARN 输出 */
    private long slowRequestThresholdMs = 1000L;

    /** 采样比例（0~1），慢请求与异常请求不受采样影响 */
    private double sampleRate = 1.0D;
}
