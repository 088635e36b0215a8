package com.frontdesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 公共线程池配置，前缀 thread.pool.executor.config。
 * <p>
 * 目前只有接线报告生成会提交到这个线程池，默认值按“少量、短任务”设置。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 4;

    /** 最大线程数 */
    private Integer maxPoolSize = 16;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveTime = 30L;

    /** 队列容量 */
    private Integer blockQueueSize = 256;

    /** 拒绝策略：AbortPolicy / DiscardPolicy / DiscardOldestPolicy / CallerRunsPolicy */
    private String policy = "AbortPolicy";

    /** 线程名前缀 */
    private String threadNamePrefix = "router-common-";

}
