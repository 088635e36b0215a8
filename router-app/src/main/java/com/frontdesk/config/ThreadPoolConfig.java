package com.frontdesk.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 公共线程池配置。
 * <p>
 * Truth Bundle 导出时接线报告在这个线程池中执行，调用方带超时等待；
 * 被拒绝的任务会让导出降级，不会阻塞请求线程。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "commonThreadPoolExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "commonThreadPoolExecutor")
    public ThreadPoolExecutor commonThreadPoolExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        AtomicInteger threadIndex = new AtomicInteger(0);
        String prefix = properties.getThreadNamePrefix() == null ? "router-common-" : properties.getThreadNamePrefix();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("THREAD_POOL_CREATED name=commonThreadPoolExecutor, core={}, max={}, queue={}, policy={}",
                coreSize, maxSize, properties.getBlockQueueSize(), properties.getPolicy());
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                rejectedExecutionHandler(properties.getPolicy()));
    }

    static RejectedExecutionHandler rejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if (!"AbortPolicy".equals(policy)) {
            log.warn("THREAD_POOL_POLICY_UNKNOWN policy={}, fallback=AbortPolicy", policy);
        }
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
