package com.frontdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 场景路由服务启动类。
 * <p>
 * 位于顶层包 {@code com.frontdesk}，以便扫描 trigger、domain、infrastructure 各模块中的组件。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
