package com.aquacontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AquaControl 鱼池事件溯源服务启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到各子模块中的组件。
 * </p>
 *
 * @author aquacontrol
 * @since 2025-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
