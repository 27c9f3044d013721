package com.leadengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 线索互动引擎启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到所有子模块中的组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
