package com.eraser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 水印去除服务 - 启动类。
 * <p>
 * 默认以 Web 服务方式运行；配置 {@code eraser.cli.input-dir} 后启动时会处理整个目录，
 * 只想跑目录批处理时可加 {@code --spring.main.web-application-type=none}。
 */
@SpringBootApplication(scanBasePackages = "com.eraser")
public class EraserApplication {

    public static void main(String[] args) {
        SpringApplication.run(EraserApplication.class, args);
    }
}
