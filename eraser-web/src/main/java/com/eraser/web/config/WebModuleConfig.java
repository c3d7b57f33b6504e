package com.eraser.web.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.eraser.web")
public class WebModuleConfig {
}
