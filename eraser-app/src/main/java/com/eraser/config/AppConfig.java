package com.eraser.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 启动模块配置。
 */
@Configuration
@EnableConfigurationProperties(CliProperties.class)
public class AppConfig {
}
