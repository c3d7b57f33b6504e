package com.eraser.batch.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 批处理模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.eraser.batch")
@EnableConfigurationProperties(BatchProperties.class)
public class BatchModuleConfig {
}
