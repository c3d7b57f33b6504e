package com.eraser.image.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 图片编码输出配置。
 */
@Data
@ConfigurationProperties(prefix = "eraser.codec")
public class CodecProperties {

    /** JPEG 质量 (0-100) */
    private int jpegQuality = 95;

    /** PNG 压缩级别 (0-9) */
    private int pngCompression = 3;

    /** 无扩展名时使用的默认编码格式 */
    private String defaultFormat = "png";
}
