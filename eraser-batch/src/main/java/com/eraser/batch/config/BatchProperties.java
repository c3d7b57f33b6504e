package com.eraser.batch.config;

import com.eraser.common.dto.InpaintAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 批处理配置项。
 */
@Data
@ConfigurationProperties(prefix = "eraser.batch")
public class BatchProperties {

    /** 最大并发数（同时处理的图片数） */
    private int maxConcurrent = 4;

    /** 自动检测时是否使用激进模式 */
    private boolean aggressive = true;

    /** 批处理使用的修复算法 */
    private InpaintAlgorithm algorithm = InpaintAlgorithm.BLEND;

    /** 每完成多少张打印一次进度 */
    private int progressLogInterval = 5;
}
