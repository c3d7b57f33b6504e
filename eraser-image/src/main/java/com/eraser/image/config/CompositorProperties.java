package com.eraser.image.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 修复结果后处理配置。
 */
@Data
@ConfigurationProperties(prefix = "eraser.compositor")
public class CompositorProperties {

    /** 锐化核缩放系数（核为 [-1..9..-1] * scale） */
    private double sharpenKernelScale = 0.3;

    /** 锐化结果在混合中的权重，其余为未锐化结果 */
    private double sharpenBlendWeight = 0.15;

    /** 是否按原图做逐通道均值/标准差匹配 */
    private boolean colorMatchEnabled = true;
}
