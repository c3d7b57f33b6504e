package com.eraser.image.config;

import com.eraser.common.dto.InpaintAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 图像修复相关配置。
 */
@Data
@ConfigurationProperties(prefix = "eraser.inpaint")
public class InpaintProperties {

    /** 默认修复算法 */
    private InpaintAlgorithm defaultAlgorithm = InpaintAlgorithm.BLEND;

    /** 单遍修复的采样半径 */
    private double radius = 3;

    /** 多遍增强模式的采样半径 */
    private double multiPassRadius = 5;

    /** 多遍增强模式的遍数 */
    private int multiPassCount = 3;

    /** 修复前是否做彩色非局部均值去噪 */
    private boolean denoiseEnabled = false;

    /** 去噪强度（亮度） */
    private float denoiseH = 3;

    /** 去噪强度（色彩） */
    private float denoiseHColor = 3;

    /** 去噪模板窗口大小 */
    private int denoiseTemplateWindowSize = 7;

    /** 去噪搜索窗口大小 */
    private int denoiseSearchWindowSize = 21;
}
