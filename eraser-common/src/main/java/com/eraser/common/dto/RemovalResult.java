package com.eraser.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单张图片去水印结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemovalResult {

    /** 输出图片（未检测到水印时即原图） */
    private PixelImage image;

    /** 实际使用的蒙版 */
    private WatermarkMask mask;

    /** 使用的修复算法 */
    private InpaintAlgorithm algorithm;

    /** 是否找到需要修复的区域 */
    private boolean watermarkFound;

    /** 被修复的像素数 */
    private long maskedPixels;

    /** 处理耗时（毫秒） */
    private long processingTimeMs;
}
