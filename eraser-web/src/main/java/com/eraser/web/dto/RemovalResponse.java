package com.eraser.web.dto;

import com.eraser.common.dto.InpaintAlgorithm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单张图片去水印的返回结果，图片以 Base64 传输。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemovalResponse {

    /** 处理后的图片 (Base64) */
    private String imageBase64;

    /** 图片 MIME 类型 */
    private String mimeType;

    /** 实际使用的蒙版 PNG (Base64) */
    private String maskBase64;

    private InpaintAlgorithm algorithm;

    private boolean watermarkFound;

    private long maskedPixels;

    private int width;

    private int height;

    private long processingTimeMs;
}
