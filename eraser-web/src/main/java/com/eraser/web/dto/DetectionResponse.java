package com.eraser.web.dto;

import com.eraser.common.dto.WatermarkMask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 只检测不修复的返回结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResponse {

    /** 检测蒙版 PNG (Base64)，白色为水印区域 */
    private String maskBase64;

    private boolean watermarkFound;

    private long maskedPixels;

    /** 蒙版覆盖率 [0,1] */
    private double coverage;

    /** 外接矩形，未检测到时为 null */
    private WatermarkMask.Region boundingBox;
}
