package com.eraser.image.inpaint;

import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.image.config.InpaintProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Component;

/**
 * 多遍增强：用更大的采样半径反复做快速行进修复，每遍以上一遍的输出为输入。
 * 用于单遍修复后仍有残影的较重水印。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiPassInpainter implements Inpainter {

    private final FastMarchingInpainter fastMarching;
    private final InpaintProperties properties;

    @Override
    public Mat inpaint(Mat image, Mat mask) {
        int passes = Math.max(1, properties.getMultiPassCount());
        Mat result = image;
        for (int pass = 0; pass < passes; pass++) {
            result = fastMarching.inpaint(result, mask, properties.getMultiPassRadius());
        }
        log.debug("多遍修复完成: {} 遍, 半径={}", passes, properties.getMultiPassRadius());
        return result;
    }

    @Override
    public InpaintAlgorithm getAlgorithm() {
        return InpaintAlgorithm.MULTI_PASS_ENHANCED;
    }
}
