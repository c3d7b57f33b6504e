package com.eraser.image.inpaint;

import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.image.config.InpaintProperties;
import lombok.RequiredArgsConstructor;
import org.bytedeco.opencv.global.opencv_photo;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Component;

/**
 * 各向异性扩散（Navier-Stokes）：沿等照度线扩散平滑，不跨越强边缘。
 * 比快速行进法慢，但更能保持大尺度纹理。
 */
@Component
@RequiredArgsConstructor
public class AnisotropicDiffusionInpainter implements Inpainter {

    private final InpaintProperties properties;

    @Override
    public Mat inpaint(Mat image, Mat mask) {
        Mat result = new Mat();
        opencv_photo.inpaint(image, mask, result, properties.getRadius(), opencv_photo.INPAINT_NS);
        return result;
    }

    @Override
    public InpaintAlgorithm getAlgorithm() {
        return InpaintAlgorithm.ANISOTROPIC_DIFFUSION;
    }
}
