package com.eraser.image.inpaint;

import com.eraser.common.dto.InpaintAlgorithm;
import lombok.RequiredArgsConstructor;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Component;

import static org.bytedeco.opencv.global.opencv_core.addWeighted;

/**
 * 混合模式：两种算法各自独立修复，逐像素等权平均。
 */
@Component
@RequiredArgsConstructor
public class BlendInpainter implements Inpainter {

    private final FastMarchingInpainter fastMarching;
    private final AnisotropicDiffusionInpainter diffusion;

    @Override
    public Mat inpaint(Mat image, Mat mask) {
        Mat telea = fastMarching.inpaint(image, mask);
        Mat ns = diffusion.inpaint(image, mask);
        Mat blended = new Mat();
        addWeighted(telea, 0.5, ns, 0.5, 0, blended);
        return blended;
    }

    @Override
    public InpaintAlgorithm getAlgorithm() {
        return InpaintAlgorithm.BLEND;
    }
}
