package com.eraser.image.service;

import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.image.model.SignalMaps;
import com.eraser.image.support.MatConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

/**
 * 水印自动检测：灰度化 -> 五路信号提取 -> 区域合成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatermarkDetector {

    private final SignalExtractor extractor;
    private final RegionSynthesizer synthesizer;

    public WatermarkMask detect(PixelImage image, boolean aggressive) {
        return MatConverter.toMask(detect(MatConverter.toMat(image), aggressive));
    }

    /**
     * 对 BGR 图片生成二值蒙版（CV_8UC1，0/255）。
     */
    public Mat detect(Mat bgr, boolean aggressive) {
        long start = System.currentTimeMillis();
        Mat gray = extractor.toGrayscale(bgr);
        SignalMaps maps = extractor.extractAll(gray);
        Mat mask = synthesizer.synthesize(maps, aggressive);
        log.info("水印检测耗时 {}ms ({}x{})", System.currentTimeMillis() - start, bgr.cols(), bgr.rows());
        return mask;
    }
}
