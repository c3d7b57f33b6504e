package com.eraser.image.service;

import com.eraser.common.exception.AlgorithmFailureException;
import com.eraser.image.config.CompositorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.springframework.stereotype.Service;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.filter2D;

/**
 * 修复结果后处理：轻度锐化 -> 与未锐化结果混合 -> 逐通道均值/标准差匹配原图。
 * <p>
 * 颜色匹配作用于整张图而不是只作用于蒙版区域，修复算法带来的整体亮度/对比度漂移
 * 由一次全局仿射校正抵消，不需要单独在蒙版边界做羽化。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostCompositor {

    private final CompositorProperties properties;

    public Mat compose(Mat reconstructed, Mat original) {
        if (reconstructed.cols() != original.cols() || reconstructed.rows() != original.rows()
                || reconstructed.type() != original.type()) {
            throw new AlgorithmFailureException("修复结果与原图尺寸或类型不一致");
        }

        Mat sharpened = new Mat();
        filter2D(reconstructed, sharpened, -1, sharpenKernel());

        double weight = properties.getSharpenBlendWeight();
        Mat blended = new Mat();
        addWeighted(reconstructed, 1.0 - weight, sharpened, weight, 0, blended);

        Mat result = properties.isColorMatchEnabled() ? matchColorDistribution(blended, original) : blended;
        if (result.cols() != original.cols() || result.rows() != original.rows()
                || result.type() != original.type()) {
            throw new AlgorithmFailureException("后处理输出尺寸或类型非法");
        }
        return result;
    }

    /**
     * 逐通道仿射变换：把 result 每个通道的均值/标准差拉到与 original 一致。
     * result 某通道标准差为 0 时只平移均值。
     */
    public Mat matchColorDistribution(Mat result, Mat original) {
        double[][] resultStats = channelStats(result);
        double[][] originalStats = channelStats(original);

        MatVector channels = new MatVector();
        split(result, channels);
        for (int c = 0; c < channels.size(); c++) {
            double resultMean = resultStats[0][c];
            double resultStd = resultStats[1][c];
            double scale = resultStd > 0 ? originalStats[1][c] / resultStd : 1.0;
            double shift = originalStats[0][c] - resultMean * scale;
            // 8 位输出自动四舍五入并截断到 [0,255]
            Mat adjusted = new Mat();
            channels.get(c).convertTo(adjusted, -1, scale, shift);
            channels.put(c, adjusted);
        }

        Mat matched = new Mat();
        merge(channels, matched);
        log.debug("颜色分布匹配完成: 原图均值={}, 结果均值={}",
                Arrays.toString(originalStats[0]), Arrays.toString(resultStats[0]));
        return matched;
    }

    /**
     * [[-1,-1,-1],[-1,9,-1],[-1,-1,-1]] * scale
     */
    private Mat sharpenKernel() {
        double scale = properties.getSharpenKernelScale();
        Mat kernel = new Mat(3, 3, CV_32F, new Scalar(-scale));
        try (FloatIndexer idx = kernel.createIndexer()) {
            idx.put(1, 1, (float) (9 * scale));
        }
        return kernel;
    }

    /**
     * @return [0] 各通道均值, [1] 各通道标准差
     */
    private double[][] channelStats(Mat image) {
        Mat meanMat = new Mat();
        Mat stdMat = new Mat();
        meanStdDev(image, meanMat, stdMat);
        int n = image.channels();
        double[][] stats = new double[2][n];
        try (DoubleIndexer meanIdx = meanMat.createIndexer();
             DoubleIndexer stdIdx = stdMat.createIndexer()) {
            for (int c = 0; c < n; c++) {
                stats[0][c] = meanIdx.get(c);
                stats[1][c] = stdIdx.get(c);
            }
        }
        return stats;
    }
}
