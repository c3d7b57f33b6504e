package com.eraser.image.service;

import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.config.DetectionProperties;
import com.eraser.image.model.SignalMaps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.IntIndexer;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 区域合成服务：把五路信号融合为一张二值蒙版。
 * <p>
 * 流程：
 * 1. 五路信号按位或
 * 2. 乘以位置权重（四角、中央是水印常见位置）并截断到 [0,255]
 * 3. 固定阈值二值化
 * 4. 闭运算连接碎片，开运算去除孤立噪点
 * 5. 去除面积过小的连通域
 * 6. 激进模式下再膨胀一次，宁可多修几个像素也不要留下水印残边
 * <p>
 * 最终没有任何区域时返回全 0 蒙版，不抛异常。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegionSynthesizer {

    private final DetectionProperties properties;

    public Mat synthesize(SignalMaps maps, boolean aggressive) {
        int width = maps.width();
        int height = maps.height();
        for (Mat signal : maps.all()) {
            if (signal.cols() != width || signal.rows() != height || signal.type() != CV_8UC1) {
                throw new InvalidInputException("信号图尺寸或类型不一致: "
                        + signal.cols() + "x" + signal.rows() + " type=" + signal.type());
            }
        }

        // === 第1步：融合 ===
        Mat combined = combine(maps);

        // === 第2步：位置加权 ===
        Mat weighted = applyWeights(combined, weightMap(width, height));

        // === 第3步：二值化 ===
        Mat binary = new Mat();
        threshold(weighted, binary, properties.getBinaryThreshold(), 255, THRESH_BINARY);

        // === 第4步：形态学清理 ===
        Mat cleaned = cleanUp(binary);

        // === 第5步：去除小连通域 ===
        long minArea = removeSmallRegions(cleaned);

        int remaining = countNonZero(cleaned);
        if (remaining == 0) {
            log.info("区域合成完成：未发现候选区域 (最小面积={})", minArea);
            return cleaned;
        }

        // === 第6步：激进模式扩张 ===
        if (aggressive) {
            cleaned = expand(cleaned);
        }

        log.info("区域合成完成：蒙版像素 {} / {} ({}%), aggressive={}",
                countNonZero(cleaned), (long) width * height,
                String.format("%.2f", 100.0 * countNonZero(cleaned) / ((double) width * height)),
                aggressive);
        return cleaned;
    }

    /**
     * 五路信号按位或。
     */
    public Mat combine(SignalMaps maps) {
        Mat combined = maps.getEdges().clone();
        for (Mat signal : maps.all()) {
            bitwise_or(combined, signal, combined);
        }
        return combined;
    }

    /**
     * 位置权重图：基础权重，四角（宽高各 1/4）加权，中央 1/3 区域加权。
     * 中央区域在四角之后写入，两者重叠时以中央为准。
     */
    public Mat weightMap(int width, int height) {
        Mat weights = new Mat(height, width, CV_32FC1, new Scalar(properties.getBaseWeight()));

        int cornerH = height / 4;
        int cornerW = width / 4;
        if (cornerH > 0 && cornerW > 0) {
            Scalar cornerWeight = new Scalar(properties.getCornerWeight());
            new Mat(weights, new Rect(0, 0, cornerW, cornerH)).put(cornerWeight);
            new Mat(weights, new Rect(width - cornerW, 0, cornerW, cornerH)).put(cornerWeight);
            new Mat(weights, new Rect(0, height - cornerH, cornerW, cornerH)).put(cornerWeight);
            new Mat(weights, new Rect(width - cornerW, height - cornerH, cornerW, cornerH)).put(cornerWeight);
        }

        int cx = width / 3;
        int cy = height / 3;
        int cw = 2 * width / 3 - cx;
        int ch = 2 * height / 3 - cy;
        if (cw > 0 && ch > 0) {
            new Mat(weights, new Rect(cx, cy, cw, ch)).put(new Scalar(properties.getCenterWeight()));
        }
        return weights;
    }

    private Mat applyWeights(Mat combined, Mat weights) {
        Mat combinedF = new Mat();
        combined.convertTo(combinedF, CV_32F);
        multiply(combinedF, weights, combinedF);
        // convertTo 到 8 位时自动饱和截断到 [0,255]
        Mat weighted = new Mat();
        combinedF.convertTo(weighted, CV_8U);
        return weighted;
    }

    /**
     * 闭运算（连接相近碎片）后开运算（去除孤立噪点）。
     */
    public Mat cleanUp(Mat binary) {
        int k = properties.getMorphKernelSize();
        Mat kernel = getStructuringElement(MORPH_ELLIPSE, new Size(k, k));
        Mat closed = new Mat();
        morphologyEx(binary, closed, MORPH_CLOSE, kernel, new Point(-1, -1),
                properties.getCloseIterations(), BORDER_CONSTANT, morphologyDefaultBorderValue());
        Mat opened = new Mat();
        morphologyEx(closed, opened, MORPH_OPEN, kernel, new Point(-1, -1),
                properties.getOpenIterations(), BORDER_CONSTANT, morphologyDefaultBorderValue());
        return opened;
    }

    /**
     * 原地清除面积小于阈值的 8 连通域。
     *
     * @return 使用的最小面积阈值（像素）
     */
    public long removeSmallRegions(Mat mask) {
        double minArea = (double) mask.cols() * mask.rows() * properties.getMinRegionAreaRatio();

        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        int count = connectedComponentsWithStats(mask, labels, stats, centroids, 8, CV_32S);

        boolean[] drop = new boolean[count];
        int dropped = 0;
        try (IntIndexer statIdx = stats.createIndexer()) {
            // label 0 是背景
            for (int i = 1; i < count; i++) {
                if (statIdx.get(i, CC_STAT_AREA) < minArea) {
                    drop[i] = true;
                    dropped++;
                }
            }
        }

        if (dropped > 0) {
            try (IntIndexer labelIdx = labels.createIndexer();
                 UByteIndexer maskIdx = mask.createIndexer()) {
                for (int y = 0; y < mask.rows(); y++) {
                    for (int x = 0; x < mask.cols(); x++) {
                        if (drop[labelIdx.get(y, x)]) {
                            maskIdx.put(y, x, 0);
                        }
                    }
                }
            }
        }
        log.debug("连通域 {} 个，去除小区域 {} 个 (最小面积={})", count - 1, dropped, (long) Math.ceil(minArea));
        return (long) Math.ceil(minArea);
    }

    /**
     * 激进模式：椭圆核膨胀，保证覆盖水印的柔和边缘。
     */
    public Mat expand(Mat mask) {
        int k = properties.getAggressiveKernelSize();
        Mat kernel = getStructuringElement(MORPH_ELLIPSE, new Size(k, k));
        Mat dilated = new Mat();
        dilate(mask, dilated, kernel, new Point(-1, -1), properties.getAggressiveIterations(),
                BORDER_CONSTANT, morphologyDefaultBorderValue());
        return dilated;
    }
}
