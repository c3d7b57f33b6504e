package com.eraser.image.service;

import com.eraser.image.config.DetectionProperties;
import com.eraser.image.model.SignalMaps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 信号提取服务：对灰度图做五路互相独立的逐像素分析。
 * <p>
 * 每路输出都是同尺寸的单通道 8 位二值图 (0/255)，任何一路都不修改输入。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalExtractor {

    private final DetectionProperties properties;

    /**
     * 灰度化处理。
     */
    public Mat toGrayscale(Mat src) {
        if (src.channels() == 1) {
            return src.clone();
        }
        Mat gray = new Mat();
        cvtColor(src, gray, src.channels() == 4 ? COLOR_BGRA2GRAY : COLOR_BGR2GRAY);
        return gray;
    }

    /**
     * 一次提取全部五路信号。
     */
    public SignalMaps extractAll(Mat gray) {
        SignalMaps maps = new SignalMaps(
                edgeResponse(gray),
                highFrequencyResponse(gray),
                varianceResponse(gray),
                outlierResponse(gray),
                cornerResponse(gray));
        if (log.isDebugEnabled()) {
            log.debug("信号像素数: edge={}, freq={}, var={}, outlier={}, corner={}",
                    countNonZero(maps.getEdges()), countNonZero(maps.getHighFrequency()),
                    countNonZero(maps.getVariance()), countNonZero(maps.getOutliers()),
                    countNonZero(maps.getCorners()));
        }
        return maps;
    }

    /**
     * 边缘响应：Canny 检测硬边（文字/Logo 轮廓），再用小矩形核膨胀连接笔画间隙。
     */
    public Mat edgeResponse(Mat gray) {
        Mat edges = new Mat();
        Canny(gray, edges, properties.getCannyLowThreshold(), properties.getCannyHighThreshold());
        int k = properties.getEdgeDilateKernelSize();
        Mat kernel = getStructuringElement(MORPH_RECT, new Size(k, k));
        Mat dilated = new Mat();
        dilate(edges, dilated, kernel);
        return dilated;
    }

    /**
     * 高频响应：拉普拉斯绝对值超过阈值的位置，对应叠加层造成的纹理突变。
     */
    public Mat highFrequencyResponse(Mat gray) {
        Mat laplacian = new Mat();
        Laplacian(gray, laplacian, CV_64F);
        Mat magnitude = new Mat();
        convertScaleAbs(laplacian, magnitude);
        Mat mask = new Mat();
        threshold(magnitude, mask, properties.getLaplacianThreshold(), 255, THRESH_BINARY);
        return mask;
    }

    /**
     * 局部方差响应：原图与高斯模糊图之差，捕捉边缘检测漏掉的半透明叠加。
     */
    public Mat varianceResponse(Mat gray) {
        int k = properties.getVarianceBlurKernelSize();
        Mat blurred = new Mat();
        GaussianBlur(gray, blurred, new Size(k, k), 0);
        Mat diff = new Mat();
        absdiff(gray, blurred, diff);
        Mat mask = new Mat();
        threshold(diff, mask, properties.getVarianceThreshold(), 255, THRESH_BINARY);
        return mask;
    }

    /**
     * 统计离群点：偏离全局均值超过 N 倍标准差的过亮/过暗像素。
     */
    public Mat outlierResponse(Mat gray) {
        Mat meanMat = new Mat();
        Mat stdMat = new Mat();
        meanStdDev(gray, meanMat, stdMat);
        double mean;
        double std;
        try (DoubleIndexer meanIdx = meanMat.createIndexer();
             DoubleIndexer stdIdx = stdMat.createIndexer()) {
            mean = meanIdx.get(0);
            std = stdIdx.get(0);
        }

        double lower = mean - properties.getOutlierStdFactor() * std;
        double upper = mean + properties.getOutlierStdFactor() * std;

        // 过暗：gray < lower。8 位图上 THRESH_BINARY_INV 取 <= floor(t)，换算成严格小于
        Mat dark = new Mat();
        threshold(gray, dark, Math.ceil(lower) - 1, 255, THRESH_BINARY_INV);
        // 过亮：gray > upper
        Mat bright = new Mat();
        threshold(gray, bright, upper, 255, THRESH_BINARY);

        Mat outliers = new Mat();
        bitwise_or(dark, bright, outliers);
        return outliers;
    }

    /**
     * 角点响应：Harris 角点膨胀后按自身最大值的比例阈值化，Logo 类图形角点密集。
     */
    public Mat cornerResponse(Mat gray) {
        Mat grayF = new Mat();
        gray.convertTo(grayF, CV_32F);
        Mat harris = new Mat();
        cornerHarris(grayF, harris, properties.getHarrisBlockSize(),
                properties.getHarrisApertureSize(), properties.getHarrisK());
        dilate(harris, harris, new Mat());

        DoublePointer minVal = new DoublePointer(1);
        DoublePointer maxVal = new DoublePointer(1);
        minMaxLoc(harris, minVal, maxVal, (Point) null, (Point) null, (Mat) null);
        double max = maxVal.get();
        minVal.deallocate();
        maxVal.deallocate();

        Mat corners = new Mat(gray.rows(), gray.cols(), CV_8UC1, new Scalar(0.0));
        if (max <= 0) {
            // 平坦图没有正的角点响应
            return corners;
        }
        Mat thresholded = new Mat();
        threshold(harris, thresholded, properties.getCornerQualityRatio() * max, 255, THRESH_BINARY);
        thresholded.convertTo(corners, CV_8U);
        return corners;
    }
}
