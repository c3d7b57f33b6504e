package com.eraser.image.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

/**
 * 五路检测信号，每路都是与灰度图同尺寸的单通道 8 位图 (0/255)。
 * 合成蒙版后即丢弃。
 */
@Getter
@AllArgsConstructor
public class SignalMaps {

    /** 边缘响应（Canny + 膨胀） */
    private final Mat edges;

    /** 高频响应（拉普拉斯） */
    private final Mat highFrequency;

    /** 局部方差响应（原图 - 模糊图） */
    private final Mat variance;

    /** 全局统计离群点 */
    private final Mat outliers;

    /** 角点密度（Harris） */
    private final Mat corners;

    public List<Mat> all() {
        return List.of(edges, highFrequency, variance, outliers, corners);
    }

    public int width() {
        return edges.cols();
    }

    public int height() {
        return edges.rows();
    }
}
