package com.eraser.image.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 水印自动检测相关配置。
 * <p>
 * 这些阈值都是经验值，默认值沿用实际观测到的效果，不同图片领域可能需要重新调整。
 */
@Data
@ConfigurationProperties(prefix = "eraser.detection")
public class DetectionProperties {

    // ==================== 信号提取 ====================

    /** Canny 低阈值 */
    private double cannyLowThreshold = 30;

    /** Canny 高阈值 */
    private double cannyHighThreshold = 100;

    /** 边缘膨胀核大小（矩形），用于连接笔画间隙 */
    private int edgeDilateKernelSize = 3;

    /** 拉普拉斯响应阈值（高频突变） */
    private double laplacianThreshold = 20;

    /** 局部方差检测的高斯模糊核大小（必须为奇数） */
    private int varianceBlurKernelSize = 5;

    /** 原图与模糊图差值阈值（半透明叠加） */
    private double varianceThreshold = 15;

    /** 全局离群点判定的标准差倍数 */
    private double outlierStdFactor = 1.5;

    /** Harris 角点邻域大小 */
    private int harrisBlockSize = 2;

    /** Harris Sobel 孔径 */
    private int harrisApertureSize = 3;

    /** Harris 自由参数 k */
    private double harrisK = 0.04;

    /** 角点响应相对最大值的比例阈值 */
    private double cornerQualityRatio = 0.01;

    // ==================== 区域合成 ====================

    /** 位置权重：基础值 */
    private double baseWeight = 1.0;

    /** 位置权重：四个角（各占宽高的 1/4） */
    private double cornerWeight = 1.5;

    /** 位置权重：中央 1/3 区域 */
    private double centerWeight = 1.2;

    /** 加权后二值化阈值 */
    private double binaryThreshold = 50;

    /** 形态学核大小（椭圆） */
    private int morphKernelSize = 5;

    /** 闭运算迭代次数 */
    private int closeIterations = 2;

    /** 开运算迭代次数 */
    private int openIterations = 1;

    /** 最小连通域面积占图片总面积的比例，低于此值视为噪点 */
    private double minRegionAreaRatio = 0.0001;

    /** 激进模式膨胀核大小（椭圆） */
    private int aggressiveKernelSize = 7;

    /** 激进模式膨胀迭代次数 */
    private int aggressiveIterations = 2;
}
