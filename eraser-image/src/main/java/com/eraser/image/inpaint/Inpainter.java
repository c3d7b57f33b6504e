package com.eraser.image.inpaint;

import com.eraser.common.dto.InpaintAlgorithm;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * 图像修复算法接口。
 * 每种 {@link InpaintAlgorithm} 对应一个实现，由 {@link InpainterFactory} 统一分派。
 */
public interface Inpainter {

    /**
     * 用蒙版外的邻域信息重建蒙版内的像素。
     *
     * @param image BGR 三通道 8 位图，不会被修改
     * @param mask  单通道 8 位蒙版，非 0 表示需要重建
     * @return 与输入同尺寸同类型的新图
     */
    Mat inpaint(Mat image, Mat mask);

    /**
     * 对应的算法类型。
     */
    InpaintAlgorithm getAlgorithm();
}
