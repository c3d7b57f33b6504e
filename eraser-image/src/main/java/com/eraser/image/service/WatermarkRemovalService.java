package com.eraser.image.service;

import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.RemovalResult;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.AlgorithmFailureException;
import com.eraser.common.exception.EraserException;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.config.InpaintProperties;
import com.eraser.image.inpaint.InpaintingEngine;
import com.eraser.image.support.MatConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

import static org.bytedeco.opencv.global.opencv_core.countNonZero;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_NEAREST;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

/**
 * 去水印对外服务。
 * <p>
 * 两个入口：
 * 1. {@link #detectAndRemove}：自动检测 -> 修复 -> 后处理；未检测到水印时原样返回
 * 2. {@link #removeWithMask}：跳过检测，使用调用方提供的蒙版（手动绘制或从文件读取）
 * <p>
 * 输入/输出都是不可变像素缓冲，调用方的图片和蒙版在调用期间被复制，不会被修改。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatermarkRemovalService {

    private final WatermarkDetector detector;
    private final InpaintingEngine engine;
    private final PostCompositor compositor;
    private final InpaintProperties properties;

    /**
     * 使用默认算法自动去水印。
     */
    public RemovalResult detectAndRemove(PixelImage image, boolean aggressive) {
        return detectAndRemove(image, properties.getDefaultAlgorithm(), aggressive);
    }

    public RemovalResult detectAndRemove(PixelImage image, InpaintAlgorithm algorithm, boolean aggressive) {
        validateImage(image);
        long start = System.currentTimeMillis();
        Mat src = MatConverter.toMat(image);
        Mat mask = runStage("水印检测", () -> detector.detect(src, aggressive));

        if (countNonZero(mask) == 0) {
            log.warn("未检测到水印区域，原图返回 ({}x{})", image.getWidth(), image.getHeight());
            return unchanged(image, algorithm, start);
        }
        return reconstruct(src, mask, algorithm, start);
    }

    /**
     * 使用默认算法按给定蒙版去水印。
     */
    public RemovalResult removeWithMask(PixelImage image, WatermarkMask mask) {
        return removeWithMask(image, mask, properties.getDefaultAlgorithm());
    }

    public RemovalResult removeWithMask(PixelImage image, WatermarkMask mask, InpaintAlgorithm algorithm) {
        validateImage(image);
        if (mask == null) {
            throw new InvalidInputException("蒙版不能为空");
        }
        long start = System.currentTimeMillis();
        if (mask.isEmpty()) {
            log.info("蒙版为空，原图返回");
            return unchanged(image, algorithm, start);
        }
        Mat src = MatConverter.toMat(image);
        Mat aligned = alignMask(MatConverter.toMat(mask), image.getWidth(), image.getHeight());
        if (countNonZero(aligned) == 0) {
            log.info("蒙版缩放后为空，原图返回");
            return unchanged(image, algorithm, start);
        }
        return reconstruct(src, aligned, algorithm, start);
    }

    /**
     * 只做检测，返回蒙版（全 0 表示未检测到）。
     */
    public WatermarkMask detect(PixelImage image, boolean aggressive) {
        validateImage(image);
        Mat src = MatConverter.toMat(image);
        return MatConverter.toMask(runStage("水印检测", () -> detector.detect(src, aggressive)));
    }

    private RemovalResult reconstruct(Mat src, Mat mask, InpaintAlgorithm algorithm, long start) {
        if (algorithm == null) {
            throw new InvalidInputException("修复算法不能为空");
        }
        Mat inpainted = engine.reconstruct(src, mask, algorithm);
        Mat composed = runStage("后处理", () -> compositor.compose(inpainted, src));

        PixelImage output = MatConverter.toPixelImage(composed);
        WatermarkMask usedMask = MatConverter.toMask(mask);
        long elapsed = System.currentTimeMillis() - start;
        log.info("去水印完成: 算法={}, 修复像素={}, 耗时 {}ms", algorithm, usedMask.getMaskedPixelCount(), elapsed);
        return RemovalResult.builder()
                .image(output)
                .mask(usedMask)
                .algorithm(algorithm)
                .watermarkFound(true)
                .maskedPixels(usedMask.getMaskedPixelCount())
                .processingTimeMs(elapsed)
                .build();
    }

    /**
     * 蒙版尺寸与图片不一致时，用最近邻插值缩放到图片尺寸；仍不一致则拒绝。
     */
    private Mat alignMask(Mat mask, int width, int height) {
        if (mask.cols() == width && mask.rows() == height) {
            return mask;
        }
        log.warn("蒙版尺寸 {}x{} 与图片 {}x{} 不一致，按最近邻缩放", mask.cols(), mask.rows(), width, height);
        Mat resized = new Mat();
        try {
            resize(mask, resized, new Size(width, height), 0, 0, INTER_NEAREST);
        } catch (RuntimeException e) {
            throw new InvalidInputException("蒙版缩放失败", e);
        }
        if (resized.cols() != width || resized.rows() != height) {
            throw new InvalidInputException("蒙版无法对齐到图片尺寸 " + width + "x" + height);
        }
        return resized;
    }

    private RemovalResult unchanged(PixelImage image, InpaintAlgorithm algorithm, long start) {
        return RemovalResult.builder()
                .image(image)
                .mask(WatermarkMask.empty(image.getWidth(), image.getHeight()))
                .algorithm(algorithm)
                .watermarkFound(false)
                .maskedPixels(0)
                .processingTimeMs(System.currentTimeMillis() - start)
                .build();
    }

    private void validateImage(PixelImage image) {
        if (image == null) {
            throw new InvalidInputException("图片不能为空");
        }
        if (image.getChannels() != PixelImage.COLOR_CHANNELS) {
            throw new InvalidInputException("仅支持三通道彩色图，实际通道数: " + image.getChannels());
        }
    }

    /**
     * 执行一个阶段，把 OpenCV 运行时错误统一包装为算法失败。
     */
    private Mat runStage(String stage, Supplier<Mat> action) {
        try {
            return action.get();
        } catch (EraserException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlgorithmFailureException(stage + "失败: " + e.getMessage(), e);
        }
    }
}
