package com.eraser.image.inpaint;

import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.common.exception.AlgorithmFailureException;
import com.eraser.common.exception.EraserException;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.config.InpaintProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.global.opencv_photo;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * 图像修复引擎：校验输入 -> （可选）去噪 -> 按算法分派 -> 校验输出 -> 还原蒙版外像素。
 * <p>
 * 后置条件：只有蒙版为 255 的像素会变化，蒙版为 0 的像素与输入逐字节一致。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InpaintingEngine {

    private final InpainterFactory factory;
    private final InpaintProperties properties;

    public Mat reconstruct(Mat image, Mat mask, InpaintAlgorithm algorithm) {
        validateInput(image, mask);

        long start = System.currentTimeMillis();
        Inpainter inpainter = factory.getInpainter(algorithm);
        Mat result;
        try {
            Mat source = properties.isDenoiseEnabled() ? denoise(image) : image;
            result = inpainter.inpaint(source, mask);
        } catch (EraserException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlgorithmFailureException("修复算法 " + algorithm + " 执行失败: " + e.getMessage(), e);
        }

        if (result == null || result.empty()
                || result.cols() != image.cols() || result.rows() != image.rows()
                || result.type() != image.type()) {
            throw new AlgorithmFailureException("修复算法 " + algorithm + " 输出尺寸或类型非法");
        }

        // 蒙版外像素恢复为原输入（去噪只作用于修复的取样来源）
        Mat keep = new Mat();
        bitwise_not(mask, keep);
        image.copyTo(result, keep);

        log.info("修复完成: 算法={}, 修复像素={}, 耗时 {}ms",
                algorithm, countNonZero(mask), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 彩色非局部均值去噪，减少噪点对修复取样的干扰。
     */
    private Mat denoise(Mat image) {
        Mat denoised = new Mat();
        opencv_photo.fastNlMeansDenoisingColored(image, denoised,
                properties.getDenoiseH(), properties.getDenoiseHColor(),
                properties.getDenoiseTemplateWindowSize(), properties.getDenoiseSearchWindowSize());
        return denoised;
    }

    private void validateInput(Mat image, Mat mask) {
        if (image == null || image.empty()) {
            throw new InvalidInputException("待修复图片为空");
        }
        if (image.type() != CV_8UC3) {
            throw new InvalidInputException("待修复图片必须是三通道 8 位图，实际 type=" + image.type());
        }
        if (mask == null || mask.empty() || mask.type() != CV_8UC1) {
            throw new InvalidInputException("蒙版必须是单通道 8 位图");
        }
        if (mask.cols() != image.cols() || mask.rows() != image.rows()) {
            throw new InvalidInputException("蒙版尺寸 " + mask.cols() + "x" + mask.rows()
                    + " 与图片尺寸 " + image.cols() + "x" + image.rows() + " 不一致");
        }
    }
}
