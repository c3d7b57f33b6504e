package com.eraser.image.support;

import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.InvalidInputException;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * {@link PixelImage} / {@link WatermarkMask} 与 OpenCV Mat 之间的互转。
 * <p>
 * 两个方向都会复制数据，返回的 Mat 与传入的缓冲互不影响。
 */
public final class MatConverter {

    private MatConverter() {
    }

    public static Mat toMat(PixelImage image) {
        int type = switch (image.getChannels()) {
            case 1 -> CV_8UC1;
            case 3 -> CV_8UC3;
            default -> CV_8UC4;
        };
        Mat mat = new Mat(image.getHeight(), image.getWidth(), type);
        mat.data().put(image.getData());
        return mat;
    }

    public static Mat toMat(WatermarkMask mask) {
        Mat mat = new Mat(mask.getHeight(), mask.getWidth(), CV_8UC1);
        mat.data().put(mask.getData());
        return mat;
    }

    public static PixelImage toPixelImage(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new InvalidInputException("图片为空");
        }
        if (mat.depth() != CV_8U) {
            throw new InvalidInputException("仅支持 8 位图片，实际 depth=" + mat.depth());
        }
        return new PixelImage(mat.cols(), mat.rows(), mat.channels(), toBytes(mat));
    }

    public static WatermarkMask toMask(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new InvalidInputException("蒙版为空");
        }
        if (mat.type() != CV_8UC1) {
            throw new InvalidInputException("蒙版必须是单通道 8 位图，实际 type=" + mat.type());
        }
        return new WatermarkMask(mat.cols(), mat.rows(), toBytes(mat));
    }

    private static byte[] toBytes(Mat mat) {
        // ROI 子视图不连续，先复制成连续内存
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        byte[] buffer = new byte[(int) (continuous.total() * continuous.channels())];
        continuous.data().get(buffer);
        return buffer;
    }
}
