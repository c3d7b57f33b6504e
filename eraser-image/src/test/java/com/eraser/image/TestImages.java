package com.eraser.image;

import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.image.config.CodecProperties;
import com.eraser.image.config.CompositorProperties;
import com.eraser.image.config.DetectionProperties;
import com.eraser.image.config.InpaintProperties;
import com.eraser.image.inpaint.AnisotropicDiffusionInpainter;
import com.eraser.image.inpaint.BlendInpainter;
import com.eraser.image.inpaint.FastMarchingInpainter;
import com.eraser.image.inpaint.InpainterFactory;
import com.eraser.image.inpaint.InpaintingEngine;
import com.eraser.image.inpaint.MultiPassInpainter;
import com.eraser.image.service.ImageCodec;
import com.eraser.image.service.PostCompositor;
import com.eraser.image.service.RegionSynthesizer;
import com.eraser.image.service.SignalExtractor;
import com.eraser.image.service.WatermarkDetector;
import com.eraser.image.service.WatermarkRemovalService;

import java.util.List;

/**
 * 测试用合成图片与手工装配的服务。
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * 纯色 BGR 图。
     */
    public static PixelImage solid(int width, int height, int b, int g, int r) {
        byte[] data = new byte[width * height * 3];
        for (int i = 0; i < width * height; i++) {
            data[i * 3] = (byte) b;
            data[i * 3 + 1] = (byte) g;
            data[i * 3 + 2] = (byte) r;
        }
        return new PixelImage(width, height, 3, data);
    }

    /**
     * 灰色背景上叠加一个实心方块（高对比度水印）。
     */
    public static PixelImage squareOnGray(int width, int height, int background,
                                          int squareX, int squareY, int size, int foreground) {
        byte[] data = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                boolean inside = x >= squareX && x < squareX + size && y >= squareY && y < squareY + size;
                byte v = (byte) (inside ? foreground : background);
                int i = (y * width + x) * 3;
                data[i] = v;
                data[i + 1] = v;
                data[i + 2] = v;
            }
        }
        return new PixelImage(width, height, 3, data);
    }

    /**
     * 三个通道都有变化的平滑渐变图。
     */
    public static PixelImage gradient(int width, int height) {
        byte[] data = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = (y * width + x) * 3;
                data[i] = (byte) (40 + x * 150 / width);
                data[i + 1] = (byte) (40 + y * 150 / height);
                data[i + 2] = (byte) (60 + (x + y) * 100 / (width + height));
            }
        }
        return new PixelImage(width, height, 3, data);
    }

    /**
     * 矩形蒙版。
     */
    public static WatermarkMask rectMask(int width, int height, int rx, int ry, int rw, int rh) {
        byte[] values = new byte[width * height];
        for (int y = ry; y < ry + rh; y++) {
            for (int x = rx; x < rx + rw; x++) {
                values[y * width + x] = (byte) 255;
            }
        }
        return new WatermarkMask(width, height, values);
    }

    public static InpaintingEngine engine(InpaintProperties properties) {
        FastMarchingInpainter telea = new FastMarchingInpainter(properties);
        AnisotropicDiffusionInpainter ns = new AnisotropicDiffusionInpainter(properties);
        InpainterFactory factory = new InpainterFactory(List.of(
                telea, ns, new BlendInpainter(telea, ns), new MultiPassInpainter(telea, properties)));
        return new InpaintingEngine(factory, properties);
    }

    public static WatermarkDetector detector(DetectionProperties properties) {
        return new WatermarkDetector(new SignalExtractor(properties), new RegionSynthesizer(properties));
    }

    public static WatermarkRemovalService removalService() {
        InpaintProperties inpaint = new InpaintProperties();
        return new WatermarkRemovalService(
                detector(new DetectionProperties()),
                engine(inpaint),
                new PostCompositor(new CompositorProperties()),
                inpaint);
    }

    public static ImageCodec codec() {
        return new ImageCodec(new CodecProperties());
    }
}
