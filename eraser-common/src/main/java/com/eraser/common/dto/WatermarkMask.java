package com.eraser.common.dto;

import com.eraser.common.exception.InvalidInputException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * 不可变的二值蒙版：255 表示需要修复，0 表示保留原像素。
 * <p>
 * 构造时按 {@code >= 128} 归一化为 0/255，与从磁盘读取的灰度蒙版约定一致。
 */
@Getter
public final class WatermarkMask {

    public static final int MASKED = 255;

    public static final int KEEP = 0;

    /** 灰度值不低于该值视为需要修复 */
    public static final int MASKED_THRESHOLD = 128;

    private final int width;

    private final int height;

    @Getter(lombok.AccessLevel.NONE)
    private final byte[] data;

    private final long maskedPixelCount;

    public WatermarkMask(int width, int height, byte[] values) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("蒙版尺寸非法: " + width + "x" + height);
        }
        if (values == null || values.length != width * height) {
            throw new InvalidInputException("蒙版数据长度与尺寸不符: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.data = new byte[values.length];
        long count = 0;
        for (int i = 0; i < values.length; i++) {
            if ((values[i] & 0xFF) >= MASKED_THRESHOLD) {
                data[i] = (byte) MASKED;
                count++;
            }
        }
        this.maskedPixelCount = count;
    }

    /**
     * 全 0 蒙版（无需修复）。
     */
    public static WatermarkMask empty(int width, int height) {
        return new WatermarkMask(width, height, new byte[width * height]);
    }

    /**
     * 全 255 蒙版（整图重建）。
     */
    public static WatermarkMask full(int width, int height) {
        byte[] values = new byte[width * height];
        Arrays.fill(values, (byte) MASKED);
        return new WatermarkMask(width, height, values);
    }

    public boolean isMasked(int x, int y) {
        return data[y * width + x] != 0;
    }

    public boolean isEmpty() {
        return maskedPixelCount == 0;
    }

    public boolean matches(PixelImage image) {
        return image.sameSize(width, height);
    }

    /**
     * 蒙版覆盖率 (0-1)。
     */
    public double coverage() {
        return (double) maskedPixelCount / ((long) width * height);
    }

    /**
     * 返回蒙版数据副本（0/255）。
     */
    public byte[] getData() {
        return data.clone();
    }

    /**
     * 被标记像素的外接矩形，空蒙版返回 null。
     */
    public Region boundingBox() {
        if (isEmpty()) {
            return null;
        }
        int minX = width, minY = height, maxX = -1, maxY = -1;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                if (data[row + x] != 0) {
                    if (x < minX) minX = x;
                    if (x > maxX) maxX = x;
                    if (y < minY) minY = y;
                    if (y > maxY) maxY = y;
                }
            }
        }
        return new Region(minX, minY, maxX - minX + 1, maxY - minY + 1);
    }

    /**
     * 轴对齐矩形区域。
     */
    @Getter
    @AllArgsConstructor
    public static final class Region {

        private final int x;

        private final int y;

        private final int width;

        private final int height;

        public long area() {
            return (long) width * height;
        }

        /**
         * 交并比 (IoU)。
         */
        public double iou(Region other) {
            int ix = Math.max(0, Math.min(x + width, other.x + other.width) - Math.max(x, other.x));
            int iy = Math.max(0, Math.min(y + height, other.y + other.height) - Math.max(y, other.y));
            long inter = (long) ix * iy;
            long union = area() + other.area() - inter;
            return union == 0 ? 0 : (double) inter / union;
        }

        @Override
        public String toString() {
            return "(" + x + "," + y + " " + width + "x" + height + ")";
        }
    }
}
