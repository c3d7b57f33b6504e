package com.eraser.common.dto;

import com.eraser.common.exception.InvalidInputException;
import lombok.Getter;

import java.util.Arrays;

/**
 * 不可变的 8 位像素缓冲。
 * <p>
 * 数据按行优先紧密排列（stride = width * channels），彩色图通道顺序为 BGR。
 * 构造和读取时都会复制底层数组，流水线各阶段之间不共享同一块缓冲。
 */
@Getter
public final class PixelImage {

    /** 流水线要求的彩色通道数 */
    public static final int COLOR_CHANNELS = 3;

    private final int width;

    private final int height;

    private final int channels;

    @Getter(lombok.AccessLevel.NONE)
    private final byte[] data;

    public PixelImage(int width, int height, int channels, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("图片尺寸非法: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new InvalidInputException("不支持的通道数: " + channels);
        }
        if (data == null || data.length != width * height * channels) {
            throw new InvalidInputException("像素数据长度与尺寸不符: 期望 "
                    + ((long) width * height * channels) + ", 实际 " + (data == null ? 0 : data.length));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data.clone();
    }

    /**
     * 行跨度（字节）。
     */
    public int getStride() {
        return width * channels;
    }

    /**
     * 返回像素数据的副本。
     */
    public byte[] getData() {
        return data.clone();
    }

    /**
     * 读取单个通道值 (0-255)。
     */
    public int get(int x, int y, int channel) {
        return data[(y * width + x) * channels + channel] & 0xFF;
    }

    public boolean sameSize(int otherWidth, int otherHeight) {
        return width == otherWidth && height == otherHeight;
    }

    /**
     * 像素级完全一致（尺寸、通道、数据）。
     */
    public boolean contentEquals(PixelImage other) {
        return other != null
                && width == other.width
                && height == other.height
                && channels == other.channels
                && Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return "PixelImage[" + width + "x" + height + "x" + channels + "]";
    }
}
