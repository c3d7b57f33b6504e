package com.eraser.common.util;

import java.util.Base64;
import java.util.Locale;
import java.util.Set;

/**
 * 图片编解码与文件名工具类。
 */
public final class ImageUtils {

    /** 支持处理的图片扩展名 */
    public static final Set<String> SUPPORTED_EXTENSIONS =
            Set.of("jpg", "jpeg", "png", "webp", "bmp", "tiff", "tif");

    private ImageUtils() {
    }

    public static String toBase64(byte[] imageBytes) {
        return Base64.getEncoder().encodeToString(imageBytes);
    }

    /**
     * 取小写扩展名（不含点），无扩展名返回空串。
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * 去掉扩展名后的文件名。
     */
    public static String stemOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }

    public static boolean isSupported(String fileName) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(fileName));
    }

    /**
     * 根据文件扩展名推断 MIME 类型。
     */
    public static String getMimeType(String fileName) {
        if (fileName == null) return "image/jpeg";
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) return "image/png";
        if (lower.endsWith(".bmp")) return "image/bmp";
        if (lower.endsWith(".webp")) return "image/webp";
        if (lower.endsWith(".tif") || lower.endsWith(".tiff")) return "image/tiff";
        return "image/jpeg";
    }
}
