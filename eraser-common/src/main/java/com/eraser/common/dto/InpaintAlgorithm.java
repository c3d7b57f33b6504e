package com.eraser.common.dto;

import com.eraser.common.exception.InvalidInputException;

import java.util.Arrays;

/**
 * 修复算法选择。简称与早期版本的模式名保持一致（telea / ns / mixed / ai）。
 */
public enum InpaintAlgorithm {

    FAST_MARCHING("telea", "快速行进法，速度快，适合细线水印"),

    ANISOTROPIC_DIFFUSION("ns", "各向异性扩散，较慢，保留大尺度纹理"),

    BLEND("mixed", "两种算法结果平均，通用默认选择"),

    MULTI_PASS_ENHANCED("ai", "快速行进法多遍增强，适合较重的水印");

    private final String alias;

    private final String description;

    InpaintAlgorithm(String alias, String description) {
        this.alias = alias;
        this.description = description;
    }

    public String getAlias() {
        return alias;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 按枚举名或简称解析（不区分大小写，支持 '-' 与 '_'）。
     */
    public static InpaintAlgorithm fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidInputException("修复算法不能为空");
        }
        String normalized = code.trim().replace('-', '_');
        return Arrays.stream(values())
                .filter(a -> a.name().equalsIgnoreCase(normalized) || a.alias.equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidInputException(
                        "未知的修复算法: " + code + "，可选: telea, ns, mixed, ai"));
    }
}
