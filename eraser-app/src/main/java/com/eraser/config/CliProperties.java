package com.eraser.config;

import com.eraser.common.dto.InpaintAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 命令行模式配置项：单张图片或整个目录。
 */
@Data
@ConfigurationProperties(prefix = "eraser.cli")
public class CliProperties {

    /** 输入目录，为空时不启用目录批处理 */
    private String inputDir;

    /** 输出目录，为空时为 {输入目录}/watermark_removed */
    private String outputDir;

    /** 手动蒙版目录，文件名为 {原文件名}_mask{扩展名}，找不到时自动检测 */
    private String maskDir;

    /** 是否递归处理子目录 */
    private boolean recursive = false;

    /** 单张图片路径，为空时不启用单张处理 */
    private String inputFile;

    /** 单张图片的手动蒙版，为空时自动检测 */
    private String maskFile;

    /** 单张图片的输出路径，为空时为 {原文件名}_no_watermark{扩展名} */
    private String outputFile;

    /** 修复算法，为空时使用 eraser.inpaint.default-algorithm */
    private InpaintAlgorithm algorithm;

    /** 单张自动检测时是否使用激进模式 */
    private boolean aggressive = true;
}
