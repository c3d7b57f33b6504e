package com.eraser.config;

import com.eraser.batch.service.BatchCoordinator;
import com.eraser.batch.service.BatchService;
import com.eraser.common.dto.BatchReport;
import com.eraser.common.exception.EraserException;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.common.util.ImageUtils;
import com.eraser.image.service.ImageCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 应用启动时，如果配置了输入目录，就把目录下所有图片跑一遍去水印。
 * <p>
 * 配置方式（在 application.yml 中）：
 * eraser.cli.input-dir=/path/to/images
 * <p>
 * 或通过命令行参数：--eraser.cli.input-dir=/path/to/images --eraser.cli.recursive=true
 * <p>
 * 输出保持相对目录结构；单张图片失败只记录日志，不影响其他图片。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchDirectoryRunner implements CommandLineRunner {

    static final String DEFAULT_OUTPUT_DIR = "watermark_removed";

    static final String MASK_SUFFIX = "_mask";

    private final CliProperties properties;
    private final BatchService batchService;
    private final ImageCodec codec;

    @Override
    public void run(String... args) {
        if (properties.getInputDir() == null || properties.getInputDir().isBlank()) {
            log.debug("未配置 eraser.cli.input-dir，跳过目录批处理");
            return;
        }
        try {
            processDirectory();
        } catch (EraserException e) {
            log.error("目录批处理失败: [{}] {}", e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * 处理输入目录。
     *
     * @return 批处理报告
     */
    public BatchReport processDirectory() {
        Path inputDir = Path.of(properties.getInputDir()).toAbsolutePath().normalize();
        if (!Files.isDirectory(inputDir)) {
            throw new InvalidInputException("输入目录不存在: " + inputDir);
        }
        Path outputDir = properties.getOutputDir() == null || properties.getOutputDir().isBlank()
                ? inputDir.resolve(DEFAULT_OUTPUT_DIR)
                : Path.of(properties.getOutputDir()).toAbsolutePath().normalize();
        Path maskDir = properties.getMaskDir() == null || properties.getMaskDir().isBlank()
                ? null : Path.of(properties.getMaskDir()).toAbsolutePath().normalize();

        List<Path> images = collectImages(inputDir, outputDir, maskDir);
        log.info("目录批处理: 输入 {}, 输出 {}, 图片 {} 张, recursive={}",
                inputDir, outputDir, images.size(), properties.isRecursive());

        BatchCoordinator batch = batchService.newBatch();
        Map<Integer, Path> relativePaths = new HashMap<>();
        for (Path image : images) {
            Path mask = findMask(maskDir, image);
            if (mask != null) {
                log.debug("使用手动蒙版: {} -> {}", image.getFileName(), mask.getFileName());
            }
            relativePaths.put(batch.enqueue(image, mask), inputDir.relativize(image));
        }

        BatchReport report = batch.processAll();

        int written = 0;
        for (BatchReport.ItemSummary item : report.getDone()) {
            Path target = outputDir.resolve(relativePaths.get(item.getIndex()));
            try {
                codec.write(batch.resultFor(item.getIndex()), target);
                written++;
            } catch (EraserException e) {
                log.warn("写入结果失败: {} ({})", target, e.getMessage());
            }
        }
        for (BatchReport.ItemSummary item : report.getFailed()) {
            log.warn("处理失败: {} [{}] {}", item.getName(), item.getErrorCode(), item.getErrorMessage());
        }
        log.info("目录批处理完成: 成功 {}, 失败 {}, 已写入 {} -> {}",
                report.getDoneCount(), report.getFailedCount(), written, outputDir);
        return report;
    }

    /**
     * 收集支持的图片，跳过输出目录、蒙版目录以及 *_mask 文件。
     */
    List<Path> collectImages(Path inputDir, Path outputDir, Path maskDir) {
        int depth = properties.isRecursive() ? Integer.MAX_VALUE : 1;
        try (Stream<Path> stream = Files.walk(inputDir, depth)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> !p.startsWith(outputDir))
                    .filter(p -> maskDir == null || !p.startsWith(maskDir))
                    .filter(p -> ImageUtils.isSupported(p.getFileName().toString()))
                    .filter(p -> !ImageUtils.stemOf(p.getFileName().toString()).endsWith(MASK_SUFFIX))
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new InvalidInputException("读取输入目录失败: " + inputDir, e);
        }
    }

    /**
     * 蒙版文件名为 {原文件名}_mask{原扩展名}，找不到时再找同名 PNG。
     */
    Path findMask(Path maskDir, Path image) {
        if (maskDir == null) {
            return null;
        }
        String fileName = image.getFileName().toString();
        String stem = ImageUtils.stemOf(fileName);
        String suffix = fileName.substring(stem.length());
        Path sameExt = maskDir.resolve(stem + MASK_SUFFIX + suffix);
        if (Files.isRegularFile(sameExt)) {
            return sameExt;
        }
        Path png = maskDir.resolve(stem + MASK_SUFFIX + ".png");
        return Files.isRegularFile(png) ? png : null;
    }
}
