package com.eraser.config;

import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.RemovalResult;
import com.eraser.common.exception.EraserException;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.common.util.ImageUtils;
import com.eraser.image.config.InpaintProperties;
import com.eraser.image.service.ImageCodec;
import com.eraser.image.service.WatermarkRemovalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 应用启动时，如果配置了单张图片路径，就处理这一张。
 * <p>
 * 例：--eraser.cli.input-file=/path/a.jpg --eraser.cli.mask-file=/path/a_mask.png
 * <p>
 * 未指定输出路径时写到原图旁边的 {原文件名}_no_watermark{扩展名}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SingleImageRunner implements CommandLineRunner {

    static final String OUTPUT_SUFFIX = "_no_watermark";

    private final CliProperties properties;
    private final WatermarkRemovalService removalService;
    private final ImageCodec codec;
    private final InpaintProperties inpaintProperties;

    @Override
    public void run(String... args) {
        if (properties.getInputFile() == null || properties.getInputFile().isBlank()) {
            log.debug("未配置 eraser.cli.input-file，跳过单张处理");
            return;
        }
        try {
            processImage();
        } catch (EraserException e) {
            log.error("单张处理失败: [{}] {}", e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * 处理单张图片并写出结果。
     *
     * @return 实际写入的输出路径
     */
    public Path processImage() {
        Path input = Path.of(properties.getInputFile()).toAbsolutePath().normalize();
        if (!Files.isRegularFile(input)) {
            throw new InvalidInputException("输入图片不存在: " + input);
        }
        InpaintAlgorithm algorithm = properties.getAlgorithm() != null
                ? properties.getAlgorithm() : inpaintProperties.getDefaultAlgorithm();

        PixelImage image = codec.read(input);
        RemovalResult result;
        if (properties.getMaskFile() != null && !properties.getMaskFile().isBlank()) {
            Path maskPath = Path.of(properties.getMaskFile()).toAbsolutePath().normalize();
            log.info("使用手动蒙版: {}", maskPath);
            result = removalService.removeWithMask(image, codec.readMask(maskPath), algorithm);
        } else {
            result = removalService.detectAndRemove(image, algorithm, properties.isAggressive());
        }

        Path output = resolveOutput(input);
        codec.write(result.getImage(), output);
        log.info("单张处理完成: {} -> {}, 检测到水印={}, 修复像素={}, 耗时 {}ms",
                input.getFileName(), output, result.isWatermarkFound(), result.getMaskedPixels(),
                result.getProcessingTimeMs());
        return output;
    }

    Path resolveOutput(Path input) {
        if (properties.getOutputFile() != null && !properties.getOutputFile().isBlank()) {
            return Path.of(properties.getOutputFile()).toAbsolutePath().normalize();
        }
        String fileName = input.getFileName().toString();
        String stem = ImageUtils.stemOf(fileName);
        return input.resolveSibling(stem + OUTPUT_SUFFIX + fileName.substring(stem.length()));
    }
}
