package com.eraser.web.controller;

import com.eraser.batch.service.BatchCoordinator;
import com.eraser.batch.service.BatchService;
import com.eraser.common.dto.ApiResponse;
import com.eraser.common.dto.BatchReport;
import com.eraser.common.dto.BrushStroke;
import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.RemovalResult;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.common.util.ImageUtils;
import com.eraser.image.config.InpaintProperties;
import com.eraser.image.service.ImageCodec;
import com.eraser.image.service.WatermarkRemovalService;
import com.eraser.web.dto.AlgorithmInfo;
import com.eraser.web.dto.BatchResponse;
import com.eraser.web.dto.DetectionResponse;
import com.eraser.web.dto.RemovalResponse;
import com.eraser.web.service.StrokeMaskService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 去水印 REST API 控制器。
 * <p>
 * 支持四种方式：
 * 1. 自动检测 + 修复
 * 2. 上传蒙版图片（白色为修复区域）
 * 3. 提交画笔笔画，由服务端回放生成蒙版
 * 4. 多张图片批量处理，单张失败不影响其余图片
 */
@Slf4j
@RestController
@RequestMapping("/api/watermark")
@RequiredArgsConstructor
public class WatermarkController {

    private final WatermarkRemovalService removalService;
    private final ImageCodec codec;
    private final BatchService batchService;
    private final StrokeMaskService strokeMaskService;
    private final InpaintProperties inpaintProperties;

    /**
     * 自动检测水印并修复。
     *
     * @param algorithm  修复算法（可选，枚举名或简称 telea/ns/mixed/ai）
     * @param aggressive 是否激进扩张蒙版
     */
    @PostMapping("/remove")
    public ApiResponse<RemovalResponse> remove(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "algorithm", required = false) String algorithm,
            @RequestParam(value = "aggressive", defaultValue = "true") boolean aggressive) {

        log.info("收到去水印请求, 文件名: {}, 大小: {} bytes, algorithm: {}, aggressive: {}",
                file.getOriginalFilename(), file.getSize(), algorithm, aggressive);

        PixelImage image = codec.decode(readBytes(file));
        RemovalResult result = removalService.detectAndRemove(image, resolveAlgorithm(algorithm), aggressive);
        return ApiResponse.ok(toResponse(result, file.getOriginalFilename()),
                result.isWatermarkFound() ? "去水印完成" : "未检测到水印，返回原图");
    }

    /**
     * 使用上传的蒙版修复（蒙版按灰度读取，>= 128 为修复区域，尺寸不一致时自动缩放）。
     */
    @PostMapping("/remove-with-mask")
    public ApiResponse<RemovalResponse> removeWithMask(
            @RequestParam("file") MultipartFile file,
            @RequestParam("mask") MultipartFile mask,
            @RequestParam(value = "algorithm", required = false) String algorithm) {

        log.info("收到蒙版去水印请求, 文件名: {}, 蒙版: {}", file.getOriginalFilename(), mask.getOriginalFilename());

        PixelImage image = codec.decode(readBytes(file));
        WatermarkMask watermarkMask = codec.decodeMask(readBytes(mask));
        RemovalResult result = removalService.removeWithMask(image, watermarkMask, resolveAlgorithm(algorithm));
        return ApiResponse.ok(toResponse(result, file.getOriginalFilename()));
    }

    /**
     * 按画笔笔画生成蒙版后修复。
     *
     * @param strokes           笔画 JSON 数组 [{"x":..,"y":..,"radius":..,"polarity":"PAINT|ERASE"}]
     * @param brushRadius       笔画未指定半径时使用的画笔半径（5~100）
     * @param seedWithDetection 是否在自动检测结果上继续修改
     */
    @PostMapping("/remove-with-strokes")
    public ApiResponse<RemovalResponse> removeWithStrokes(
            @RequestParam("file") MultipartFile file,
            @RequestParam("strokes") String strokes,
            @RequestParam(value = "algorithm", required = false) String algorithm,
            @RequestParam(value = "brushRadius", required = false) Integer brushRadius,
            @RequestParam(value = "seedWithDetection", defaultValue = "false") boolean seedWithDetection,
            @RequestParam(value = "aggressive", defaultValue = "true") boolean aggressive) {

        List<BrushStroke> strokeList = strokeMaskService.parseStrokes(strokes);
        log.info("收到笔画去水印请求, 文件名: {}, 笔画数: {}", file.getOriginalFilename(), strokeList.size());

        PixelImage image = codec.decode(readBytes(file));
        WatermarkMask mask = strokeMaskService.buildMask(image, strokeList, brushRadius, seedWithDetection, aggressive);
        RemovalResult result = removalService.removeWithMask(image, mask, resolveAlgorithm(algorithm));
        return ApiResponse.ok(toResponse(result, file.getOriginalFilename()));
    }

    /**
     * 只检测不修复，返回蒙版 PNG，便于前端叠加显示后再手动修改。
     */
    @PostMapping("/detect")
    public ApiResponse<DetectionResponse> detect(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "aggressive", defaultValue = "true") boolean aggressive) {

        PixelImage image = codec.decode(readBytes(file));
        WatermarkMask mask = removalService.detect(image, aggressive);
        DetectionResponse response = DetectionResponse.builder()
                .maskBase64(ImageUtils.toBase64(codec.encodeMask(mask)))
                .watermarkFound(!mask.isEmpty())
                .maskedPixels(mask.getMaskedPixelCount())
                .coverage(mask.coverage())
                .boundingBox(mask.boundingBox())
                .build();
        return ApiResponse.ok(response);
    }

    /**
     * 批量去水印：逐张独立处理，返回汇总报告与成功图片。
     */
    @PostMapping("/batch")
    public ApiResponse<BatchResponse> batch(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "algorithm", required = false) String algorithm,
            @RequestParam(value = "aggressive", defaultValue = "true") boolean aggressive) {

        if (files == null || files.isEmpty()) {
            throw new InvalidInputException("请至少上传一张图片");
        }
        log.info("收到批量去水印请求, 图片数: {}", files.size());

        BatchCoordinator batch = batchService.newBatch().withOptions(resolveAlgorithm(algorithm), aggressive);
        List<String> names = new ArrayList<>();
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename() == null ? "image-" + names.size() : file.getOriginalFilename();
            names.add(name);
            batch.enqueue(name, readBytes(file));
        }

        BatchReport report = batch.processAll();

        List<BatchResponse.BatchImage> images = new ArrayList<>();
        for (BatchReport.ItemSummary item : report.getDone()) {
            String format = codec.formatFor(names.get(item.getIndex()));
            images.add(BatchResponse.BatchImage.builder()
                    .index(item.getIndex())
                    .name(item.getName())
                    .mimeType(ImageUtils.getMimeType("out." + format))
                    .imageBase64(ImageUtils.toBase64(codec.encode(batch.resultFor(item.getIndex()), format)))
                    .build());
        }
        String message = String.format("完成 %d 张，失败 %d 张", report.getDoneCount(), report.getFailedCount());
        return ApiResponse.ok(BatchResponse.builder().report(report).images(images).build(), message);
    }

    /**
     * 可选修复算法列表。
     */
    @GetMapping("/algorithms")
    public ApiResponse<List<AlgorithmInfo>> algorithms() {
        InpaintAlgorithm defaultAlgorithm = inpaintProperties.getDefaultAlgorithm();
        List<AlgorithmInfo> algorithms = Arrays.stream(InpaintAlgorithm.values())
                .map(a -> new AlgorithmInfo(a.name(), a.getAlias(), a.getDescription(), a == defaultAlgorithm))
                .collect(Collectors.toList());
        return ApiResponse.ok(algorithms);
    }

    // ======================== 工具方法 ========================

    private InpaintAlgorithm resolveAlgorithm(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            return inpaintProperties.getDefaultAlgorithm();
        }
        return InpaintAlgorithm.fromCode(algorithm);
    }

    private RemovalResponse toResponse(RemovalResult result, String fileName) {
        String format = codec.formatFor(fileName);
        PixelImage output = result.getImage();
        return RemovalResponse.builder()
                .imageBase64(ImageUtils.toBase64(codec.encode(output, format)))
                .mimeType(ImageUtils.getMimeType("out." + format))
                .maskBase64(result.getMask() == null ? null : ImageUtils.toBase64(codec.encodeMask(result.getMask())))
                .algorithm(result.getAlgorithm())
                .watermarkFound(result.isWatermarkFound())
                .maskedPixels(result.getMaskedPixels())
                .width(output.getWidth())
                .height(output.getHeight())
                .processingTimeMs(result.getProcessingTimeMs())
                .build();
    }

    private static byte[] readBytes(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("上传文件为空");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new InvalidInputException("读取上传文件失败: " + file.getOriginalFilename(), e);
        }
    }
}
