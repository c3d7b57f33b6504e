package com.eraser.batch.model;

import com.eraser.common.dto.BatchItemStatus;
import com.eraser.common.dto.BatchReport;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.RemovalResult;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.EraserException;
import lombok.Getter;

import java.util.function.Supplier;

/**
 * 批处理队列中的一项。
 * <p>
 * 图片和蒙版都是延迟加载的：字节或文件在真正处理时才解码，解码失败只影响这一项。
 * 状态只由 {@code BatchCoordinator} 修改，PROCESSING 到终态之间由唯一的工作线程持有。
 */
@Getter
public class BatchItem {

    private final int index;

    private final String name;

    @Getter(lombok.AccessLevel.NONE)
    private final Supplier<PixelImage> imageLoader;

    /** 手动蒙版，null 表示自动检测 */
    @Getter(lombok.AccessLevel.NONE)
    private final Supplier<WatermarkMask> maskLoader;

    private volatile BatchItemStatus status = BatchItemStatus.PENDING;

    private volatile RemovalResult result;

    private volatile EraserException error;

    private volatile long processingTimeMs;

    public BatchItem(int index, String name, Supplier<PixelImage> imageLoader, Supplier<WatermarkMask> maskLoader) {
        this.index = index;
        this.name = name;
        this.imageLoader = imageLoader;
        this.maskLoader = maskLoader;
    }

    public boolean hasManualMask() {
        return maskLoader != null;
    }

    public PixelImage loadImage() {
        return imageLoader.get();
    }

    public WatermarkMask loadMask() {
        return maskLoader == null ? null : maskLoader.get();
    }

    public void markProcessing() {
        this.status = BatchItemStatus.PROCESSING;
    }

    public void markDone(RemovalResult result, long elapsedMs) {
        this.result = result;
        this.processingTimeMs = elapsedMs;
        this.status = BatchItemStatus.DONE;
    }

    public void markFailed(EraserException error, long elapsedMs) {
        this.error = error;
        this.processingTimeMs = elapsedMs;
        this.status = BatchItemStatus.FAILED;
    }

    public BatchReport.ItemSummary toSummary() {
        BatchReport.ItemSummary.ItemSummaryBuilder builder = BatchReport.ItemSummary.builder()
                .index(index)
                .name(name)
                .status(status)
                .processingTimeMs(processingTimeMs);
        if (result != null) {
            builder.watermarkFound(result.isWatermarkFound());
        }
        if (error != null) {
            builder.errorCode(error.getErrorCode()).errorMessage(error.getMessage());
        }
        return builder.build();
    }
}
