package com.eraser.batch.service;

import com.eraser.batch.config.BatchProperties;
import com.eraser.batch.model.BatchItem;
import com.eraser.common.dto.BatchItemStatus;
import com.eraser.common.dto.BatchReport;
import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.RemovalResult;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.AlgorithmFailureException;
import com.eraser.common.exception.EraserException;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.service.ImageCodec;
import com.eraser.image.service.WatermarkRemovalService;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 一个批次的协调器：入队 -> 并发处理 -> 汇总报告 -> 按序号取结果。
 * <p>
 * 核心策略：
 * - 每张图独立走完整流水线，任何一张失败只把该条目标记为 FAILED，不影响其他条目
 * - 用 Semaphore 控制本批次同一时刻运行的条目数，执行线程池可以被多个批次共享
 * - 队列本身由锁保护，条目从 PROCESSING 到终态只被一个工作线程持有
 * <p>
 * 通过 {@link BatchService#newBatch()} 创建，每个批次一个实例。
 */
@Slf4j
public class BatchCoordinator {

    private final String batchId;
    private final WatermarkRemovalService removalService;
    private final ImageCodec codec;
    private final BatchProperties properties;
    private final ExecutorService executor;

    private final List<BatchItem> items = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private InpaintAlgorithm algorithm;
    private boolean aggressive;

    BatchCoordinator(String batchId, WatermarkRemovalService removalService, ImageCodec codec,
                     BatchProperties properties, ExecutorService executor) {
        this.batchId = batchId;
        this.removalService = removalService;
        this.codec = codec;
        this.properties = properties;
        this.executor = executor;
        this.algorithm = properties.getAlgorithm();
        this.aggressive = properties.isAggressive();
    }

    public String getBatchId() {
        return batchId;
    }

    /**
     * 覆盖本批次的修复算法与检测模式（默认取配置）。
     */
    public BatchCoordinator withOptions(InpaintAlgorithm algorithm, boolean aggressive) {
        if (algorithm != null) {
            this.algorithm = algorithm;
        }
        this.aggressive = aggressive;
        return this;
    }

    // ==================== 入队 ====================

    public int enqueue(String name, PixelImage image) {
        return enqueue(name, image, null);
    }

    public int enqueue(String name, PixelImage image, WatermarkMask mask) {
        return add(name, () -> image, mask == null ? null : () -> mask);
    }

    /**
     * 以编码后的字节入队，处理时才解码。
     */
    public int enqueue(String name, byte[] encoded) {
        return enqueue(name, encoded, null);
    }

    public int enqueue(String name, byte[] encoded, WatermarkMask mask) {
        return add(name, () -> codec.decode(encoded), mask == null ? null : () -> mask);
    }

    /**
     * 以文件路径入队，处理时才读取。
     */
    public int enqueue(Path path) {
        return enqueue(path, null);
    }

    /**
     * @param maskPath 手动蒙版文件（灰度值 >= 128 为修复区域），null 表示自动检测
     */
    public int enqueue(Path path, Path maskPath) {
        return add(path.toString(), () -> codec.read(path), maskPath == null ? null : () -> codec.readMask(maskPath));
    }

    private int add(String name, Supplier<PixelImage> imageLoader, Supplier<WatermarkMask> maskLoader) {
        lock.lock();
        try {
            int index = items.size();
            items.add(new BatchItem(index, name, imageLoader, maskLoader));
            return index;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 处理 ====================

    /**
     * 处理所有 PENDING 条目，单个条目失败不会抛出到调用方。
     *
     * @return 本批次全部条目的汇总
     */
    public BatchReport processAll() {
        long start = System.currentTimeMillis();
        List<BatchItem> pending = pendingItems();
        int totalTasks = pending.size();
        if (totalTasks == 0) {
            log.info("批次 {} 没有待处理的图片", batchId);
            return report(System.currentTimeMillis() - start);
        }

        int concurrency = Math.max(1, Math.min(properties.getMaxConcurrent(), totalTasks));
        log.info("批次 {} 开始处理 {} 张图片, 并发度: {}, 算法: {}, aggressive={}",
                batchId, totalTasks, concurrency, algorithm, aggressive);

        // Semaphore 控制本批次同一时刻最多 concurrency 个条目在执行
        Semaphore semaphore = new Semaphore(concurrency);
        AtomicInteger completed = new AtomicInteger(0);
        AtomicInteger succeeded = new AtomicInteger(0);
        int interval = Math.max(1, properties.getProgressLogInterval());

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (BatchItem item : pending) {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                try {
                    semaphore.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("批次 {} 条目 #{} 等待调度时被中断，保持 PENDING", batchId, item.getIndex());
                    return;
                }
                try {
                    if (cancelled.get()) {
                        return;
                    }
                    if (processItem(item)) {
                        succeeded.incrementAndGet();
                    }
                    int done = completed.incrementAndGet();
                    if (done % interval == 0 || done == totalTasks) {
                        log.info("批处理进度: {}/{} (成功 {})", done, totalTasks, succeeded.get());
                    }
                } finally {
                    semaphore.release();
                }
            }, executor);
            futures.add(future);
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        BatchReport report = report(System.currentTimeMillis() - start);
        log.info("批次 {} 处理完成, 成功: {}, 失败: {}, 未处理: {}, 耗时 {}ms", batchId,
                report.getDoneCount(), report.getFailedCount(), report.getPendingCount(), report.getProcessingTimeMs());
        return report;
    }

    /**
     * 处理单个条目，所有异常和 Error 都记录到条目上。
     *
     * @return 是否成功
     */
    private boolean processItem(BatchItem item) {
        item.markProcessing();
        long start = System.currentTimeMillis();
        try {
            PixelImage image = item.loadImage();
            RemovalResult result = item.hasManualMask()
                    ? removalService.removeWithMask(image, item.loadMask(), algorithm)
                    : removalService.detectAndRemove(image, algorithm, aggressive);
            item.markDone(result, System.currentTimeMillis() - start);
            return true;
        } catch (EraserException e) {
            log.warn("条目 #{} ({}) 处理失败: [{}] {}", item.getIndex(), item.getName(), e.getErrorCode(), e.getMessage());
            item.markFailed(e, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.warn("条目 #{} ({}) 处理异常", item.getIndex(), item.getName(), e);
            item.markFailed(new AlgorithmFailureException("处理失败: " + e.getMessage(), e),
                    System.currentTimeMillis() - start);
        } catch (Error e) {
            // 本地库加载失败等错误同样只记到该条目上，不中断整个批次
            log.error("条目 #{} ({}) 处理时发生严重错误", item.getIndex(), item.getName(), e);
            item.markFailed(new AlgorithmFailureException("处理失败: " + e, e),
                    System.currentTimeMillis() - start);
        }
        return false;
    }

    /**
     * 不再开始新的条目，已在处理中的条目会正常完成，未开始的保持 PENDING。
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("批次 {} 已取消", batchId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // ==================== 结果 ====================

    /**
     * 取单个条目的输出图片。
     *
     * @throws EraserException       条目处理失败时，抛出记录的原始异常
     * @throws IllegalStateException 条目尚未处理完成
     */
    public PixelImage resultFor(int index) {
        return removalResultFor(index).getImage();
    }

    public RemovalResult removalResultFor(int index) {
        BatchItem item = itemAt(index);
        switch (item.getStatus()) {
            case DONE:
                return item.getResult();
            case FAILED:
                throw item.getError();
            default:
                throw new IllegalStateException("条目 #" + index + " 尚未处理完成，当前状态: " + item.getStatus());
        }
    }

    public BatchItemStatus statusOf(int index) {
        return itemAt(index).getStatus();
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public BatchReport report() {
        return report(0);
    }

    private BatchReport report(long elapsedMs) {
        List<BatchReport.ItemSummary> done = new ArrayList<>();
        List<BatchReport.ItemSummary> failed = new ArrayList<>();
        int pending = 0;
        for (BatchItem item : snapshot()) {
            BatchItemStatus status = item.getStatus();
            if (status == BatchItemStatus.DONE) {
                done.add(item.toSummary());
            } else if (status == BatchItemStatus.FAILED) {
                failed.add(item.toSummary());
            } else {
                pending++;
            }
        }
        return BatchReport.builder()
                .batchId(batchId)
                .total(done.size() + failed.size() + pending)
                .doneCount(done.size())
                .failedCount(failed.size())
                .pendingCount(pending)
                .done(done)
                .failed(failed)
                .processingTimeMs(elapsedMs)
                .build();
    }

    private BatchItem itemAt(int index) {
        lock.lock();
        try {
            if (index < 0 || index >= items.size()) {
                throw new InvalidInputException("批次 " + batchId + " 中不存在条目 #" + index);
            }
            return items.get(index);
        } finally {
            lock.unlock();
        }
    }

    private List<BatchItem> pendingItems() {
        List<BatchItem> pending = new ArrayList<>();
        for (BatchItem item : snapshot()) {
            if (item.getStatus() == BatchItemStatus.PENDING) {
                pending.add(item);
            }
        }
        return pending;
    }

    private List<BatchItem> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(items);
        } finally {
            lock.unlock();
        }
    }
}
