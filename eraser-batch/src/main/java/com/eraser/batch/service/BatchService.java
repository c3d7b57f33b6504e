package com.eraser.batch.service;

import com.eraser.batch.config.BatchProperties;
import com.eraser.common.util.IdGenerator;
import com.eraser.image.service.ImageCodec;
import com.eraser.image.service.WatermarkRemovalService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 批处理入口：持有共享的工作线程池，按需创建批次。
 */
@Slf4j
@Service
public class BatchService {

    private final WatermarkRemovalService removalService;
    private final ImageCodec codec;
    private final BatchProperties properties;

    /** 工作线程池，所有批次共享，单个批次的并发度由批次内的 Semaphore 控制 */
    private final ExecutorService workerPool;

    public BatchService(WatermarkRemovalService removalService, ImageCodec codec, BatchProperties properties) {
        this.removalService = removalService;
        this.codec = codec;
        this.properties = properties;
        int threads = Math.max(1, properties.getMaxConcurrent());
        this.workerPool = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("eraser-batch-"));
        log.info("批处理线程池已创建, 线程数: {}", threads);
    }

    /**
     * 创建一个新批次，算法和检测模式取配置默认值。
     */
    public BatchCoordinator newBatch() {
        String batchId = IdGenerator.withPrefix("batch");
        log.debug("创建批次 {}", batchId);
        return new BatchCoordinator(batchId, removalService, codec, properties, workerPool);
    }

    @PreDestroy
    public void shutdown() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("批处理线程池未能在 30 秒内结束，强制关闭");
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
