package com.eraser.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次批处理的汇总报告。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchReport {

    /** 批次ID */
    private String batchId;

    /** 队列总数 */
    private int total;

    /** 成功数 */
    private int doneCount;

    /** 失败数 */
    private int failedCount;

    /** 未处理数（取消后剩余） */
    private int pendingCount;

    /** 成功条目 */
    private List<ItemSummary> done;

    /** 失败条目 */
    private List<ItemSummary> failed;

    /** 总耗时（毫秒） */
    private long processingTimeMs;

    /**
     * 单个条目的处理摘要。
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemSummary {

        /** 入队序号（从 0 开始） */
        private int index;

        /** 图片名称或路径 */
        private String name;

        private BatchItemStatus status;

        /** 是否检测到水印（仅成功条目） */
        private boolean watermarkFound;

        /** 错误码（仅失败条目） */
        private String errorCode;

        /** 错误信息（仅失败条目） */
        private String errorMessage;

        /** 处理耗时（毫秒） */
        private long processingTimeMs;
    }
}
