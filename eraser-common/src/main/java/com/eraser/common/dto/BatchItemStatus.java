package com.eraser.common.dto;

/**
 * 批处理条目状态。
 */
public enum BatchItemStatus {
    PENDING, PROCESSING, DONE, FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
