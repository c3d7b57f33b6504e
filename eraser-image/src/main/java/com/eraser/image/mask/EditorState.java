package com.eraser.image.mask;

/**
 * 蒙版编辑器状态。
 */
public enum EditorState {
    IDLE, PAINTING, ERASING
}
