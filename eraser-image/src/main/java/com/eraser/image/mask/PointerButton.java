package com.eraser.image.mask;

/**
 * 指针按键：主键绘制，副键擦除。
 */
public enum PointerButton {
    PRIMARY, SECONDARY
}
