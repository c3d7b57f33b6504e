package com.eraser.common.exception;

/**
 * 输入非法：图片/蒙版无法解码、通道数不符、尺寸无法对齐等。
 * <p>
 * 直接抛给调用方，不重试。
 */
public class InvalidInputException extends EraserException {

    public static final String CODE = "INVALID_INPUT";

    public InvalidInputException(String message) {
        super(CODE, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
