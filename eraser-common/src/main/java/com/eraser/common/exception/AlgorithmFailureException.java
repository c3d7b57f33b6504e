package com.eraser.common.exception;

/**
 * 修复算法执行失败（OpenCV 内部错误、输出尺寸/类型不合法等）。
 * <p>
 * 批处理模式下只会把对应条目标记为失败，不影响队列中其余图片。
 */
public class AlgorithmFailureException extends EraserException {

    public static final String CODE = "ALGORITHM_FAILURE";

    public AlgorithmFailureException(String message) {
        super(CODE, message);
    }

    public AlgorithmFailureException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
