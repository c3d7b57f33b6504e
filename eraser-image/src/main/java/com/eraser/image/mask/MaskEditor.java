package com.eraser.image.mask;

import com.eraser.common.dto.BrushStroke;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.support.MatConverter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 手动蒙版编辑器：IDLE / PAINTING / ERASING 三态状态机。
 * <p>
 * 只接收纯数据形式的指针事件（坐标、按键），与具体的渲染/界面框架无关；
 * 只修改自己持有的蒙版缓冲，从不触碰原图。
 * <p>
 * 每个编辑会话一个实例，非线程安全，应只在持有显示面的线程上调用。
 * 交给修复流水线的永远是 {@link #snapshot()} 返回的不可变副本。
 */
@Slf4j
public class MaskEditor {

    public static final int MIN_BRUSH_RADIUS = 5;

    public static final int MAX_BRUSH_RADIUS = 100;

    public static final int DEFAULT_BRUSH_RADIUS = 15;

    /** 滚轮每一格调整的半径 */
    public static final int BRUSH_STEP = 2;

    private final int width;
    private final int height;
    private final Mat mask;

    /** 最近一次自动检测的结果，用于"恢复检测结果" */
    private WatermarkMask detected;

    private EditorState state = EditorState.IDLE;
    private int brushRadius = DEFAULT_BRUSH_RADIUS;
    private Point lastPoint;

    public MaskEditor(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("蒙版尺寸非法: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.mask = new Mat(height, width, CV_8UC1, new Scalar(0.0));
    }

    /**
     * 以自动检测结果为起点创建编辑器。
     */
    public MaskEditor(WatermarkMask detected) {
        this(detected.getWidth(), detected.getHeight());
        seed(detected);
    }

    // ==================== 指针事件 ====================

    /**
     * 按下：主键进入绘制，副键进入擦除，并在按下位置落一笔。
     */
    public void pointerDown(int x, int y, PointerButton button) {
        state = button == PointerButton.PRIMARY ? EditorState.PAINTING : EditorState.ERASING;
        lastPoint = new Point(x, y);
        stamp(x, y, brushRadius, currentValue());
    }

    /**
     * 拖动：非 IDLE 状态下沿上一个采样点到当前点的线段连续落笔，快速拖动也不会断开。
     */
    public void pointerMove(int x, int y) {
        if (state == EditorState.IDLE) {
            return;
        }
        Point current = new Point(x, y);
        Scalar color = new Scalar((double) currentValue());
        if (lastPoint != null) {
            line(mask, lastPoint, current, color, brushRadius * 2, LINE_8, 0);
        }
        circle(mask, current, brushRadius, color, FILLED, LINE_8, 0);
        lastPoint = current;
    }

    /**
     * 抬起：回到 IDLE。
     */
    public void pointerUp() {
        state = EditorState.IDLE;
        lastPoint = null;
    }

    /**
     * 直接应用一次笔画（圆心、半径、极性），与当前状态无关。
     */
    public void applyStroke(BrushStroke stroke) {
        if (stroke == null) {
            throw new InvalidInputException("笔画不能为空");
        }
        BrushStroke.Polarity polarity = stroke.getPolarity() == null
                ? BrushStroke.Polarity.PAINT : stroke.getPolarity();
        int radius = stroke.getRadius() > 0 ? clampRadius(stroke.getRadius()) : brushRadius;
        stamp(stroke.getX(), stroke.getY(), radius, polarity.getValue());
    }

    // ==================== 画笔 ====================

    public void setBrushRadius(int radius) {
        this.brushRadius = clampRadius(radius);
    }

    /**
     * 按滚轮格数调整画笔半径（正数变大、负数变小），结果限制在 [5, 100]。
     */
    public void adjustBrush(int steps) {
        setBrushRadius(brushRadius + steps * BRUSH_STEP);
        log.debug("画笔半径: {}", brushRadius);
    }

    public int getBrushRadius() {
        return brushRadius;
    }

    public EditorState getState() {
        return state;
    }

    // ==================== 重置 ====================

    /**
     * 清空蒙版（全 0）。
     */
    public void reset() {
        mask.put(new Scalar(0.0));
        pointerUp();
    }

    /**
     * 与 {@link #reset()} 相同。
     */
    public void clear() {
        reset();
    }

    /**
     * 设置自动检测结果并以其覆盖当前蒙版。
     */
    public void seed(WatermarkMask detectedMask) {
        if (detectedMask.getWidth() != width || detectedMask.getHeight() != height) {
            throw new InvalidInputException("检测蒙版尺寸 " + detectedMask.getWidth() + "x"
                    + detectedMask.getHeight() + " 与编辑器尺寸 " + width + "x" + height + " 不一致");
        }
        this.detected = detectedMask;
        restoreDetected();
    }

    /**
     * 恢复到最近一次自动检测的结果；从未设置过检测结果时等同于清空。
     */
    public void restoreDetected() {
        if (detected == null) {
            reset();
            return;
        }
        MatConverter.toMat(detected).copyTo(mask);
        pointerUp();
    }

    /**
     * 当前蒙版的不可变副本。
     */
    public WatermarkMask snapshot() {
        return MatConverter.toMask(mask);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    private int currentValue() {
        return state == EditorState.ERASING ? BrushStroke.Polarity.ERASE.getValue() : BrushStroke.Polarity.PAINT.getValue();
    }

    private void stamp(int x, int y, int radius, int value) {
        // 越界部分由 OpenCV 自动裁剪
        circle(mask, new Point(x, y), radius, new Scalar((double) value), FILLED, LINE_8, 0);
    }

    private static int clampRadius(int radius) {
        return Math.max(MIN_BRUSH_RADIUS, Math.min(MAX_BRUSH_RADIUS, radius));
    }
}
