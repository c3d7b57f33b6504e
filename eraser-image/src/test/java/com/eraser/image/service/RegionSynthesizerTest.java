package com.eraser.image.service;

import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.config.DetectionProperties;
import com.eraser.image.model.SignalMaps;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.countNonZero;

class RegionSynthesizerTest {

    private DetectionProperties properties;
    private RegionSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        properties = new DetectionProperties();
        synthesizer = new RegionSynthesizer(properties);
    }

    @Test
    void should_WeightCornersAndCenter_When_BuildingWeightMap() {
        Mat weights = synthesizer.weightMap(200, 120);

        try (FloatIndexer idx = weights.createIndexer()) {
            // 四角
            assertThat((double) idx.get(0, 0)).isCloseTo(1.5, within(1e-6));
            assertThat((double) idx.get(0, 199)).isCloseTo(1.5, within(1e-6));
            assertThat((double) idx.get(119, 0)).isCloseTo(1.5, within(1e-6));
            assertThat((double) idx.get(119, 199)).isCloseTo(1.5, within(1e-6));
            // 中央三分之一
            assertThat((double) idx.get(60, 100)).isCloseTo(1.2, within(1e-6));
            // 其他位置
            assertThat((double) idx.get(5, 100)).isCloseTo(1.0, within(1e-6));
            assertThat((double) idx.get(60, 5)).isCloseTo(1.0, within(1e-6));
        }
    }

    @Test
    void should_ReturnEmptyMask_When_NoSignalFires() {
        SignalMaps maps = maps(80, 60, new Mat[5]);

        Mat mask = synthesizer.synthesize(maps, true);

        assertThat(mask.cols()).isEqualTo(80);
        assertThat(mask.rows()).isEqualTo(60);
        assertThat(countNonZero(mask)).isZero();
    }

    @Test
    void should_UnionAllSignals_When_Combining() {
        Mat[] signals = new Mat[5];
        signals[1] = filled(80, 60, new Rect(5, 5, 10, 10));
        signals[4] = filled(80, 60, new Rect(50, 30, 10, 10));

        Mat combined = synthesizer.combine(maps(80, 60, signals));

        assertThat(countNonZero(combined)).isEqualTo(200);
    }

    @Test
    void should_DropRegionsBelowMinimumArea_When_RemovingSmallRegions() {
        properties.setMinRegionAreaRatio(0.01);
        Mat mask = blank(100, 100);
        new Mat(mask, new Rect(5, 5, 5, 5)).put(new Scalar(255.0));
        new Mat(mask, new Rect(50, 50, 20, 20)).put(new Scalar(255.0));

        long minArea = synthesizer.removeSmallRegions(mask);

        assertThat(minArea).isEqualTo(100);
        assertThat(countNonZero(mask)).isEqualTo(400);
        assertThat(valueAt(mask, 7, 7)).isZero();
        assertThat(valueAt(mask, 60, 60)).isEqualTo(255);
    }

    @Test
    void should_OnlyGrowMask_When_Aggressive() {
        Mat[] signals = new Mat[5];
        signals[3] = filled(120, 120, new Rect(40, 40, 30, 20));
        SignalMaps maps = maps(120, 120, signals);

        Mat normal = synthesizer.synthesize(maps, false);
        Mat aggressive = synthesizer.synthesize(maps, true);

        assertThat(countNonZero(aggressive)).isGreaterThan(countNonZero(normal));
        try (UByteIndexer n = normal.createIndexer(); UByteIndexer a = aggressive.createIndexer()) {
            for (int y = 0; y < 120; y++) {
                for (int x = 0; x < 120; x++) {
                    if (n.get(y, x) != 0) {
                        assertThat(a.get(y, x)).isEqualTo(255);
                    }
                }
            }
        }
    }

    @Test
    void should_RejectMaps_When_SizesDiffer() {
        Mat[] signals = new Mat[5];
        signals[2] = blank(10, 10);

        assertThatThrownBy(() -> synthesizer.synthesize(maps(20, 20, signals), false))
                .isInstanceOf(InvalidInputException.class);
    }

    /**
     * 未指定的信号用全 0 图填充。
     */
    private static SignalMaps maps(int width, int height, Mat[] signals) {
        for (int i = 0; i < signals.length; i++) {
            if (signals[i] == null) {
                signals[i] = blank(width, height);
            }
        }
        return new SignalMaps(signals[0], signals[1], signals[2], signals[3], signals[4]);
    }

    private static Mat blank(int width, int height) {
        return new Mat(height, width, CV_8UC1, new Scalar(0.0));
    }

    private static Mat filled(int width, int height, Rect rect) {
        Mat mat = blank(width, height);
        new Mat(mat, rect).put(new Scalar(255.0));
        return mat;
    }

    private static int valueAt(Mat mat, int x, int y) {
        try (UByteIndexer idx = mat.createIndexer()) {
            return idx.get(y, x);
        }
    }
}
