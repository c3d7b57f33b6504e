package com.eraser.image.service;

import com.eraser.common.dto.PixelImage;
import com.eraser.common.exception.AlgorithmFailureException;
import com.eraser.image.TestImages;
import com.eraser.image.config.CompositorProperties;
import com.eraser.image.support.MatConverter;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.bytedeco.opencv.global.opencv_core.meanStdDev;

class PostCompositorTest {

    private CompositorProperties properties;
    private PostCompositor compositor;

    @BeforeEach
    void setUp() {
        properties = new CompositorProperties();
        compositor = new PostCompositor(properties);
    }

    @Test
    void should_ReturnIdenticalImage_When_InputIsUniform() {
        PixelImage solid = TestImages.solid(30, 20, 40, 120, 200);
        Mat mat = MatConverter.toMat(solid);

        Mat composed = compositor.compose(mat, mat);

        assertThat(MatConverter.toPixelImage(composed).contentEquals(solid)).isTrue();
    }

    @Test
    void should_DarkenUniformImage_When_ColorMatchDisabled() {
        properties.setColorMatchEnabled(false);
        PixelImage solid = TestImages.solid(30, 20, 100, 100, 100);
        Mat mat = MatConverter.toMat(solid);

        PixelImage composed = MatConverter.toPixelImage(compositor.compose(mat, mat));

        // 0.85 * 100 + 0.15 * (0.3 * 100)
        assertThat(composed.get(15, 10, 0)).isBetween(89, 90);
    }

    @Test
    void should_MatchChannelStatistics_When_ResultDrifted() {
        Mat original = MatConverter.toMat(TestImages.gradient(64, 48));
        Mat drifted = new Mat();
        original.convertTo(drifted, -1, 0.6, 30);

        Mat matched = compositor.matchColorDistribution(drifted, original);

        double[][] expected = stats(original);
        double[][] actual = stats(matched);
        for (int c = 0; c < 3; c++) {
            assertThat(actual[0][c]).isCloseTo(expected[0][c], within(1.0));
            assertThat(actual[1][c]).isCloseTo(expected[1][c], within(1.0));
        }
    }

    @Test
    void should_PreserveSizeAndType_When_Composing() {
        Mat original = MatConverter.toMat(TestImages.gradient(50, 40));

        Mat composed = compositor.compose(original.clone(), original);

        assertThat(composed.cols()).isEqualTo(50);
        assertThat(composed.rows()).isEqualTo(40);
        assertThat(composed.type()).isEqualTo(original.type());
    }

    @Test
    void should_ThrowAlgorithmFailure_When_SizesDiffer() {
        Mat a = MatConverter.toMat(TestImages.solid(10, 10, 0, 0, 0));
        Mat b = MatConverter.toMat(TestImages.solid(12, 10, 0, 0, 0));

        assertThatThrownBy(() -> compositor.compose(a, b)).isInstanceOf(AlgorithmFailureException.class);
    }

    private static double[][] stats(Mat image) {
        Mat mean = new Mat();
        Mat std = new Mat();
        meanStdDev(image, mean, std);
        double[][] result = new double[2][3];
        try (DoubleIndexer m = mean.createIndexer(); DoubleIndexer s = std.createIndexer()) {
            for (int c = 0; c < 3; c++) {
                result[0][c] = m.get(c);
                result[1][c] = s.get(c);
            }
        }
        return result;
    }
}
