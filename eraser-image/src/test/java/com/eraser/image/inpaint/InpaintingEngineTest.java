package com.eraser.image.inpaint;

import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.AlgorithmFailureException;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.TestImages;
import com.eraser.image.config.InpaintProperties;
import com.eraser.image.support.MatConverter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InpaintingEngineTest {

    private InpaintProperties properties;
    private InpaintingEngine engine;
    private PixelImage gradient;
    private WatermarkMask centerMask;

    @BeforeEach
    void setUp() {
        properties = new InpaintProperties();
        engine = TestImages.engine(properties);
        gradient = TestImages.gradient(80, 60);
        centerMask = TestImages.rectMask(80, 60, 30, 20, 16, 12);
    }

    @ParameterizedTest
    @EnumSource(InpaintAlgorithm.class)
    void should_KeepUnmaskedPixelsUnchanged_When_Reconstructing(InpaintAlgorithm algorithm) {
        Mat result = engine.reconstruct(MatConverter.toMat(gradient), MatConverter.toMat(centerMask), algorithm);

        PixelImage output = MatConverter.toPixelImage(result);
        assertUnmaskedEqual(output, gradient, centerMask);
    }

    @ParameterizedTest
    @EnumSource(InpaintAlgorithm.class)
    void should_FillWithSurroundingColor_When_BackgroundIsUniform(InpaintAlgorithm algorithm) {
        PixelImage solid = TestImages.solid(60, 60, 50, 100, 150);
        WatermarkMask mask = TestImages.rectMask(60, 60, 20, 20, 15, 15);

        PixelImage output = MatConverter.toPixelImage(
                engine.reconstruct(MatConverter.toMat(solid), MatConverter.toMat(mask), algorithm));

        for (int y = 20; y < 35; y++) {
            for (int x = 20; x < 35; x++) {
                assertThat(output.get(x, y, 0)).isBetween(48, 52);
                assertThat(output.get(x, y, 1)).isBetween(98, 102);
                assertThat(output.get(x, y, 2)).isBetween(148, 152);
            }
        }
    }

    @Test
    void should_Terminate_When_MaskCoversWholeImage() {
        Mat result = engine.reconstruct(MatConverter.toMat(gradient),
                MatConverter.toMat(WatermarkMask.full(80, 60)), InpaintAlgorithm.MULTI_PASS_ENHANCED);

        assertThat(result.cols()).isEqualTo(80);
        assertThat(result.rows()).isEqualTo(60);
        assertThat(result.channels()).isEqualTo(3);
    }

    @Test
    void should_NotModifyInputs_When_Reconstructing() {
        Mat image = MatConverter.toMat(gradient);
        Mat mask = MatConverter.toMat(centerMask);

        engine.reconstruct(image, mask, InpaintAlgorithm.BLEND);

        assertThat(MatConverter.toPixelImage(image).contentEquals(gradient)).isTrue();
        assertThat(MatConverter.toMask(mask).getData()).isEqualTo(centerMask.getData());
    }

    @Test
    void should_KeepUnmaskedPixels_When_DenoiseEnabled() {
        properties.setDenoiseEnabled(true);

        Mat result = engine.reconstruct(MatConverter.toMat(gradient), MatConverter.toMat(centerMask),
                InpaintAlgorithm.FAST_MARCHING);

        assertUnmaskedEqual(MatConverter.toPixelImage(result), gradient, centerMask);
    }

    @Test
    void should_ThrowInvalidInput_When_MaskSizeDiffers() {
        WatermarkMask small = WatermarkMask.full(40, 30);

        assertThatThrownBy(() -> engine.reconstruct(MatConverter.toMat(gradient), MatConverter.toMat(small),
                InpaintAlgorithm.FAST_MARCHING))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("40x30");
    }

    @Test
    void should_ThrowInvalidInput_When_ImageIsNotThreeChannel() {
        PixelImage gray = new PixelImage(80, 60, 1, new byte[80 * 60]);

        assertThatThrownBy(() -> engine.reconstruct(MatConverter.toMat(gray), MatConverter.toMat(centerMask),
                InpaintAlgorithm.FAST_MARCHING))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void should_ThrowAlgorithmFailure_When_AlgorithmNotRegistered() {
        InpaintingEngine teleaOnly = new InpaintingEngine(
                new InpainterFactory(List.of(new FastMarchingInpainter(properties))), properties);

        assertThatThrownBy(() -> teleaOnly.reconstruct(MatConverter.toMat(gradient), MatConverter.toMat(centerMask),
                InpaintAlgorithm.BLEND))
                .isInstanceOf(AlgorithmFailureException.class)
                .hasMessageContaining("BLEND");
    }

    @Test
    void should_WrapRuntimeError_When_InpainterFails() {
        Inpainter broken = new Inpainter() {
            @Override
            public Mat inpaint(Mat image, Mat mask) {
                throw new IllegalStateException("boom");
            }

            @Override
            public InpaintAlgorithm getAlgorithm() {
                return InpaintAlgorithm.FAST_MARCHING;
            }
        };
        InpaintingEngine brokenEngine = new InpaintingEngine(new InpainterFactory(List.of(broken)), properties);

        assertThatThrownBy(() -> brokenEngine.reconstruct(MatConverter.toMat(gradient),
                MatConverter.toMat(centerMask), InpaintAlgorithm.FAST_MARCHING))
                .isInstanceOf(AlgorithmFailureException.class)
                .hasMessageContaining("boom");
    }

    private static void assertUnmaskedEqual(PixelImage actual, PixelImage expected, WatermarkMask mask) {
        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                if (mask.isMasked(x, y)) {
                    continue;
                }
                for (int c = 0; c < 3; c++) {
                    assertThat(actual.get(x, y, c)).as("pixel (%d,%d) channel %d", x, y, c)
                            .isEqualTo(expected.get(x, y, c));
                }
            }
        }
    }
}
