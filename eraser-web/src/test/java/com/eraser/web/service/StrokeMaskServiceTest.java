package com.eraser.web.service;

import com.eraser.common.dto.BrushStroke;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.service.WatermarkRemovalService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StrokeMaskServiceTest {

    @Mock
    private WatermarkRemovalService removalService;

    private StrokeMaskService service;
    private PixelImage image;

    @BeforeEach
    void setUp() {
        service = new StrokeMaskService(new ObjectMapper(), removalService);
        image = new PixelImage(100, 60, 3, new byte[100 * 60 * 3]);
    }

    @Test
    void should_DefaultToPaint_When_PolarityOmitted() {
        List<BrushStroke> strokes = service.parseStrokes("[{\"x\":1,\"y\":2,\"radius\":8}]");

        assertThat(strokes).singleElement().satisfies(stroke -> {
            assertThat(stroke.getX()).isEqualTo(1);
            assertThat(stroke.getRadius()).isEqualTo(8);
            assertThat(stroke.getPolarity()).isEqualTo(BrushStroke.Polarity.PAINT);
        });
    }

    @Test
    void should_RejectInput_When_JsonInvalidOrBlank() {
        assertThatThrownBy(() -> service.parseStrokes("[{\"x\":")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.parseStrokes(" ")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.parseStrokes("null")).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void should_RejectInput_When_StrokeListContainsNull() {
        assertThatThrownBy(() -> service.parseStrokes("[{\"x\":1,\"y\":2}, null]"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("第 2 个笔画为空");
        assertThatThrownBy(() -> service.parseStrokes("[null]")).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void should_UseGivenBrushRadius_When_StrokeHasNoRadius() {
        List<BrushStroke> strokes = List.of(BrushStroke.builder().x(50).y(30).build());

        WatermarkMask mask = service.buildMask(image, strokes, 20, false, true);

        assertThat(mask.isMasked(50 + 19, 30)).isTrue();
        assertThat(mask.isMasked(50 + 22, 30)).isFalse();
    }

    @Test
    void should_EditDetectedMask_When_SeedRequested() {
        byte[] full = new byte[100 * 60];
        Arrays.fill(full, (byte) 255);
        when(removalService.detect(any(PixelImage.class), eq(false))).thenReturn(new WatermarkMask(100, 60, full));
        List<BrushStroke> strokes = List.of(BrushStroke.builder()
                .x(10).y(10).radius(5).polarity(BrushStroke.Polarity.ERASE).build());

        WatermarkMask mask = service.buildMask(image, strokes, null, true, false);

        assertThat(mask.isMasked(10, 10)).isFalse();
        assertThat(mask.isMasked(90, 50)).isTrue();
    }
}
