package com.eraser.image.service;

import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {

    @TempDir
    Path tempDir;

    private ImageCodec codec;

    @BeforeEach
    void setUp() {
        codec = TestImages.codec();
    }

    @Test
    void should_ThrowInvalidInput_When_BytesAreNotAnImage() {
        byte[] garbage = "definitely not an image".getBytes();

        assertThatThrownBy(() -> codec.decode(garbage)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0])).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void should_KeepPixelsExact_When_UsingPng() {
        PixelImage image = TestImages.gradient(32, 24);

        PixelImage decoded = codec.decode(codec.encode(image, "png"));

        assertThat(decoded.contentEquals(image)).isTrue();
    }

    @Test
    void should_TreatGrayFrom128AsMasked_When_DecodingMask() {
        byte[] gray = new byte[4 * 2];
        gray[0] = 127;
        gray[1] = (byte) 128;
        gray[2] = (byte) 255;
        PixelImage grayImage = new PixelImage(4, 2, 1, gray);

        WatermarkMask mask = codec.decodeMask(codec.encode(grayImage, "png"));

        assertThat(mask.isMasked(0, 0)).isFalse();
        assertThat(mask.isMasked(1, 0)).isTrue();
        assertThat(mask.isMasked(2, 0)).isTrue();
        assertThat(mask.getMaskedPixelCount()).isEqualTo(2);
    }

    @Test
    void should_CreateParentDirectories_When_Writing() {
        Path target = tempDir.resolve("out/nested/result.png");
        PixelImage image = TestImages.solid(8, 8, 1, 2, 3);

        codec.write(image, target);

        assertThat(Files.exists(target)).isTrue();
        assertThat(codec.read(target).contentEquals(image)).isTrue();
    }

    @Test
    void should_DecodeAsColor_When_JpegWritten() {
        Path target = tempDir.resolve("photo.jpg");

        codec.write(TestImages.gradient(16, 16), target);

        PixelImage read = codec.read(target);
        assertThat(read.getChannels()).isEqualTo(3);
        assertThat(read.sameSize(16, 16)).isTrue();
    }

    @Test
    void should_KeepSupportedExtension_When_ChoosingOutputFormat() {
        assertThat(codec.formatFor("scan.JPG")).isEqualTo("jpg");
        assertThat(codec.formatFor("logo.webp")).isEqualTo("webp");
        assertThat(codec.formatFor("upload.gif")).isEqualTo("png");
        assertThat(codec.formatFor(null)).isEqualTo("png");
    }

    @Test
    void should_ThrowInvalidInput_When_FileMissing() {
        assertThatThrownBy(() -> codec.readMask(tempDir.resolve("missing.png")))
                .isInstanceOf(InvalidInputException.class);
    }
}
