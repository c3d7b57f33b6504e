package com.eraser.image.service;

import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.common.util.ImageUtils;
import com.eraser.image.config.CodecProperties;
import com.eraser.image.support.MatConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 图片编解码服务：字节数组 / 文件 与像素缓冲之间的转换。
 * <p>
 * 修复流水线本身不做任何 I/O，读写文件由调用方显式通过本服务完成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageCodec {

    private final CodecProperties properties;

    /**
     * 解码彩色图片（BGR 三通道）。
     */
    public PixelImage decode(byte[] imageBytes) {
        return MatConverter.toPixelImage(decodeMat(imageBytes, opencv_imgcodecs.IMREAD_COLOR, "图片"));
    }

    /**
     * 解码蒙版：按灰度读取，灰度值 >= 128 视为需要修复。
     */
    public WatermarkMask decodeMask(byte[] maskBytes) {
        return MatConverter.toMask(decodeMat(maskBytes, opencv_imgcodecs.IMREAD_GRAYSCALE, "蒙版"));
    }

    public PixelImage read(Path path) {
        return decode(readBytes(path));
    }

    public WatermarkMask readMask(Path path) {
        return decodeMask(readBytes(path));
    }

    /**
     * 按格式编码（"png"、"jpg" 等，不带点）。
     */
    public byte[] encode(PixelImage image, String format) {
        return encodeMat(MatConverter.toMat(image), format);
    }

    /**
     * 蒙版编码为 PNG（白色为修复区域）。
     */
    public byte[] encodeMask(WatermarkMask mask) {
        return encodeMat(MatConverter.toMat(mask), "png");
    }

    /**
     * 按文件名选择输出格式：支持的扩展名原样沿用，否则使用默认格式。
     */
    public String formatFor(String fileName) {
        return ImageUtils.isSupported(fileName) ? ImageUtils.extensionOf(fileName) : properties.getDefaultFormat();
    }

    /**
     * 按目标文件扩展名编码并写入，自动创建父目录。
     */
    public void write(PixelImage image, Path path) {
        String format = ImageUtils.extensionOf(path.getFileName().toString());
        byte[] encoded = encode(image, format.isEmpty() ? properties.getDefaultFormat() : format);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, encoded);
            log.debug("已写入: {} ({} bytes)", path, encoded.length);
        } catch (IOException e) {
            throw new InvalidInputException("写入图片失败: " + path, e);
        }
    }

    private Mat decodeMat(byte[] bytes, int flags, String what) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidInputException(what + "内容为空");
        }
        try {
            Mat raw = opencv_imgcodecs.imdecode(new Mat(bytes), flags);
            if (raw == null || raw.empty()) {
                throw new InvalidInputException("无法解码" + what + "，请确认格式正确");
            }
            log.debug("{}解码成功: {}x{}", what, raw.cols(), raw.rows());
            return raw;
        } catch (InvalidInputException e) {
            throw e;
        } catch (Exception e) {
            throw new InvalidInputException("读取" + what + "失败", e);
        }
    }

    private byte[] encodeMat(Mat mat, String format) {
        String ext = "." + (format == null || format.isBlank() ? properties.getDefaultFormat() : format.toLowerCase());
        BytePointer buf = new BytePointer();
        IntPointer params = new IntPointer(
                opencv_imgcodecs.IMWRITE_JPEG_QUALITY, properties.getJpegQuality(),
                opencv_imgcodecs.IMWRITE_PNG_COMPRESSION, properties.getPngCompression());
        try {
            boolean ok = opencv_imgcodecs.imencode(ext, mat, buf, params);
            if (!ok || buf.limit() == 0) {
                throw new InvalidInputException("图片编码为 " + ext + " 失败");
            }
            byte[] result = new byte[(int) buf.limit()];
            buf.get(result);
            return result;
        } catch (InvalidInputException e) {
            throw e;
        } catch (Exception e) {
            throw new InvalidInputException("不支持的输出格式: " + ext, e);
        } finally {
            buf.deallocate();
            params.deallocate();
        }
    }

    private byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new InvalidInputException("读取文件失败: " + path, e);
        }
    }
}
