package com.eraser.web.service;

import com.eraser.common.dto.BrushStroke;
import com.eraser.common.dto.PixelImage;
import com.eraser.common.dto.WatermarkMask;
import com.eraser.common.exception.InvalidInputException;
import com.eraser.image.mask.MaskEditor;
import com.eraser.image.service.WatermarkRemovalService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 把前端提交的画笔笔画回放到 {@link MaskEditor} 上，生成修复蒙版。
 * <p>
 * 每个请求一个编辑器实例，请求之间不共享任何蒙版状态。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrokeMaskService {

    private static final TypeReference<List<BrushStroke>> STROKE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final WatermarkRemovalService removalService;

    /**
     * 解析笔画 JSON 数组：[{"x":10,"y":20,"radius":15,"polarity":"PAINT"}, ...]
     */
    public List<BrushStroke> parseStrokes(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidInputException("笔画数据不能为空");
        }
        try {
            List<BrushStroke> strokes = objectMapper.readValue(json, STROKE_LIST);
            if (strokes == null) {
                throw new InvalidInputException("笔画数据不能为空");
            }
            for (int i = 0; i < strokes.size(); i++) {
                if (strokes.get(i) == null) {
                    throw new InvalidInputException("第 " + (i + 1) + " 个笔画为空");
                }
            }
            return strokes;
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("笔画数据格式错误: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 按顺序回放笔画。
     *
     * @param brushRadius       未指定半径的笔画使用的画笔半径，null 为默认值
     * @param seedWithDetection 是否以自动检测结果为起点，再叠加手动笔画
     */
    public WatermarkMask buildMask(PixelImage image, List<BrushStroke> strokes, Integer brushRadius,
                                   boolean seedWithDetection, boolean aggressive) {
        MaskEditor editor = seedWithDetection
                ? new MaskEditor(removalService.detect(image, aggressive))
                : new MaskEditor(image.getWidth(), image.getHeight());
        if (brushRadius != null) {
            editor.setBrushRadius(brushRadius);
        }
        for (BrushStroke stroke : strokes) {
            editor.applyStroke(stroke);
        }
        WatermarkMask mask = editor.snapshot();
        log.info("笔画蒙版生成完成: 笔画 {} 个, 蒙版像素 {}, 以检测结果为起点={}",
                strokes.size(), mask.getMaskedPixelCount(), seedWithDetection);
        return mask;
    }
}
