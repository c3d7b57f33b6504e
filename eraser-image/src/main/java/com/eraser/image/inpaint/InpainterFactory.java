package com.eraser.image.inpaint;

import com.eraser.common.dto.InpaintAlgorithm;
import com.eraser.common.exception.AlgorithmFailureException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 修复算法工厂，按 {@link InpaintAlgorithm} 选择对应的实现。
 */
@Component
public class InpainterFactory {

    private final Map<InpaintAlgorithm, Inpainter> inpainters = new EnumMap<>(InpaintAlgorithm.class);

    public InpainterFactory(List<Inpainter> inpainters) {
        for (Inpainter inpainter : inpainters) {
            this.inpainters.put(inpainter.getAlgorithm(), inpainter);
        }
    }

    public Inpainter getInpainter(InpaintAlgorithm algorithm) {
        Inpainter inpainter = inpainters.get(algorithm);
        if (inpainter == null) {
            throw new AlgorithmFailureException("未注册的修复算法: " + algorithm);
        }
        return inpainter;
    }
}
