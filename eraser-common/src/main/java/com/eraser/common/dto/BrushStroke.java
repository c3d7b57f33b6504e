package com.eraser.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次画笔落点：圆心、半径、极性。笔画本身不保留历史。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrushStroke {

    /** 圆心 X（像素） */
    private int x;

    /** 圆心 Y（像素） */
    private int y;

    /** 画笔半径（像素） */
    private int radius;

    /** 极性：PAINT 写 255，ERASE 写 0 */
    @Builder.Default
    private Polarity polarity = Polarity.PAINT;

    public enum Polarity {
        PAINT(255), ERASE(0);

        private final int value;

        Polarity(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }
    }
}
