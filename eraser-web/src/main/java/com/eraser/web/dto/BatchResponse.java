package com.eraser.web.dto;

import com.eraser.common.dto.BatchReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量去水印的返回结果：汇总报告 + 成功条目的图片。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResponse {

    private BatchReport report;

    private List<BatchImage> images;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchImage {

        private int index;

        private String name;

        private String mimeType;

        private String imageBase64;
    }
}
