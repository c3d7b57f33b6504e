package com.eraser.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 可选修复算法说明。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlgorithmInfo {

    private String code;

    private String alias;

    private String description;

    private boolean defaultAlgorithm;
}
