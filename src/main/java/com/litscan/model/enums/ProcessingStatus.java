package com.litscan.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 文件处理状态
 *
 * @author litscan
 */
@Getter
@AllArgsConstructor
public enum ProcessingStatus {

    PENDING("pending"),
    NEEDS_OCR("needs_ocr"),
    NEEDS_REVIEW("needs_review"),
    SUCCESS("success"),
    FAILED("failed");

    private final String value;

    /**
     * 由解析置信度得出终态：达到阈值为 success，大于 0 需要人工复核，否则需要 OCR
     */
    public static ProcessingStatus fromConfidence(double confidence, double threshold) {
        if (confidence >= threshold) {
            return SUCCESS;
        }
        if (confidence > 0) {
            return NEEDS_REVIEW;
        }
        return NEEDS_OCR;
    }

    public static ProcessingStatus of(String value) {
        for (ProcessingStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知处理状态: " + value);
    }
}
