package com.litscan.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 证书文本来源
 *
 * @author litscan
 */
@Getter
@AllArgsConstructor
public enum ExtractionMethod {

    PDF_TEXT("pdf_text"),
    OCR("ocr"),
    /** PDF 文本抽取后再用 OCR 补全缺失字段 */
    PDF_OCR("pdf+ocr"),
    TEXT_FILE("text_file");

    private final String value;
}
