package com.litscan.service;

import com.litscan.model.dto.ExtractedFields;

import java.nio.file.Path;

/**
 * 论文元数据抽取服务
 *
 * @author litscan
 */
public interface MetadataExtractionService {

    /**
     * 从 PDF 文本层抽取字段
     *
     * @param path PDF 路径
     * @return 字段集合，rawText / pageCount / charCount 总是填充
     */
    ExtractedFields extractFromPdf(Path path);

    /**
     * 从 OCR 文本抽取字段（先做误识别修正，启用大模型时优先使用大模型）
     */
    ExtractedFields extractFromOcrText(String ocrText);

    /**
     * 文本层过短，需要 OCR
     */
    boolean needsOcr(ExtractedFields fields);
}
