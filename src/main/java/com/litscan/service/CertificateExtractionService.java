package com.litscan.service;

import com.litscan.model.dto.CertificateExtraction;
import com.litscan.model.enums.ExtractionMethod;

import java.nio.file.Path;

/**
 * 专利 / 软著证书抽取服务
 *
 * @author litscan
 */
public interface CertificateExtractionService {

    /**
     * 按文件类型选择文本来源后分类并抽取
     */
    CertificateExtraction extract(Path path);

    /**
     * 对已获得的文本分类并抽取；method 为 PDF_TEXT 且缺失字段过多时对 source 做一次 OCR 补全
     *
     * @param text   证书文本
     * @param method 文本来源
     * @param source 源文件，用于 OCR 补全
     */
    CertificateExtraction extractFromText(String text, ExtractionMethod method, Path source);
}
