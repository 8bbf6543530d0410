package com.litscan.service;

import com.litscan.model.dto.RawDocument;

import java.nio.file.Path;

/**
 * PDF 文档访问服务
 *
 * @author litscan
 */
public interface PdfDocumentService {

    /**
     * 读取前 maxPages 页的文本及信息字典
     *
     * @param path     PDF 文件路径
     * @param maxPages 最多读取的页数
     * @return 文档视图
     */
    RawDocument load(Path path, int maxPages);

    /**
     * 将指定页渲染为 PNG
     *
     * @param path      PDF 文件路径
     * @param pageIndex 页码，从 0 开始
     * @param scale     缩放倍率，1.0 对应 72 dpi
     * @return PNG 字节
     */
    byte[] renderPageAsPng(Path path, int pageIndex, float scale);
}
