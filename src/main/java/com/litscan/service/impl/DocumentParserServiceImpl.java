package com.litscan.service.impl;

import com.litscan.service.DocumentParserService;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.nio.file.Path;

/**
 * 文档解析服务实现
 * 使用 Apache Tika 自动检测和解析多种文档格式
 *
 * @author litscan
 */
@Slf4j
@Service
public class DocumentParserServiceImpl implements DocumentParserService {

    private final Tika tika = new Tika();

    @Override
    public String parseFile(Path path) {
        if (path == null) {
            throw new BusinessException("文件不能为空");
        }
        try {
            log.info("开始解析文档: {}", path.getFileName());
            String text = cleanText(tika.parseToString(path));
            log.info("文档解析完成: {}, 字符数={}", path.getFileName(), text.length());
            return text;
        } catch (Exception e) {
            log.error("文档解析失败: {}", path, e);
            throw new BusinessException("文档解析失败: " + e.getMessage());
        }
    }

    /**
     * 清理文本
     * - 移除控制字符
     * - 标准化换行
     * - 合并行内多余空白（证书字段依赖换行，换行保留）
     */
    static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return text
            .replace("\r\n", "\n")
            .replace('\r', '\n')
            // 移除特殊控制字符（保留换行符和制表符）
            .replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "")
            // 保留最多两个连续换行
            .replaceAll("\\n{3,}", "\n\n")
            // 行内的多个空格和制表符合并为一个
            .replaceAll("[ \\t]{2,}", " ")
            .trim();
    }
}
