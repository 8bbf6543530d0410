package com.litscan.service;

import java.nio.file.Path;

/**
 * 通用文档解析服务接口
 *
 * @author litscan
 */
public interface DocumentParserService {

    /**
     * 解析文件文本内容（自动识别格式）
     *
     * @param path 文件路径
     * @return 清理后的文本，保留换行
     */
    String parseFile(Path path);
}
