package com.litscan.service;

import com.litscan.model.dto.SourceFile;

import java.nio.file.Path;
import java.util.List;

/**
 * 目录扫描服务
 *
 * @author litscan
 */
public interface FileScannerService {

    /**
     * 递归列出根目录下扩展名匹配且未被排除的文件
     */
    List<Path> listFiles(Path root);

    /**
     * 计算文件描述（相对路径、SHA-256、大小、修改时间）
     */
    SourceFile describe(Path root, Path file);
}
