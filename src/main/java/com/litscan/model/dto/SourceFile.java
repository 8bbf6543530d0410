package com.litscan.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * 扫描得到的源文件描述
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceFile {

    private Path absolutePath;

    /**
     * 相对扫描根目录的路径，使用 / 分隔
     */
    private String relativePath;

    private String filename;

    private String sha256;

    private Long size;

    /**
     * 最后修改时间（毫秒）
     */
    private Long mtime;
}
