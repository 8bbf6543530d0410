package com.litscan.service.impl;

import cn.hutool.core.io.FileUtil;
import cn.hutool.crypto.digest.DigestUtil;
import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.SourceFile;
import com.litscan.service.FileScannerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 目录扫描实现
 *
 * @author litscan
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileScannerServiceImpl implements FileScannerService {

    private final LitScanProperties properties;

    @Override
    public List<Path> listFiles(Path root) {
        if (!Files.isDirectory(root)) {
            throw new BusinessException("扫描目录不存在: " + root);
        }
        List<String> extensions = properties.getScan().getExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        List<String> excluded = properties.getScan().getExcludedFolders().stream()
                .map(FileScannerServiceImpl::normalizeRelative)
                .filter(folder -> !folder.isEmpty())
                .collect(Collectors.toList());

        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String relative = relativePath(root, dir);
                    for (String folder : excluded) {
                        if (relative.equals(folder) || relative.startsWith(folder + "/")) {
                            log.debug("跳过排除目录: {}", relative);
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                    if (attrs.isRegularFile() && extensions.stream().anyMatch(name::endsWith)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("无法访问文件: {}, {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("目录扫描失败: {}", root, e);
            throw new BusinessException("目录扫描失败: " + e.getMessage());
        }
        Collections.sort(files);
        log.info("扫描目录 {} 共找到 {} 个文件", root, files.size());
        return files;
    }

    @Override
    public SourceFile describe(Path root, Path file) {
        File target = file.toFile();
        if (!target.isFile()) {
            throw new BusinessException("文件不存在: " + file);
        }
        return SourceFile.builder()
                .absolutePath(file.toAbsolutePath())
                .relativePath(relativePath(root, file))
                .filename(target.getName())
                .sha256(DigestUtil.sha256Hex(target))
                .size(FileUtil.size(target))
                .mtime(target.lastModified())
                .build();
    }

    static String relativePath(Path root, Path path) {
        return root.toAbsolutePath().normalize()
                .relativize(path.toAbsolutePath().normalize())
                .toString()
                .replace(File.separatorChar, '/');
    }

    private static String normalizeRelative(String folder) {
        String normalized = folder.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
