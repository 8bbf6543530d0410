package com.litscan.service.impl;

import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import top.continew.starter.core.exception.BusinessException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileScannerServiceImplTest {

    @TempDir
    Path root;

    private LitScanProperties properties;
    private FileScannerServiceImpl scanner;

    @BeforeEach
    void setUp() throws IOException {
        properties = new LitScanProperties();
        scanner = new FileScannerServiceImpl(properties);

        Files.createDirectories(root.resolve("2020/conf"));
        Files.createDirectories(root.resolve("archive/old"));
        Files.write(root.resolve("a.pdf"), "hello".getBytes(StandardCharsets.UTF_8));
        Files.write(root.resolve("B.PDF"), new byte[]{1});
        Files.write(root.resolve("notes.txt"), new byte[]{1});
        Files.write(root.resolve("2020/conf/c.png"), new byte[]{1});
        Files.write(root.resolve("archive/old/d.pdf"), new byte[]{1});
    }

    private List<String> relativeNames(List<Path> files) {
        return files.stream().map(file -> FileScannerServiceImpl.relativePath(root, file)).collect(Collectors.toList());
    }

    @Test
    void listFiles_shouldWalkRecursivelyAndMatchExtensionsIgnoringCase() {
        List<Path> files = scanner.listFiles(root);

        assertThat(relativeNames(files))
                .containsExactlyInAnyOrder("a.pdf", "B.PDF", "2020/conf/c.png", "archive/old/d.pdf");
    }

    @Test
    void listFiles_shouldSkipExcludedFolders() {
        properties.getScan().getExcludedFolders().add("./archive/");

        List<Path> files = scanner.listFiles(root);

        assertThat(relativeNames(files)).containsExactlyInAnyOrder("a.pdf", "B.PDF", "2020/conf/c.png");
    }

    @Test
    void listFiles_shouldRejectMissingRoot() {
        assertThatThrownBy(() -> scanner.listFiles(root.resolve("missing")))
                .isInstanceOf(BusinessException.class)
                .hasMessageStartingWith("扫描目录不存在");
    }

    @Test
    void describe_shouldHashContentAndUseSlashSeparatedPath() {
        SourceFile source = scanner.describe(root, root.resolve("a.pdf"));

        assertThat(source.getRelativePath()).isEqualTo("a.pdf");
        assertThat(source.getFilename()).isEqualTo("a.pdf");
        assertThat(source.getSha256()).isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
        assertThat(source.getSize()).isEqualTo(5L);
        assertThat(source.getAbsolutePath().isAbsolute()).isTrue();

        assertThat(scanner.describe(root, root.resolve("2020/conf/c.png")).getRelativePath()).isEqualTo("2020/conf/c.png");
    }

    @Test
    void describe_shouldRejectMissingFile() {
        assertThatThrownBy(() -> scanner.describe(root, root.resolve("gone.pdf")))
                .isInstanceOf(BusinessException.class);
    }
}
