package com.litscan.service.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import top.continew.starter.core.exception.BusinessException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentParserServiceImplTest {

    private final DocumentParserServiceImpl parser = new DocumentParserServiceImpl();

    @Test
    void cleanText_shouldKeepLineBreaksAndCollapseSpaces() {
        String cleaned = DocumentParserServiceImpl.cleanText("  软件名称：文献系统\r\n\r\n\r\n\r\n著作权人：\t\t某某公司\u0007  ");

        assertThat(cleaned).isEqualTo("软件名称：文献系统\n\n著作权人： 某某公司");
    }

    @Test
    void cleanText_shouldTreatNullAsEmpty() {
        assertThat(DocumentParserServiceImpl.cleanText(null)).isEmpty();
    }

    @Test
    void parseFile_shouldReadPlainText(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("登记证书.txt");
        Files.write(file, "登记号：2023SR0123456\n著作权人：某某科技有限公司\n".getBytes(StandardCharsets.UTF_8));

        String text = parser.parseFile(file);

        assertThat(text).contains("登记号：2023SR0123456").contains("著作权人：某某科技有限公司");
    }

    @Test
    void parseFile_shouldRejectNullPath() {
        assertThatThrownBy(() -> parser.parseFile(null)).isInstanceOf(BusinessException.class);
    }
}
