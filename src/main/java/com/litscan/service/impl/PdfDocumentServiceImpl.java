package com.litscan.service.impl;

import cn.hutool.core.util.StrUtil;
import com.litscan.model.dto.RawDocument;
import com.litscan.service.PdfDocumentService;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * PDF 文档访问实现（Apache PDFBox）
 *
 * @author litscan
 */
@Slf4j
@Service
public class PdfDocumentServiceImpl implements PdfDocumentService {

    @Override
    public RawDocument load(Path path, int maxPages) {
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            int pageCount = document.getNumberOfPages();
            RawDocument.RawDocumentBuilder builder = RawDocument.builder()
                    .path(path)
                    .pageCount(pageCount);

            PDDocumentInformation info = document.getDocumentInformation();
            if (info != null) {
                String title = StrUtil.isNotBlank(info.getTitle()) ? info.getTitle() : info.getSubject();
                builder.infoTitle(StrUtil.trimToNull(title));
                builder.infoAuthor(StrUtil.trimToNull(info.getAuthor()));
            }

            PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= Math.min(maxPages, pageCount); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                builder.pageText(stripper.getText(document));
            }
            RawDocument raw = builder.build();
            log.debug("PDF读取完成: {}, 总页数={}, 已读={}", path.getFileName(), pageCount, raw.getPageTexts().size());
            return raw;
        } catch (IOException e) {
            log.error("PDF读取失败: {}", path, e);
            throw new BusinessException("PDF读取失败: " + e.getMessage());
        }
    }

    @Override
    public byte[] renderPageAsPng(Path path, int pageIndex, float scale) {
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            int pageCount = document.getNumberOfPages();
            if (pageIndex < 0 || pageIndex >= pageCount) {
                throw new BusinessException("页码超出范围 (共 " + pageCount + " 页)");
            }
            BufferedImage image = new PDFRenderer(document).renderImage(pageIndex, scale, ImageType.RGB);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            log.error("PDF页面渲染失败: {}, page={}", path, pageIndex, e);
            throw new BusinessException("PDF页面渲染失败: " + e.getMessage());
        }
    }
}
