package com.litscan.service.impl;

import com.litscan.config.LitScanProperties;
import com.litscan.extractor.OcrTextCorrector;
import com.litscan.extractor.PaperFieldExtractor;
import com.litscan.model.dto.ExtractedFields;
import com.litscan.model.dto.RawDocument;
import com.litscan.service.LlmParserService;
import com.litscan.service.MetadataExtractionService;
import com.litscan.service.PdfDocumentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 论文元数据抽取实现
 *
 * <p>PDF 路径：信息字典标题/作者 → 文本规则（DOI、年份、标题、作者、期刊）→ 可选的大模型补全。</p>
 * <p>OCR 路径：误识别修正 → 大模型（启用时）→ OCR 规则（标题、邮箱锚定作者）→ DOI、年份。</p>
 *
 * @author litscan
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetadataExtractionServiceImpl implements MetadataExtractionService {

    private static final String DOI_URL_PREFIX = "https://doi.org/";

    private final PdfDocumentService pdfDocumentService;
    private final LlmParserService llmParserService;
    private final LitScanProperties properties;

    @Override
    public ExtractedFields extractFromPdf(Path path) {
        RawDocument raw = pdfDocumentService.load(path, properties.getPipeline().getMaxPages());
        String text = raw.getText();

        ExtractedFields fields = new ExtractedFields();
        fields.setRawText(text);
        fields.setPageCount(raw.getPageCount());
        fields.setCharCount(text.trim().length());
        fields.setTitle(raw.getInfoTitle());
        fields.setAuthors(raw.getInfoAuthor());

        PaperFieldExtractor.extractDoi(text).ifPresent(fields::setDoi);
        PaperFieldExtractor.extractYear(text).ifPresent(fields::setYear);
        if (fields.getTitle() == null) {
            PaperFieldExtractor.extractTitle(text).ifPresent(fields::setTitle);
        }
        if (fields.getAuthors() == null) {
            PaperFieldExtractor.extractAuthors(text).ifPresent(fields::setAuthors);
        }
        PaperFieldExtractor.extractVenue(text).ifPresent(fields::setVenue);

        if (!needsOcr(fields) && (fields.getTitle() == null || fields.getAuthors() == null) && llmParserService.isEnabled()) {
            log.info("文本规则未得到标题或作者，尝试大模型补全: {}", path.getFileName());
            llmParserService.parse(text).ifPresent(fields::fillMissingFrom);
        }

        log.info("PDF元数据抽取完成: {}, title={}, doi={}, year={}, 字符数={}",
                path.getFileName(), fields.getTitle(), fields.getDoi(), fields.getYear(), fields.getCharCount());
        return fields;
    }

    @Override
    public ExtractedFields extractFromOcrText(String ocrText) {
        String corrected = OcrTextCorrector.correct(ocrText == null ? "" : ocrText);

        ExtractedFields fields = new ExtractedFields();
        fields.setRawText(corrected);
        fields.setPageCount(1);
        fields.setCharCount(corrected.trim().length());

        Optional<ExtractedFields> llmFields = llmParserService.isEnabled()
                ? llmParserService.parse(corrected)
                : Optional.empty();
        if (llmFields.isPresent()) {
            log.info("OCR文本使用大模型解析结果");
            fields.fillMissingFrom(llmFields.get());
        } else {
            PaperFieldExtractor.extractTitleFromOcr(corrected).ifPresent(fields::setTitle);
            PaperFieldExtractor.extractAuthorsFromOcr(corrected).ifPresent(fields::setAuthors);
        }

        PaperFieldExtractor.extractDoi(corrected).ifPresent(doi -> {
            fields.setDoi(doi);
            fields.setUrl(DOI_URL_PREFIX + doi);
        });
        if (fields.getYear() == null) {
            PaperFieldExtractor.extractYear(corrected).ifPresent(fields::setYear);
        }

        log.info("OCR元数据抽取完成: title={}, authors={}, doi={}", fields.getTitle(), fields.getAuthors(), fields.getDoi());
        return fields;
    }

    @Override
    public boolean needsOcr(ExtractedFields fields) {
        return fields.getCharCount() < properties.getPipeline().getMinTextLength();
    }
}
