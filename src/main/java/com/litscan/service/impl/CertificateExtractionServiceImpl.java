package com.litscan.service.impl;

import com.litscan.config.LitScanProperties;
import com.litscan.extractor.CertificateClassifier;
import com.litscan.extractor.PatentFieldExtractor;
import com.litscan.extractor.SoftwareFieldExtractor;
import com.litscan.model.dto.CertificateExtraction;
import com.litscan.model.dto.CertificateFields;
import com.litscan.model.dto.PatentFields;
import com.litscan.model.dto.SoftwareFields;
import com.litscan.model.enums.CertificateKind;
import com.litscan.model.enums.ExtractionMethod;
import com.litscan.service.CertificateExtractionService;
import com.litscan.service.DocumentParserService;
import com.litscan.service.OcrService;
import com.litscan.service.PdfDocumentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 专利 / 软著证书抽取实现
 *
 * @author litscan
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CertificateExtractionServiceImpl implements CertificateExtractionService {

    private final PdfDocumentService pdfDocumentService;
    private final DocumentParserService documentParserService;
    private final OcrService ocrService;
    private final LitScanProperties properties;

    @Override
    public CertificateExtraction extract(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        LitScanProperties.PipelineConfig pipeline = properties.getPipeline();

        if (isImage(name)) {
            String ocrText = ocrService.recognize(path, 0);
            return extractFromText(usableOrEmpty(ocrText), ExtractionMethod.OCR, path);
        }
        if (name.endsWith(".pdf")) {
            String text = pdfDocumentService.load(path, pipeline.getCertificateMaxPages()).getText();
            if (text.trim().length() < pipeline.getCertificateMinTextLength()) {
                log.info("证书文本层过短({}字符)，改用OCR: {}", text.trim().length(), path.getFileName());
                String ocrText = ocrService.recognize(path, 0);
                if (OcrService.isUsableText(ocrText)) {
                    return extractFromText(ocrText, ExtractionMethod.OCR, path);
                }
                log.warn("证书OCR未得到文本: {}", ocrText);
            }
            return extractFromText(text, ExtractionMethod.PDF_TEXT, path);
        }
        return extractFromText(documentParserService.parseFile(path), ExtractionMethod.TEXT_FILE, path);
    }

    @Override
    public CertificateExtraction extractFromText(String text, ExtractionMethod method, Path source) {
        CertificateKind kind = CertificateClassifier.classify(text);
        CertificateExtraction extraction = CertificateExtraction.builder()
                .kind(kind)
                .extractionMethod(method)
                .rawText(text)
                .ocrFilledFields(Collections.emptyList())
                .build();
        if (kind == CertificateKind.NEITHER) {
            log.info("未识别为专利或软著证书: {}", source == null ? "-" : source.getFileName());
            return extraction;
        }

        CertificateFields fields = kind == CertificateKind.PATENT
                ? PatentFieldExtractor.extract(text)
                : SoftwareFieldExtractor.extract(text);
        extraction.setFields(fields);

        int missing = fields.countMissing();
        if (method == ExtractionMethod.PDF_TEXT && source != null
                && missing >= properties.getPipeline().getOcrRemedyMissingThreshold()) {
            remedyWithOcr(extraction, source, missing);
        }
        return extraction;
    }

    /**
     * 文本层缺失字段过多时识别首页，只补全缺失字段
     */
    private void remedyWithOcr(CertificateExtraction extraction, Path source, int missing) {
        log.info("证书缺失{}个字段，调用OCR补全: {}", missing, source.getFileName());
        String ocrText = ocrService.recognize(source, 0);
        if (!OcrService.isUsableText(ocrText)) {
            log.warn("OCR补全失败，保留文本层结果: {}", ocrText);
            return;
        }
        List<String> filled;
        if (extraction.getKind() == CertificateKind.PATENT) {
            filled = extraction.getPatentFields().fillMissingFrom(PatentFieldExtractor.extract(ocrText));
        } else {
            filled = extraction.getSoftwareFields().fillMissingFrom(SoftwareFieldExtractor.extract(ocrText));
        }
        extraction.setExtractionMethod(ExtractionMethod.PDF_OCR);
        extraction.setOcrFilledFields(filled);
        log.info("OCR补全字段: {}", filled);
    }

    private boolean isImage(String lowerCaseName) {
        return properties.getScan().getImageExtensions().stream().anyMatch(lowerCaseName::endsWith);
    }

    private static String usableOrEmpty(String ocrText) {
        if (OcrService.isUsableText(ocrText)) {
            return ocrText;
        }
        log.warn("证书OCR未得到文本: {}", ocrText);
        return "";
    }
}
